package com.dcruver.tasklist.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Number of open tasks per tag. Tags differing only in case share one bucket,
 * shown in the form seen first.
 */
public class TagIndex {

    private final Map<String, TagCount> tags;
    private final int untagged;

    private TagIndex(Map<String, TagCount> tags, int untagged) {
        this.tags = tags;
        this.untagged = untagged;
    }

    public static TagIndex build(List<TaskEntry> entries) {
        Map<String, TagCount> tags = new LinkedHashMap<>();
        int untagged = 0;

        for (TaskEntry entry : entries) {
            if (!entry.isOpen()) {
                continue;
            }
            if (entry.getTags().isEmpty()) {
                untagged++;
                continue;
            }
            for (String tag : entry.getTags()) {
                tags.merge(tag.toLowerCase(Locale.ROOT), new TagCount(tag, 1),
                    (existing, added) -> new TagCount(existing.getTag(), existing.getCount() + 1));
            }
        }
        return new TagIndex(tags, untagged);
    }

    /**
     * Tags sorted case-insensitively
     */
    public List<TagCount> getTags() {
        List<TagCount> sorted = new ArrayList<>(tags.values());
        sorted.sort(Comparator.comparing(TagCount::getTag, String.CASE_INSENSITIVE_ORDER));
        return sorted;
    }

    public int count(String tag) {
        TagCount count = tags.get(tag.toLowerCase(Locale.ROOT));
        return count != null ? count.getCount() : 0;
    }

    /**
     * Open tasks without any tag
     */
    public int getUntagged() {
        return untagged;
    }

    @Value
    public static class TagCount {
        String tag;
        int count;
    }
}
