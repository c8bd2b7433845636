package com.dcruver.tasklist.extract;

import com.dcruver.tasklist.config.LabelPatterns;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Result of checking the first line of a paragraph for a task list header
 * like {@code TODO: @work @home} followed by a list. A confirmed header
 * makes all checkboxes of the paragraph tasks and gives them its tags.
 */
@Value
public class TaskListHeader {

    private static final TaskListHeader NONE = new TaskListHeader(false, List.of());
    private static final Pattern TAG_TOKEN = Pattern.compile("^@\\w+$");

    boolean confirmed;
    List<String> tags;

    public static TaskListHeader none() {
        return NONE;
    }

    /**
     * Look at the first two items: a labeled text line followed by a list entry,
     * where every word after the label is a tag. Anything else is no header.
     */
    public static TaskListHeader detect(List<Item> items, LabelPatterns labels) {
        if (items.size() < 2 || items.get(0).isListEntry() || !items.get(1).isListEntry()) {
            return NONE;
        }

        String line = items.get(0).getText();
        Optional<String> label = labels.matchLabel(line);
        if (label.isEmpty()) {
            return NONE;
        }

        String rest = stripColons(line.substring(label.get().length()));
        List<String> tags = new ArrayList<>();
        for (String word : rest.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (!TAG_TOKEN.matcher(word).matches()) {
                return NONE;
            }
            tags.add(word);
        }
        return new TaskListHeader(true, List.copyOf(tags));
    }

    private static String stripColons(String text) {
        String trimmed = text.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == ':') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == ':') {
            end--;
        }
        return trimmed.substring(start, end);
    }
}
