package com.dcruver.tasklist.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which tasks are visible for a set of filter criteria.
 *
 * Only open tasks match on their own. All filter dimensions must hold (tags and
 * labels each match if any of the selected values is present). Every ancestor of
 * a matching task is shown as well, so matches keep their context.
 */
@Component
@Slf4j
public class QueryEngine {

    public Set<Long> filterVisible(List<TaskEntry> entries, FilterCriteria criteria) {
        Set<String> tagFilter = normalizeTags(criteria.getTags());
        Set<String> labelFilter = lowerCase(criteria.getLabels());
        log.debug("Filtering {} tasks with labels: {} tags: {} text: {}",
            entries.size(), labelFilter, tagFilter, criteria.getText());

        Map<Long, Long> parents = new HashMap<>();
        Set<Long> visible = new HashSet<>();
        for (TaskEntry entry : entries) {
            parents.put(entry.getId(), entry.getParentId());
            if (matches(entry, criteria, tagFilter, labelFilter)) {
                visible.add(entry.getId());
            }
        }

        Set<Long> propagated = new HashSet<>();
        for (Long id : List.copyOf(visible)) {
            Long parent = parents.get(id);
            while (parent != null && parent != 0L && propagated.add(parent)) {
                visible.add(parent);
                parent = parents.get(parent);
            }
        }
        return visible;
    }

    boolean matches(TaskEntry entry, FilterCriteria criteria, Set<String> tagFilter, Set<String> labelFilter) {
        if (!entry.isOpen() || (criteria.isActionableOnly() && !entry.isActionable())) {
            return false;
        }

        if (labelFilter != null && entry.getLabels().stream()
                .map(label -> label.toLowerCase(Locale.ROOT))
                .noneMatch(labelFilter::contains)) {
            return false;
        }

        if (tagFilter != null) {
            boolean untaggedMatch = tagFilter.contains(FilterCriteria.NO_TAGS) && entry.getTags().isEmpty();
            boolean tagMatch = entry.getTags().stream()
                .map(tag -> tag.toLowerCase(Locale.ROOT))
                .anyMatch(tagFilter::contains);
            if (!untaggedMatch && !tagMatch) {
                return false;
            }
        }

        TextFilter text = criteria.getText();
        return text == null || text.matches(entry.getDescription(), entry.getDocumentName());
    }

    private static Set<String> normalizeTags(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return null;
        }
        return tags.stream()
            .map(tag -> tag.startsWith("@") ? tag.substring(1) : tag)
            .map(tag -> tag.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    private static Set<String> lowerCase(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.stream()
            .map(value -> value.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }
}
