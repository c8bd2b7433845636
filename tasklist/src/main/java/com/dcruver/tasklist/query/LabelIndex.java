package com.dcruver.tasklist.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Number of open tasks per label, in configured label order.
 */
public class LabelIndex {

    private final Map<String, Integer> counts;

    private LabelIndex(Map<String, Integer> counts) {
        this.counts = counts;
    }

    public static LabelIndex build(List<TaskEntry> entries, List<String> labelOrder) {
        Map<String, Integer> found = new LinkedHashMap<>();
        for (TaskEntry entry : entries) {
            if (entry.isOpen()) {
                entry.getLabels().forEach(label -> found.merge(label, 1, Integer::sum));
            }
        }

        Map<String, Integer> ordered = new LinkedHashMap<>();
        for (String label : labelOrder) {
            if (found.containsKey(label)) {
                ordered.put(label, found.remove(label));
            }
        }
        ordered.putAll(found);
        return new LabelIndex(ordered);
    }

    /**
     * Counts in label order
     */
    public Map<String, Integer> getCounts() {
        return Collections.unmodifiableMap(counts);
    }

    public List<String> getLabels() {
        return List.copyOf(counts.keySet());
    }

    public int count(String label) {
        return counts.getOrDefault(label, 0);
    }
}
