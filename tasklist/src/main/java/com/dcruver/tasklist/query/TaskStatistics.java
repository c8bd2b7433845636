package com.dcruver.tasklist.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * Open task counts per priority.
 */
@Value
public class TaskStatistics {
    int total;
    List<Integer> byPriority;   // highest priority first, down to priority 0

    public static TaskStatistics of(List<TaskEntry> entries) {
        TreeMap<Integer, Integer> counts = new TreeMap<>();
        for (TaskEntry entry : entries) {
            if (entry.isOpen()) {
                counts.merge(entry.getRow().getPriority(), 1, Integer::sum);
            }
        }
        if (counts.isEmpty()) {
            return new TaskStatistics(0, List.of());
        }

        List<Integer> byPriority = new ArrayList<>();
        int total = 0;
        for (int prio = 0; prio <= counts.lastKey(); prio++) {
            int count = counts.getOrDefault(prio, 0);
            byPriority.add(count);
            total += count;
        }
        Collections.reverse(byPriority);
        return new TaskStatistics(total, List.copyOf(byPriority));
    }
}
