package com.dcruver.tasklist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the task list, bound from {@code tasklist.*}.
 */
@ConfigurationProperties(prefix = "tasklist")
@Data
public class TaskListProperties {

    private String notebookPath = System.getProperty("user.home") + "/Notebooks/Notes";
    private String fileExtension = ".txt";
    private String database = System.getProperty("user.home") + "/.tasklist/tasklist.db";

    /**
     * Labels marking tasks, e.g. "FIXME", "TODO"
     */
    private List<String> labels = new ArrayList<>(List.of("FIXME", "TODO"));

    /**
     * Label for the next task in a sequence; blank disables the convention
     */
    private String nextLabel = "Next:";

    /**
     * Consider all checkboxes as tasks, not only those below a task list header
     */
    private boolean allCheckboxes = true;

    /**
     * Turn page name components into tags
     */
    private boolean tagByPage = false;

    /**
     * Implicit due date for tasks on calendar pages
     */
    private boolean deadlineByPage = false;

    private String calendarNamespace = "Journal";

    /**
     * Subtrees to index; empty means the whole notebook
     */
    private List<String> includedSubtrees = new ArrayList<>();

    /**
     * Subtrees to ignore
     */
    private List<String> excludedSubtrees = new ArrayList<>();

    private Monitor monitor = new Monitor();

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private long intervalMs = 30_000;
    }

    /**
     * Settings that change the extracted rows. The stored table is dropped
     * and rebuilt when this string differs from the one it was built with.
     */
    public String rebuildFingerprint() {
        return String.join("|",
            String.valueOf(allCheckboxes),
            String.join(",", labels),
            String.valueOf(nextLabel),
            String.valueOf(deadlineByPage),
            String.valueOf(calendarNamespace),
            String.join(",", includedSubtrees),
            String.join(",", excludedSubtrees));
    }
}
