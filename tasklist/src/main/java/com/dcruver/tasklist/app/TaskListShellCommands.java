package com.dcruver.tasklist.app;

import com.dcruver.tasklist.config.LabelPatterns;
import com.dcruver.tasklist.index.TaskListIndexer;
import com.dcruver.tasklist.query.FilterCriteria;
import com.dcruver.tasklist.query.LabelIndex;
import com.dcruver.tasklist.query.TagIndex;
import com.dcruver.tasklist.query.TaskEntry;
import com.dcruver.tasklist.query.TaskListService;
import com.dcruver.tasklist.query.TaskStatistics;
import com.dcruver.tasklist.query.TextFilter;
import com.dcruver.tasklist.store.TaskRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring Shell commands for the task list.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class TaskListShellCommands {

    private final TaskListIndexer indexer;
    private final TaskListService taskListService;
    private final LabelPatterns labelPatterns;
    private final ObjectMapper objectMapper;

    @ShellMethod(key = {"index", "rebuild"}, value = "Rebuild the task list from the notebook")
    public String index() {
        log.info("Running full index...");

        try {
            int pages = indexer.rebuild();
            TaskStatistics stats = taskListService.statistics();
            return String.format("Indexed %d pages, %d open tasks.", pages, stats.getTotal());
        } catch (Exception e) {
            log.error("Index failed", e);
            return "Index failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"tasks", "list"}, value = "List open tasks, filtered by text, tags and labels")
    public String tasks(
        @ShellOption(defaultValue = "", help = "Text to match, prefix with 'not ' to exclude") String filter,
        @ShellOption(defaultValue = "", help = "Comma separated tags, use __no_tags__ for untagged tasks") String tags,
        @ShellOption(defaultValue = "", help = "Comma separated labels") String labels,
        @ShellOption(defaultValue = "false", help = "Only show actionable tasks") boolean actionable,
        @ShellOption(defaultValue = "false", help = "Print as JSON") boolean json
    ) {
        try {
            FilterCriteria criteria = FilterCriteria.builder()
                .actionableOnly(actionable)
                .tags(splitList(tags))
                .labels(splitList(labels))
                .text(TextFilter.parse(filter))
                .build();

            List<TaskEntry> visible = taskListService.query(criteria);
            if (json) {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(visible);
            }
            if (visible.isEmpty()) {
                return "No matching tasks.";
            }

            StringBuilder sb = new StringBuilder();
            for (TaskEntry entry : visible) {
                sb.append(formatEntry(entry)).append("\n");
            }
            sb.append(String.format("\n%d tasks shown\n", visible.size()));
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to list tasks", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "task", value = "Show a single task and its subtasks")
    public String task(@ShellOption long id) {
        try {
            Optional<TaskRow> task = taskListService.getTask(id);
            if (task.isEmpty()) {
                return "No task with id " + id;
            }

            TaskRow row = task.get();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("ID: %d\n", row.getId()));
            sb.append(String.format("  Page: %s%s\n", row.getSource(),
                taskListService.getDocumentOf(row).map(d -> "").orElse(" (missing)")));
            sb.append(String.format("  Task: %s\n", row.getDescription()));
            sb.append(String.format("  Open: %s, actionable: %s\n", row.isOpen(), row.isActionable()));
            sb.append(String.format("  Priority: %d\n", row.getPriority()));
            sb.append(String.format("  Due: %s\n", row.getDue() != null ? row.getDue() : "-"));

            List<TaskRow> children = taskListService.listTasks(row);
            if (!children.isEmpty()) {
                sb.append("  Subtasks:\n");
                for (TaskRow child : children) {
                    sb.append(String.format("    [%d] %s\n", child.getId(), child.getDescription()));
                }
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to show task {}", id, e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "tags", value = "Show labels and tags with their number of open tasks")
    public String tags() {
        try {
            LabelIndex labels = taskListService.labelIndex();
            TagIndex tags = taskListService.tagIndex();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("All Tasks (%d)\n", taskListService.statistics().getTotal()));
            for (String label : labels.getLabels()) {
                if (!labelPatterns.isNextLabel(label)) {
                    sb.append(String.format("%s (%d)\n", label, labels.count(label)));
                }
            }
            if (tags.getUntagged() > 0) {
                sb.append(String.format("Untagged (%d)\n", tags.getUntagged()));
            }
            sb.append("\n");
            for (TagIndex.TagCount tag : tags.getTags()) {
                sb.append(String.format("@%s (%d)\n", tag.getTag(), tag.getCount()));
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to list tags", e);
            return "Failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "stats", value = "Show open tasks per priority")
    public String stats() {
        try {
            TaskStatistics stats = taskListService.statistics();
            String perPriority = stats.getByPriority().stream()
                .map(String::valueOf)
                .collect(Collectors.joining("/"));
            return String.format("%d open items (%s)", stats.getTotal(), perPriority);
        } catch (Exception e) {
            log.error("Failed to compute statistics", e);
            return "Failed: " + e.getMessage();
        }
    }

    private String formatEntry(TaskEntry entry) {
        TaskRow row = entry.getRow();
        String indent = "  ".repeat(entry.getDepth());
        String due = row.getDue() != null ? row.getDue().toString() : "";
        // non-actionable tasks are marked with "~"
        String marker = row.isActionable() ? " " : "~";
        return String.format("%5d %s %d %-10s %s%s  [%s]",
            row.getId(), marker, row.getPriority(), due, indent, row.getDescription(), entry.getDocumentName());
    }

    private static Set<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toSet());
    }
}
