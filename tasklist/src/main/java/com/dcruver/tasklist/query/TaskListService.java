package com.dcruver.tasklist.query;

import com.dcruver.tasklist.config.LabelPatterns;
import com.dcruver.tasklist.config.TaskListProperties;
import com.dcruver.tasklist.document.Document;
import com.dcruver.tasklist.document.DocumentSource;
import com.dcruver.tasklist.index.TaskListChangedEvent;
import com.dcruver.tasklist.store.TaskRow;
import com.dcruver.tasklist.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read side of the task list: browsing stored tasks, tag and label counts, and filtering.
 */
@Service
@Slf4j
public class TaskListService {

    private static final Pattern TAG = Pattern.compile("(?<!\\S)@(\\w+)\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final TaskStore taskStore;
    private final DocumentSource documentSource;
    private final LabelPatterns labelPatterns;
    private final QueryEngine queryEngine;
    private final boolean tagByPage;

    private final AtomicLong generation = new AtomicLong();
    private final AtomicReference<CachedView> cache = new AtomicReference<>();

    @Autowired
    public TaskListService(TaskStore taskStore, DocumentSource documentSource, LabelPatterns labelPatterns,
                           QueryEngine queryEngine, TaskListProperties properties) {
        this(taskStore, documentSource, labelPatterns, queryEngine, properties.isTagByPage());
    }

    public TaskListService(TaskStore taskStore, DocumentSource documentSource, LabelPatterns labelPatterns,
                           QueryEngine queryEngine, boolean tagByPage) {
        this.taskStore = taskStore;
        this.documentSource = documentSource;
        this.labelPatterns = labelPatterns;
        this.queryEngine = queryEngine;
        this.tagByPage = tagByPage;
    }

    /**
     * Tasks directly below a parent; null lists top level tasks
     */
    public List<TaskRow> listTasks(TaskRow parent) {
        return taskStore.childrenOf(parent != null ? parent.getId() : null);
    }

    public Optional<TaskRow> getTask(long taskId) {
        return taskStore.get(taskId);
    }

    /**
     * Source document of a task; empty when the document is gone
     */
    public Optional<Document> getDocumentOf(TaskRow task) {
        return documentSource.lookup(task.getSource());
    }

    /**
     * All displayable tasks in tree order, top level tasks sorted by page name.
     * Tasks of pages that no longer exist are left out with their subtasks.
     */
    public List<TaskEntry> snapshot() {
        long current = generation.get();
        CachedView cached = cache.get();
        if (cached != null && cached.generation() == current) {
            return cached.entries();
        }

        List<TaskEntry> entries = buildSnapshot();
        // a view built before a change carries the old generation and is never served
        cache.compareAndSet(cached, new CachedView(current, entries));
        return entries;
    }

    @EventListener
    public void onTaskListChanged(TaskListChangedEvent event) {
        log.debug("Task list changed ({}), dropping cached view",
            event.isRebuild() ? "rebuild" : event.getDocumentId());
        generation.incrementAndGet();
        cache.set(null);
    }

    public TagIndex tagIndex() {
        return TagIndex.build(snapshot());
    }

    public LabelIndex labelIndex() {
        return LabelIndex.build(snapshot(), labelPatterns.getLabels());
    }

    public TaskStatistics statistics() {
        return TaskStatistics.of(snapshot());
    }

    /**
     * Visible tasks for the criteria, in tree order
     */
    public List<TaskEntry> query(FilterCriteria criteria) {
        List<TaskEntry> entries = snapshot();
        Set<Long> visible = queryEngine.filterVisible(entries, criteria);
        return entries.stream()
            .filter(entry -> visible.contains(entry.getId()))
            .toList();
    }

    /**
     * Built from a single read of all rows, so a replace running meanwhile
     * shows either the old or the new forest of a document.
     */
    private List<TaskEntry> buildSnapshot() {
        Map<Long, List<TaskRow>> childrenByParent = new HashMap<>();
        for (TaskRow row : taskStore.allRows()) {
            childrenByParent.computeIfAbsent(row.getParentId(), id -> new ArrayList<>()).add(row);
        }

        List<TaskEntry> entries = new ArrayList<>();
        appendTasks(TaskRow.NO_PARENT, 0, childrenByParent, entries, new HashMap<>());
        log.debug("Built task view with {} tasks", entries.size());
        return List.copyOf(entries);
    }

    private void appendTasks(long parentId, int depth, Map<Long, List<TaskRow>> childrenByParent,
                             List<TaskEntry> entries, Map<String, Optional<Document>> documents) {
        List<TaskRow> rows = new ArrayList<>(childrenByParent.getOrDefault(parentId, List.of()));
        rows.removeIf(row -> documents.computeIfAbsent(row.getSource(), documentSource::lookup).isEmpty());
        rows.sort(Comparator.comparing((TaskRow row) -> documents.get(row.getSource()).get().getName()));

        for (TaskRow row : rows) {
            Document document = documents.get(row.getSource()).get();
            entries.add(TaskEntry.builder()
                .row(row)
                .documentName(document.getName())
                .tags(tagsOf(row, document))
                .labels(labelPatterns.labelsIn(row.getDescription()))
                .depth(depth)
                .build());

            appendTasks(row.getId(), depth + 1, childrenByParent, entries, documents);
        }
    }

    private List<String> tagsOf(TaskRow row, Document document) {
        List<String> tags = new ArrayList<>();
        Matcher matcher = TAG.matcher(row.getDescription());
        while (matcher.find()) {
            tags.add(matcher.group(1));
        }
        if (tagByPage) {
            tags.addAll(document.getParts());
        }
        return List.copyOf(tags);
    }

    private record CachedView(long generation, List<TaskEntry> entries) {}
}
