package com.dcruver.tasklist.index;

import com.dcruver.tasklist.config.TaskListProperties;
import com.dcruver.tasklist.document.CalendarPages;
import com.dcruver.tasklist.document.Document;
import com.dcruver.tasklist.document.DocumentSource;
import com.dcruver.tasklist.document.ParseNode;
import com.dcruver.tasklist.extract.TaskNode;
import com.dcruver.tasklist.extract.TreeBuilder;
import com.dcruver.tasklist.store.ReplaceResult;
import com.dcruver.tasklist.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Keeps the task store in sync with the notebook.
 * Each document is extracted and replaced as one unit; work on the same
 * document is serialized while different documents proceed independently.
 */
@Component
@Slf4j
public class TaskListIndexer {

    private final TaskStore taskStore;
    private final DocumentSource documentSource;
    private final TreeBuilder treeBuilder;
    private final CalendarPages calendarPages;
    private final ApplicationEventPublisher eventPublisher;
    private final SubtreeFilter subtreeFilter;
    private final boolean deadlineByPage;

    private static final int LOCK_STRIPES = 64;

    // a document always maps to the same stripe; unrelated documents may share one
    private final ReentrantLock[] documentLocks = new ReentrantLock[LOCK_STRIPES];

    public TaskListIndexer(TaskStore taskStore, DocumentSource documentSource, TreeBuilder treeBuilder,
                           CalendarPages calendarPages, ApplicationEventPublisher eventPublisher,
                           TaskListProperties properties) {
        this.taskStore = taskStore;
        this.documentSource = documentSource;
        this.treeBuilder = treeBuilder;
        this.calendarPages = calendarPages;
        this.eventPublisher = eventPublisher;
        this.subtreeFilter = new SubtreeFilter(properties.getIncludedSubtrees(), properties.getExcludedSubtrees());
        this.deadlineByPage = properties.isDeadlineByPage();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            documentLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Extract the tasks of a (changed) document and replace its stored rows
     *
     * @return true if stored tasks changed
     */
    public boolean onDocumentIndexed(String documentId) {
        if (!taskStore.isInitialized()) {
            log.debug("Task store not initialized, ignoring {}", documentId);
            return false;
        }

        boolean changed = withDocumentLock(documentId, () -> indexDocument(documentId));
        if (changed) {
            eventPublisher.publishEvent(new TaskListChangedEvent(documentId));
        }
        return changed;
    }

    /**
     * Drop the tasks of a deleted document
     *
     * @return true if the document had tasks
     */
    public boolean onDocumentRemoved(String documentId) {
        if (!taskStore.isInitialized()) {
            return false;
        }

        boolean removed = withDocumentLock(documentId, () -> taskStore.removeDocument(documentId));
        if (removed) {
            log.info("Removed tasks of deleted page {}", documentId);
            eventPublisher.publishEvent(new TaskListChangedEvent(documentId));
        }
        return removed;
    }

    /**
     * Clear the store and extract every document again
     *
     * @return number of documents indexed
     */
    public int rebuild() {
        log.info("Rebuilding task list...");
        taskStore.clear();

        List<Document> documents = documentSource.listDocuments();
        for (Document document : documents) {
            withDocumentLock(document.getId(), () -> indexDocument(document.getId()));
        }

        log.info("Rebuilt task list: {} tasks in {} pages", taskStore.count(), documents.size());
        eventPublisher.publishEvent(new TaskListChangedEvent(null));
        return documents.size();
    }

    /**
     * Index the whole notebook when the store dropped its rows at startup
     */
    @EventListener(ContextRefreshedEvent.class)
    public void rebuildIfRequired() {
        if (taskStore.isInitialized() && taskStore.isRebuildRequired()) {
            log.info("Stored tasks were dropped, indexing the notebook");
            rebuild();
        }
    }

    private boolean indexDocument(String documentId) {
        if (!subtreeFilter.accepts(documentId)) {
            log.debug("Page {} is outside the indexed subtrees", documentId);
            return taskStore.removeDocument(documentId);
        }

        Optional<ParseNode> parseTree = documentSource.getParseTree(documentId);
        if (parseTree.isEmpty()) {
            return taskStore.removeDocument(documentId);
        }

        LocalDate defaultDate = deadlineByPage ? calendarPages.deadlineFor(documentId).orElse(null) : null;
        List<TaskNode> forest = treeBuilder.build(parseTree.get(), defaultDate);

        ReplaceResult result = taskStore.replace(documentId, forest);
        if (result.getInserted() > 0) {
            log.debug("Indexed {}: {} tasks", documentId, result.getInserted());
        }
        return result.isChanged();
    }

    private boolean withDocumentLock(String documentId, BooleanSupplier work) {
        ReentrantLock lock = documentLocks[Math.floorMod(documentId.hashCode(), LOCK_STRIPES)];
        lock.lock();
        try {
            return work.getAsBoolean();
        } finally {
            lock.unlock();
        }
    }
}
