package com.dcruver.tasklist.index;

import com.dcruver.tasklist.document.Document;
import com.dcruver.tasklist.document.DocumentSource;
import com.dcruver.tasklist.store.TaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Polls the notebook for added, changed and deleted pages and passes them to the indexer.
 * The first scan indexes every page and drops tasks of pages that no longer exist.
 */
@Component
@ConditionalOnProperty(name = "tasklist.monitor.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class NotebookMonitor {

    private final DocumentSource documentSource;
    private final TaskListIndexer indexer;
    private final TaskStore taskStore;

    private final Map<String, Instant> lastSeen = new HashMap<>();
    private boolean firstScan = true;

    public NotebookMonitor(DocumentSource documentSource, TaskListIndexer indexer, TaskStore taskStore) {
        this.documentSource = documentSource;
        this.indexer = indexer;
        this.taskStore = taskStore;
    }

    @Scheduled(fixedDelayString = "${tasklist.monitor.interval-ms:30000}")
    public void poll() {
        try {
            ScanResult result = scan();
            if (result.indexed() > 0 || result.removed() > 0) {
                log.info("Notebook scan: {} pages indexed, {} removed", result.indexed(), result.removed());
            }
        } catch (Exception e) {
            log.error("Notebook scan failed", e);
        }
    }

    /**
     * Compare modification times with the previous scan and fire index/remove notifications
     */
    public synchronized ScanResult scan() {
        List<Document> documents = documentSource.listDocuments();
        Set<String> current = new HashSet<>();
        int indexed = 0;
        int removed = 0;

        for (Document document : documents) {
            current.add(document.getId());
            Instant modified = document.getModified();
            if (modified != null && modified.equals(lastSeen.get(document.getId()))) {
                continue;
            }
            try {
                indexer.onDocumentIndexed(document.getId());
                lastSeen.put(document.getId(), modified);
                indexed++;
            } catch (Exception e) {
                log.error("Failed to index page: {}", document.getId(), e);
            }
        }

        Set<String> gone = new HashSet<>(lastSeen.keySet());
        if (firstScan) {
            gone.addAll(taskStore.documentIds());
        }
        gone.removeAll(current);
        for (String documentId : gone) {
            try {
                if (indexer.onDocumentRemoved(documentId)) {
                    removed++;
                }
                lastSeen.remove(documentId);
            } catch (Exception e) {
                log.error("Failed to remove tasks of page: {}", documentId, e);
            }
        }

        firstScan = false;
        return new ScanResult(indexed, removed);
    }

    public record ScanResult(int indexed, int removed) {}
}
