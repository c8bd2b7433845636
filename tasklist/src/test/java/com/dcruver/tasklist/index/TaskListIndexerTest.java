package com.dcruver.tasklist.index;

import com.dcruver.tasklist.config.LabelPatterns;
import com.dcruver.tasklist.config.TaskListProperties;
import com.dcruver.tasklist.document.CalendarPages;
import com.dcruver.tasklist.document.NotebookDocumentSource;
import com.dcruver.tasklist.document.OutlineFileReader;
import com.dcruver.tasklist.extract.FieldParser;
import com.dcruver.tasklist.extract.Flattener;
import com.dcruver.tasklist.extract.TreeBuilder;
import com.dcruver.tasklist.store.TaskRow;
import com.dcruver.tasklist.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Indexes a small notebook in a temp directory into a SQLite store.
 */
class TaskListIndexerTest {

    @TempDir
    Path notebook;

    @TempDir
    Path dataDir;

    private TaskListProperties properties;
    private TaskStore store;
    private ApplicationEventPublisher publisher;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(notebook.resolve("Projects"));
        Files.createDirectories(notebook.resolve("Journal/2024/03"));
        Files.createDirectories(notebook.resolve("Archive"));
        Files.writeString(notebook.resolve("Projects/Home.txt"), """
            Content-Type: text/x-zim-wiki
            Wiki-Format: zim 0.4

            ====== Home ======

            [ ] paint the fence !
            \t[ ] buy paint
            [*] fix the door
            """);
        Files.writeString(notebook.resolve("Journal/2024/03/01.txt"), "[ ] call back\n");
        Files.writeString(notebook.resolve("Archive/Old.txt"), "[ ] forgotten\n");

        properties = new TaskListProperties();
        properties.setNotebookPath(notebook.toString());

        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dataDir.resolve("tasks.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new TaskStore(dataSource, properties);
        store.init();

        publisher = mock(ApplicationEventPublisher.class);
    }

    private TaskListIndexer indexer() {
        LabelPatterns labels = new LabelPatterns(properties);
        TreeBuilder treeBuilder = new TreeBuilder(new Flattener(), new FieldParser(labels), labels, properties);
        NotebookDocumentSource source = new NotebookDocumentSource(new OutlineFileReader(), properties);
        return new TaskListIndexer(store, source, treeBuilder, new CalendarPages(properties), publisher, properties);
    }

    @Test
    void testIndexDocument() {
        TaskListIndexer indexer = indexer();

        assertTrue(indexer.onDocumentIndexed("Projects:Home"));

        List<TaskRow> top = store.childrenOf(null);
        assertEquals(List.of("paint the fence !", "fix the door"), top.stream().map(TaskRow::getDescription).toList());
        assertEquals(1, store.childrenOf(top.get(0).getId()).get(0).getPriority());
        verify(publisher).publishEvent(any(TaskListChangedEvent.class));
    }

    @Test
    void testDeletedPageDropsItsTasks() throws Exception {
        TaskListIndexer indexer = indexer();
        indexer.onDocumentIndexed("Projects:Home");

        Files.delete(notebook.resolve("Projects/Home.txt"));

        assertTrue(indexer.onDocumentIndexed("Projects:Home"));
        assertEquals(0, store.count());
        assertFalse(indexer.onDocumentRemoved("Projects:Home"));
    }

    @Test
    void testRemovingUnknownPageDoesNotNotify() {
        TaskListIndexer indexer = indexer();

        assertFalse(indexer.onDocumentRemoved("Nope"));
        verify(publisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void testCalendarPageDeadline() {
        properties.setDeadlineByPage(true);
        TaskListIndexer indexer = indexer();

        indexer.onDocumentIndexed("Journal:2024:03:01");

        assertEquals(LocalDate.of(2024, 3, 1), store.childrenOf(null).get(0).getDue());
    }

    @Test
    void testNoDeadlineWithoutSetting() {
        indexer().onDocumentIndexed("Journal:2024:03:01");

        assertNull(store.childrenOf(null).get(0).getDue());
    }

    @Test
    void testExcludedSubtree() {
        properties.setExcludedSubtrees(List.of("Archive"));
        TaskListIndexer indexer = indexer();

        assertFalse(indexer.onDocumentIndexed("Archive:Old"));
        assertEquals(0, store.count());
    }

    @Test
    void testRebuild() {
        TaskListIndexer indexer = indexer();

        assertEquals(3, indexer.rebuild());
        assertEquals(List.of("Archive:Old", "Journal:2024:03:01", "Projects:Home"), store.documentIds());
        assertEquals(5, store.count());
        verify(publisher).publishEvent(new TaskListChangedEvent(null));
    }

    @Test
    void testRebuildOnlyWhenStoreWasDropped() {
        TaskListIndexer indexer = indexer();

        indexer.rebuildIfRequired();
        assertEquals(5, store.count());
        assertFalse(store.isRebuildRequired());

        store.removeDocument("Projects:Home");
        indexer.rebuildIfRequired();
        assertEquals(2, store.count());
    }

    @Test
    void testConcurrentIndexingOfOnePage() throws Exception {
        TaskListIndexer indexer = indexer();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> indexer.onDocumentIndexed("Projects:Home")));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get());
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(3, store.count());
        assertEquals(2, store.childrenOf(null).size());
    }

    @Test
    void testIgnoredBeforeStoreInit() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dataDir.resolve("other.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new TaskStore(dataSource, "test");

        assertFalse(indexer().onDocumentIndexed("Projects:Home"));
    }
}
