package com.dcruver.tasklist.query;

import com.dcruver.tasklist.config.LabelPatterns;
import com.dcruver.tasklist.document.Document;
import com.dcruver.tasklist.document.DocumentSource;
import com.dcruver.tasklist.extract.TaskFields;
import com.dcruver.tasklist.extract.TaskNode;
import com.dcruver.tasklist.index.TaskListChangedEvent;
import com.dcruver.tasklist.store.TaskRow;
import com.dcruver.tasklist.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TaskListServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private DocumentSource documentSource;

    private TaskStore store;
    private TaskListService service;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("tasks.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new TaskStore(dataSource, "test");
        store.init();

        when(documentSource.lookup(anyString())).thenReturn(Optional.empty());
        for (String name : List.of("A:Page", "B:Page")) {
            when(documentSource.lookup(name))
                .thenReturn(Optional.of(Document.builder().id(name).name(name).build()));
        }

        LabelPatterns labels = new LabelPatterns(List.of("FIXME", "TODO"), "Next:");
        service = new TaskListService(store, documentSource, labels, new QueryEngine(), false);
    }

    private static TaskNode task(String description, TaskNode... children) {
        TaskNode node = new TaskNode(TaskFields.builder()
            .open(true).actionable(true).priority(0).description(description).build());
        node.getChildren().addAll(List.of(children));
        return node;
    }

    @Test
    void testSnapshotOrderAndDepth() {
        store.replace("B:Page", List.of(task("TODO b task @Work")));
        store.replace("A:Page", List.of(task("a task", task("a child"))));

        List<TaskEntry> entries = service.snapshot();

        assertEquals(List.of("a task", "a child", "TODO b task @Work"),
            entries.stream().map(TaskEntry::getDescription).toList());
        assertEquals(List.of(0, 1, 0), entries.stream().map(TaskEntry::getDepth).toList());
        assertEquals(List.of("Work"), entries.get(2).getTags());
        assertEquals(List.of("TODO"), entries.get(2).getLabels());
        assertEquals("B:Page", entries.get(2).getDocumentName());
    }

    @Test
    void testReplaceDuringSnapshotShowsWholeForest() {
        store.replace("A:Page", List.of(task("root v1", task("child v1"))));
        AtomicBoolean replaced = new AtomicBoolean();
        when(documentSource.lookup("A:Page")).thenAnswer(invocation -> {
            if (replaced.compareAndSet(false, true)) {
                store.replace("A:Page", List.of(task("root v2", task("child v2"))));
            }
            return Optional.of(Document.builder().id("A:Page").name("A:Page").build());
        });

        List<TaskEntry> during = service.snapshot();

        assertTrue(replaced.get());
        assertEquals(List.of("root v1", "child v1"), during.stream().map(TaskEntry::getDescription).toList());
        assertTrue(during.get(0).getRow().isHasChildren());

        service.onTaskListChanged(new TaskListChangedEvent("A:Page"));
        assertEquals(List.of("root v2", "child v2"),
            service.snapshot().stream().map(TaskEntry::getDescription).toList());
    }

    @Test
    void testChangeDuringBuildIsNotCached() {
        store.replace("A:Page", List.of(task("first")));
        AtomicBoolean changed = new AtomicBoolean();
        when(documentSource.lookup("A:Page")).thenAnswer(invocation -> {
            if (changed.compareAndSet(false, true)) {
                store.replace("B:Page", List.of(task("second")));
                service.onTaskListChanged(new TaskListChangedEvent("B:Page"));
            }
            return Optional.of(Document.builder().id("A:Page").name("A:Page").build());
        });

        assertEquals(1, service.snapshot().size());
        assertEquals(List.of("first", "second"),
            service.snapshot().stream().map(TaskEntry::getDescription).toList());
    }

    @Test
    void testTasksOfMissingDocumentsAreLeftOut() {
        store.replace("A:Page", List.of(task("kept")));
        store.replace("Gone:Page", List.of(task("stale", task("stale child"))));

        List<TaskEntry> entries = service.snapshot();

        assertEquals(List.of("kept"), entries.stream().map(TaskEntry::getDescription).toList());
        assertEquals(1, service.statistics().getTotal());
    }

    @Test
    void testSnapshotIsCachedUntilChange() {
        store.replace("A:Page", List.of(task("first")));
        assertEquals(1, service.snapshot().size());

        store.replace("B:Page", List.of(task("second")));
        assertEquals(1, service.snapshot().size());

        service.onTaskListChanged(new TaskListChangedEvent("B:Page"));
        assertEquals(2, service.snapshot().size());
    }

    @Test
    void testQueryKeepsTreeOrder() {
        store.replace("A:Page", List.of(
            task("garden", task("buy seeds @shop")),
            task("cook dinner")));

        List<TaskEntry> result = service.query(FilterCriteria.builder().tags(Set.of("shop")).build());

        assertEquals(List.of("garden", "buy seeds @shop"),
            result.stream().map(TaskEntry::getDescription).toList());
    }

    @Test
    void testPageTags() {
        LabelPatterns labels = new LabelPatterns(List.of("TODO"), "");
        TaskListService byPage = new TaskListService(store, documentSource, labels, new QueryEngine(), true);
        store.replace("A:Page", List.of(task("water plants @home")));

        TaskEntry entry = byPage.snapshot().get(0);

        assertEquals(List.of("home", "A", "Page"), entry.getTags());
        assertEquals(1, byPage.tagIndex().count("page"));
    }

    @Test
    void testBrowsing() {
        store.replace("A:Page", List.of(task("parent", task("child"))));

        TaskRow parent = service.listTasks(null).get(0);
        List<TaskRow> children = service.listTasks(parent);

        assertEquals("child", children.get(0).getDescription());
        assertEquals(parent, service.getTask(parent.getId()).orElseThrow());
        assertEquals("A:Page", service.getDocumentOf(parent).orElseThrow().getName());
    }
}
