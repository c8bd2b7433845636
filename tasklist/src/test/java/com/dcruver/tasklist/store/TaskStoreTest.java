package com.dcruver.tasklist.store;

import com.dcruver.tasklist.extract.TaskFields;
import com.dcruver.tasklist.extract.TaskNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQLite task store, run against a database file in a temp directory.
 */
class TaskStoreTest {

    @TempDir
    Path tempDir;

    private DriverManagerDataSource dataSource;
    private TaskStore store;

    @BeforeEach
    void setUp() {
        dataSource = new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("tasks.db"));
        dataSource.setDriverClassName("org.sqlite.JDBC");
        store = new TaskStore(dataSource, "test");
        store.init();
    }

    private static TaskNode task(String description, TaskNode... children) {
        return task(description, true, children);
    }

    private static TaskNode task(String description, boolean open, TaskNode... children) {
        TaskNode node = new TaskNode(TaskFields.builder()
            .open(open)
            .actionable(true)
            .priority(1)
            .description(description)
            .build());
        node.getChildren().addAll(List.of(children));
        return node;
    }

    private List<TaskNode> sampleForest() {
        return List.of(
            task("root", task("child", task("grandchild"))),
            task("second root", false));
    }

    @Test
    void testReplaceStoresForest() {
        ReplaceResult result = store.replace("Projects:Home", sampleForest());

        assertEquals(0, result.getRemoved());
        assertEquals(4, result.getInserted());
        assertTrue(result.isChanged());

        List<TaskRow> top = store.childrenOf(null);
        assertEquals(List.of("root", "second root"), top.stream().map(TaskRow::getDescription).toList());
        assertTrue(top.get(0).isHasChildren());
        assertTrue(top.get(0).isTopLevel());
        assertFalse(top.get(1).isOpen());

        TaskRow child = store.childrenOf(top.get(0).getId()).get(0);
        assertEquals("child", child.getDescription());
        assertEquals(top.get(0).getId(), child.getParentId());
        assertEquals("Projects:Home", child.getSource());

        TaskRow grandchild = store.childrenOf(child.getId()).get(0);
        assertFalse(grandchild.isHasChildren());
        assertNull(grandchild.getDue());
        assertEquals(grandchild, store.get(grandchild.getId()).orElseThrow());
    }

    @Test
    void testHasChildrenMatchesStoredChildren() {
        store.replace("A", sampleForest());
        store.replace("B", List.of(task("lonely")));

        List<TaskRow> rows = store.allRows();
        Map<Long, TaskRow> byId = rows.stream().collect(Collectors.toMap(TaskRow::getId, Function.identity()));
        for (TaskRow row : rows) {
            boolean hasStoredChild = rows.stream().anyMatch(other -> other.getParentId() == row.getId());
            assertEquals(hasStoredChild, row.isHasChildren(), row.getDescription());
            if (!row.isTopLevel()) {
                assertEquals(row.getSource(), byId.get(row.getParentId()).getSource());
            }
        }
    }

    @Test
    void testReplaceIsIdempotent() {
        store.replace("Projects:Home", sampleForest());
        ReplaceResult again = store.replace("Projects:Home", sampleForest());

        assertEquals(4, again.getRemoved());
        assertEquals(4, again.getInserted());
        assertEquals(List.of("child", "grandchild", "root", "second root"),
            store.allRows().stream().map(TaskRow::getDescription).sorted().toList());
    }

    @Test
    void testReplaceLeavesOtherDocumentsAlone() {
        store.replace("A", sampleForest());
        store.replace("B", List.of(task("other")));
        store.replace("A", List.of());

        assertEquals(List.of("B"), store.documentIds());
        assertEquals(1, store.count());
    }

    @Test
    void testDueDateRoundTrip() {
        TaskNode dated = new TaskNode(TaskFields.builder()
            .open(true).priority(0).due(LocalDate.of(2024, 3, 1)).description("dated").build());
        store.replace("A", List.of(dated));

        assertEquals(LocalDate.of(2024, 3, 1), store.childrenOf(null).get(0).getDue());
    }

    @Test
    void testRemoveDocument() {
        store.replace("A", sampleForest());

        assertFalse(store.removeDocument("Missing"));
        assertTrue(store.removeDocument("A"));
        assertEquals(0, store.count());
        assertFalse(store.removeDocument("A"));
    }

    @Test
    void testFailedReplaceKeepsPreviousRows() {
        store.replace("A", sampleForest());

        TaskNode broken = new TaskNode(TaskFields.builder().open(true).build());
        assertThrows(DataAccessException.class, () -> store.replace("A", List.of(task("ok"), broken)));

        assertEquals(4, store.count());
        assertEquals(2, store.childrenOf(null).size());
    }

    @Test
    void testIdsKeepGrowingAfterReopen() {
        store.replace("A", sampleForest());
        long maxId = store.allRows().stream().mapToLong(TaskRow::getId).max().orElseThrow();

        TaskStore reopened = new TaskStore(dataSource, "test");
        reopened.init();
        reopened.replace("B", List.of(task("later")));

        assertFalse(reopened.isRebuildRequired());
        assertTrue(reopened.childrenOf(null).stream()
            .filter(row -> row.getSource().equals("B"))
            .allMatch(row -> row.getId() > maxId));
    }

    @Test
    void testChangedSettingsDropStoredTasks() {
        store.replace("A", sampleForest());

        TaskStore reopened = new TaskStore(dataSource, "other settings");
        reopened.init();

        assertTrue(reopened.isRebuildRequired());
        assertEquals(0, reopened.count());

        reopened.clear();
        assertFalse(reopened.isRebuildRequired());
    }

    @Test
    void testReadsBeforeInit() {
        TaskStore fresh = new TaskStore(dataSource, "test");

        assertFalse(fresh.isInitialized());
        assertTrue(fresh.childrenOf(null).isEmpty());
        assertTrue(fresh.get(1).isEmpty());
        assertTrue(fresh.documentIds().isEmpty());
        assertFalse(fresh.removeDocument("A"));
        assertThrows(IllegalStateException.class, () -> fresh.replace("A", List.of()));
    }
}
