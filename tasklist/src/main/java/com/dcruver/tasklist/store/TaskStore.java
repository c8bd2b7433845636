package com.dcruver.tasklist.store;

import com.dcruver.tasklist.config.TaskListProperties;
import com.dcruver.tasklist.extract.DueDates;
import com.dcruver.tasklist.extract.TaskFields;
import com.dcruver.tasklist.extract.TaskNode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores extracted tasks in SQLite as rows linked to their parent.
 *
 * All rows of a document are replaced in a single transaction, so readers
 * see either the old or the new forest of a document. Writes are serialized;
 * reads before {@link #init()} return nothing.
 */
@Component
@Slf4j
public class TaskStore {

    static final String FORMAT_VERSION = "0.6";

    private static final String FORMAT_KEY = "format";
    private static final String FINGERPRINT_KEY = "fingerprint";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final String fingerprint;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final RowMapper<TaskRow> rowMapper = new TaskRowMapper();

    private volatile boolean initialized;
    private volatile boolean rebuildRequired;
    private long lastId;

    @Autowired
    public TaskStore(DataSource dataSource, TaskListProperties properties) {
        this(dataSource, properties.rebuildFingerprint());
    }

    public TaskStore(DataSource dataSource, String fingerprint) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.fingerprint = fingerprint;
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tasklist_meta (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL
            )
            """);

        String storedFormat = readMeta(FORMAT_KEY);
        String storedFingerprint = readMeta(FINGERPRINT_KEY);
        if (!FORMAT_VERSION.equals(storedFormat) || !fingerprint.equals(storedFingerprint)) {
            if (storedFormat != null) {
                log.info("Task list format or settings changed, dropping stored tasks");
            }
            jdbcTemplate.execute("DROP TABLE IF EXISTS tasklist");
            rebuildRequired = true;
        }

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tasklist (
                id INTEGER PRIMARY KEY,
                source TEXT NOT NULL,
                parent INTEGER NOT NULL,
                haschildren BOOLEAN NOT NULL,
                open BOOLEAN NOT NULL,
                actionable BOOLEAN NOT NULL,
                prio INTEGER NOT NULL,
                due TEXT NOT NULL,
                description TEXT NOT NULL
            )
            """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_tasklist_source ON tasklist(source)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_tasklist_parent ON tasklist(parent)");

        writeMeta(FORMAT_KEY, FORMAT_VERSION);
        writeMeta(FINGERPRINT_KEY, fingerprint);

        Long maxId = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(id), 0) FROM tasklist", Long.class);
        lastId = maxId != null ? maxId : 0L;
        initialized = true;

        log.info("Initialized task store ({} tasks)", count());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * True when the stored rows were dropped at startup and the notebook must be indexed again
     */
    public boolean isRebuildRequired() {
        return rebuildRequired;
    }

    /**
     * Replace all rows of a document with the given forest.
     * Ids are assigned depth first, so siblings keep document order.
     */
    public ReplaceResult replace(String documentId, List<TaskNode> forest) {
        requireInitialized();
        writeLock.lock();
        try {
            long[] nextId = {lastId};
            ReplaceResult result = transactionTemplate.execute(status -> {
                int removed = jdbcTemplate.update("DELETE FROM tasklist WHERE source = ?", documentId);
                int inserted = insert(documentId, TaskRow.NO_PARENT, forest, nextId);
                return new ReplaceResult(removed, inserted);
            });
            lastId = nextId[0];
            log.debug("Replaced tasks of {}: {}", documentId, result);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private int insert(String documentId, long parentId, List<TaskNode> tasks, long[] nextId) {
        int inserted = 0;
        for (TaskNode task : tasks) {
            long id = ++nextId[0];
            TaskFields fields = task.getFields();
            jdbcTemplate.update(
                "INSERT INTO tasklist (id, source, parent, haschildren, open, actionable, prio, due, description) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                id, documentId, parentId, !task.getChildren().isEmpty(), fields.isOpen(), fields.isActionable(),
                fields.getPriority(), DueDates.toStored(fields.getDue()), fields.getDescription()
            );
            inserted++;
            if (!task.getChildren().isEmpty()) {
                inserted += insert(documentId, id, task.getChildren(), nextId);
            }
        }
        return inserted;
    }

    /**
     * Delete all rows of a document
     *
     * @return true if the document had any tasks
     */
    public boolean removeDocument(String documentId) {
        if (!initialized) {
            return false;
        }
        writeLock.lock();
        try {
            int removed = jdbcTemplate.update("DELETE FROM tasklist WHERE source = ?", documentId);
            log.debug("Removed {} tasks of {}", removed, documentId);
            return removed > 0;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Delete all rows, used before a full rebuild
     */
    public void clear() {
        requireInitialized();
        writeLock.lock();
        try {
            int removed = jdbcTemplate.update("DELETE FROM tasklist");
            log.info("Cleared {} stored tasks", removed);
            rebuildRequired = false;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Tasks below a parent in insertion order; null lists the top level tasks
     */
    public List<TaskRow> childrenOf(Long parentId) {
        if (!initialized) {
            return List.of();
        }
        long parent = parentId != null ? parentId : TaskRow.NO_PARENT;
        return jdbcTemplate.query("SELECT * FROM tasklist WHERE parent = ? ORDER BY id", rowMapper, parent);
    }

    public Optional<TaskRow> get(long taskId) {
        if (!initialized) {
            return Optional.empty();
        }
        List<TaskRow> rows = jdbcTemplate.query("SELECT * FROM tasklist WHERE id = ?", rowMapper, taskId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<TaskRow> allRows() {
        if (!initialized) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT * FROM tasklist ORDER BY id", rowMapper);
    }

    public List<String> documentIds() {
        if (!initialized) {
            return List.of();
        }
        return jdbcTemplate.queryForList("SELECT DISTINCT source FROM tasklist ORDER BY source", String.class);
    }

    public int count() {
        if (!initialized) {
            return 0;
        }
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM tasklist", Integer.class);
        return count != null ? count : 0;
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Task store is not initialized");
        }
    }

    private String readMeta(String key) {
        List<String> values = jdbcTemplate.queryForList(
            "SELECT value FROM tasklist_meta WHERE key = ?", String.class, key);
        return values.isEmpty() ? null : values.get(0);
    }

    private void writeMeta(String key, String value) {
        jdbcTemplate.update("INSERT OR REPLACE INTO tasklist_meta (key, value) VALUES (?, ?)", key, value);
    }

    private static class TaskRowMapper implements RowMapper<TaskRow> {
        @Override
        public TaskRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return TaskRow.builder()
                .id(rs.getLong("id"))
                .source(rs.getString("source"))
                .parentId(rs.getLong("parent"))
                .hasChildren(rs.getBoolean("haschildren"))
                .open(rs.getBoolean("open"))
                .actionable(rs.getBoolean("actionable"))
                .priority(rs.getInt("prio"))
                .due(DueDates.fromStored(rs.getString("due")))
                .description(rs.getString("description"))
                .build();
        }
    }
}
