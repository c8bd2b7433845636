package com.dcruver.tasklist.store;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * A stored task. Top level tasks have parent id 0.
 */
@Data
@Builder
public class TaskRow {
    public static final long NO_PARENT = 0L;

    private final long id;
    private final String source;
    private final long parentId;
    private final boolean hasChildren;
    private final boolean open;
    private final boolean actionable;
    private final int priority;
    private final LocalDate due;
    private final String description;

    public boolean isTopLevel() {
        return parentId == NO_PARENT;
    }
}
