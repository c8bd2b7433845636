package com.dcruver.tasklist.extract;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A task in an extracted forest, with its child tasks in document order.
 */
@Data
public class TaskNode {
    private final TaskFields fields;
    private final List<TaskNode> children = new ArrayList<>();

    public boolean isOpen() {
        return fields.isOpen();
    }
}
