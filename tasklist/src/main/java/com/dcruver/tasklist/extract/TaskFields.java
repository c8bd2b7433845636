package com.dcruver.tasklist.extract;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Parsed properties of a single task.
 */
@Value
@Builder
public class TaskFields {
    boolean open;
    boolean actionable;
    int priority;
    LocalDate due;        // null when the task has no due date
    String description;
}
