package com.dcruver.tasklist.query;

import com.dcruver.tasklist.store.TaskRow;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A stored task prepared for display and filtering.
 */
@Value
@Builder
public class TaskEntry {
    TaskRow row;
    String documentName;
    List<String> tags;     // without "@", in order of appearance
    List<String> labels;
    int depth;

    public long getId() {
        return row.getId();
    }

    public long getParentId() {
        return row.getParentId();
    }

    public boolean isOpen() {
        return row.isOpen();
    }

    public boolean isActionable() {
        return row.isActionable();
    }

    public String getDescription() {
        return row.getDescription();
    }
}
