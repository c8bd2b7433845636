package com.dcruver.tasklist.index;

import lombok.Value;

/**
 * Published after stored tasks changed. The document id is null after a full rebuild.
 */
@Value
public class TaskListChangedEvent {
    String documentId;

    public boolean isRebuild() {
        return documentId == null;
    }
}
