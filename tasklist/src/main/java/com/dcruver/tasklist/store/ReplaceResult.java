package com.dcruver.tasklist.store;

import lombok.Value;

/**
 * Row counts of a document replace.
 */
@Value
public class ReplaceResult {
    int removed;
    int inserted;

    public boolean isChanged() {
        return removed > 0 || inserted > 0;
    }
}
