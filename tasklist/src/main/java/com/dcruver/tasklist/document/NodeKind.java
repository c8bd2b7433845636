package com.dcruver.tasklist.document;

/**
 * Node types of a parsed outline document.
 */
public enum NodeKind {
    DOCUMENT,
    PARAGRAPH,
    HEADING,
    LIST,
    LIST_ITEM,
    TEXT,
    STRIKE,
    INLINE,
    UNKNOWN
}
