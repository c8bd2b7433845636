package com.dcruver.tasklist.document;

/**
 * Bullet types of list items in an outline document.
 */
public enum BulletKind {
    /**
     * Open checkbox, written as {@code [ ]}
     */
    UNCHECKED_BOX,

    /**
     * Done checkbox, written as {@code [*]}
     */
    CHECKED_BOX,

    /**
     * Cancelled checkbox, written as {@code [x]}
     */
    CANCELLED_BOX,

    /**
     * Ordinary bullet or numbered item
     */
    PLAIN_BULLET;

    public boolean isCheckbox() {
        return this != PLAIN_BULLET;
    }

    /**
     * Checked and cancelled boxes close a task, everything else leaves it open.
     */
    public boolean isClosed() {
        return this == CHECKED_BOX || this == CANCELLED_BOX;
    }
}
