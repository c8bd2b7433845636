package com.dcruver.tasklist.extract;

import com.dcruver.tasklist.document.BulletKind;
import lombok.Value;

/**
 * One line of a flattened paragraph: either plain text or a list entry
 * with its bullet and nesting level.
 */
@Value
public class Item {
    BulletKind bullet;  // null for plain text
    int level;
    String text;

    public static Item text(String text) {
        return new Item(null, 0, text);
    }

    public static Item listEntry(BulletKind bullet, int level, String text) {
        return new Item(bullet, level, text);
    }

    public boolean isListEntry() {
        return bullet != null;
    }
}
