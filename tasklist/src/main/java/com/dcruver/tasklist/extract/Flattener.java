package com.dcruver.tasklist.extract;

import com.dcruver.tasklist.document.NodeKind;
import com.dcruver.tasklist.document.ParseNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a paragraph of the parse tree into a flat sequence of lines and list entries.
 * Struck out text is dropped everywhere; unexpected nodes are skipped.
 */
@Component
@Slf4j
public class Flattener {

    private static final String LINE_BREAK = "\\R";

    public List<Item> flattenParagraph(ParseNode paragraph) {
        List<Item> items = new ArrayList<>();
        StringBuilder text = new StringBuilder();

        for (ParseNode child : paragraph.getChildren()) {
            switch (child.getKind()) {
                case TEXT, INLINE -> text.append(flattenText(child));
                case STRIKE -> {
                    // struck out text is never a task
                }
                case LIST -> {
                    addLines(text, items);
                    text.setLength(0);
                    flattenList(child, 0, items);
                }
                default -> log.debug("Skipping {} node inside paragraph", child.getKind());
            }
        }

        addLines(text, items);
        return items;
    }

    /**
     * Emit one entry per list item; nested lists go one level deeper.
     * A list nested inside an item follows that item's entry.
     */
    private void flattenList(ParseNode list, int level, List<Item> items) {
        for (ParseNode node : list.getChildren()) {
            if (node.getKind() == NodeKind.LIST) {
                flattenList(node, level + 1, items);
            } else if (node.getKind() == NodeKind.LIST_ITEM) {
                items.add(Item.listEntry(node.getBullet(), level, flattenText(node)));
                for (ParseNode nested : node.getChildren()) {
                    if (nested.getKind() == NodeKind.LIST) {
                        flattenList(nested, level + 1, items);
                    }
                }
            } else {
                log.debug("Skipping {} node inside list", node.getKind());
            }
        }
    }

    /**
     * All text below a node, without struck out parts and nested lists
     */
    String flattenText(ParseNode node) {
        if (node.isText()) {
            return node.getText() != null ? node.getText() : "";
        }
        StringBuilder text = new StringBuilder();
        for (ParseNode child : node.getChildren()) {
            if (child.getKind() == NodeKind.STRIKE || child.getKind() == NodeKind.LIST) {
                continue;
            }
            text.append(flattenText(child));
        }
        return text.toString();
    }

    private void addLines(CharSequence text, List<Item> items) {
        if (text.length() == 0) {
            return;
        }
        for (String line : text.toString().split(LINE_BREAK)) {
            items.add(Item.text(line));
        }
    }
}
