package com.dcruver.tasklist.document;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable node of a document parse tree.
 * Text runs are {@link NodeKind#TEXT} leaves, everything else is a container.
 */
@Value
@Builder
public class ParseNode {
    NodeKind kind;
    String text;         // TEXT only
    BulletKind bullet;   // LIST_ITEM only
    @Singular
    List<ParseNode> children;

    public static ParseNode text(String text) {
        return ParseNode.builder().kind(NodeKind.TEXT).text(text).build();
    }

    public static ParseNode of(NodeKind kind, List<ParseNode> children) {
        return ParseNode.builder().kind(kind).children(children).build();
    }

    public static ParseNode of(NodeKind kind, ParseNode... children) {
        return of(kind, List.of(children));
    }

    public static ParseNode listItem(BulletKind bullet, List<ParseNode> children) {
        return ParseNode.builder().kind(NodeKind.LIST_ITEM).bullet(bullet).children(children).build();
    }

    public static ParseNode listItem(BulletKind bullet, String text) {
        return listItem(bullet, List.of(text(text)));
    }

    public boolean isText() {
        return kind == NodeKind.TEXT;
    }
}
