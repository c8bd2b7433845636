package com.dcruver.tasklist.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads outline pages written in the zim wiki dialect into a parse tree.
 * Only the structure needed for task extraction is recognized: headings,
 * paragraphs, nested bullet and checkbox lists, and a few inline styles.
 */
@Component
@Slf4j
public class OutlineFileReader {

    private static final Pattern FILE_HEADER = Pattern.compile("^Content-Type:\\s*\\S+.*$");
    private static final Pattern HEADING = Pattern.compile("^(={2,})\\s+(.+?)\\s+=+\\s*$");
    private static final Pattern LIST_LINE = Pattern.compile("^([\\t ]*)(\\*|\\[[ *xX]\\]|\\d+\\.|[a-zA-Z]\\.)\\s+(.*)$");
    private static final Pattern INLINE = Pattern.compile(
        "~~(.+?)~~|\\*\\*(.+?)\\*\\*|__(.+?)__|\\[\\[([^|\\]]+)(?:\\|([^\\]]*))?\\]\\]");

    private static final Pattern LETTER_MARKER = Pattern.compile("^[a-zA-Z]\\.$");

    private static final int SPACES_PER_LEVEL = 4;

    /**
     * Read and parse an outline file
     */
    public ParseNode read(Path filePath) throws IOException {
        String content = Files.readString(filePath);
        ParseNode tree = parse(content);
        log.debug("Parsed {} into {} blocks", filePath.getFileName(), tree.getChildren().size());
        return tree;
    }

    /**
     * Parse outline text into a document node whose children are paragraphs and headings
     */
    public ParseNode parse(String content) {
        List<String> lines = content.lines().toList();
        List<ParseNode> blocks = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();

        for (int i = skipFileHeader(lines); i < lines.size(); i++) {
            String line = lines.get(i);

            Matcher headingMatcher = HEADING.matcher(line);
            if (headingMatcher.matches()) {
                flushParagraph(paragraph, blocks);
                blocks.add(ParseNode.of(NodeKind.HEADING, parseInline(headingMatcher.group(2))));
            } else if (line.isBlank()) {
                flushParagraph(paragraph, blocks);
            } else {
                paragraph.add(line);
            }
        }
        flushParagraph(paragraph, blocks);

        return ParseNode.of(NodeKind.DOCUMENT, blocks);
    }

    /**
     * Skip the "Content-Type: ..." header block up to and including the first blank line
     */
    private int skipFileHeader(List<String> lines) {
        if (lines.isEmpty() || !FILE_HEADER.matcher(lines.get(0)).matches()) {
            return 0;
        }
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).isBlank()) {
                return i + 1;
            }
        }
        return lines.size();
    }

    private void flushParagraph(List<String> lines, List<ParseNode> blocks) {
        if (lines.isEmpty()) {
            return;
        }
        blocks.add(buildParagraph(lines));
        lines.clear();
    }

    /**
     * Build a paragraph node. Consecutive list lines form one list, nested by indentation;
     * other lines become text runs, keeping their line breaks.
     */
    private ParseNode buildParagraph(List<String> lines) {
        List<ParseNode> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        ListBuilder list = null;

        for (String line : lines) {
            Matcher listMatcher = LIST_LINE.matcher(line);
            // "a." only continues a list, otherwise "P. S. call Bob" would be an item
            boolean listItem = listMatcher.matches()
                && (list != null || !LETTER_MARKER.matcher(listMatcher.group(2)).matches());
            if (listItem) {
                if (text.length() > 0) {
                    children.addAll(parseInline(text.toString()));
                    text.setLength(0);
                }
                if (list == null) {
                    list = new ListBuilder();
                }
                int indent = indentLevel(listMatcher.group(1));
                BulletKind bullet = bulletKind(listMatcher.group(2));
                list.add(indent, ParseNode.listItem(bullet, parseInline(listMatcher.group(3))));
            } else {
                if (list != null) {
                    children.add(list.build());
                    list = null;
                }
                text.append(line).append('\n');
            }
        }

        if (list != null) {
            children.add(list.build());
        }
        if (text.length() > 0) {
            children.addAll(parseInline(text.toString()));
        }

        return ParseNode.of(NodeKind.PARAGRAPH, children);
    }

    /**
     * Split text into plain runs and inline formatting nodes
     */
    List<ParseNode> parseInline(String text) {
        List<ParseNode> nodes = new ArrayList<>();
        Matcher matcher = INLINE.matcher(text);
        int position = 0;

        while (matcher.find()) {
            if (matcher.start() > position) {
                nodes.add(ParseNode.text(text.substring(position, matcher.start())));
            }

            if (matcher.group(1) != null) {
                nodes.add(ParseNode.of(NodeKind.STRIKE, ParseNode.text(matcher.group(1))));
            } else if (matcher.group(2) != null) {
                nodes.add(ParseNode.of(NodeKind.INLINE, ParseNode.text(matcher.group(2))));
            } else if (matcher.group(3) != null) {
                nodes.add(ParseNode.of(NodeKind.INLINE, ParseNode.text(matcher.group(3))));
            } else {
                String label = matcher.group(5);
                String shown = label != null && !label.isBlank() ? label : matcher.group(4);
                nodes.add(ParseNode.of(NodeKind.INLINE, ParseNode.text(shown)));
            }
            position = matcher.end();
        }

        if (position < text.length()) {
            nodes.add(ParseNode.text(text.substring(position)));
        }
        return nodes;
    }

    private int indentLevel(String whitespace) {
        int tabs = 0;
        int spaces = 0;
        for (char c : whitespace.toCharArray()) {
            if (c == '\t') {
                tabs++;
            } else {
                spaces++;
            }
        }
        return tabs + spaces / SPACES_PER_LEVEL;
    }

    private BulletKind bulletKind(String marker) {
        return switch (marker) {
            case "[ ]" -> BulletKind.UNCHECKED_BOX;
            case "[*]" -> BulletKind.CHECKED_BOX;
            case "[x]", "[X]" -> BulletKind.CANCELLED_BOX;
            default -> BulletKind.PLAIN_BULLET;
        };
    }

    /**
     * Collects list items into nested lists. A nested list is added to its parent
     * list right after the item that precedes it.
     */
    private static class ListBuilder {
        private final Deque<Level> levels = new ArrayDeque<>();

        void add(int indent, ParseNode item) {
            if (levels.isEmpty()) {
                levels.push(new Level(indent, new ArrayList<>()));
            }
            while (levels.size() > 1 && levels.peek().indent() > indent) {
                closeLevel();
            }
            if (indent > levels.peek().indent()) {
                levels.push(new Level(indent, new ArrayList<>()));
            }
            levels.peek().items().add(item);
        }

        ParseNode build() {
            while (levels.size() > 1) {
                closeLevel();
            }
            return ParseNode.of(NodeKind.LIST, levels.pop().items());
        }

        private void closeLevel() {
            Level nested = levels.pop();
            levels.peek().items().add(ParseNode.of(NodeKind.LIST, nested.items()));
        }

        private record Level(int indent, List<ParseNode> items) {}
    }
}
