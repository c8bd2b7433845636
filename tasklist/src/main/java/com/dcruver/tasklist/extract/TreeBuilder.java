package com.dcruver.tasklist.extract;

import com.dcruver.tasklist.config.LabelPatterns;
import com.dcruver.tasklist.config.TaskListProperties;
import com.dcruver.tasklist.document.NodeKind;
import com.dcruver.tasklist.document.ParseNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Extracts the task forest of a document.
 *
 * Paragraphs are flattened and walked line by line with an explicit stack of
 * open ancestor tasks, so nesting follows list indentation. A plain text line
 * ends all open lists. Children inherit due date and priority from their parent
 * unless they set their own.
 */
@Component
@Slf4j
public class TreeBuilder {

    private static final int NOT_PRUNED = -1;

    private final Flattener flattener;
    private final FieldParser fieldParser;
    private final LabelPatterns labels;
    private final boolean allCheckboxes;

    @Autowired
    public TreeBuilder(Flattener flattener, FieldParser fieldParser, LabelPatterns labels,
                       TaskListProperties properties) {
        this(flattener, fieldParser, labels, properties.isAllCheckboxes());
    }

    public TreeBuilder(Flattener flattener, FieldParser fieldParser, LabelPatterns labels, boolean allCheckboxes) {
        this.flattener = flattener;
        this.fieldParser = fieldParser;
        this.labels = labels;
        this.allCheckboxes = allCheckboxes;
    }

    /**
     * @param document parse tree, its paragraph children are searched for tasks
     * @param defaultDate due date for the whole document, may be null
     * @return top level tasks in document order
     */
    public List<TaskNode> build(ParseNode document, LocalDate defaultDate) {
        List<TaskNode> tasks = new ArrayList<>();
        for (ParseNode block : document.getChildren()) {
            if (block.getKind() == NodeKind.PARAGRAPH) {
                buildParagraph(flattener.flattenParagraph(block), defaultDate, tasks);
            }
        }
        log.debug("Extracted {} top level tasks", tasks.size());
        return tasks;
    }

    void buildParagraph(List<Item> lines, LocalDate defaultDate, List<TaskNode> tasks) {
        TaskListHeader header = TaskListHeader.detect(lines, labels);
        List<Item> items = header.isConfirmed() ? lines.subList(1, lines.size()) : lines;
        List<String> globalTags = header.getTags();

        Deque<Frame> stack = new ArrayDeque<>();
        int prunedLevel = NOT_PRUNED;

        for (Item item : items) {
            if (!item.isListEntry()) {
                stack.clear();
                prunedLevel = NOT_PRUNED;
                if (labels.startsWithLabel(item.getText())) {
                    TaskFields fields = fieldParser.parse(item.getText(), true, globalTags, defaultDate, null, tasks);
                    tasks.add(new TaskNode(fields));
                }
                continue;
            }

            int level = item.getLevel();
            while (!stack.isEmpty() && stack.peek().level() >= level) {
                stack.pop();
            }

            if (prunedLevel != NOT_PRUNED) {
                if (level > prunedLevel) {
                    continue;
                }
                prunedLevel = NOT_PRUNED;
            }

            if (!isTask(item, header.isConfirmed())) {
                prunedLevel = level;
                continue;
            }

            LocalDate myDefaultDate = defaultDate;
            Integer myDefaultPriority = null;
            if (!stack.isEmpty()) {
                TaskFields parent = stack.peek().task().getFields();
                if (parent.getDue() != null) {
                    myDefaultDate = parent.getDue();
                }
                myDefaultPriority = parent.getPriority();
            }

            List<TaskNode> siblings = stack.isEmpty() ? tasks : stack.peek().task().getChildren();
            boolean open = !item.getBullet().isClosed();
            TaskFields fields = fieldParser.parse(
                item.getText(), open, globalTags, myDefaultDate, myDefaultPriority, siblings);

            TaskNode task = new TaskNode(fields);
            siblings.add(task);
            stack.push(new Frame(level, task));
        }
    }

    private boolean isTask(Item item, boolean taskListHeader) {
        return (item.getBullet().isCheckbox() && (taskListHeader || allCheckboxes))
            || labels.startsWithLabel(item.getText());
    }

    private record Frame(int level, TaskNode task) {}
}
