package com.dcruver.tasklist.extract;

import com.dcruver.tasklist.config.LabelPatterns;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses the text of a single task into {@link TaskFields}.
 */
@Component
@RequiredArgsConstructor
public class FieldParser {

    private final LabelPatterns labels;

    /**
     * @param text raw item text
     * @param open whether the item is open (unchecked box, bullet or label line)
     * @param globalTags tags of the paragraph's task list header, appended when missing
     * @param defaultDate due date used when the text has no valid directive, may be null
     * @param defaultPriority priority used when the text has no "!", may be null
     * @param siblings tasks preceding this one at the same level
     */
    public TaskFields parse(String text, boolean open, List<String> globalTags,
                            LocalDate defaultDate, Integer defaultPriority, List<TaskNode> siblings) {
        int priority = countPriority(text);
        if (priority == 0 && defaultPriority != null && defaultPriority > 0) {
            priority = defaultPriority;
        }

        String description = appendTags(text, globalTags);

        DueDates.Extraction extraction = DueDates.extract(description);
        description = extraction.text();
        LocalDate due = extraction.date() != null ? extraction.date() : defaultDate;

        return TaskFields.builder()
            .open(open)
            .actionable(isActionable(description, siblings))
            .priority(priority)
            .due(due)
            .description(description)
            .build();
    }

    /**
     * Priority is the number of exclamation marks
     */
    static int countPriority(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '!') {
                count++;
            }
        }
        return count;
    }

    static String appendTags(String text, List<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return text;
        }
        StringBuilder result = new StringBuilder(text);
        for (String tag : tags) {
            Pattern present = Pattern.compile("(?<!\\S)" + Pattern.quote(tag) + "(?!\\w)", Pattern.CASE_INSENSITIVE);
            if (!present.matcher(result).find()) {
                result.append(' ').append(tag);
            }
        }
        return result.toString();
    }

    /**
     * A "next" item waits for the item before it at the same level to be closed
     */
    private boolean isActionable(String description, List<TaskNode> siblings) {
        if (!labels.isNextItem(description)) {
            return true;
        }
        return siblings == null || siblings.isEmpty() || !siblings.get(siblings.size() - 1).isOpen();
    }
}
