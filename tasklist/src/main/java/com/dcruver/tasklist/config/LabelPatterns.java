package com.dcruver.tasklist.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Matchers for the configured task labels.
 * Labels are only recognized at the start of a text and must not be
 * followed by a word character, so "TODOS" is not a "TODO".
 */
@Component
@Slf4j
public class LabelPatterns {

    private final List<String> labels;
    private final String nextLabel;
    private final Pattern labelPattern;
    private final Pattern nextLabelPattern;

    @Autowired
    public LabelPatterns(TaskListProperties properties) {
        this(properties.getLabels(), properties.getNextLabel());
    }

    public LabelPatterns(List<String> configuredLabels, String nextLabel) {
        List<String> all = new ArrayList<>();
        if (configuredLabels != null) {
            configuredLabels.stream()
                .map(String::trim)
                .filter(label -> !label.isEmpty())
                .forEach(all::add);
        }

        if (nextLabel != null && !nextLabel.isBlank()) {
            this.nextLabel = nextLabel.trim();
            // "Next: do this" should not need to be written as "TODO: Next: do this"
            this.nextLabelPattern = Pattern.compile("^" + Pattern.quote(this.nextLabel) + ":?\\s+");
            all.add(this.nextLabel);
        } else {
            this.nextLabel = null;
            this.nextLabelPattern = null;
        }

        this.labels = Collections.unmodifiableList(all);
        this.labelPattern = all.isEmpty() ? null : Pattern.compile(
            "^(" + all.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")(?!\\w)");

        log.debug("Task labels: {}, next label: {}", this.labels, this.nextLabel);
    }

    /**
     * All recognized labels in configured order, the next label last
     */
    public List<String> getLabels() {
        return labels;
    }

    public String getNextLabel() {
        return nextLabel;
    }

    public boolean isNextLabel(String label) {
        return nextLabel != null && nextLabel.equals(label);
    }

    /**
     * The label the text starts with, if any
     */
    public Optional<String> matchLabel(String text) {
        if (labelPattern == null || text == null) {
            return Optional.empty();
        }
        Matcher matcher = labelPattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public boolean startsWithLabel(String text) {
        return matchLabel(text).isPresent();
    }

    /**
     * Labels recognized in a task description
     */
    public List<String> labelsIn(String description) {
        return matchLabel(description).map(List::of).orElse(List.of());
    }

    /**
     * Whether the text is an item of a "next" sequence
     */
    public boolean isNextItem(String text) {
        return nextLabelPattern != null && text != null && nextLabelPattern.matcher(text).find();
    }
}
