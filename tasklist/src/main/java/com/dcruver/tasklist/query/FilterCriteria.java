package com.dcruver.tasklist.query;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * What the task list should show. Null sets and a null text filter mean "no restriction".
 */
@Value
@Builder(toBuilder = true)
public class FilterCriteria {

    /**
     * Pseudo tag matching tasks without any tag
     */
    public static final String NO_TAGS = "__no_tags__";

    boolean actionableOnly;
    Set<String> tags;
    Set<String> labels;
    TextFilter text;

    public static FilterCriteria all() {
        return FilterCriteria.builder().build();
    }
}
