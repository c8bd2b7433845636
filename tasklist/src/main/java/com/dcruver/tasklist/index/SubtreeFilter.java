package com.dcruver.tasklist.index;

import com.dcruver.tasklist.document.Document;

import java.util.List;

/**
 * Restricts indexing to pages below the included namespaces and outside the excluded ones.
 * A subtree matches the page itself and every page below it.
 */
public class SubtreeFilter {

    private final List<String> included;
    private final List<String> excluded;

    public SubtreeFilter(List<String> included, List<String> excluded) {
        this.included = normalize(included);
        this.excluded = normalize(excluded);
    }

    public boolean accepts(String pageName) {
        if (!included.isEmpty() && included.stream().noneMatch(subtree -> isBelow(pageName, subtree))) {
            return false;
        }
        return excluded.stream().noneMatch(subtree -> isBelow(pageName, subtree));
    }

    private static boolean isBelow(String pageName, String subtree) {
        return pageName.equals(subtree) || pageName.startsWith(subtree + Document.NAMESPACE_SEPARATOR);
    }

    private static List<String> normalize(List<String> subtrees) {
        if (subtrees == null) {
            return List.of();
        }
        return subtrees.stream()
            .map(String::trim)
            .map(s -> s.replaceAll("^:+|:+$", ""))
            .filter(s -> !s.isEmpty())
            .toList();
    }
}
