package com.dcruver.tasklist.document;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * A page of the notebook.
 * The id doubles as display name, e.g. {@code Projects:Home}.
 */
@Value
@Builder
public class Document {
    public static final String NAMESPACE_SEPARATOR = ":";

    String id;
    String name;
    Path path;
    Instant modified;

    /**
     * Namespace components of the page name
     */
    public List<String> getParts() {
        return Arrays.stream(name.split(NAMESPACE_SEPARATOR))
            .filter(part -> !part.isBlank())
            .toList();
    }
}
