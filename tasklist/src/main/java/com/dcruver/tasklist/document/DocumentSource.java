package com.dcruver.tasklist.document;

import java.util.List;
import java.util.Optional;

/**
 * Supplies documents and their parse trees to the task list.
 */
public interface DocumentSource {

    /**
     * All documents currently available
     */
    List<Document> listDocuments();

    /**
     * Resolve a document by id; empty when it no longer exists
     */
    Optional<Document> lookup(String documentId);

    /**
     * Parse tree of a document; empty when it does not exist or can not be read
     */
    Optional<ParseNode> getParseTree(String documentId);
}
