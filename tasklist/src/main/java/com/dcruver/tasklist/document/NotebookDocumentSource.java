package com.dcruver.tasklist.document;

import com.dcruver.tasklist.config.TaskListProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Documents backed by a notebook directory of outline text files.
 * The file {@code Projects/Home.txt} is the page {@code Projects:Home}.
 */
@Component
@Slf4j
public class NotebookDocumentSource implements DocumentSource {

    private final OutlineFileReader fileReader;
    private final Path notebookDir;
    private final String extension;

    public NotebookDocumentSource(OutlineFileReader fileReader, TaskListProperties properties) {
        this.fileReader = fileReader;
        this.notebookDir = Path.of(properties.getNotebookPath()).toAbsolutePath().normalize();
        this.extension = properties.getFileExtension();
    }

    @Override
    public List<Document> listDocuments() {
        if (!Files.isDirectory(notebookDir)) {
            log.warn("Notebook directory does not exist: {}", notebookDir);
            return List.of();
        }

        List<Document> documents = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(notebookDir)) {
            List<Path> pageFiles = paths
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(extension))
                .filter(p -> !notebookDir.relativize(p).toString().startsWith("."))
                .toList();

            for (Path pageFile : pageFiles) {
                try {
                    documents.add(toDocument(pageFile));
                } catch (IOException e) {
                    log.error("Failed to stat page: {}", pageFile, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list notebook " + notebookDir, e);
        }

        documents.sort(Comparator.comparing(Document::getName));
        log.debug("Found {} pages in {}", documents.size(), notebookDir);
        return documents;
    }

    @Override
    public Optional<Document> lookup(String documentId) {
        Path pageFile = resolve(documentId);
        if (!Files.isRegularFile(pageFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(toDocument(pageFile));
        } catch (IOException e) {
            log.warn("Failed to stat page {}: {}", documentId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<ParseNode> getParseTree(String documentId) {
        Path pageFile = resolve(documentId);
        if (!Files.isRegularFile(pageFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(fileReader.read(pageFile));
        } catch (IOException e) {
            log.warn("Failed to read page {}: {}", documentId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Map a page name to its file, e.g. {@code Projects:Home} to {@code Projects/Home.txt}
     */
    Path resolve(String pageName) {
        Path path = notebookDir;
        for (String part : pageName.split(Document.NAMESPACE_SEPARATOR)) {
            if (!part.isBlank()) {
                path = path.resolve(part);
            }
        }
        return path.resolveSibling(path.getFileName() + extension);
    }

    /**
     * Map a file below the notebook to its page name
     */
    String pageName(Path pageFile) {
        Path relative = notebookDir.relativize(pageFile);
        String name = Stream.iterate(0, i -> i < relative.getNameCount(), i -> i + 1)
            .map(i -> relative.getName(i).toString())
            .collect(Collectors.joining(Document.NAMESPACE_SEPARATOR));
        return name.substring(0, name.length() - extension.length());
    }

    private Document toDocument(Path pageFile) throws IOException {
        String name = pageName(pageFile);
        Instant modified = Files.getLastModifiedTime(pageFile).toInstant();
        return Document.builder()
            .id(name)
            .name(name)
            .path(pageFile)
            .modified(modified)
            .build();
    }
}
