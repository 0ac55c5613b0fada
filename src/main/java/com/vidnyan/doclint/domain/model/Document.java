package com.vidnyan.doclint.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One unit of text content evaluated against every rule.
 * Immutable value object, owned by the caller and read-only to the engine.
 *
 * <p>{@code content} is {@code null} when the document source could not read the file;
 * the scheduler reports such a document as an engine error instead of evaluating it.
 */
public record Document(
    String path,
    String content
) {

    public Document {
        Objects.requireNonNull(path, "path");
    }

    /**
     * Create a document whose content could not be materialized.
     */
    public static Document unreadable(String path) {
        return new Document(path, null);
    }

    /**
     * Content of the document, failing if it was never read.
     */
    public String requireContent() {
        if (content == null) {
            throw new DocumentUnreadableException(path);
        }
        return content;
    }

    /**
     * File name portion of the path, used as a short log label.
     */
    public String displayName() {
        Path fileName = Path.of(path).getFileName();
        return fileName != null ? fileName.toString() : path;
    }
}
