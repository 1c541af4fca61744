package io.docmirror.core.model;

import java.util.Objects;

/**
 * Reference to another document, identified by its slash-separated path relative to the
 * database root ({@code users/alice}, {@code users/alice/orders/o-1}).
 *
 * @param path document path with an even, non-zero number of non-empty segments
 */
public record DocumentReference(String path) {

    public DocumentReference {
        Objects.requireNonNull(path, "path must not be null");
        String[] segments = path.split("/", -1);
        if (path.isEmpty() || segments.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Document path must have an even number of segments (collection/document): '" + path + "'");
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Document path contains an empty segment: '" + path + "'");
            }
        }
    }

    /** The document id (last path segment). */
    public String id() {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /** Path of the collection containing this document. */
    public String parentPath() {
        return path.substring(0, path.lastIndexOf('/'));
    }
}
