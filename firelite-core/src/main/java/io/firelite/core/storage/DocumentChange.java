package io.firelite.core.storage;

import io.firelite.core.document.Document;

/**
 * A single committed mutation. {@code document} is null for removals and
 * {@code oldDocument} is null for additions.
 */
public record DocumentChange(Type type, String path, Document document, Document oldDocument) {

    public enum Type {
        ADDED,
        MODIFIED,
        REMOVED
    }
}
