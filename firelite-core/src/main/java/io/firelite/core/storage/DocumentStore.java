package io.firelite.core.storage;

import java.util.Map;

import io.firelite.core.document.Document;

/**
 * Path-keyed document storage. Each call is linearizable on its own;
 * multi-call atomicity is provided by the caller.
 */
public interface DocumentStore {
    Document get(String path);

    void set(String path, Document document);

    void delete(String path);

    boolean exists(String path);

    /**
     * Point-in-time copy of every stored document keyed by path.
     */
    Map<String, Document> getAllDocuments();

    int size();

    void clear();

    /**
     * Registers a listener for every set and delete. Returns a handle that
     * unregisters it.
     */
    default Runnable addChangeListener(DocumentChangeListener listener) {
        throw new UnsupportedOperationException("Change notifications are not supported by " + getClass().getName());
    }
}
