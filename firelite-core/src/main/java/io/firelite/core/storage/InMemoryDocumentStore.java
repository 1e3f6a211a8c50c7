package io.firelite.core.storage;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.firelite.core.document.Document;

/**
 * Memory-resident {@link DocumentStore}. Documents are immutable, so reads hand
 * out the stored instance directly.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private static final Logger LOGGER = Logger.getLogger(InMemoryDocumentStore.class.getName());

    private final ConcurrentSkipListMap<String, Document> documents = new ConcurrentSkipListMap<>();
    private final CopyOnWriteArrayList<DocumentChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Document get(String path) {
        return documents.get(path);
    }

    @Override
    public void set(String path, Document document) {
        Document previous = documents.put(path, document);
        emit(new DocumentChange(previous == null ? DocumentChange.Type.ADDED : DocumentChange.Type.MODIFIED,
                path, document, previous));
    }

    @Override
    public void delete(String path) {
        Document previous = documents.remove(path);
        if (previous != null) {
            emit(new DocumentChange(DocumentChange.Type.REMOVED, path, null, previous));
        }
    }

    @Override
    public boolean exists(String path) {
        return documents.containsKey(path);
    }

    @Override
    public Map<String, Document> getAllDocuments() {
        return new TreeMap<>(documents);
    }

    @Override
    public int size() {
        return documents.size();
    }

    @Override
    public void clear() {
        Map.Entry<String, Document> entry;
        while ((entry = documents.pollFirstEntry()) != null) {
            emit(new DocumentChange(DocumentChange.Type.REMOVED, entry.getKey(), null, entry.getValue()));
        }
        LOGGER.fine("Cleared all documents");
    }

    @Override
    public Runnable addChangeListener(DocumentChangeListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void emit(DocumentChange change) {
        for (DocumentChangeListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Document change listener failed for " + change.path(), e);
            }
        }
    }
}
