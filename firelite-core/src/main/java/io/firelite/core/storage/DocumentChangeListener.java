package io.firelite.core.storage;

@FunctionalInterface
public interface DocumentChangeListener {
    void onChange(DocumentChange change);
}
