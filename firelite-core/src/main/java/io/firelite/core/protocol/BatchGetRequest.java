package io.firelite.core.protocol;

import java.time.Instant;
import java.util.List;

import io.firelite.core.tx.TransactionOptions;

/**
 * Reads a set of documents, optionally inside an existing transaction or a
 * new one. {@code mask} and {@code readTime} may be null.
 */
public record BatchGetRequest(List<String> documents, List<String> mask, String transaction,
        TransactionOptions newTransaction, Instant readTime) {

    public static BatchGetRequest of(List<String> documents) {
        return new BatchGetRequest(documents, null, null, null, null);
    }

    public BatchGetRequest inTransaction(String id) {
        return new BatchGetRequest(documents, mask, id, newTransaction, readTime);
    }

    public BatchGetRequest withNewTransaction(TransactionOptions options) {
        return new BatchGetRequest(documents, mask, transaction, options, readTime);
    }

    public BatchGetRequest withMask(List<String> fieldPaths) {
        return new BatchGetRequest(documents, fieldPaths, transaction, newTransaction, readTime);
    }
}
