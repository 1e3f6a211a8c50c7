package io.firelite.core.protocol;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import io.firelite.core.Engine;
import io.firelite.core.document.Document;
import io.firelite.core.document.DocumentPath;
import io.firelite.core.document.FieldPath;
import io.firelite.core.error.FireliteException;
import io.firelite.core.tx.TransactionManager;
import io.firelite.core.tx.TransactionOptions;
import io.firelite.core.tx.TransactionState;
import io.firelite.core.write.Write;
import io.firelite.core.write.WriteEngine;
import io.firelite.core.write.WriteResult;

/**
 * The batchGet, commit, beginTransaction and rollback operations over typed
 * requests.
 */
public class DocumentHandlers {
    private static final Logger LOGGER = Logger.getLogger(DocumentHandlers.class.getName());

    public static final int MAX_BATCH_GET_DOCUMENTS = 100;
    public static final int MAX_COMMIT_WRITES = 500;

    private final Engine engine;
    private final TransactionManager transactions;
    private final WriteEngine writeEngine;
    private final ReentrantLock commitLock;

    public DocumentHandlers(Engine engine) {
        this.engine = engine;
        this.transactions = engine.getTransactionManager();
        this.writeEngine = engine.getWriteEngine();
        this.commitLock = engine.getCommitLock();
    }

    public List<BatchGetResult> batchGet(BatchGetRequest request) {
        List<String> documents = request.documents();
        if (documents == null || documents.isEmpty()) {
            throw FireliteException.invalidArgument("documents must contain at least one document name");
        }
        if (documents.size() > MAX_BATCH_GET_DOCUMENTS) {
            throw FireliteException.invalidArgument("batchGet supports at most " + MAX_BATCH_GET_DOCUMENTS
                    + " documents, got " + documents.size());
        }
        if (request.transaction() != null && request.newTransaction() != null) {
            throw FireliteException.invalidArgument("transaction and newTransaction are mutually exclusive");
        }
        for (String name : documents) {
            DocumentPath.resolve(name);
        }
        if (request.mask() != null) {
            request.mask().forEach(FieldPath::parse);
        }

        commitLock.lock();
        try {
            String transactionId = request.transaction();
            String newTransactionId = null;
            if (request.newTransaction() != null) {
                newTransactionId = transactions.newTransactionId();
                transactions.createTransaction(newTransactionId, request.newTransaction().readOnly());
                transactionId = newTransactionId;
            } else if (transactionId != null) {
                transactions.requireActive(transactionId);
            }

            Instant readTime = engine.now();
            List<BatchGetResult> results = new ArrayList<>(documents.size());
            for (String name : documents) {
                Document document = transactionId != null
                        ? transactions.readInTransaction(transactionId, name)
                        : engine.getStore().get(name);
                if (document == null) {
                    results.add(new BatchGetResult(null, name, readTime, newTransactionId));
                } else {
                    if (request.mask() != null) {
                        document = document.withFields(FieldPath.applyFieldMask(document.fields(), request.mask()));
                    }
                    results.add(new BatchGetResult(document, null, readTime, newTransactionId));
                }
            }
            return results;
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Applies all writes atomically. A transactional commit first verifies
     * that nothing the transaction read has changed; any failure rolls the
     * transaction back and leaves the store untouched.
     */
    public CommitResponse commit(CommitRequest request) {
        commitLock.lock();
        try {
            String transactionId = request.transaction();
            TransactionState transaction = transactionId == null ? null : transactions.requireActive(transactionId);
            try {
                List<Write> writes = request.writes();
                if (writes == null) {
                    throw FireliteException.invalidArgument("writes is required");
                }
                if (writes.size() > MAX_COMMIT_WRITES) {
                    throw FireliteException.invalidArgument("commit supports at most " + MAX_COMMIT_WRITES
                            + " writes, got " + writes.size());
                }
                if (transaction != null && transaction.isReadOnly() && !writes.isEmpty()) {
                    throw FireliteException.invalidArgument("Cannot commit writes in a read-only transaction");
                }
                Instant commitTime = engine.nextCommitTime();
                if (transaction != null) {
                    checkConflicts(transaction);
                }
                List<WriteEngine.PreparedWrite> prepared = writeEngine.prepare(writes, commitTime);
                // the transaction may have been ended while the batch was validated
                if (transaction != null && !transactions.commitTransaction(transactionId)) {
                    throw FireliteException.invalidArgument("Transaction has already been committed or rolled back");
                }
                List<WriteResult> results = writeEngine.apply(prepared);
                return new CommitResponse(results, commitTime);
            } catch (RuntimeException e) {
                if (transaction != null) {
                    transactions.rollbackTransaction(transactionId);
                }
                throw e;
            }
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Rolls back {@code transactionId} if it is still active. Used when a
     * commit naming it fails before reaching {@link #commit}.
     */
    public void abandon(String transactionId) {
        commitLock.lock();
        try {
            if (transactions.rollbackTransaction(transactionId)) {
                LOGGER.fine(() -> "Transaction " + transactionId + " rolled back after a rejected commit");
            }
        } finally {
            commitLock.unlock();
        }
    }

    private void checkConflicts(TransactionState transaction) {
        for (Map.Entry<String, Document> read : transaction.getReadSnapshot().entrySet()) {
            Document live = engine.getStore().get(read.getKey());
            if (!Document.sameState(read.getValue(), live)) {
                LOGGER.info(() -> "Transaction " + transaction.getId() + " aborted: " + read.getKey()
                        + " changed since it was read");
                throw FireliteException.aborted("Transaction aborted due to conflicting modifications");
            }
        }
    }

    /**
     * Starts a transaction and returns its id. A {@code retryTransaction}
     * naming a live transaction rolls that one back first.
     */
    public String beginTransaction(TransactionOptions options) {
        TransactionOptions effective = options == null ? TransactionOptions.readWrite() : options;
        commitLock.lock();
        try {
            if (effective.retryTransaction() != null) {
                TransactionState previous = transactions.getTransaction(effective.retryTransaction());
                if (previous != null && !previous.isTerminal()) {
                    transactions.rollbackTransaction(previous.getId());
                }
            }
            String id = transactions.newTransactionId();
            transactions.createTransaction(id, effective.readOnly());
            return id;
        } finally {
            commitLock.unlock();
        }
    }

    /**
     * Serialized with commits, so a transaction is never rolled back while a
     * commit naming it is in progress.
     */
    public void rollback(String transactionId) {
        if (transactionId == null || transactionId.isEmpty()) {
            throw FireliteException.invalidArgument("transaction is required");
        }
        commitLock.lock();
        try {
            TransactionState state = transactions.getTransaction(transactionId);
            if (state == null) {
                throw FireliteException.invalidArgument("Invalid transaction ID");
            }
            if (state.isCommitted()) {
                throw FireliteException.invalidArgument("Cannot rollback a committed transaction");
            }
            if (state.isRolledBack()) {
                throw FireliteException.invalidArgument("Transaction has already been rolled back");
            }
            transactions.rollbackTransaction(transactionId);
        } finally {
            commitLock.unlock();
        }
    }
}
