package io.firelite.core.tx;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import io.firelite.core.document.Document;

/**
 * Per-transaction bookkeeping: the point-in-time view taken at start and the
 * documents actually observed through it.
 */
public class TransactionState {
    private final String id;
    private final boolean readOnly;
    private final Instant startTime;
    private final Map<String, Document> globalSnapshot;
    // path -> observed document, null value when observed missing
    private final Map<String, Document> readSnapshot = new LinkedHashMap<>();
    private TransactionStatus status = TransactionStatus.CREATED;

    TransactionState(String id, boolean readOnly, Instant startTime, Map<String, Document> globalSnapshot) {
        this.id = id;
        this.readOnly = readOnly;
        this.startTime = startTime;
        this.globalSnapshot = new HashMap<>(globalSnapshot);
    }

    public String getId() {
        return id;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public synchronized TransactionStatus getStatus() {
        return status;
    }

    public synchronized boolean isCommitted() {
        return status == TransactionStatus.COMMITTED;
    }

    public synchronized boolean isRolledBack() {
        return status == TransactionStatus.ROLLED_BACK;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Returns the document at {@code path} as of transaction start. The first
     * read of a path is recorded; later reads return the recorded value.
     */
    synchronized Document read(String path) {
        activate();
        if (readSnapshot.containsKey(path)) {
            return readSnapshot.get(path);
        }
        Document doc = globalSnapshot.get(path);
        readSnapshot.put(path, doc);
        return doc;
    }

    /**
     * Copy of the observed documents, for conflict detection.
     */
    public synchronized Map<String, Document> getReadSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(readSnapshot));
    }

    synchronized void activate() {
        if (status == TransactionStatus.CREATED) {
            status = TransactionStatus.ACTIVE;
        }
    }

    /**
     * Moves to a terminal status. Returns false if already terminal.
     */
    synchronized boolean finish(TransactionStatus terminal) {
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        return true;
    }

    synchronized void release() {
        readSnapshot.clear();
        globalSnapshot.clear();
    }
}
