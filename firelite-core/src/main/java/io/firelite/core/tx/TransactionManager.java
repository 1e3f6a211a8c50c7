package io.firelite.core.tx;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import io.firelite.core.document.Document;
import io.firelite.core.error.FireliteException;
import io.firelite.core.storage.DocumentStore;

/**
 * Manages transactions for the emulator.
 * Provides snapshot-isolated reads and the bookkeeping needed for optimistic
 * conflict detection at commit.
 *
 * <p>Expiry is evaluated lazily: a transaction whose timeout has elapsed is
 * rolled back the next time it is looked up, so no scheduler thread is needed.</p>
 */
public class TransactionManager {
    private static final Logger LOGGER = Logger.getLogger(TransactionManager.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(60_000);

    private final DocumentStore store;
    private final Clock clock;
    private final long timeoutMillis;
    private final Map<String, TransactionState> transactions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();

    public TransactionManager(DocumentStore store, Clock clock, Duration timeout) {
        this.store = store;
        this.clock = clock;
        this.timeoutMillis = timeout.toMillis();
    }

    public String newTransactionId() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Creates a transaction whose reads observe every document as it is now.
     * Callers needing a consistent view across concurrent commits must hold
     * the commit lock.
     */
    public TransactionState createTransaction(String id, boolean readOnly) {
        purgeExpired();
        TransactionState state = new TransactionState(id, readOnly, clock.instant(), store.getAllDocuments());
        if (transactions.putIfAbsent(id, state) != null) {
            throw FireliteException.invalidArgument("Transaction " + id + " already exists");
        }
        LOGGER.fine(() -> "Transaction " + id + " started (readOnly=" + readOnly + ")");
        return state;
    }

    /**
     * Returns the transaction or null for unknown ids. An expired, still
     * active transaction is marked rolled back and released before it is
     * returned.
     */
    public TransactionState getTransaction(String id) {
        if (id == null) {
            return null;
        }
        TransactionState state = transactions.get(id);
        if (state != null && isExpired(state) && state.finish(TransactionStatus.ROLLED_BACK)) {
            LOGGER.fine(() -> "Transaction " + id + " expired");
            cleanupTransaction(id);
        }
        return state;
    }

    /**
     * Returns the transaction if it exists and is not terminal, otherwise
     * fails with invalid-argument.
     */
    public TransactionState requireActive(String id) {
        TransactionState state = getTransaction(id);
        if (state == null) {
            throw FireliteException.invalidArgument("Invalid transaction ID");
        }
        if (state.isTerminal()) {
            throw FireliteException.invalidArgument("Transaction has already been committed or rolled back");
        }
        return state;
    }

    public boolean isExpired(TransactionState state) {
        return clock.millis() - state.getStartTime().toEpochMilli() > timeoutMillis;
    }

    /**
     * Reads {@code path} from the transaction's start-time view, recording it
     * for conflict detection. Repeated reads return the recorded value.
     */
    public Document readInTransaction(String id, String path) {
        return requireActive(id).read(path);
    }

    /**
     * Marks the transaction committed. Returns false if it is unknown or
     * already terminal, in which case nothing changes.
     */
    public boolean commitTransaction(String id) {
        return finish(id, TransactionStatus.COMMITTED);
    }

    /**
     * Marks the transaction rolled back. Returns false if it is unknown or
     * already terminal.
     */
    public boolean rollbackTransaction(String id) {
        return finish(id, TransactionStatus.ROLLED_BACK);
    }

    private boolean finish(String id, TransactionStatus terminal) {
        TransactionState state = transactions.get(id);
        if (state == null) {
            return false;
        }
        boolean changed = state.finish(terminal);
        if (changed) {
            LOGGER.fine(() -> "Transaction " + id + " " + terminal);
        }
        cleanupTransaction(id);
        return changed;
    }

    /**
     * Releases snapshot memory and forgets the transaction. Any further
     * lookup of {@code id} returns null.
     */
    public void cleanupTransaction(String id) {
        TransactionState state = transactions.remove(id);
        if (state != null) {
            state.release();
        }
    }

    /**
     * Rolls back every transaction whose timeout has elapsed.
     */
    public void purgeExpired() {
        Iterator<TransactionState> it = transactions.values().iterator();
        while (it.hasNext()) {
            TransactionState state = it.next();
            if (isExpired(state) && state.finish(TransactionStatus.ROLLED_BACK)) {
                LOGGER.fine(() -> "Transaction " + state.getId() + " expired");
                it.remove();
                state.release();
            }
        }
    }

    public int activeCount() {
        return transactions.size();
    }
}
