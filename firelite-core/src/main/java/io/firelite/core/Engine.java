package io.firelite.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import io.firelite.core.storage.DocumentStore;
import io.firelite.core.storage.InMemoryDocumentStore;
import io.firelite.core.tx.TransactionManager;
import io.firelite.core.write.WriteEngine;

/**
 * Wires the document store, transaction manager and write engine of one
 * emulator instance.
 */
public class Engine {
    private static final Logger LOGGER = Logger.getLogger(Engine.class.getName());

    private final DocumentStore store;
    private final Clock clock;
    private final TransactionManager transactionManager;
    private final WriteEngine writeEngine;
    private final ReentrantLock commitLock = new ReentrantLock();
    private final Instant startTime;
    private long lastCommitMillis;

    public Engine() {
        this(new InMemoryDocumentStore(), Clock.systemUTC(), TransactionManager.DEFAULT_TIMEOUT);
    }

    public Engine(DocumentStore store, Clock clock, Duration transactionTimeout) {
        this.store = store;
        this.clock = clock;
        this.transactionManager = new TransactionManager(store, clock, transactionTimeout);
        this.writeEngine = new WriteEngine(store);
        this.startTime = clock.instant();
        LOGGER.info(() -> "Firelite engine initialized (transaction timeout " + transactionTimeout.toMillis() + " ms)");
    }

    /**
     * Serializes commits, transaction creation and multi-document reads so
     * each sees a consistent store.
     */
    public ReentrantLock getCommitLock() {
        return commitLock;
    }

    /**
     * Returns a millisecond-precision commit time strictly after every
     * previously returned one.
     */
    public synchronized Instant nextCommitTime() {
        long now = Math.max(clock.millis(), lastCommitMillis + 1);
        lastCommitMillis = now;
        return Instant.ofEpochMilli(now);
    }

    public Instant now() {
        return Instant.ofEpochMilli(clock.millis());
    }

    /**
     * Removes every document. Active transactions keep their snapshots.
     */
    public void clear() {
        commitLock.lock();
        try {
            store.clear();
        } finally {
            commitLock.unlock();
        }
        LOGGER.info("All documents cleared");
    }

    public DocumentStore getStore() {
        return store;
    }

    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    public WriteEngine getWriteEngine() {
        return writeEngine;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Clock getClock() {
        return clock;
    }
}
