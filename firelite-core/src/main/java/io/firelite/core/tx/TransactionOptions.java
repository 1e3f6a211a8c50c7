package io.firelite.core.tx;

import java.time.Instant;

/**
 * Options accepted by beginTransaction and batchGet's newTransaction.
 * {@code readTime} applies to read-only transactions; {@code retryTransaction}
 * to read-write ones.
 */
public record TransactionOptions(boolean readOnly, Instant readTime, String retryTransaction) {

    public static TransactionOptions readWrite() {
        return new TransactionOptions(false, null, null);
    }

    public static TransactionOptions readOnlyOptions() {
        return new TransactionOptions(true, null, null);
    }
}
