package io.firelite.core.tx;

/**
 * Lifecycle of a transaction. COMMITTED and ROLLED_BACK are terminal.
 */
public enum TransactionStatus {
    CREATED,
    ACTIVE,
    COMMITTED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK;
    }
}
