package io.firelite.core.protocol;

import java.time.Instant;

import io.firelite.core.document.Document;

/**
 * One entry of a batchGet response: exactly one of {@code found} and
 * {@code missing} is set. {@code transaction} is set only when the request
 * began a new transaction.
 */
public record BatchGetResult(Document found, String missing, Instant readTime, String transaction) {

    public boolean isFound() {
        return found != null;
    }
}
