package io.firelite.core.write;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import io.firelite.core.document.Document;
import io.firelite.core.error.FireliteException;

/**
 * Condition on the current document that a write requires. Either clause may
 * be null.
 *
 * <p>{@code updateTime} is compared at millisecond precision, the precision at
 * which timestamps are stored and rendered, rather than as the exact string the
 * client sent. A client echoing back a rendered {@code updateTime} in another
 * RFC3339 form (different offset or trailing zeros) still matches.</p>
 */
public record Precondition(Boolean exists, Instant updateTime) {

    public static Precondition exists(boolean exists) {
        return new Precondition(exists, null);
    }

    public static Precondition updateTime(Instant updateTime) {
        return new Precondition(null, updateTime);
    }

    /**
     * Fails with failed-precondition, or already-exists for a violated
     * {@code exists=false}, when {@code current} does not satisfy this.
     */
    public void check(Document current) {
        if (exists != null) {
            if (exists && current == null) {
                throw FireliteException.failedPrecondition("Document does not exist");
            }
            if (!exists && current != null) {
                throw FireliteException.alreadyExists("Document already exists");
            }
        }
        if (updateTime != null) {
            if (current == null) {
                throw FireliteException.failedPrecondition("Document does not exist");
            }
            if (current.updateTime() == null || !current.updateTime().truncatedTo(ChronoUnit.MILLIS)
                    .equals(updateTime.truncatedTo(ChronoUnit.MILLIS))) {
                throw FireliteException.failedPrecondition("Document updateTime does not match");
            }
        }
    }
}
