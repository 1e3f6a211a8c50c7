package io.firelite.core.value;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

import io.firelite.core.error.FireliteException;

/**
 * RFC3339 timestamp formatting with millisecond precision. Decoded
 * timestamps must lie between years 1 and 9999 inclusive.
 */
public final class Timestamps {
    public static final Instant MIN = Instant.parse("0001-01-01T00:00:00Z");
    public static final Instant MAX = Instant.parse("9999-12-31T23:59:59.999999999Z");

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSX")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return FORMATTER.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    public static Instant parse(String text) {
        try {
            return checkRange(OffsetDateTime.parse(text).toInstant(), text);
        } catch (DateTimeParseException e) {
            throw FireliteException.invalidArgument("Invalid timestamp format: " + text);
        }
    }

    public static Instant fromSecondsAndNanos(long seconds, int nanos) {
        if (nanos < 0 || nanos > 999_999_999) {
            throw FireliteException.invalidArgument("Timestamp nanos out of range: " + nanos);
        }
        if (seconds < MIN.getEpochSecond() || seconds > MAX.getEpochSecond()) {
            throw FireliteException.invalidArgument("Timestamp seconds out of range: " + seconds);
        }
        return Instant.ofEpochSecond(seconds, nanos);
    }

    private static Instant checkRange(Instant instant, String text) {
        if (instant.isBefore(MIN) || instant.isAfter(MAX)) {
            throw FireliteException.invalidArgument("Timestamp out of range: " + text);
        }
        return instant;
    }
}
