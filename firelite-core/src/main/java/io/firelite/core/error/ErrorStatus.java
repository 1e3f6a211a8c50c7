package io.firelite.core.error;

/**
 * Canonical error kinds surfaced on the wire, with the HTTP status each maps to.
 */
public enum ErrorStatus {
    INVALID_ARGUMENT(400),
    FAILED_PRECONDITION(400),
    NOT_FOUND(404),
    ALREADY_EXISTS(409),
    ABORTED(409),
    INTERNAL(500);

    private final int httpCode;

    ErrorStatus(int httpCode) {
        this.httpCode = httpCode;
    }

    public int httpCode() {
        return httpCode;
    }
}
