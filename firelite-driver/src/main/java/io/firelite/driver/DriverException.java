package io.firelite.driver;

/**
 * Failure of a driver call. For error responses from the emulator,
 * {@link #getHttpStatus()} and {@link #getStatus()} carry the response's
 * HTTP code and canonical status name; both are unset for transport errors.
 */
public class DriverException extends RuntimeException {
    private final int httpStatus;
    private final String status;

    public DriverException(String message, int httpStatus, String status) {
        super(message);
        this.httpStatus = httpStatus;
        this.status = status;
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = -1;
        this.status = null;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getStatus() {
        return status;
    }
}
