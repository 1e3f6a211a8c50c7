package io.firelite.core.error;

public class FireliteException extends RuntimeException {
    private final ErrorStatus status;

    public FireliteException(ErrorStatus status, String message) {
        super(message);
        this.status = status;
    }

    public FireliteException(ErrorStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public ErrorStatus getStatus() {
        return status;
    }

    public static FireliteException invalidArgument(String message) {
        return new FireliteException(ErrorStatus.INVALID_ARGUMENT, message);
    }

    public static FireliteException failedPrecondition(String message) {
        return new FireliteException(ErrorStatus.FAILED_PRECONDITION, message);
    }

    public static FireliteException notFound(String message) {
        return new FireliteException(ErrorStatus.NOT_FOUND, message);
    }

    public static FireliteException alreadyExists(String message) {
        return new FireliteException(ErrorStatus.ALREADY_EXISTS, message);
    }

    public static FireliteException aborted(String message) {
        return new FireliteException(ErrorStatus.ABORTED, message);
    }
}
