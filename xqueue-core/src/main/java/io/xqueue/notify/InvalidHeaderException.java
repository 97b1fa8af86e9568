package io.xqueue.notify;

/**
 * Thrown when a submission header cannot be parsed or lacks its callback address.
 */
public final class InvalidHeaderException extends IllegalArgumentException {
    public InvalidHeaderException(String message) {
        super(message);
    }

    public InvalidHeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
