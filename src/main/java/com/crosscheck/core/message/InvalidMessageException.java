package com.crosscheck.core.message;

/**
 * Thrown when a message is malformed: unknown type, mismatched payload or missing routing fields.
 */
public class InvalidMessageException extends RuntimeException {

    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
