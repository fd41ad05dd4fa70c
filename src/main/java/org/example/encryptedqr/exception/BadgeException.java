package org.example.encryptedqr.exception;

/**
 * Base type for every failure the badge pipeline reports to its callers.
 */
public class BadgeException extends RuntimeException {

    public BadgeException(String message) {
        super(message);
    }

    public BadgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
