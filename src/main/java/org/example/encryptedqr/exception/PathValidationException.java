package org.example.encryptedqr.exception;

public class PathValidationException extends BadgeException {

    public PathValidationException(String message) {
        super(message);
    }
}
