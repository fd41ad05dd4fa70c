package org.example.encryptedqr.exception;

public class ArtifactWriteException extends BadgeException {

    public ArtifactWriteException(String message) {
        super(message);
    }

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
