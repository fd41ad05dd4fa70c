package org.example.encryptedqr.exception;

import lombok.Getter;

/**
 * Raised when raw employee fields do not pass input validation.
 */
@Getter
public class ValidationException extends BadgeException {
    private final ValidationError error;

    public ValidationException(ValidationError error) {
        super(error.getMessage());
        this.error = error;
    }
}
