package org.example.encryptedqr.exception;

import lombok.Getter;

@Getter
public enum ValidationError {
    INVALID_NAME("Name must contain at least 2 characters"),
    INVALID_ID("Employee ID must contain digits only"),
    INVALID_DEPARTMENT("Department must contain at least 2 characters");

    private final String message;

    ValidationError(String message) {
        this.message = message;
    }
}
