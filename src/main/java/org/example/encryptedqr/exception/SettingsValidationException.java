package org.example.encryptedqr.exception;

/**
 * Raised for settings values other than path and color that fail validation.
 */
public class SettingsValidationException extends BadgeException {

    public SettingsValidationException(String message) {
        super(message);
    }
}
