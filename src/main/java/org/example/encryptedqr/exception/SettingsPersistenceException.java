package org.example.encryptedqr.exception;

public class SettingsPersistenceException extends BadgeException {

    public SettingsPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
