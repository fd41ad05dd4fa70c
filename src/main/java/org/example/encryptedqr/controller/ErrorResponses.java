package org.example.encryptedqr.controller;

import org.example.encryptedqr.exception.BadgeException;
import org.example.encryptedqr.exception.ColorFormatException;
import org.example.encryptedqr.exception.PathValidationException;
import org.example.encryptedqr.exception.SettingsValidationException;
import org.example.encryptedqr.exception.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> of(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", true,
                "message", message
        ));
    }

    static ResponseEntity<Map<String, Object>> of(BadgeException e) {
        return of(statusFor(e), e.getMessage());
    }

    static HttpStatus statusFor(BadgeException e) {
        if (e instanceof ValidationException
                || e instanceof PathValidationException
                || e instanceof ColorFormatException
                || e instanceof SettingsValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
