package org.example.encryptedqr.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.AppSettings;
import org.example.encryptedqr.common.ImageQuality;
import org.example.encryptedqr.common.QrSize;
import org.example.encryptedqr.exception.BadgeException;
import org.example.encryptedqr.service.SettingsStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsStore settingsStore;

    @GetMapping
    public AppSettings getSettings() {
        return settingsStore.current();
    }

    @PutMapping
    public ResponseEntity<?> saveSettings(@RequestBody AppSettings settings) {
        try {
            return ResponseEntity.ok(settingsStore.save(settings));
        } catch (BadgeException e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(e);
        }
    }

    @PostMapping("/reset")
    public ResponseEntity<?> resetSettings() {
        try {
            return ResponseEntity.ok(settingsStore.reset());
        } catch (BadgeException e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(e);
        }
    }

    /**
     * Allowed labels for the enumerated settings, with the value each one maps to.
     */
    @GetMapping("/options")
    public Map<String, Object> getOptions() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        for (QrSize size : QrSize.values()) {
            sizes.put(size.getLabel(), size.getPixels());
        }
        Map<String, Integer> qualities = new LinkedHashMap<>();
        for (ImageQuality quality : ImageQuality.values()) {
            qualities.put(quality.getLabel(), quality.getPercent());
        }
        return Map.of("qr_size", sizes, "image_quality", qualities);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadableSettings(HttpMessageNotReadableException e) {
        log.error(e.getMessage(), e);
        Throwable cause = e.getMostSpecificCause();
        String message = cause instanceof BadgeException ? cause.getMessage() : "Malformed settings body";
        return ErrorResponses.of(HttpStatus.BAD_REQUEST, message);
    }
}
