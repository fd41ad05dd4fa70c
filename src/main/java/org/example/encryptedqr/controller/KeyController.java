package org.example.encryptedqr.controller;

import lombok.RequiredArgsConstructor;
import org.example.encryptedqr.common.KeyLoadResult;
import org.example.encryptedqr.common.KeySource;
import org.example.encryptedqr.util.KeyStoreLoader;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Diagnostics for the encryption key. Never returns key material.
 */
@RestController
@RequestMapping("/api/key")
@RequiredArgsConstructor
public class KeyController {

    private final KeyStoreLoader keyStoreLoader;

    @GetMapping("/status")
    public Map<String, Object> getKeyStatus() {
        KeyLoadResult result = keyStoreLoader.getOrCreateKey();
        Map<String, Object> response = new HashMap<>();
        response.put("source", result.getSource().name());
        response.put("fingerprint", result.getKey().fingerprint());
        response.put("path", keyStoreLoader.getKeyPath().toAbsolutePath().toString());
        response.put("persistent", result.getSource() != KeySource.EPHEMERAL);
        response.put("warnings", result.getWarnings());
        return response;
    }
}
