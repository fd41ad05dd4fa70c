package org.example.encryptedqr.config;

import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.KeyLoadResult;
import org.example.encryptedqr.common.SettingsLoadResult;
import org.example.encryptedqr.service.SettingsStore;
import org.example.encryptedqr.util.KeyStoreLoader;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Slf4j
@Configuration
public class StoreInitializationConfig {
    private final KeyStoreLoader keyStoreLoader;
    private final SettingsStore settingsStore;

    public StoreInitializationConfig(KeyStoreLoader keyStoreLoader, SettingsStore settingsStore) {
        this.keyStoreLoader = keyStoreLoader;
        this.settingsStore = settingsStore;
    }

    /**
     * Loads the key and settings once at startup so that fallbacks show up in the log
     * before the first request.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeStores() {
        KeyLoadResult key = keyStoreLoader.getOrCreateKey();
        if (key.hasWarnings()) {
            log.warn("Encryption key initialized with {} warning(s)", key.getWarnings().size());
        }
        SettingsLoadResult settings = settingsStore.load();
        log.info("Settings loaded ({}), save path {}",
                settings.isFromFile() ? "from file" : "defaults", settings.getSettings().getSavePath());
    }
}
