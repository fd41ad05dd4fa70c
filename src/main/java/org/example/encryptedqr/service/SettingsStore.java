package org.example.encryptedqr.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.AppSettings;
import org.example.encryptedqr.common.ImageQuality;
import org.example.encryptedqr.common.QrSize;
import org.example.encryptedqr.common.SettingsLoadResult;
import org.example.encryptedqr.exception.SettingsPersistenceException;
import org.example.encryptedqr.exception.SettingsValidationException;
import org.example.encryptedqr.util.HexColors;
import org.example.encryptedqr.util.PathValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.IllformedLocaleException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Holds the application settings and their JSON file. Every write goes through
 * validation first; a rejected or failed save leaves both the file and the in-memory
 * settings untouched.
 */
@Slf4j
@Service
public class SettingsStore {
    private final ObjectMapper mapper;
    private final Path settingsPath;
    private final String defaultSavePath;

    private AppSettings settings;
    private SettingsLoadResult lastLoad;

    public SettingsStore(ObjectMapper objectMapper,
                         @Value("${settings.path:settings.json}") String settingsPath,
                         @Value("${settings.default-save-path:${user.home}/QR-pass}") String defaultSavePath) {
        this.mapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.settingsPath = Paths.get(settingsPath);
        this.defaultSavePath = defaultSavePath;
    }

    public AppSettings defaults() {
        return AppSettings.defaults(defaultSavePath);
    }

    /**
     * Reads the settings file over the defaults. Values that fail validation keep their
     * default and are reported as warnings.
     */
    public synchronized SettingsLoadResult load() {
        AppSettings merged = defaults();
        List<String> warnings = new ArrayList<>();
        boolean fromFile = false;

        if (Files.exists(settingsPath)) {
            try {
                JsonNode root = mapper.readTree(settingsPath.toFile());
                if (root != null && root.isObject()) {
                    merge(root, merged, warnings);
                    fromFile = true;
                } else {
                    warnings.add("Settings file " + settingsPath + " does not contain a JSON object; using defaults");
                }
            } catch (IOException e) {
                warnings.add("Cannot read settings file " + settingsPath + ": " + e.getMessage() + "; using defaults");
                merged = defaults();
            }
        }
        warnings.forEach(log::warn);

        settings = merged;
        lastLoad = new SettingsLoadResult(merged.copy(), fromFile, warnings);
        return lastLoad;
    }

    public synchronized AppSettings current() {
        ensureLoaded();
        return settings.copy();
    }

    public synchronized Optional<SettingsLoadResult> lastLoad() {
        return Optional.ofNullable(lastLoad);
    }

    public synchronized AppSettings save(AppSettings candidate) {
        if (candidate == null) {
            throw new SettingsValidationException("Settings are missing");
        }
        validate(candidate);
        ensureLoaded();

        AppSettings accepted = candidate.copy();
        try {
            write(accepted);
        } catch (IOException e) {
            throw new SettingsPersistenceException("Cannot write settings file " + settingsPath + ": " + e.getMessage(), e);
        }
        settings = accepted;
        log.info("Settings saved to {}", settingsPath);
        return accepted.copy();
    }

    /**
     * Restores the defaults in memory and writes them out. The in-memory reset happens even
     * if the write fails; the failure is still reported.
     */
    public synchronized AppSettings reset() {
        settings = defaults();
        try {
            write(settings);
        } catch (IOException e) {
            throw new SettingsPersistenceException("Cannot write settings file " + settingsPath + ": " + e.getMessage(), e);
        }
        log.info("Settings reset to defaults");
        return settings.copy();
    }

    public static void validate(AppSettings candidate) {
        PathValidator.requireWritableDirectory(candidate.getSavePath());
        HexColors.requireValid("QR color", candidate.getQrColor());
        HexColors.requireValid("QR background color", candidate.getQrBgColor());
        if (!isValidLanguage(candidate.getLanguage())) {
            throw new SettingsValidationException("Invalid language tag '" + candidate.getLanguage() + "'");
        }
        if (candidate.getQrSize() == null) {
            throw new SettingsValidationException("QR size is required");
        }
        if (candidate.getImageQuality() == null) {
            throw new SettingsValidationException("Image quality is required");
        }
    }

    public static boolean isValidLanguage(String tag) {
        if (tag == null || tag.isBlank()) {
            return false;
        }
        try {
            new Locale.Builder().setLanguageTag(tag);
            return true;
        } catch (IllformedLocaleException e) {
            return false;
        }
    }

    private void ensureLoaded() {
        if (settings == null) {
            load();
        }
    }

    private void write(AppSettings value) throws IOException {
        Path parent = settingsPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(settingsPath.toFile(), value);
    }

    private void merge(JsonNode root, AppSettings target, List<String> warnings) {
        mergeText(root, "save_path", warnings, PathValidator::isWritableDirectory, target::setSavePath);

        JsonNode autoSave = root.get("auto_save");
        if (autoSave != null) {
            if (autoSave.isBoolean()) {
                target.setAutoSave(autoSave.booleanValue());
            } else {
                warnings.add("Ignoring auto_save: not a boolean");
            }
        }

        mergeText(root, "image_quality", warnings, l -> ImageQuality.fromLabel(l).isPresent(),
                l -> target.setImageQuality(ImageQuality.of(l)));
        mergeText(root, "qr_size", warnings, l -> QrSize.fromLabel(l).isPresent(),
                l -> target.setQrSize(QrSize.of(l)));
        mergeText(root, "qr_color", warnings, HexColors::isValid, target::setQrColor);
        mergeText(root, "qr_bg_color", warnings, HexColors::isValid, target::setQrBgColor);
        mergeText(root, "language", warnings, SettingsStore::isValidLanguage, target::setLanguage);
    }

    private static void mergeText(JsonNode root, String key, List<String> warnings,
                                  Predicate<String> valid, Consumer<String> apply) {
        JsonNode node = root.get(key);
        if (node == null) {
            return;
        }
        if (node.isTextual() && valid.test(node.textValue())) {
            apply.accept(node.textValue());
        } else {
            warnings.add("Ignoring " + key + " '" + node.asText() + "' from settings file; keeping default");
        }
    }
}
