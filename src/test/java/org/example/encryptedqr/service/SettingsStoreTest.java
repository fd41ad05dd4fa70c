package org.example.encryptedqr.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.encryptedqr.common.AppSettings;
import org.example.encryptedqr.common.ImageQuality;
import org.example.encryptedqr.common.QrSize;
import org.example.encryptedqr.common.SettingsLoadResult;
import org.example.encryptedqr.exception.ColorFormatException;
import org.example.encryptedqr.exception.PathValidationException;
import org.example.encryptedqr.exception.SettingsPersistenceException;
import org.example.encryptedqr.exception.SettingsValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsStoreTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private Path settingsFile;
    private Path saveDir;
    private SettingsStore store;

    @BeforeEach
    void setUp() throws Exception {
        settingsFile = tempDir.resolve("settings.json");
        saveDir = Files.createDirectory(tempDir.resolve("out"));
        store = new SettingsStore(objectMapper, settingsFile.toString(), tempDir.resolve("QR-pass").toString());
    }

    @Test
    void usesDefaultsWithoutFile() {
        SettingsLoadResult result = store.load();

        assertThat(result.isFromFile()).isFalse();
        assertThat(result.getWarnings()).isEmpty();
        AppSettings settings = result.getSettings();
        assertThat(settings.getSavePath()).isEqualTo(tempDir.resolve("QR-pass").toString());
        assertThat(settings.isAutoSave()).isFalse();
        assertThat(settings.getImageQuality()).isEqualTo(ImageQuality.HIGH);
        assertThat(settings.getQrSize()).isEqualTo(QrSize.MEDIUM);
        assertThat(settings.getQrColor()).isEqualTo("#000000");
        assertThat(settings.getQrBgColor()).isEqualTo("#FFFFFF");
        assertThat(settings.getLanguage()).isEqualTo("ar");
    }

    @Test
    void mergesFileOverDefaultsAndIgnoresUnknownKeys() throws Exception {
        writeSettings("{\"save_path\": \"" + json(saveDir) + "\", \"auto_save\": true, \"qr_size\": \"كبير\","
                + " \"qr_color\": \"#123\", \"theme\": \"dark\"}");

        SettingsLoadResult result = store.load();

        assertThat(result.isFromFile()).isTrue();
        assertThat(result.getWarnings()).isEmpty();
        AppSettings settings = result.getSettings();
        assertThat(settings.getSavePath()).isEqualTo(saveDir.toString());
        assertThat(settings.isAutoSave()).isTrue();
        assertThat(settings.getQrSize()).isEqualTo(QrSize.LARGE);
        assertThat(settings.getQrColor()).isEqualTo("#123");
        assertThat(settings.getImageQuality()).isEqualTo(ImageQuality.HIGH);
    }

    @Test
    void discardsSavePathThatFailsProbe() throws Exception {
        writeSettings("{\"save_path\": \"relative/dir\", \"language\": \"en\"}");

        SettingsLoadResult result = store.load();

        assertThat(result.getSettings().getSavePath()).isEqualTo(tempDir.resolve("QR-pass").toString());
        assertThat(result.getSettings().getLanguage()).isEqualTo("en");
        assertThat(result.getWarnings()).anySatisfy(w -> assertThat(w).contains("save_path"));
    }

    @Test
    void unknownLabelsKeepDefaultsWithWarning() throws Exception {
        writeSettings("{\"qr_size\": \"huge\", \"image_quality\": \"ultra\", \"qr_bg_color\": \"white\"}");

        SettingsLoadResult result = store.load();

        assertThat(result.getSettings().getQrSize()).isEqualTo(QrSize.MEDIUM);
        assertThat(result.getSettings().getImageQuality()).isEqualTo(ImageQuality.HIGH);
        assertThat(result.getSettings().getQrBgColor()).isEqualTo("#FFFFFF");
        assertThat(result.getWarnings()).hasSize(3);
    }

    @Test
    void malformedFileFallsBackToDefaults() throws Exception {
        writeSettings("{ not json");

        SettingsLoadResult result = store.load();

        assertThat(result.isFromFile()).isFalse();
        assertThat(result.getSettings().getQrSize()).isEqualTo(QrSize.MEDIUM);
        assertThat(result.getWarnings()).hasSize(1);
    }

    @Test
    void saveWritesSnakeCaseJson() throws Exception {
        AppSettings candidate = validSettings();
        candidate.setQrSize(QrSize.EXTRA_LARGE);

        store.save(candidate);

        JsonNode written = objectMapper.readTree(settingsFile.toFile());
        assertThat(written.get("save_path").asText()).isEqualTo(saveDir.toString());
        assertThat(written.get("qr_size").asText()).isEqualTo("كبير جداً");
        assertThat(written.get("image_quality").asText()).isEqualTo("عالية");
        assertThat(written.get("auto_save").asBoolean()).isTrue();
        assertThat(written.has("qr_bg_color")).isTrue();
        assertThat(Files.readString(settingsFile, StandardCharsets.UTF_8)).contains("كبير جداً");

        SettingsStore reopened = new SettingsStore(objectMapper, settingsFile.toString(), "/unused");
        assertThat(reopened.load().getSettings().getQrSize()).isEqualTo(QrSize.EXTRA_LARGE);
    }

    @Test
    void rejectedSaveWritesNothingAndKeepsCurrentSettings() {
        AppSettings before = store.current();

        AppSettings relative = validSettings();
        relative.setSavePath("relative/dir");
        assertThatThrownBy(() -> store.save(relative)).isInstanceOf(PathValidationException.class);

        AppSettings badColor = validSettings();
        badColor.setQrColor("000000");
        assertThatThrownBy(() -> store.save(badColor))
                .isInstanceOf(ColorFormatException.class)
                .hasMessageContaining("QR color");

        AppSettings badLanguage = validSettings();
        badLanguage.setLanguage("not a tag");
        assertThatThrownBy(() -> store.save(badLanguage)).isInstanceOf(SettingsValidationException.class);

        AppSettings noSize = validSettings();
        noSize.setQrSize(null);
        assertThatThrownBy(() -> store.save(noSize)).isInstanceOf(SettingsValidationException.class);

        assertThat(Files.exists(settingsFile)).isFalse();
        assertThat(store.current().getSavePath()).isEqualTo(before.getSavePath());
    }

    @Test
    void failedWriteKeepsInMemorySettings() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        SettingsStore broken = new SettingsStore(objectMapper, blocker.resolve("settings.json").toString(),
                tempDir.resolve("QR-pass").toString());
        AppSettings before = broken.current();

        assertThatThrownBy(() -> broken.save(validSettings())).isInstanceOf(SettingsPersistenceException.class);

        assertThat(broken.current().getSavePath()).isEqualTo(before.getSavePath());
        assertThat(broken.current().isAutoSave()).isFalse();
    }

    @Test
    void currentReturnsCopies() {
        AppSettings copy = store.current();
        copy.setQrColor("#FF0000");

        assertThat(store.current().getQrColor()).isEqualTo("#000000");
    }

    @Test
    void resetRestoresAndPersistsDefaults() throws Exception {
        store.save(validSettings());

        AppSettings reset = store.reset();

        assertThat(reset.isAutoSave()).isFalse();
        assertThat(reset.getSavePath()).isEqualTo(tempDir.resolve("QR-pass").toString());
        JsonNode written = objectMapper.readTree(settingsFile.toFile());
        assertThat(written.get("auto_save").asBoolean()).isFalse();
        assertThat(written.get("qr_size").asText()).isEqualTo("متوسط");
    }

    @Test
    void languageTags() {
        assertThat(SettingsStore.isValidLanguage("ar")).isTrue();
        assertThat(SettingsStore.isValidLanguage("fr-CA")).isTrue();
        assertThat(SettingsStore.isValidLanguage("")).isFalse();
        assertThat(SettingsStore.isValidLanguage("en_US")).isFalse();
    }

    private AppSettings validSettings() {
        AppSettings settings = store.defaults();
        settings.setSavePath(saveDir.toString());
        settings.setAutoSave(true);
        return settings;
    }

    private void writeSettings(String content) throws Exception {
        Files.writeString(settingsFile, content, StandardCharsets.UTF_8);
    }

    private static String json(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
