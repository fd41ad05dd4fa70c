package org.example.encryptedqr.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.AppSettings;
import org.example.encryptedqr.common.CiphertextEnvelope;
import org.example.encryptedqr.common.EmployeeRecord;
import org.example.encryptedqr.common.GenerationOutcome;
import org.example.encryptedqr.common.QrArtifact;
import org.example.encryptedqr.exception.ArtifactWriteException;
import org.example.encryptedqr.exception.BadgeException;
import org.example.encryptedqr.exception.GenerationException;
import org.example.encryptedqr.exception.GenerationException.Stage;
import org.example.encryptedqr.exception.SettingsValidationException;
import org.example.encryptedqr.util.HexColors;
import org.example.encryptedqr.util.KeyStoreLoader;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs one badge request end to end on the calling thread:
 * validate, serialize, encrypt, encode and, when auto-save is on, write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BadgeGenerationService {
    private final PayloadCodec payloadCodec;
    private final EncryptionService encryptionService;
    private final QrImageEncoder qrImageEncoder;
    private final ArtifactWriter artifactWriter;
    private final KeyStoreLoader keyStoreLoader;
    private final SettingsStore settingsStore;

    public EmployeeRecord validateInput(String name, String employeeId, String department, String notes) {
        return payloadCodec.validate(name, employeeId, department, notes);
    }

    public QrArtifact generateArtifact(EmployeeRecord record, AppSettings settings) {
        if (settings == null) {
            throw new SettingsValidationException("Settings are missing");
        }
        if (settings.getQrSize() == null || settings.getImageQuality() == null) {
            throw new SettingsValidationException("QR size and image quality are required");
        }
        HexColors.requireValid("QR color", settings.getQrColor());
        HexColors.requireValid("QR background color", settings.getQrBgColor());

        String plaintext;
        try {
            plaintext = payloadCodec.serialize(record);
        } catch (RuntimeException e) {
            throw new GenerationException(Stage.SERIALIZE, e);
        }

        CiphertextEnvelope envelope;
        try {
            envelope = encryptionService.encrypt(plaintext, keyStoreLoader.getKey());
        } catch (Exception e) {
            throw new GenerationException(Stage.ENCRYPT, e);
        }

        String payload = envelope.toPayloadText();
        byte[] png;
        try {
            png = qrImageEncoder.encodePng(payload, settings.getQrSize(), settings.getQrColor(),
                    settings.getQrBgColor(), settings.getImageQuality());
        } catch (BadgeException e) {
            throw e;
        } catch (Exception e) {
            throw new GenerationException(Stage.ENCODE, e);
        }

        log.info("Generated QR code for employee {} ({} px)", record.getEmployeeId(), settings.getQrSize().getPixels());
        return new QrArtifact(record.getEmployeeId(), payload, png, settings.getQrSize().getPixels(),
                settings.getQrColor(), settings.getQrBgColor());
    }

    public Path persistArtifact(QrArtifact artifact, AppSettings settings) {
        return artifactWriter.write(artifact.getPng(), settings.getSavePath(), artifact.getEmployeeId());
    }

    /**
     * Validates the raw fields and generates against the current settings, saving the
     * image as well when auto-save is enabled.
     */
    public GenerationOutcome generate(String name, String employeeId, String department, String notes) {
        EmployeeRecord record = validateInput(name, employeeId, department, notes);
        AppSettings settings = settingsStore.current();
        QrArtifact artifact = generateArtifact(record, settings);

        if (!settings.isAutoSave()) {
            return GenerationOutcome.notSaved(artifact);
        }
        try {
            return GenerationOutcome.saved(artifact, persistArtifact(artifact, settings));
        } catch (ArtifactWriteException e) {
            log.warn("Auto-save failed for employee {}: {}", employeeId, e.getMessage());
            return GenerationOutcome.saveFailed(artifact, e.getMessage());
        }
    }

    /**
     * Generates and always saves, regardless of the auto-save setting.
     */
    public GenerationOutcome generateAndSave(String name, String employeeId, String department, String notes) {
        EmployeeRecord record = validateInput(name, employeeId, department, notes);
        AppSettings settings = settingsStore.current();
        QrArtifact artifact = generateArtifact(record, settings);
        return GenerationOutcome.saved(artifact, persistArtifact(artifact, settings));
    }
}
