package org.example.encryptedqr.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.GenerationOutcome;
import org.example.encryptedqr.common.QrArtifact;
import org.example.encryptedqr.exception.BadgeException;
import org.example.encryptedqr.service.BadgeGenerationService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/badges")
@RequiredArgsConstructor
public class BadgeController {

    private final BadgeGenerationService badgeGenerationService;

    /**
     * Generates an encrypted QR code and returns it as base64 PNG with its payload.
     * Saves it too when auto-save is enabled.
     */
    @PostMapping
    public ResponseEntity<?> generate(
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "employeeId", required = false) String employeeId,
            @RequestParam(value = "department", required = false) String department,
            @RequestParam(value = "notes", required = false) String notes) {

        try {
            GenerationOutcome outcome = badgeGenerationService.generate(name, employeeId, department, notes);
            return ResponseEntity.ok(toBody(outcome));
        } catch (BadgeException e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "QR generation failed: " + e.getMessage());
        }
    }

    @PostMapping("/image")
    public ResponseEntity<?> generateImage(
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "employeeId", required = false) String employeeId,
            @RequestParam(value = "department", required = false) String department,
            @RequestParam(value = "notes", required = false) String notes) {

        try {
            QrArtifact artifact = badgeGenerationService.generate(name, employeeId, department, notes).getArtifact();

            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + artifact.getFileName() + "\"")
                    .contentType(MediaType.IMAGE_PNG)
                    .body(artifact.getPng());
        } catch (BadgeException e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "QR generation failed: " + e.getMessage());
        }
    }

    /**
     * Generates and writes the image to the configured save directory.
     */
    @PostMapping("/save")
    public ResponseEntity<?> generateAndSave(
            @RequestParam(value = "name", required = false) String name,
            @RequestParam(value = "employeeId", required = false) String employeeId,
            @RequestParam(value = "department", required = false) String department,
            @RequestParam(value = "notes", required = false) String notes) {

        try {
            GenerationOutcome outcome = badgeGenerationService.generateAndSave(name, employeeId, department, notes);
            return ResponseEntity.ok(toBody(outcome));
        } catch (BadgeException e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(e);
        } catch (Exception e) {
            log.error(e.getMessage(), e);
            return ErrorResponses.of(HttpStatus.INTERNAL_SERVER_ERROR, "Saving QR code failed: " + e.getMessage());
        }
    }

    @GetMapping("/status")
    public ResponseEntity<?> getServiceStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("status", "online");
        status.put("message", "Encrypted QR code service is running");
        status.put("timestamp", System.currentTimeMillis());

        return ResponseEntity.ok(status);
    }

    private Map<String, Object> toBody(GenerationOutcome outcome) {
        QrArtifact artifact = outcome.getArtifact();
        Map<String, Object> response = new HashMap<>();
        response.put("employeeId", artifact.getEmployeeId());
        response.put("payload", artifact.getPayload());
        response.put("image", Base64.getEncoder().encodeToString(artifact.getPng()));
        response.put("size", artifact.getPixelSize());
        response.put("qrColor", artifact.getForeground());
        response.put("qrBgColor", artifact.getBackground());
        response.put("fileName", artifact.getFileName());
        outcome.savedPath().ifPresent(p -> response.put("savedTo", p.toString()));
        if (outcome.getSaveError() != null) {
            response.put("saveError", outcome.getSaveError());
        }
        return response;
    }
}
