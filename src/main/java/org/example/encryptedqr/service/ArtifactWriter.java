package org.example.encryptedqr.service;

import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.exception.ArtifactWriteException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

/**
 * Writes badge images as {@code qr_code_<employeeId>.png}. The file is staged next to the
 * target and moved into place, so readers never observe a half-written image.
 */
@Slf4j
@Component
public class ArtifactWriter {

    public static String fileName(String employeeId) {
        return "qr_code_" + employeeId + ".png";
    }

    public Path write(byte[] png, String directory, String employeeId) {
        if (!PayloadCodec.isValidEmployeeId(employeeId)) {
            throw new ArtifactWriteException("Employee ID must contain digits only: " + employeeId);
        }
        Path dir;
        try {
            dir = Paths.get(directory == null ? "" : directory);
        } catch (InvalidPathException e) {
            throw new ArtifactWriteException("Invalid save directory: " + directory);
        }
        if (!dir.isAbsolute()) {
            throw new ArtifactWriteException("Save directory must be absolute: " + directory);
        }

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot create directory " + dir + ": " + describe(e), e);
        }

        Path target = dir.resolve(fileName(employeeId));
        Path tmp = null;
        try {
            // default permissions, the moved file keeps the staging file's mode
            tmp = dir.resolve(".qr_code_" + UUID.randomUUID() + ".tmp");
            Files.write(tmp, png, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Saved QR code to {}", target);
            return target;
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot save image to " + target + ": " + describe(e), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    private static String describe(IOException e) {
        if (e instanceof AccessDeniedException) {
            return "permission denied";
        }
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : " (" + e.getMessage() + ")");
    }
}
