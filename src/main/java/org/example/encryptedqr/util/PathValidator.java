package org.example.encryptedqr.util;

import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.exception.PathValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Write-test probe for save directories: a path is accepted only if it is absolute and a
 * file can be created in it and removed again.
 */
@Slf4j
public final class PathValidator {
    private static final String PROBE_PREFIX = ".write-probe-";

    private PathValidator() {
    }

    public static boolean isWritableDirectory(String path) {
        try {
            requireWritableDirectory(path);
            return true;
        } catch (PathValidationException e) {
            log.debug("Path rejected: {}", e.getMessage());
            return false;
        }
    }

    public static Path requireWritableDirectory(String path) {
        if (path == null || path.isBlank()) {
            throw new PathValidationException("Save path is empty");
        }
        Path dir;
        try {
            dir = Paths.get(path);
        } catch (InvalidPathException e) {
            throw new PathValidationException("Save path is not a valid path: " + path);
        }
        if (!dir.isAbsolute()) {
            throw new PathValidationException("Save path must be absolute: " + path);
        }
        Path probe;
        try {
            probe = Files.createTempFile(dir, PROBE_PREFIX, ".tmp");
        } catch (IOException | SecurityException e) {
            throw new PathValidationException("Save path is not writable: " + path);
        }
        try {
            Files.delete(probe);
        } catch (IOException e) {
            throw new PathValidationException("Cannot remove write probe in " + path + ": " + e.getMessage());
        }
        return dir;
    }
}
