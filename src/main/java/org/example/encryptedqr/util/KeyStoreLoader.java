package org.example.encryptedqr.util;

import lombok.extern.slf4j.Slf4j;
import org.example.encryptedqr.common.KeyLoadResult;
import org.example.encryptedqr.common.KeySource;
import org.example.encryptedqr.common.SymmetricKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the AES key file: loads it, or generates and persists a new key when the file is
 * missing or unreadable. I/O failures never make the key unavailable; they end up as
 * warnings on the {@link KeyLoadResult}.
 */
@Slf4j
@Component
public class KeyStoreLoader {
    private final Path keyPath;
    private final SecureRandom random = new SecureRandom();

    private KeyLoadResult loaded;

    public KeyStoreLoader(@Value("${keystore.path:encryption_key.bin}") String keystorePath) {
        this.keyPath = Paths.get(keystorePath);
    }

    public Path getKeyPath() {
        return keyPath;
    }

    /**
     * Loads the key once per loader and returns the same result afterwards.
     */
    public synchronized KeyLoadResult getOrCreateKey() {
        if (loaded == null) {
            loaded = load();
            log.info("Encryption key {} from {} (fingerprint {})",
                    loaded.getSource().name().toLowerCase(), keyPath, loaded.getKey().fingerprint());
        }
        return loaded;
    }

    public SymmetricKey getKey() {
        return getOrCreateKey().getKey();
    }

    private KeyLoadResult load() {
        List<String> warnings = new ArrayList<>();
        boolean exists = Files.exists(keyPath);

        if (exists) {
            try {
                byte[] bytes = Files.readAllBytes(keyPath);
                if (bytes.length == SymmetricKey.KEY_LENGTH) {
                    return new KeyLoadResult(SymmetricKey.of(bytes), KeySource.LOADED, warnings);
                }
                warnings.add("Key file " + keyPath + " has " + bytes.length + " bytes, expected "
                        + SymmetricKey.KEY_LENGTH + "; generating a new key");
            } catch (IOException e) {
                warnings.add("Cannot read key file " + keyPath + ": " + e.getMessage() + "; generating a new key");
            }
            log.warn(warnings.get(warnings.size() - 1));
        }

        SymmetricKey fresh = generate();
        try {
            if (exists) {
                replace(fresh);
            } else {
                createIfAbsent(fresh);
            }
            return new KeyLoadResult(fresh, KeySource.GENERATED, warnings);
        } catch (FileAlreadyExistsException e) {
            // another process created the file between our check and our write
            return adoptWinner(fresh, warnings);
        } catch (IOException | SecurityException e) {
            String msg = "Cannot write key file " + keyPath + ": " + e.getMessage()
                    + "; using an in-memory key for this session only";
            log.warn(msg);
            warnings.add(msg);
            return new KeyLoadResult(fresh, KeySource.EPHEMERAL, warnings);
        }
    }

    private KeyLoadResult adoptWinner(SymmetricKey fallback, List<String> warnings) {
        try {
            byte[] bytes = Files.readAllBytes(keyPath);
            if (bytes.length == SymmetricKey.KEY_LENGTH) {
                return new KeyLoadResult(SymmetricKey.of(bytes), KeySource.LOADED, warnings);
            }
            warnings.add("Key file " + keyPath + " appeared concurrently but is malformed");
        } catch (IOException e) {
            warnings.add("Key file " + keyPath + " appeared concurrently but cannot be read: " + e.getMessage());
        }
        log.warn(warnings.get(warnings.size() - 1));
        return new KeyLoadResult(fallback, KeySource.EPHEMERAL, warnings);
    }

    private SymmetricKey generate() {
        byte[] material = new byte[SymmetricKey.KEY_LENGTH];
        random.nextBytes(material);
        return SymmetricKey.of(material);
    }

    private void createIfAbsent(SymmetricKey key) throws IOException {
        Path parent = createParent();
        Path tmp = Files.createTempFile(parent, ".key-", ".tmp");
        try {
            Files.write(tmp, key.toFileBytes());
            try {
                // link fails if the key file exists, and the key file is complete once visible
                Files.createLink(keyPath, tmp);
            } catch (FileAlreadyExistsException e) {
                throw e;
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Hard links unavailable for {}, falling back to exclusive create", keyPath);
                Files.write(keyPath, key.toFileBytes(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void replace(SymmetricKey key) throws IOException {
        Path parent = createParent();
        Path tmp = Files.createTempFile(parent, ".key-", ".tmp");
        try {
            Files.write(tmp, key.toFileBytes());
            try {
                Files.move(tmp, keyPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, keyPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path createParent() throws IOException {
        Path parent = keyPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        return parent;
    }
}
