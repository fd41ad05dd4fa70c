package org.example.encryptedqr.common;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque handle over the 256-bit AES key. The raw material never leaves this class
 * except as a JCA key for the cipher.
 */
public final class SymmetricKey {
    public static final int KEY_LENGTH = 32;

    private final byte[] material;

    private SymmetricKey(byte[] material) {
        this.material = material;
    }

    public static SymmetricKey of(byte[] material) {
        if (material == null || material.length != KEY_LENGTH) {
            throw new IllegalArgumentException("AES-256 key must be exactly " + KEY_LENGTH + " bytes");
        }
        return new SymmetricKey(material.clone());
    }

    public SecretKey asSecretKey() {
        return new SecretKeySpec(material, "AES");
    }

    /**
     * First 8 bytes of SHA-256 over the key, hex encoded. Safe to log.
     */
    public String fingerprint() {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            md.update("qr-badge-key".getBytes(StandardCharsets.US_ASCII));
            byte[] digest = md.digest(material);
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Raw bytes for writing the key file. Only the key loader calls this.
     */
    public byte[] toFileBytes() {
        return material.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymmetricKey)) return false;
        return MessageDigest.isEqual(material, ((SymmetricKey) o).material);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(material);
    }

    @Override
    public String toString() {
        return "SymmetricKey[" + fingerprint() + "]";
    }
}
