package org.example.encryptedqr.common;

import java.util.Base64;

/**
 * IV plus AES-CBC ciphertext. Its text form is the exact QR payload:
 * {@code <base64-iv>:<base64-ciphertext>}.
 */
public final class CiphertextEnvelope {
    public static final int IV_LENGTH = 16;
    public static final char SEPARATOR = ':';

    private final byte[] iv;
    private final byte[] ciphertext;

    public CiphertextEnvelope(byte[] iv, byte[] ciphertext) {
        if (iv == null || iv.length != IV_LENGTH) {
            throw new IllegalArgumentException("IV must be " + IV_LENGTH + " bytes");
        }
        if (ciphertext == null || ciphertext.length == 0 || ciphertext.length % IV_LENGTH != 0) {
            throw new IllegalArgumentException("Ciphertext must be a non-empty multiple of the AES block size");
        }
        this.iv = iv.clone();
        this.ciphertext = ciphertext.clone();
    }

    public static CiphertextEnvelope parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Envelope text is null");
        }
        int idx = text.indexOf(SEPARATOR);
        if (idx < 0 || idx != text.lastIndexOf(SEPARATOR)) {
            throw new IllegalArgumentException("Envelope must contain exactly one '" + SEPARATOR + "'");
        }
        Base64.Decoder decoder = Base64.getDecoder();
        return new CiphertextEnvelope(
                decoder.decode(text.substring(0, idx)),
                decoder.decode(text.substring(idx + 1)));
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public String toPayloadText() {
        Base64.Encoder encoder = Base64.getEncoder();
        return encoder.encodeToString(iv) + SEPARATOR + encoder.encodeToString(ciphertext);
    }

    @Override
    public String toString() {
        return toPayloadText();
    }
}
