package org.example.encryptedqr.service;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.example.encryptedqr.common.CiphertextEnvelope;
import org.example.encryptedqr.common.SymmetricKey;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;

/**
 * AES-256-CBC with PKCS#7 padding. Every call draws a new random IV, so encrypting the same
 * record twice never yields the same envelope.
 */
@Service
public class EncryptionService {
    public static final String TRANSFORMATION = "AES/CBC/PKCS7Padding";

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final SecureRandom random = new SecureRandom();

    public CiphertextEnvelope encrypt(String plaintext, SymmetricKey key) throws GeneralSecurityException {
        byte[] iv = new byte[CiphertextEnvelope.IV_LENGTH];
        random.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(Cipher.ENCRYPT_MODE, key.asSecretKey(), new IvParameterSpec(iv));
        byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        return new CiphertextEnvelope(iv, ciphertext);
    }
}
