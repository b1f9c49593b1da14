package com.credentialguard.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * AES-256-GCM payload cipher with a process-local key.
 *
 * <p>Security properties:
 * - Unique random IV per seal operation
 * - Authentication via GCM tag (integrity + confidentiality)
 * - Storage address bound as associated data, so a payload cannot be moved to another address
 * - Key generated at construction and never exported; a restart makes old payloads unreadable
 */
@Slf4j
public class AesGcmPayloadCipher implements PayloadCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = SealedPayload.TAG_LENGTH * 8;
    private static final int AES_KEY_SIZE = 256;

    private final SecureRandom secureRandom;
    private final SecretKey key;

    public AesGcmPayloadCipher() {
        this(new SecureRandom());
    }

    AesGcmPayloadCipher(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
        this.key = generateKey(secureRandom);
    }

    @Override
    public SealedPayload seal(byte[] plaintext, byte[] associatedData) {
        try {
            byte[] iv = new byte[SealedPayload.IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(associatedData);

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext);
            int ciphertextLength = ciphertextWithTag.length - SealedPayload.TAG_LENGTH;

            SealedPayload sealed = new SealedPayload(
                Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength),
                iv,
                Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length)
            );

            log.debug("Sealed {} bytes", plaintext.length);
            return sealed;

        } catch (GeneralSecurityException e) {
            log.error("Sealing failed", e);
            throw new CryptoException("Failed to seal payload", e);
        }
    }

    @Override
    public byte[] open(SealedPayload sealed, byte[] associatedData) {
        try {
            byte[] ciphertext = sealed.getCiphertext();
            byte[] authTag = sealed.getAuthTag();
            byte[] ciphertextWithTag = ByteBuffer.allocate(ciphertext.length + authTag.length)
                .put(ciphertext)
                .put(authTag)
                .array();

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, sealed.getIv()));
            cipher.updateAAD(associatedData);

            return cipher.doFinal(ciphertextWithTag);

        } catch (GeneralSecurityException e) {
            log.warn("Opening sealed payload failed: {}", e.getClass().getSimpleName());
            throw new CryptoException("Failed to open payload", e);
        }
    }

    private static SecretKey generateKey(SecureRandom secureRandom) {
        try {
            KeyGenerator keyGen = KeyGenerator.getInstance("AES");
            keyGen.init(AES_KEY_SIZE, secureRandom);
            return keyGen.generateKey();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES key generation unavailable", e);
        }
    }

    /**
     * Exception thrown when cryptographic operations fail.
     */
    public static class CryptoException extends RuntimeException {
        public CryptoException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
