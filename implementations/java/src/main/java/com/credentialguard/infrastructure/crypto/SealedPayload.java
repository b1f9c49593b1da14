package com.credentialguard.infrastructure.crypto;

import lombok.EqualsAndHashCode;

import java.util.Objects;

/**
 * Ciphertext of a stored item with its AES-GCM parameters.
 *
 * <p><strong>Security Guarantees:</strong>
 * <ul>
 *   <li>Immutable - byte arrays are copied in and out</li>
 *   <li>No plaintext or key material held here</li>
 *   <li>Authentication tag kept separately so tampering is detected on open</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@EqualsAndHashCode
public final class SealedPayload {

    public static final String ALGORITHM = "AES-256-GCM";
    static final int IV_LENGTH = 12;
    static final int TAG_LENGTH = 16;

    private final byte[] ciphertext;
    private final byte[] iv;
    private final byte[] authTag;

    /**
     * Creates a sealed payload with validation.
     *
     * @param ciphertext Encrypted bytes (may be empty for an empty secret)
     * @param iv 12-byte GCM nonce
     * @param authTag 16-byte GCM tag
     * @throws IllegalArgumentException if IV or tag have the wrong length
     */
    public SealedPayload(byte[] ciphertext, byte[] iv, byte[] authTag) {
        this.ciphertext = Objects.requireNonNull(ciphertext, "Ciphertext must not be null").clone();

        if (iv == null || iv.length != IV_LENGTH) {
            throw new IllegalArgumentException(ALGORITHM + " requires 12-byte IV");
        }
        if (authTag == null || authTag.length != TAG_LENGTH) {
            throw new IllegalArgumentException(ALGORITHM + " requires 16-byte auth tag");
        }
        this.iv = iv.clone();
        this.authTag = authTag.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getIv() {
        return iv.clone();
    }

    public byte[] getAuthTag() {
        return authTag.clone();
    }

    @Override
    public String toString() {
        return String.format("SealedPayload[algorithm=%s, ciphertext=%d bytes]", ALGORITHM, ciphertext.length);
    }
}
