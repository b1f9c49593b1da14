package com.credentialguard.infrastructure.crypto;

/**
 * Protects stored payloads at rest.
 *
 * <p>Implementations hold the key material; callers only see {@link SealedPayload}s.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface PayloadCipher {

    /**
     * Encrypt a payload.
     *
     * @param plaintext Data to encrypt
     * @param associatedData Bytes bound to the ciphertext (e.g. the storage address)
     * @return Sealed payload
     */
    SealedPayload seal(byte[] plaintext, byte[] associatedData);

    /**
     * Decrypt and verify a payload.
     *
     * @param sealed Sealed payload
     * @param associatedData Same bytes given to {@link #seal}
     * @return Plaintext bytes
     */
    byte[] open(SealedPayload sealed, byte[] associatedData);
}
