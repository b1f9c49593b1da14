package com.credentialguard.domain.model;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * The retrieved credential.
 *
 * <p>Owned by the caller once returned. Callers must {@link #purge()} it
 * (or use try-with-resources) as soon as the credential has been used.
 *
 * <p><strong>Security:</strong>
 * <ul>
 *   <li>Accessors return copies; the internal buffer never escapes</li>
 *   <li>{@link #toString()} never exposes content</li>
 *   <li>Purging zero-fills the buffer and is idempotent</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
public final class ProtectedSecret implements AutoCloseable {

    private final byte[] bytes;
    private volatile boolean purged;

    private ProtectedSecret(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a payload after checking it is well-formed UTF-8.
     *
     * @param payload Raw payload (copied)
     * @return Secret holding a copy of the payload
     * @throws CharacterCodingException if the payload is not valid UTF-8
     */
    public static ProtectedSecret decode(byte[] payload) throws CharacterCodingException {
        Objects.requireNonNull(payload, "Payload must not be null");
        wipe(strictDecoder().decode(ByteBuffer.wrap(payload)));
        return new ProtectedSecret(payload.clone());
    }

    /**
     * Whether the bytes form well-formed UTF-8, i.e. whether {@link #decode(byte[])}
     * would accept them.
     *
     * @param payload Candidate secret
     * @return true if the payload decodes strictly
     */
    public static boolean isWellFormed(byte[] payload) {
        Objects.requireNonNull(payload, "Payload must not be null");
        try {
            wipe(strictDecoder().decode(ByteBuffer.wrap(payload)));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    /**
     * Copy of the raw credential bytes.
     *
     * @return Copy of the bytes
     * @throws IllegalStateException if already purged
     */
    public byte[] getBytes() {
        ensureNotPurged();
        return bytes.clone();
    }

    /**
     * Credential as characters, for APIs that accept {@code char[]}.
     *
     * @return Freshly decoded characters; caller should clear them after use
     */
    public char[] toChars() {
        ensureNotPurged();
        CharBuffer decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(bytes));
        char[] chars = new char[decoded.remaining()];
        decoded.get(chars);
        wipe(decoded);
        return chars;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Independent copy, owned by a different caller.
     *
     * @return New secret with the same content
     */
    public ProtectedSecret copy() {
        ensureNotPurged();
        return new ProtectedSecret(bytes.clone());
    }

    /**
     * Constant-time content comparison.
     *
     * @param other Bytes to compare against
     * @return true if content matches
     */
    public boolean contentEquals(byte[] other) {
        ensureNotPurged();
        return other != null && java.security.MessageDigest.isEqual(bytes, other);
    }

    public boolean isPurged() {
        return purged;
    }

    public void purge() {
        Arrays.fill(bytes, (byte) 0);
        purged = true;
    }

    @Override
    public void close() {
        purge();
    }

    private void ensureNotPurged() {
        if (purged) {
            throw new IllegalStateException("Secret has been purged");
        }
    }

    private static CharsetDecoder strictDecoder() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    }

    private static void wipe(CharBuffer buffer) {
        if (buffer.hasArray()) {
            Arrays.fill(buffer.array(), '\0');
        }
    }

    @Override
    public String toString() {
        return purged ? "ProtectedSecret[purged]" : "ProtectedSecret[" + bytes.length + " bytes]";
    }
}
