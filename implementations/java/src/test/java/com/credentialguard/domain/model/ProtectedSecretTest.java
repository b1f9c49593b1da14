package com.credentialguard.domain.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ProtectedSecretTest {

    @Test
    void decodeRejectsMalformedUtf8() {
        assertThrows(CharacterCodingException.class,
            () -> ProtectedSecret.decode(new byte[] {(byte) 0xFF, (byte) 0xFE, (byte) 0xFD}));
    }

    @Test
    void decodeCopiesThePayload() throws Exception {
        byte[] payload = "sk-token".getBytes(StandardCharsets.UTF_8);
        ProtectedSecret secret = ProtectedSecret.decode(payload);

        payload[0] = 'X';

        assertArrayEquals("sk-token".getBytes(StandardCharsets.UTF_8), secret.getBytes());
    }

    @Test
    void toCharsDecodesUtf8() throws Exception {
        ProtectedSecret secret = ProtectedSecret.decode("clé".getBytes(StandardCharsets.UTF_8));

        assertArrayEquals("clé".toCharArray(), secret.toChars());
        assertEquals(4, secret.length());
    }

    @Test
    void closePurgesAndBlocksAccess() throws Exception {
        ProtectedSecret secret;
        try (ProtectedSecret scoped = ProtectedSecret.decode("sk-token".getBytes(StandardCharsets.UTF_8))) {
            secret = scoped;
            assertFalse(scoped.isPurged());
        }

        assertTrue(secret.isPurged());
        assertThrows(IllegalStateException.class, secret::getBytes);
        assertThrows(IllegalStateException.class, secret::copy);
    }

    @Test
    void copyIsIndependent() throws Exception {
        ProtectedSecret original = ProtectedSecret.decode("sk-token".getBytes(StandardCharsets.UTF_8));
        ProtectedSecret copy = original.copy();

        original.purge();

        assertFalse(copy.isPurged());
        assertTrue(copy.contentEquals("sk-token".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void toStringNeverShowsContent() throws Exception {
        ProtectedSecret secret = ProtectedSecret.decode("sk-token".getBytes(StandardCharsets.UTF_8));

        assertFalse(secret.toString().contains("sk-token"));
        secret.purge();
        assertEquals("ProtectedSecret[purged]", secret.toString());
    }

    @Test
    void wellFormedMatchesWhatDecodeAccepts() {
        assertTrue(ProtectedSecret.isWellFormed("sk-ant-é中☃".getBytes(StandardCharsets.UTF_8)));
        assertTrue(ProtectedSecret.isWellFormed(new byte[0]));
        assertFalse(ProtectedSecret.isWellFormed(new byte[] {(byte) 0xFF, 0x01, 0x02}));
        assertThrows(CharacterCodingException.class,
            () -> ProtectedSecret.decode(new byte[] {(byte) 0xFF, 0x01, 0x02}));
    }
}
