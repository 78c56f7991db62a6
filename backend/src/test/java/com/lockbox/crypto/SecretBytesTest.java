package com.lockbox.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecretBytesTest {

    @Test
    void closeZeroesTheBuffer() {
        byte[] raw = {1, 2, 3, 4};
        SecretBytes secret = SecretBytes.wrap(raw);

        secret.close();

        assertArrayEquals(new byte[4], raw, "Wrapped buffer must be zero-filled on close");
        assertTrue(secret.isDestroyed());
        assertThrows(IllegalStateException.class, secret::reveal);
    }

    @Test
    void copyOfDoesNotTouchTheSource() {
        byte[] raw = {9, 9, 9};
        try (SecretBytes secret = SecretBytes.copyOf(raw)) {
            assertArrayEquals(raw, secret.reveal());
        }
        assertArrayEquals(new byte[] {9, 9, 9}, raw);
    }

    @Test
    void toStringNeverShowsContent() {
        try (SecretBytes secret = SecretBytes.wrap(new byte[] {0x41, 0x42})) {
            assertEquals("SecretBytes[2 bytes]", secret.toString());
        }
    }
}
