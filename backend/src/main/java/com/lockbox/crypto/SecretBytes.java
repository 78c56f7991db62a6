package com.lockbox.crypto;

import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * Owned buffer for key material.
 *
 * The wrapped array is zeroed on {@link #close()}, so callers hold it in a
 * try-with-resources block (or close it on logout) instead of waiting for the
 * collector. Any access after close fails.
 */
public final class SecretBytes implements AutoCloseable, Destroyable {

    private final byte[] value;
    private volatile boolean destroyed;

    private SecretBytes(byte[] value) {
        this.value = value;
    }

    /** Takes ownership of {@code value}; the caller must not keep using it. */
    public static SecretBytes wrap(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return new SecretBytes(value);
    }

    public static SecretBytes copyOf(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        return new SecretBytes(value.clone());
    }

    /** Returns the live buffer, not a copy. Do not retain it past the owner's lifetime. */
    public byte[] reveal() {
        if (destroyed) {
            throw new IllegalStateException("key material already destroyed");
        }
        return value;
    }

    public int length() {
        return value.length;
    }

    @Override
    public void destroy() {
        Arrays.fill(value, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public String toString() {
        return "SecretBytes[" + (destroyed ? "destroyed" : value.length + " bytes") + "]";
    }
}
