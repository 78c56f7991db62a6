package com.lockbox.vault;

import java.nio.ByteBuffer;
import java.util.Arrays;

import com.lockbox.crypto.CipherCodec;
import com.lockbox.crypto.KeyDerivation;
import com.lockbox.error.IntegrityException;

/**
 * Binary layout shared by vault files and export bundles:
 *
 * <pre>
 * [magic 3][format_version 1][salt 16][kdf_iterations 4, big-endian][nonce 12][ciphertext + tag]
 * </pre>
 *
 * The 24 header bytes are passed to AES-GCM as associated data, so they are
 * covered by the tag even though they are stored in the clear.
 */
final class VaultContainer {

    static final byte[] VAULT_MAGIC = {'L', 'B', 'X'};
    static final byte[] EXPORT_MAGIC = {'L', 'B', 'E'};
    static final int FORMAT_VERSION = 1;
    /** Upper bound on the header's iteration count; derivation runs before the tag is checked. */
    static final int MAX_ITERATIONS = 10_000_000;
    static final int HEADER_LENGTH = 3 + 1 + KeyDerivation.SALT_LENGTH + 4;
    static final int MIN_LENGTH = HEADER_LENGTH + CipherCodec.NONCE_LENGTH + CipherCodec.TAG_LENGTH;

    record Parsed(VaultHeader header, byte[] headerBytes, byte[] sealed) {}

    private VaultContainer() {
    }

    static byte[] header(byte[] magic, VaultHeader header) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH);
        buffer.put(magic);
        buffer.put((byte) header.formatVersion());
        buffer.put(header.salt());
        buffer.putInt(header.kdfIterations());
        return buffer.array();
    }

    static byte[] join(byte[] headerBytes, byte[] sealed) {
        byte[] out = new byte[headerBytes.length + sealed.length];
        System.arraycopy(headerBytes, 0, out, 0, headerBytes.length);
        System.arraycopy(sealed, 0, out, headerBytes.length, sealed.length);
        return out;
    }

    /**
     * Structural parse only; says nothing about whether the ciphertext authenticates.
     */
    static Parsed parse(byte[] magic, byte[] data, int minIterations) {
        if (data == null || data.length < MIN_LENGTH) {
            throw new IntegrityException("container truncated");
        }
        if (!Arrays.equals(Arrays.copyOfRange(data, 0, magic.length), magic)) {
            throw new IntegrityException("unrecognized container type");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        buffer.position(magic.length);
        int version = Byte.toUnsignedInt(buffer.get());
        if (version != FORMAT_VERSION) {
            throw new IntegrityException("unsupported format version " + version);
        }
        byte[] salt = new byte[KeyDerivation.SALT_LENGTH];
        buffer.get(salt);
        int iterations = buffer.getInt();
        if (iterations < minIterations) {
            throw new IntegrityException("kdf iteration count below floor");
        }
        if (iterations > MAX_ITERATIONS) {
            throw new IntegrityException("kdf iteration count above ceiling");
        }
        byte[] headerBytes = Arrays.copyOfRange(data, 0, HEADER_LENGTH);
        byte[] sealed = Arrays.copyOfRange(data, HEADER_LENGTH, data.length);
        return new Parsed(new VaultHeader(version, salt, iterations), headerBytes, sealed);
    }
}
