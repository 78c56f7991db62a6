package com.lockbox.crypto;

import java.security.SecureRandom;
import java.util.Arrays;

import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Password-based key derivation: PBKDF2-HMAC-SHA256 producing 256-bit keys.
 *
 * Deterministic and CPU-bound. The iteration count is a parameter rather than a
 * constant so that it can travel in the vault header and be raised for new
 * vaults without breaking old ones.
 */
public class KeyDerivation {

    public static final int KEY_LENGTH = 32;
    public static final int SALT_LENGTH = 16;
    public static final int DEFAULT_ITERATIONS = 100_000;

    private final SecureRandom random;

    public KeyDerivation() {
        this(new SecureRandom());
    }

    public KeyDerivation(SecureRandom random) {
        this.random = random;
    }

    public SecretBytes derive(char[] passphrase, byte[] salt, int iterations) {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase is required");
        }
        if (salt == null || salt.length != SALT_LENGTH) {
            throw new IllegalArgumentException("salt must be " + SALT_LENGTH + " bytes");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }

        byte[] password = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(passphrase);
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(password, salt, iterations);
            KeyParameter key = (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH * 8);
            return SecretBytes.wrap(key.getKey());
        } finally {
            Arrays.fill(password, (byte) 0);
        }
    }

    public byte[] newSalt() {
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        return salt;
    }
}
