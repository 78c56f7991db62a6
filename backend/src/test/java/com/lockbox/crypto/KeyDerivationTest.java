package com.lockbox.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PBKDF2-HMAC-SHA256 derivation. No Spring context, no mocks.
 */
class KeyDerivationTest {

    private static final int ITERATIONS = KeyDerivation.DEFAULT_ITERATIONS;

    private final KeyDerivation kdf = new KeyDerivation();

    @Test
    void sameInputsDeriveSameKey() {
        byte[] salt = kdf.newSalt();

        try (SecretBytes first = kdf.derive("Tr0ub4dor&3".toCharArray(), salt, ITERATIONS);
             SecretBytes second = kdf.derive("Tr0ub4dor&3".toCharArray(), salt, ITERATIONS)) {
            assertEquals(KeyDerivation.KEY_LENGTH, first.length());
            assertArrayEquals(first.reveal(), second.reveal(), "Derivation must be deterministic");
        }
    }

    @Test
    void differentSaltOrPassphraseChangesKey() {
        byte[] salt = kdf.newSalt();
        byte[] otherSalt = kdf.newSalt();

        try (SecretBytes base = kdf.derive("Tr0ub4dor&3".toCharArray(), salt, ITERATIONS);
             SecretBytes saltChanged = kdf.derive("Tr0ub4dor&3".toCharArray(), otherSalt, ITERATIONS);
             SecretBytes passChanged = kdf.derive("Tr0ub4dor&4".toCharArray(), salt, ITERATIONS)) {
            assertFalse(Arrays.equals(base.reveal(), saltChanged.reveal()));
            assertFalse(Arrays.equals(base.reveal(), passChanged.reveal()));
        }
    }

    @Test
    void agreesWithJcePbkdf2() {
        byte[] salt = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

        try (SecretBytes ours = kdf.derive("passwd".toCharArray(), salt, 1000)) {
            assertArrayEquals(jcePbkdf2("passwd".toCharArray(), salt, 1000), ours.reveal(),
                    "BouncyCastle and JCE PBKDF2-HMAC-SHA256 must agree");
        }
    }

    @Test
    void emptyPassphraseIsAllowed() {
        try (SecretBytes key = kdf.derive(new char[0], kdf.newSalt(), 1)) {
            assertEquals(KeyDerivation.KEY_LENGTH, key.length());
        }
    }

    @Test
    void rejectsBadParameters() {
        byte[] salt = kdf.newSalt();
        assertThrows(IllegalArgumentException.class, () -> kdf.derive(null, salt, ITERATIONS));
        assertThrows(IllegalArgumentException.class, () -> kdf.derive("x".toCharArray(), new byte[8], ITERATIONS));
        assertThrows(IllegalArgumentException.class, () -> kdf.derive("x".toCharArray(), salt, 0));
    }

    @Test
    void saltsAreRandom() {
        assertEquals(KeyDerivation.SALT_LENGTH, kdf.newSalt().length);
        assertFalse(Arrays.equals(kdf.newSalt(), kdf.newSalt()));
    }

    private static byte[] jcePbkdf2(char[] passphrase, byte[] salt, int iterations) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(passphrase, salt, iterations, KeyDerivation.KEY_LENGTH * 8);
            return factory.generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
