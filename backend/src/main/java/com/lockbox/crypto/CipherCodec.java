package com.lockbox.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.lockbox.error.IntegrityException;

/**
 * AES-256-GCM authenticated encryption.
 *
 * Output layout is {@code nonce(12) || ciphertext || tag(16)}. The nonce is drawn
 * inside {@link #seal} on every call and is never accepted from the caller.
 * {@link #open} either returns the whole plaintext or throws; the tag comparison
 * is done by the provider in constant time.
 */
public class CipherCodec {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final byte[] NO_AAD = new byte[0];

    private final SecureRandom random;

    public CipherCodec() {
        this(new SecureRandom());
    }

    public CipherCodec(SecureRandom random) {
        this.random = random;
    }

    public byte[] seal(SecretBytes key, byte[] plaintext) {
        return seal(key, plaintext, NO_AAD);
    }

    public byte[] seal(SecretBytes key, byte[] plaintext, byte[] associatedData) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        try {
            Cipher cipher = init(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] result = new byte[NONCE_LENGTH + ciphertext.length];
            System.arraycopy(nonce, 0, result, 0, NONCE_LENGTH);
            System.arraycopy(ciphertext, 0, result, NONCE_LENGTH, ciphertext.length);
            return result;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    public byte[] open(SecretBytes key, byte[] sealed) {
        return open(key, sealed, NO_AAD);
    }

    public byte[] open(SecretBytes key, byte[] sealed, byte[] associatedData) {
        if (sealed == null || sealed.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new IntegrityException("ciphertext too short");
        }
        try {
            Cipher cipher = init(Cipher.DECRYPT_MODE, key, Arrays.copyOfRange(sealed, 0, NONCE_LENGTH),
                    associatedData);
            return cipher.doFinal(sealed, NONCE_LENGTH, sealed.length - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new IntegrityException("authenticated decryption failed", e);
        }
    }

    private Cipher init(int mode, SecretBytes key, byte[] nonce, byte[] associatedData)
            throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(mode, new SecretKeySpec(key.reveal(), "AES"), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
        if (associatedData != null && associatedData.length > 0) {
            cipher.updateAAD(associatedData);
        }
        return cipher;
    }
}
