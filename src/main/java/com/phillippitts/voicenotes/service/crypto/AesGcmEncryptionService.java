package com.phillippitts.voicenotes.service.crypto;

import com.phillippitts.voicenotes.exception.EncryptionException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM with a per-message key derived from the master key by PBKDF2-HMAC-SHA256.
 *
 * <p>Output layout, base64-encoded: {@code salt(16) | nonce(12) | ciphertext+tag}.
 */
public final class AesGcmEncryptionService implements EncryptionService {

    static final int SALT_LENGTH = 16;
    static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH_BITS = 256;

    private final char[] masterKey;
    private final int iterations;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param masterKey  raw master key bytes (32 bytes expected)
     * @param iterations PBKDF2 iteration count
     */
    public AesGcmEncryptionService(byte[] masterKey, int iterations) {
        if (masterKey == null || masterKey.length == 0) {
            throw new IllegalArgumentException("masterKey is required");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive, got: " + iterations);
        }
        // PBEKeySpec takes chars; base64 keeps every byte of the key significant
        this.masterKey = Base64.getEncoder().encodeToString(masterKey).toCharArray();
        this.iterations = iterations;
    }

    @Override
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext is required");
        }
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] nonce = randomBytes(NONCE_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] packed = new byte[salt.length + nonce.length + ciphertext.length];
            System.arraycopy(salt, 0, packed, 0, salt.length);
            System.arraycopy(nonce, 0, packed, salt.length, nonce.length);
            System.arraycopy(ciphertext, 0, packed, salt.length + nonce.length, ciphertext.length);
            return Base64.getEncoder().encodeToString(packed);
        } catch (GeneralSecurityException ex) {
            throw new EncryptionException("Failed to encrypt data", ex);
        }
    }

    @Override
    public String decrypt(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new EncryptionException("Encrypted data is empty");
        }
        byte[] packed;
        try {
            packed = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException ex) {
            throw new EncryptionException("Encrypted data is not valid base64", ex);
        }
        if (packed.length <= SALT_LENGTH + NONCE_LENGTH) {
            throw new EncryptionException("Encrypted data is too short");
        }
        byte[] salt = Arrays.copyOfRange(packed, 0, SALT_LENGTH);
        byte[] nonce = Arrays.copyOfRange(packed, SALT_LENGTH, SALT_LENGTH + NONCE_LENGTH);
        byte[] ciphertext = Arrays.copyOfRange(packed, SALT_LENGTH + NONCE_LENGTH, packed.length);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new EncryptionException("Failed to decrypt data", ex);
        }
    }

    private SecretKey deriveKey(byte[] salt) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(masterKey, salt, iterations, KEY_LENGTH_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256").generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }
}
