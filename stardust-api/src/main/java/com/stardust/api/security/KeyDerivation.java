package com.stardust.api.security;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.util.Arrays;

/**
 * Password-based key derivation (PBKDF2-HMAC-SHA256).
 *
 * The salt is the first 16 bytes of SHA-256(passphrase), so a passphrase always yields the
 * same key in every environment and no salt has to be stored next to the data. Moving to a
 * stored random salt would make existing ciphertexts unreadable and needs a migration plan.
 */
public final class KeyDerivation {

    public static final int ITERATIONS = 100_000;
    public static final int KEY_LENGTH_BITS = 256;
    public static final int SALT_LENGTH = 16;

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";

    private KeyDerivation() {}

    /**
     * Derive a 256-bit AES key from a passphrase. Deterministic.
     */
    public static SecretKey deriveKey(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Passphrase must not be empty");
        }
        char[] chars = passphrase.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(chars, saltFor(passphrase), ITERATIONS, KEY_LENGTH_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new CryptoService.EncryptionException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(chars, '\0');
        }
    }

    static byte[] saltFor(String passphrase) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(passphrase.getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, SALT_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
