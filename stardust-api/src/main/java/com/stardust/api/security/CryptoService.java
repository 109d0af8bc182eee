package com.stardust.api.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Crypto Service - AES-256-GCM authenticated encryption with one static key.
 *
 * Ciphertext strings are URL-safe Base64 of {@code IV || ciphertext || tag}. A fresh random
 * 12-byte IV is used per call, so encrypting the same plaintext twice gives different output.
 * Instances are immutable and safe for unsynchronized concurrent use.
 */
public class CryptoService {

    public static final String ALGORITHM_NAME = "AES-256-GCM";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey key;
    private final String keyId;
    private final ObjectMapper objectMapper;

    public CryptoService(SecretKey key, String keyId, ObjectMapper objectMapper) {
        if (key == null) {
            throw new IllegalArgumentException("Key is required");
        }
        this.key = key;
        this.keyId = keyId;
        this.objectMapper = objectMapper;
    }

    /**
     * Derive the key from a passphrase and build a service around it.
     */
    public static CryptoService fromPassphrase(String passphrase, String keyId, ObjectMapper objectMapper) {
        return new CryptoService(KeyDerivation.deriveKey(passphrase), keyId, objectMapper);
    }

    /**
     * Encrypt raw bytes.
     */
    public String encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            byte[] combined = ByteBuffer.allocate(iv.length + ciphertext.length)
                .put(iv)
                .put(ciphertext)
                .array();
            return ENCODER.encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed", e);
        }
    }

    /**
     * Decrypt a ciphertext string produced by {@link #encrypt(byte[])}.
     *
     * @throws DecryptionException on tampering, wrong key or malformed input
     */
    public byte[] decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isEmpty()) {
            throw new DecryptionException("Ciphertext is empty", null);
        }
        byte[] combined;
        try {
            combined = DECODER.decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Ciphertext is not valid Base64", e);
        }
        if (combined.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new DecryptionException("Ciphertext is too short", null);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(combined);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] body = new byte[buffer.remaining()];
            buffer.get(body);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            return cipher.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    public String encryptString(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext must not be null");
        }
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public String decryptString(String ciphertext) {
        return new String(decrypt(ciphertext), StandardCharsets.UTF_8);
    }

    /**
     * Serialize a structured value to JSON, then encrypt it.
     */
    public String encryptObject(JsonNode value) {
        try {
            return encryptString(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Value could not be serialized", e);
        }
    }

    /**
     * Decrypt, then parse the plaintext as JSON. Plaintext that is not JSON comes back
     * as a text node, so values written by {@link #encryptString(String)} stay readable.
     */
    public JsonNode decryptObject(String ciphertext) {
        String plaintext = decryptString(ciphertext);
        try {
            JsonNode parsed = objectMapper.readTree(plaintext);
            return parsed.isMissingNode() ? TextNode.valueOf(plaintext) : parsed;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(plaintext);
        }
    }

    /**
     * Base64 IV of a ciphertext, for encryption metadata.
     */
    public static String ivOf(String ciphertext) {
        byte[] combined = DECODER.decode(ciphertext);
        return Base64.getEncoder().encodeToString(Arrays.copyOf(combined, GCM_IV_LENGTH));
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 text. Detects corruption; not a MAC.
     */
    public static String checksum(String data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Plain equality check. Not constant-time, never use it to compare secrets.
     */
    public static boolean verifyChecksum(String data, String expected) {
        return checksum(data).equals(expected);
    }

    public String keyId() {
        return keyId;
    }

    public static class EncryptionException extends RuntimeException {
        public EncryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class DecryptionException extends RuntimeException {
        public DecryptionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
