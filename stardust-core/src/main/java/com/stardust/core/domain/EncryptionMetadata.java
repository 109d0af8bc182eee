package com.stardust.core.domain;

import java.time.Instant;

/**
 * Describes how a stored payload was encrypted.
 *
 * @param algorithm cipher transformation, e.g. AES-256-GCM
 * @param keyId identifier of the category key, e.g. {@code personal_info_key}
 * @param iv Base64 initialization vector of the current ciphertext
 * @param createdAt when the payload was (re-)encrypted
 * @param retentionPeriodDays retention window resolved from the category policy
 */
public record EncryptionMetadata(
        String algorithm,
        String keyId,
        String iv,
        Instant createdAt,
        int retentionPeriodDays
) {
    public EncryptionMetadata {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("Algorithm is required");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key id is required");
        }
        if (retentionPeriodDays <= 0) {
            throw new IllegalArgumentException("Retention period must be positive");
        }
    }
}
