package com.stardust.core.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Stored Secure Record - an encrypted payload owned by exactly one user.
 *
 * Two storage modes exist. In WHOLE_PAYLOAD mode the serialized payload is encrypted as one
 * opaque string with the category key. In FIELD_LEVEL mode the payload is kept as a document
 * whose schema-marked fields are individually encrypted.
 *
 * Lifecycle: created on store, re-encrypted on update, access counters bumped on every read,
 * soft-deleted (active=false) or removed on delete, physically purged once past expiresAt.
 */
public class StoredSecureRecord {

    private UUID id;
    private UUID ownerId;
    private DataCategory category;
    private SensitivityLevel sensitivity;
    private StorageMode storageMode;
    private String encryptedData;
    private ObjectNode document;
    private String schemaName;
    private EncryptionMetadata encryptionMetadata;
    private Map<String, String> additionalMetadata;
    private String checksum;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Instant deletedAt;
    private boolean active = true;
    private boolean archived = false;
    private Instant archivedAt;
    private long accessCount = 0;
    private Instant lastAccessedAt;

    public enum StorageMode {
        WHOLE_PAYLOAD,  // Entire payload encrypted with the category key
        FIELD_LEVEL     // Schema-marked fields encrypted in place
    }

    protected StoredSecureRecord() {}

    /**
     * Creates a record whose whole serialized payload is one ciphertext.
     */
    public static StoredSecureRecord wholePayload(
            UUID ownerId,
            DataCategory category,
            SensitivityLevel sensitivity,
            String encryptedData,
            EncryptionMetadata encryptionMetadata,
            String checksum,
            Map<String, String> additionalMetadata,
            Instant createdAt,
            Instant expiresAt) {

        if (encryptedData == null || encryptedData.isEmpty()) {
            throw new IllegalArgumentException("Encrypted data is required");
        }
        var record = base(ownerId, category, sensitivity, encryptionMetadata, checksum,
                additionalMetadata, createdAt, expiresAt);
        record.storageMode = StorageMode.WHOLE_PAYLOAD;
        record.encryptedData = encryptedData;
        return record;
    }

    /**
     * Creates a record that keeps a field-encrypted document.
     */
    public static StoredSecureRecord fieldLevel(
            UUID ownerId,
            DataCategory category,
            SensitivityLevel sensitivity,
            ObjectNode document,
            String schemaName,
            EncryptionMetadata encryptionMetadata,
            String checksum,
            Map<String, String> additionalMetadata,
            Instant createdAt,
            Instant expiresAt) {

        if (document == null) {
            throw new IllegalArgumentException("Document is required");
        }
        if (schemaName == null || schemaName.isBlank()) {
            throw new IllegalArgumentException("Schema name is required for field-level records");
        }
        var record = base(ownerId, category, sensitivity, encryptionMetadata, checksum,
                additionalMetadata, createdAt, expiresAt);
        record.storageMode = StorageMode.FIELD_LEVEL;
        record.document = document.deepCopy();
        record.schemaName = schemaName;
        return record;
    }

    private static StoredSecureRecord base(
            UUID ownerId,
            DataCategory category,
            SensitivityLevel sensitivity,
            EncryptionMetadata encryptionMetadata,
            String checksum,
            Map<String, String> additionalMetadata,
            Instant createdAt,
            Instant expiresAt) {

        if (ownerId == null) {
            throw new IllegalArgumentException("Owner ID is required");
        }
        if (category == null) {
            throw new IllegalArgumentException("Data category is required");
        }
        if (sensitivity == null) {
            throw new IllegalArgumentException("Sensitivity level is required");
        }
        if (encryptionMetadata == null) {
            throw new IllegalArgumentException("Encryption metadata is required");
        }
        if (checksum == null || checksum.isBlank()) {
            throw new IllegalArgumentException("Checksum is required");
        }
        if (createdAt == null || expiresAt == null || !expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("Expiry must be after creation");
        }

        var record = new StoredSecureRecord();
        record.id = UUID.randomUUID();
        record.ownerId = ownerId;
        record.category = category;
        record.sensitivity = sensitivity;
        record.encryptionMetadata = encryptionMetadata;
        record.checksum = checksum;
        record.additionalMetadata = additionalMetadata == null ? Map.of() : Map.copyOf(additionalMetadata);
        record.createdAt = createdAt;
        record.updatedAt = createdAt;
        record.expiresAt = expiresAt;
        return record;
    }

    /**
     * Deep copy, so callers never share mutable state with the store.
     */
    public StoredSecureRecord copy() {
        var copy = new StoredSecureRecord();
        copy.id = id;
        copy.ownerId = ownerId;
        copy.category = category;
        copy.sensitivity = sensitivity;
        copy.storageMode = storageMode;
        copy.encryptedData = encryptedData;
        copy.document = document == null ? null : document.deepCopy();
        copy.schemaName = schemaName;
        copy.encryptionMetadata = encryptionMetadata;
        copy.additionalMetadata = additionalMetadata;
        copy.checksum = checksum;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.expiresAt = expiresAt;
        copy.deletedAt = deletedAt;
        copy.active = active;
        copy.archived = archived;
        copy.archivedAt = archivedAt;
        copy.accessCount = accessCount;
        copy.lastAccessedAt = lastAccessedAt;
        return copy;
    }

    /**
     * True when the record is active and not yet past its expiry.
     */
    public boolean isVisibleAt(Instant now) {
        return active && expiresAt.isAfter(now);
    }

    public boolean isOwnedBy(UUID candidate) {
        return ownerId.equals(candidate);
    }

    public void recordAccess(Instant at) {
        this.accessCount++;
        this.lastAccessedAt = at;
    }

    /**
     * Replaces the ciphertext of a whole-payload record.
     */
    public void replaceEncryptedData(String encryptedData, EncryptionMetadata metadata, String checksum, Instant at) {
        if (storageMode != StorageMode.WHOLE_PAYLOAD) {
            throw new IllegalStateException("Record " + id + " is not stored as a whole payload");
        }
        this.encryptedData = encryptedData;
        this.encryptionMetadata = metadata;
        this.checksum = checksum;
        this.updatedAt = at;
    }

    /**
     * Replaces the encrypted document of a field-level record.
     */
    public void replaceDocument(ObjectNode document, EncryptionMetadata metadata, String checksum, Instant at) {
        if (storageMode != StorageMode.FIELD_LEVEL) {
            throw new IllegalStateException("Record " + id + " is not stored at field level");
        }
        this.document = document.deepCopy();
        this.encryptionMetadata = metadata;
        this.checksum = checksum;
        this.updatedAt = at;
    }

    public void softDelete(Instant at) {
        if (!active) {
            throw new IllegalStateException("Record " + id + " is already deleted");
        }
        this.active = false;
        this.deletedAt = at;
        this.updatedAt = at;
    }

    /**
     * Flags the record as archived. The record stays readable.
     */
    public void markArchived(Instant at) {
        this.archived = true;
        this.archivedAt = at;
        this.updatedAt = at;
    }

    /**
     * Bytes held by the stored form of the payload.
     */
    public long storedSizeBytes() {
        String stored = storageMode == StorageMode.WHOLE_PAYLOAD ? encryptedData : document.toString();
        return stored.getBytes(StandardCharsets.UTF_8).length;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public DataCategory getCategory() { return category; }
    public SensitivityLevel getSensitivity() { return sensitivity; }
    public StorageMode getStorageMode() { return storageMode; }
    public String getEncryptedData() { return encryptedData; }
    public ObjectNode getDocument() { return document == null ? null : document.deepCopy(); }
    public String getSchemaName() { return schemaName; }
    public EncryptionMetadata getEncryptionMetadata() { return encryptionMetadata; }
    public Map<String, String> getAdditionalMetadata() { return additionalMetadata; }
    public String getChecksum() { return checksum; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getDeletedAt() { return deletedAt; }
    public boolean isActive() { return active; }
    public boolean isArchived() { return archived; }
    public Instant getArchivedAt() { return archivedAt; }
    public long getAccessCount() { return accessCount; }
    public Instant getLastAccessedAt() { return lastAccessedAt; }
}
