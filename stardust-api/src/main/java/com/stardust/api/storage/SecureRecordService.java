package com.stardust.api.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stardust.api.audit.AccessAuditService;
import com.stardust.api.audit.AuditAppendResult;
import com.stardust.api.field.EncryptionSchemaRegistry;
import com.stardust.api.field.FieldEncryptionService;
import com.stardust.api.retention.RetentionPolicyRegistry;
import com.stardust.api.security.CategoryKeyRing;
import com.stardust.api.security.CryptoService;
import com.stardust.core.domain.AccessType;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.EncryptionMetadata;
import com.stardust.core.domain.RequestContext;
import com.stardust.core.domain.SensitivityLevel;
import com.stardust.core.domain.StoredSecureRecord;
import com.stardust.core.domain.StoredSecureRecord.StorageMode;
import com.stardust.core.repository.RecordStoreException;
import com.stardust.core.repository.SecureRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Secure Record Service - encrypted, audited CRUD over the record store.
 *
 * Every write is encrypted (at field level for schema-bound categories, as one payload
 * otherwise) and checksummed over the canonical plaintext JSON. Every read is decrypted and
 * verified; a checksum mismatch or an unreadable ciphertext fails closed with
 * {@link IntegrityException}. Each public operation writes exactly one access log entry.
 */
@Service
public class SecureRecordService {

    private static final Logger log = LoggerFactory.getLogger(SecureRecordService.class);

    static final String NOT_FOUND = "Record not found";

    private final SecureRecordRepository recordRepository;
    private final CategoryKeyRing keyRing;
    private final FieldEncryptionService fieldEncryption;
    private final EncryptionSchemaRegistry schemaRegistry;
    private final RetentionPolicyRegistry policyRegistry;
    private final AccessAuditService auditService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SecureRecordService(
            SecureRecordRepository recordRepository,
            CategoryKeyRing keyRing,
            FieldEncryptionService fieldEncryption,
            EncryptionSchemaRegistry schemaRegistry,
            RetentionPolicyRegistry policyRegistry,
            AccessAuditService auditService,
            ObjectMapper objectMapper,
            Clock clock) {
        this.recordRepository = recordRepository;
        this.keyRing = keyRing;
        this.fieldEncryption = fieldEncryption;
        this.schemaRegistry = schemaRegistry;
        this.policyRegistry = policyRegistry;
        this.auditService = auditService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public UUID store(UUID ownerId, JsonNode payload, DataCategory category, SensitivityLevel sensitivity) {
        return store(ownerId, payload, category, sensitivity, Map.of(), RequestContext.NONE);
    }

    /**
     * Encrypts and persists a payload.
     *
     * @param metadata free-form metadata kept in clear next to the record, may be null
     * @return the new record id
     */
    public UUID store(
            UUID ownerId,
            JsonNode payload,
            DataCategory category,
            SensitivityLevel sensitivity,
            Map<String, String> metadata,
            RequestContext request) {

        if (ownerId == null) {
            throw new IllegalArgumentException("Owner ID cannot be null");
        }
        if (payload == null || payload.isMissingNode()) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (category == null || sensitivity == null) {
            throw new IllegalArgumentException("Category and sensitivity are required");
        }

        Instant now = clock.instant();
        int retentionDays = policyRegistry.policyFor(category).retentionPeriodDays();
        Instant expiresAt = now.plus(Duration.ofDays(retentionDays));

        StoredSecureRecord record;
        try {
            String canonical = canonicalJson(payload);
            String checksum = CryptoService.checksum(canonical);
            Optional<String> schema = schemaRegistry.schemaFor(category);

            if (schema.isPresent() && payload.isObject()) {
                rejectReservedMembers(payload);
                ObjectNode encrypted = fieldEncryption.encryptDocument((ObjectNode) payload, schema.get());
                record = StoredSecureRecord.fieldLevel(ownerId, category, sensitivity, encrypted, schema.get(),
                        fieldMetadata(now, retentionDays), checksum, metadata, now, expiresAt);
            } else {
                CryptoService crypto = keyRing.forCategory(category);
                String ciphertext = crypto.encryptString(canonical);
                record = StoredSecureRecord.wholePayload(ownerId, category, sensitivity, ciphertext,
                        payloadMetadata(crypto, ciphertext, now, retentionDays), checksum, metadata, now, expiresAt);
            }
            record = recordRepository.save(record);
        } catch (CryptoService.EncryptionException | RecordStoreException | IllegalArgumentException e) {
            discard(auditService.recordFailure(ownerId, null, category, AccessType.CREATE,
                    e.getMessage(), request, Map.of()));
            throw e;
        }

        discard(auditService.recordSuccess(ownerId, record.getId(), category, AccessType.CREATE, request,
                Map.of("sensitivity", sensitivity.value(), "storage_mode", record.getStorageMode().name())));
        log.info("Stored record {} for owner {} in category {} ({})",
                record.getId(), ownerId, category, record.getStorageMode());
        return record.getId();
    }

    public Optional<JsonNode> retrieve(UUID ownerId, UUID recordId) {
        return retrieve(ownerId, recordId, RequestContext.NONE);
    }

    /**
     * Decrypts and verifies a record of the owner.
     *
     * @return empty when no active, unexpired record of the owner has this id
     * @throws IntegrityException when the record cannot be decrypted or its checksum disagrees
     */
    public Optional<JsonNode> retrieve(UUID ownerId, UUID recordId, RequestContext request) {
        Instant now = clock.instant();
        Optional<StoredSecureRecord> found = recordRepository.findVisible(recordId, ownerId, now);
        if (found.isEmpty()) {
            discard(auditService.recordFailure(ownerId, recordId, null, AccessType.READ,
                    NOT_FOUND, request, Map.of()));
            return Optional.empty();
        }

        StoredSecureRecord record = found.get();
        JsonNode payload = decodeVerified(record, ownerId, AccessType.READ, request);

        Optional<StoredSecureRecord> touched = recordRepository.updateOne(recordId,
                visibleTo(ownerId, now), r -> r.recordAccess(now));
        if (touched.isEmpty()) {
            // Deleted or expired between read and access stamp
            discard(auditService.recordFailure(ownerId, recordId, record.getCategory(), AccessType.READ,
                    NOT_FOUND, request, Map.of()));
            return Optional.empty();
        }

        discard(auditService.recordSuccess(ownerId, recordId, record.getCategory(), AccessType.READ,
                request, Map.of()));
        return Optional.of(payload);
    }

    public boolean update(UUID ownerId, UUID recordId, JsonNode newPayload) {
        return update(ownerId, recordId, newPayload, RequestContext.NONE);
    }

    /**
     * Re-encrypts an active record of the owner with a new payload.
     *
     * @return false when no active, unexpired record of the owner has this id
     */
    public boolean update(UUID ownerId, UUID recordId, JsonNode newPayload, RequestContext request) {
        if (newPayload == null || newPayload.isMissingNode()) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        Instant now = clock.instant();
        Optional<StoredSecureRecord> found = recordRepository.findVisible(recordId, ownerId, now);
        if (found.isEmpty()) {
            discard(auditService.recordFailure(ownerId, recordId, null, AccessType.UPDATE,
                    NOT_FOUND, request, Map.of()));
            return false;
        }
        StoredSecureRecord current = found.get();
        DataCategory category = current.getCategory();

        Optional<StoredSecureRecord> updated;
        try {
            String canonical = canonicalJson(newPayload);
            String checksum = CryptoService.checksum(canonical);
            int retentionDays = current.getEncryptionMetadata().retentionPeriodDays();

            if (current.getStorageMode() == StorageMode.FIELD_LEVEL) {
                if (!newPayload.isObject()) {
                    throw new IllegalArgumentException("Field-level record " + recordId + " needs an object payload");
                }
                rejectReservedMembers(newPayload);
                ObjectNode encrypted = fieldEncryption.encryptDocument((ObjectNode) newPayload, current.getSchemaName());
                EncryptionMetadata metadata = fieldMetadata(now, retentionDays);
                updated = recordRepository.updateOne(recordId, visibleTo(ownerId, now),
                        r -> r.replaceDocument(encrypted, metadata, checksum, now));
            } else {
                CryptoService crypto = keyRing.forCategory(category);
                String ciphertext = crypto.encryptString(canonical);
                EncryptionMetadata metadata = payloadMetadata(crypto, ciphertext, now, retentionDays);
                updated = recordRepository.updateOne(recordId, visibleTo(ownerId, now),
                        r -> r.replaceEncryptedData(ciphertext, metadata, checksum, now));
            }
        } catch (CryptoService.EncryptionException | RecordStoreException | IllegalArgumentException e) {
            discard(auditService.recordFailure(ownerId, recordId, category, AccessType.UPDATE,
                    e.getMessage(), request, Map.of()));
            throw e;
        }

        if (updated.isEmpty()) {
            discard(auditService.recordFailure(ownerId, recordId, category, AccessType.UPDATE,
                    NOT_FOUND, request, Map.of()));
            return false;
        }
        discard(auditService.recordSuccess(ownerId, recordId, category, AccessType.UPDATE, request, Map.of()));
        log.info("Updated record {} for owner {}", recordId, ownerId);
        return true;
    }

    // The encryption marker would be taken for our own and skip or clobber encryption
    private static void rejectReservedMembers(JsonNode payload) {
        if (payload.has(FieldEncryptionService.METADATA_FIELD)) {
            throw new IllegalArgumentException(
                    "Payload must not carry the reserved member " + FieldEncryptionService.METADATA_FIELD);
        }
    }

    public boolean delete(UUID ownerId, UUID recordId, boolean hardDelete) {
        return delete(ownerId, recordId, hardDelete, RequestContext.NONE);
    }

    /**
     * Soft-deletes (deactivates) or physically removes an active record of the owner.
     *
     * @return false when no active record of the owner has this id
     */
    public boolean delete(UUID ownerId, UUID recordId, boolean hardDelete, RequestContext request) {
        Instant now = clock.instant();
        Map<String, String> context = Map.of("hard_delete", String.valueOf(hardDelete));
        Predicate<StoredSecureRecord> ownedActive = r -> r.isOwnedBy(ownerId) && r.isActive();

        DataCategory category = recordRepository.findById(recordId)
                .filter(ownedActive)
                .map(StoredSecureRecord::getCategory)
                .orElse(null);

        boolean deleted;
        try {
            deleted = category != null && (hardDelete
                    ? recordRepository.deleteOne(recordId, ownedActive)
                    : recordRepository.updateOne(recordId, ownedActive, r -> r.softDelete(now)).isPresent());
        } catch (RecordStoreException e) {
            discard(auditService.recordFailure(ownerId, recordId, category, AccessType.DELETE,
                    e.getMessage(), request, context));
            throw e;
        }

        if (!deleted) {
            discard(auditService.recordFailure(ownerId, recordId, category, AccessType.DELETE,
                    NOT_FOUND, request, context));
            return false;
        }
        discard(auditService.recordSuccess(ownerId, recordId, category, AccessType.DELETE, request, context));
        log.info("{} record {} for owner {}", hardDelete ? "Removed" : "Deactivated", recordId, ownerId);
        return true;
    }

    /**
     * Aggregate summary of the owner's active records per category.
     */
    public Map<DataCategory, InventoryEntry> inventory(UUID ownerId) {
        Instant now = clock.instant();
        var groups = new EnumMap<DataCategory, List<StoredSecureRecord>>(DataCategory.class);
        for (StoredSecureRecord record : recordRepository.findByOwner(ownerId)) {
            if (record.isVisibleAt(now)) {
                groups.computeIfAbsent(record.getCategory(), c -> new ArrayList<>()).add(record);
            }
        }

        var inventory = new EnumMap<DataCategory, InventoryEntry>(DataCategory.class);
        groups.forEach((category, records) -> {
            long totalBytes = 0;
            long accessCount = 0;
            Instant oldest = null;
            Instant newest = null;
            var levels = EnumSet.noneOf(SensitivityLevel.class);
            for (StoredSecureRecord record : records) {
                totalBytes += record.storedSizeBytes();
                accessCount += record.getAccessCount();
                levels.add(record.getSensitivity());
                if (oldest == null || record.getCreatedAt().isBefore(oldest)) {
                    oldest = record.getCreatedAt();
                }
                if (newest == null || record.getCreatedAt().isAfter(newest)) {
                    newest = record.getCreatedAt();
                }
            }
            inventory.put(category, new InventoryEntry(records.size(), totalBytes, oldest, newest,
                    Set.copyOf(levels), accessCount));
        });

        discard(auditService.recordSuccess(ownerId, null, null, AccessType.READ, RequestContext.NONE,
                Map.of("operation", "inventory")));
        return inventory;
    }

    /**
     * Removes every active record whose expiry has passed. Failures are counted, not thrown.
     */
    public PurgeResult purgeExpired() {
        Instant now = clock.instant();
        int deleted = 0;
        int errors = 0;
        Map<String, String> context = Map.of("reason", "expired");

        for (StoredSecureRecord record : recordRepository.findExpired(now)) {
            try {
                boolean removed = recordRepository.deleteOne(record.getId(),
                        r -> r.isActive() && r.getExpiresAt().isBefore(now));
                if (removed) {
                    deleted++;
                    discard(auditService.recordSuccess(record.getOwnerId(), record.getId(), record.getCategory(),
                            AccessType.DELETE, RequestContext.NONE, context));
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Failed to purge expired record {}: {}", record.getId(), e.getMessage());
                discard(auditService.recordFailure(record.getOwnerId(), record.getId(), record.getCategory(),
                        AccessType.DELETE, e.getMessage(), RequestContext.NONE, context));
            }
        }

        if (deleted > 0 || errors > 0) {
            log.info("Purged {} expired records ({} errors)", deleted, errors);
        }
        return new PurgeResult(deleted, errors);
    }

    /**
     * Decrypts a single marked field of a field-level record, leaving the rest encrypted.
     *
     * @return empty when the record is not visible to the owner or the path holds no encrypted value
     */
    public Optional<JsonNode> revealField(UUID ownerId, UUID recordId, String dottedPath, RequestContext request) {
        Instant now = clock.instant();
        Map<String, String> context = Map.of("field", dottedPath);
        Optional<StoredSecureRecord> found = recordRepository.findVisible(recordId, ownerId, now)
                .filter(r -> r.getStorageMode() == StorageMode.FIELD_LEVEL);
        if (found.isEmpty()) {
            discard(auditService.recordFailure(ownerId, recordId, null, AccessType.DECRYPT,
                    NOT_FOUND, request, context));
            return Optional.empty();
        }

        StoredSecureRecord record = found.get();
        Optional<JsonNode> value;
        try {
            value = fieldEncryption.decryptField(record.getDocument(), record.getSchemaName(), dottedPath);
        } catch (CryptoService.DecryptionException e) {
            discard(auditService.recordFailure(ownerId, recordId, record.getCategory(), AccessType.DECRYPT,
                    e.getMessage(), request, context));
            throw e;
        }

        if (value.isEmpty()) {
            discard(auditService.recordFailure(ownerId, recordId, record.getCategory(), AccessType.DECRYPT,
                    "No encrypted value at " + dottedPath, request, context));
            return Optional.empty();
        }
        discard(auditService.recordSuccess(ownerId, recordId, record.getCategory(), AccessType.DECRYPT,
                request, context));
        return value;
    }

    /**
     * Decrypted copies of every visible record of the owner, one export entry logged per record.
     * Records that fail verification are logged and left out.
     */
    public List<ExportedRecord> exportAll(UUID ownerId, RequestContext request) {
        Instant now = clock.instant();
        var exported = new ArrayList<ExportedRecord>();
        for (StoredSecureRecord record : recordRepository.findByOwner(ownerId)) {
            if (!record.isVisibleAt(now)) {
                continue;
            }
            try {
                JsonNode payload = decodeVerified(record, ownerId, AccessType.EXPORT, request);
                exported.add(new ExportedRecord(record.getId(), record.getCategory(), record.getSensitivity(),
                        record.getCreatedAt(), record.getUpdatedAt(), payload));
                discard(auditService.recordSuccess(ownerId, record.getId(), record.getCategory(),
                        AccessType.EXPORT, request, Map.of()));
            } catch (IntegrityException e) {
                log.warn("Record {} left out of export for owner {}: {}", record.getId(), ownerId, e.getMessage());
            }
        }
        return exported;
    }

    /**
     * Physically removes every record of the owner, active or not.
     *
     * @return number of removed records
     */
    public int eraseAll(UUID ownerId, String reason, RequestContext request) {
        Map<String, String> context = Map.of("reason", reason);
        int removed = 0;
        for (StoredSecureRecord record : recordRepository.findByOwner(ownerId)) {
            if (recordRepository.deleteOne(record.getId(), r -> r.isOwnedBy(ownerId))) {
                removed++;
                discard(auditService.recordSuccess(ownerId, record.getId(), record.getCategory(),
                        AccessType.DELETE, request, context));
            }
        }
        log.info("Erased {} records of owner {} ({})", removed, ownerId, reason);
        return removed;
    }

    /**
     * Stored (still encrypted) form of the owner's visible records. No plaintext leaves this call.
     */
    public List<StoredSecureRecord> storedRecordsOf(UUID ownerId) {
        Instant now = clock.instant();
        return recordRepository.findByOwner(ownerId).stream()
                .filter(r -> r.isVisibleAt(now))
                .toList();
    }

    /**
     * Stored form of any record, for background jobs acting on behalf of the system.
     */
    public Optional<StoredSecureRecord> findStored(UUID recordId) {
        return recordRepository.findById(recordId);
    }

    /**
     * Flags an active record as archived. The record stays readable.
     */
    public Optional<StoredSecureRecord> markArchived(UUID recordId, String reason) {
        Instant now = clock.instant();
        Optional<StoredSecureRecord> archived = recordRepository.updateOne(recordId,
                StoredSecureRecord::isActive, r -> r.markArchived(now));
        archived.ifPresent(r -> discard(auditService.recordSuccess(r.getOwnerId(), recordId, r.getCategory(),
                AccessType.UPDATE, RequestContext.NONE, Map.of("reason", reason, "archived", "true"))));
        return archived;
    }

    /**
     * Physically removes a record on behalf of the retention engine.
     */
    public boolean deleteForRetention(UUID ownerId, UUID recordId, DataCategory category, String reason) {
        Map<String, String> context = Map.of("reason", reason);
        boolean removed = recordRepository.deleteOne(recordId, r -> r.isOwnedBy(ownerId));
        if (removed) {
            discard(auditService.recordSuccess(ownerId, recordId, category, AccessType.DELETE,
                    RequestContext.NONE, context));
        } else {
            discard(auditService.recordFailure(ownerId, recordId, category, AccessType.DELETE,
                    NOT_FOUND, RequestContext.NONE, context));
        }
        return removed;
    }

    /**
     * Decrypts a stored record and checks its checksum, auditing and raising any failure.
     */
    private JsonNode decodeVerified(StoredSecureRecord record, UUID ownerId, AccessType accessType,
                                    RequestContext request) {
        JsonNode payload;
        try {
            payload = decode(record);
        } catch (CryptoService.DecryptionException e) {
            discard(auditService.recordFailure(ownerId, record.getId(), record.getCategory(), accessType,
                    "Decryption failed: " + e.getMessage(), request, Map.of()));
            log.error("Record {} could not be decrypted", record.getId());
            throw new IntegrityException("Record " + record.getId() + " could not be decrypted", e);
        }

        if (!CryptoService.verifyChecksum(canonicalJson(payload), record.getChecksum())) {
            discard(auditService.recordFailure(ownerId, record.getId(), record.getCategory(), accessType,
                    "Checksum mismatch", request, Map.of()));
            log.error("Checksum mismatch on record {} in category {}", record.getId(), record.getCategory());
            throw new IntegrityException("Checksum mismatch on record " + record.getId(), null);
        }
        return payload;
    }

    private JsonNode decode(StoredSecureRecord record) {
        if (record.getStorageMode() == StorageMode.FIELD_LEVEL) {
            return fieldEncryption.decryptDocument(record.getDocument(), record.getSchemaName());
        }
        String plaintext = keyRing.forCategory(record.getCategory()).decryptString(record.getEncryptedData());
        try {
            return objectMapper.readTree(plaintext);
        } catch (JsonProcessingException e) {
            throw new CryptoService.DecryptionException("Decrypted payload is not valid JSON", e);
        }
    }

    private String canonicalJson(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CryptoService.EncryptionException("Payload could not be serialized", e);
        }
    }

    private static Predicate<StoredSecureRecord> visibleTo(UUID ownerId, Instant now) {
        return r -> r.isOwnedBy(ownerId) && r.isVisibleAt(now);
    }

    private EncryptionMetadata fieldMetadata(Instant now, int retentionDays) {
        return new EncryptionMetadata(CryptoService.ALGORITHM_NAME, keyRing.root().keyId(), null, now, retentionDays);
    }

    private static EncryptionMetadata payloadMetadata(CryptoService crypto, String ciphertext,
                                                      Instant now, int retentionDays) {
        return new EncryptionMetadata(CryptoService.ALGORITHM_NAME, crypto.keyId(),
                CryptoService.ivOf(ciphertext), now, retentionDays);
    }

    private static void discard(AuditAppendResult result) {
        AccessAuditService.discardFailure(result, log);
    }

    /**
     * Stored data does not match what was written: unreadable ciphertext or checksum mismatch.
     */
    public static class IntegrityException extends RuntimeException {
        public IntegrityException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
