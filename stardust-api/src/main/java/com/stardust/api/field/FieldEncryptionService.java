package com.stardust.api.field;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.stardust.api.security.CryptoService;
import com.stardust.core.document.DocumentPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Field Encryption Service - applies an encryption schema to nested documents.
 *
 * Only schema-marked paths are touched. Each marked value is encrypted as its JSON text, so
 * decryption restores strings, numbers, booleans, lists and maps with their original type.
 * An encrypted document carries exactly one {@code _encryption} block naming the schema.
 *
 * Decryption is fail-open per field: a field that cannot be decrypted keeps its encrypted
 * value and the rest of the document is still returned.
 */
public class FieldEncryptionService {

    private static final Logger log = LoggerFactory.getLogger(FieldEncryptionService.class);

    public static final String METADATA_FIELD = "_encryption";
    public static final String SCHEMA_VERSION = "1.0";

    private final CryptoService crypto;
    private final EncryptionSchemaRegistry schemas;

    public FieldEncryptionService(CryptoService crypto, EncryptionSchemaRegistry schemas) {
        this.crypto = crypto;
        this.schemas = schemas;
    }

    /**
     * Encrypt every marked field of a copy of {@code document}.
     * Unknown schemas and documents that are already encrypted are returned unchanged.
     */
    public ObjectNode encryptDocument(ObjectNode document, String schemaName) {
        ObjectNode result = document.deepCopy();
        Optional<EncryptionSchema> schema = schemas.find(schemaName);
        if (schema.isEmpty()) {
            log.debug("No encryption schema named {}, document left as is", schemaName);
            return result;
        }
        if (isEncrypted(result)) {
            return result;
        }

        for (DocumentPath path : schema.get().encryptedPaths()) {
            path.read(result).ifPresent(value ->
                    path.write(result, TextNode.valueOf(crypto.encryptObject(value))));
        }

        ObjectNode marker = result.putObject(METADATA_FIELD);
        marker.put("encrypted", true);
        marker.put("schema", schemaName);
        marker.put("version", SCHEMA_VERSION);
        return result;
    }

    /**
     * Decrypt every marked field of a copy of {@code document} and drop the metadata block.
     * Documents without an encryption marker, or with an unknown schema, come back unchanged.
     */
    public ObjectNode decryptDocument(ObjectNode document, String schemaName) {
        ObjectNode result = document.deepCopy();
        Optional<EncryptionSchema> schema = schemas.find(schemaName);
        if (!isEncrypted(result) || schema.isEmpty()) {
            return result;
        }

        for (DocumentPath path : schema.get().encryptedPaths()) {
            Optional<JsonNode> stored = path.read(result);
            if (stored.isEmpty()) {
                continue;
            }
            if (!stored.get().isTextual()) {
                log.warn("Field {} of schema {} is not an encrypted value, left as is", path, schemaName);
                continue;
            }
            try {
                path.write(result, crypto.decryptObject(stored.get().asText()));
            } catch (CryptoService.DecryptionException e) {
                log.warn("Failed to decrypt field {} of schema {}: {}", path, schemaName, e.getMessage());
            }
        }

        result.remove(METADATA_FIELD);
        return result;
    }

    /**
     * Decrypt one marked field without touching the rest of the document.
     *
     * @return empty when the path is not marked, absent, or the document is not encrypted
     * @throws CryptoService.DecryptionException when the stored value cannot be decrypted
     */
    public Optional<JsonNode> decryptField(ObjectNode document, String schemaName, String dottedPath) {
        Optional<EncryptionSchema> schema = schemas.find(schemaName);
        if (!isEncrypted(document) || schema.isEmpty() || !schema.get().encrypts(dottedPath)) {
            return Optional.empty();
        }
        return DocumentPath.parse(dottedPath).read(document)
                .filter(JsonNode::isTextual)
                .map(value -> crypto.decryptObject(value.asText()));
    }

    /**
     * Copy of a plaintext document with every field the schema marks for encryption removed.
     */
    public ObjectNode stripMarkedFields(ObjectNode document, String schemaName) {
        ObjectNode result = document.deepCopy();
        schemas.find(schemaName).ifPresent(schema -> {
            for (DocumentPath path : schema.encryptedPaths()) {
                path.remove(result);
            }
        });
        result.remove(METADATA_FIELD);
        return result;
    }

    public boolean isEncrypted(JsonNode document) {
        JsonNode marker = document.get(METADATA_FIELD);
        return marker != null && marker.path("encrypted").asBoolean(false);
    }
}
