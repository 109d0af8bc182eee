package com.stardust.core.repository;

import java.util.UUID;

/**
 * Raised when a lookup that must match finds nothing. Means "no data", never "corrupted data".
 */
public class RecordNotFoundException extends RuntimeException {

    private final String entityType;
    private final UUID id;

    public RecordNotFoundException(String entityType, UUID id) {
        super(entityType + " not found: " + id);
        this.entityType = entityType;
        this.id = id;
    }

    public String getEntityType() { return entityType; }
    public UUID getId() { return id; }
}
