package com.stardust.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of access recorded in the audit log.
 */
public enum AccessType {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    EXPORT,
    DECRYPT;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
