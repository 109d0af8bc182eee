package com.stardust.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulatory regimes a retention policy can be subject to.
 */
public enum ComplianceRegulation {
    GDPR,   // General Data Protection Regulation
    CCPA,   // California Consumer Privacy Act
    PIPEDA, // Personal Information Protection and Electronic Documents Act
    LGPD;   // Lei Geral de Protecao de Dados

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ComplianceRegulation fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
