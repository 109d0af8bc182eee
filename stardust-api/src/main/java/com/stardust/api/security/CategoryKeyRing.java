package com.stardust.api.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stardust.core.domain.DataCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static per-category key table.
 *
 * Key hierarchy: root passphrase -> one key per data category. A category key is derived from
 * {@code rootPassphrase + "|" + category} unless a dedicated passphrase is configured for it.
 * All keys are derived once at construction and the table is read-only afterwards.
 */
public class CategoryKeyRing {

    private static final Logger log = LoggerFactory.getLogger(CategoryKeyRing.class);

    public static final String ROOT_KEY_ID = "root_key";

    private final CryptoService rootCrypto;
    private final Map<DataCategory, CryptoService> categoryCrypto;

    public CategoryKeyRing(String rootPassphrase,
                           Map<DataCategory, String> categoryPassphrases,
                           ObjectMapper objectMapper) {
        if (rootPassphrase == null || rootPassphrase.isBlank()) {
            throw new IllegalArgumentException("Root passphrase is required");
        }
        Map<DataCategory, String> overrides = categoryPassphrases == null ? Map.of() : categoryPassphrases;

        this.rootCrypto = CryptoService.fromPassphrase(rootPassphrase, ROOT_KEY_ID, objectMapper);
        var keys = new EnumMap<DataCategory, CryptoService>(DataCategory.class);
        for (DataCategory category : DataCategory.values()) {
            String passphrase = overrides.getOrDefault(category, rootPassphrase + "|" + category.value());
            keys.put(category, CryptoService.fromPassphrase(passphrase, keyIdOf(category), objectMapper));
        }
        this.categoryCrypto = Collections.unmodifiableMap(keys);
        log.info("Derived {} category keys ({} with dedicated passphrases)", keys.size(), overrides.size());
    }

    public static String keyIdOf(DataCategory category) {
        return category.value() + "_key";
    }

    /**
     * Crypto bound to the root key, used for field-level encryption.
     */
    public CryptoService root() {
        return rootCrypto;
    }

    public CryptoService forCategory(DataCategory category) {
        return categoryCrypto.get(category);
    }
}
