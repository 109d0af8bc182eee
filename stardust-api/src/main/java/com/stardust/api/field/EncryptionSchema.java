package com.stardust.api.field;

import com.stardust.core.document.DocumentPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named table of dotted field paths and whether each one is encrypted.
 * Paths not listed are left untouched.
 */
public final class EncryptionSchema {

    private final String name;
    private final Map<DocumentPath, Boolean> fields;
    private final List<DocumentPath> encryptedPaths;

    private EncryptionSchema(String name, Map<DocumentPath, Boolean> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(fields);
        var marked = new ArrayList<DocumentPath>();
        fields.forEach((path, encrypt) -> {
            if (encrypt) {
                marked.add(path);
            }
        });
        this.encryptedPaths = List.copyOf(marked);
    }

    /**
     * Build a schema from {@code dotted.path -> encrypt} entries, keeping their order.
     */
    public static EncryptionSchema of(String name, Map<String, Boolean> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name is required");
        }
        var parsed = new LinkedHashMap<DocumentPath, Boolean>();
        fields.forEach((path, encrypt) -> parsed.put(DocumentPath.parse(path), Boolean.TRUE.equals(encrypt)));
        return new EncryptionSchema(name, parsed);
    }

    public String name() {
        return name;
    }

    public Map<DocumentPath, Boolean> fields() {
        return fields;
    }

    public List<DocumentPath> encryptedPaths() {
        return encryptedPaths;
    }

    public boolean encrypts(String dottedPath) {
        return Boolean.TRUE.equals(fields.get(DocumentPath.parse(dottedPath)));
    }
}
