package com.stardust.api.field;

import com.stardust.core.domain.DataCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of encryption schemas, plus the binding of data categories to schemas.
 *
 * A category bound to a schema is stored at field level; every other category is stored as
 * one encrypted payload. Loaded once at start-up and shared read-only.
 */
public final class EncryptionSchemaRegistry {

    public static final String USER = "User";
    public static final String EXPERIENCE = "Experience";
    public static final String SOLUTION = "Solution";

    private final Map<String, EncryptionSchema> schemas;
    private final Map<DataCategory, String> categoryBindings;

    public EncryptionSchemaRegistry(Map<String, EncryptionSchema> schemas, Map<DataCategory, String> categoryBindings) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        var bindings = new EnumMap<DataCategory, String>(DataCategory.class);
        categoryBindings.forEach((category, schemaName) -> {
            if (!this.schemas.containsKey(schemaName)) {
                throw new SchemaNotFoundException(schemaName);
            }
            bindings.put(category, schemaName);
        });
        this.categoryBindings = Collections.unmodifiableMap(bindings);
    }

    /**
     * Built-in schemas for users, experiences and solutions.
     */
    public static EncryptionSchemaRegistry defaults() {
        return new EncryptionSchemaRegistry(defaultSchemas(), defaultBindings());
    }

    public static Map<String, EncryptionSchema> defaultSchemas() {
        var user = new LinkedHashMap<String, Boolean>();
        user.put("profile.firstName", true);
        user.put("profile.lastName", true);
        user.put("profile.phoneNumber", true);
        user.put("profile.dateOfBirth", true);
        user.put("profile.avatar", false);

        var experience = new LinkedHashMap<String, Boolean>();
        experience.put("title", true);
        experience.put("content.text", true);
        experience.put("content.mediaFiles.transcript", true);
        experience.put("content.mediaFiles.description", true);
        experience.put("content.mediaFiles.metadata", true);
        experience.put("emotionalState.description", true);
        experience.put("metadata.location", true);
        experience.put("tags", false);

        var solution = new LinkedHashMap<String, Boolean>();
        solution.put("content.title", true);
        solution.put("content.description", true);
        solution.put("content.recommendations", true);
        solution.put("content.actionSteps", true);
        solution.put("aiMetadata.prompt", true);
        solution.put("aiMetadata.parameters", true);
        solution.put("userFeedback.improvementSuggestions", true);
        solution.put("userFeedback.positiveAspects", true);
        solution.put("followUp.notes", true);

        var result = new LinkedHashMap<String, EncryptionSchema>();
        result.put(USER, EncryptionSchema.of(USER, user));
        result.put(EXPERIENCE, EncryptionSchema.of(EXPERIENCE, experience));
        result.put(SOLUTION, EncryptionSchema.of(SOLUTION, solution));
        return result;
    }

    public static Map<DataCategory, String> defaultBindings() {
        var bindings = new EnumMap<DataCategory, String>(DataCategory.class);
        bindings.put(DataCategory.PERSONAL_INFO, USER);
        bindings.put(DataCategory.EXPERIENCE_DATA, EXPERIENCE);
        bindings.put(DataCategory.SOLUTION_DATA, SOLUTION);
        return bindings;
    }

    /**
     * Lookup that tolerates unknown names.
     */
    public Optional<EncryptionSchema> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(schemas.get(name));
    }

    /**
     * Lookup for configuration-time wiring, where an unknown name is a mistake.
     */
    public EncryptionSchema require(String name) {
        return find(name).orElseThrow(() -> new SchemaNotFoundException(name));
    }

    /**
     * Schema name bound to the category, empty for whole-payload categories.
     */
    public Optional<String> schemaFor(DataCategory category) {
        return Optional.ofNullable(categoryBindings.get(category));
    }

    public Set<String> names() {
        return schemas.keySet();
    }

    public static class SchemaNotFoundException extends RuntimeException {
        public SchemaNotFoundException(String name) {
            super("Encryption schema not found: " + name);
        }
    }
}
