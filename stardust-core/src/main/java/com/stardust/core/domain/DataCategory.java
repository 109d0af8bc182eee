package com.stardust.core.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Functional grouping of user data. Selects the retention policy, the category key
 * and (optionally) the field encryption schema applied to a stored record.
 */
public enum DataCategory {
    PERSONAL_INFO("personal_info"),
    EXPERIENCE_DATA("experience_data"),
    SOLUTION_DATA("solution_data"),
    RATING_DATA("rating_data"),
    MEDIA_FILES("media_files"),
    ACTIVITY_LOGS("activity_logs");

    private final String value;

    DataCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DataCategory fromValue(String value) {
        for (DataCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown data category: " + value);
    }
}
