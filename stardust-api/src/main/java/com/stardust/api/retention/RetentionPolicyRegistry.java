package com.stardust.api.retention;

import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionPolicy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable table of retention policies, one per data category.
 */
public final class RetentionPolicyRegistry {

    private final Map<DataCategory, RetentionPolicy> policies;

    public RetentionPolicyRegistry(Map<DataCategory, RetentionPolicy> policies) {
        var table = new EnumMap<DataCategory, RetentionPolicy>(DataCategory.class);
        table.putAll(policies);
        for (DataCategory category : DataCategory.values()) {
            if (!table.containsKey(category)) {
                throw new IllegalArgumentException("No retention policy for category " + category);
            }
        }
        this.policies = Collections.unmodifiableMap(table);
    }

    /**
     * Built-in policies: personal data 7 years, experiences 5, solutions 3, ratings 2,
     * media 5 and activity logs 1.
     */
    public static RetentionPolicyRegistry defaults() {
        return new RetentionPolicyRegistry(defaultPolicies());
    }

    public static Map<DataCategory, RetentionPolicy> defaultPolicies() {
        var gdpr = Set.of(ComplianceRegulation.GDPR);
        var gdprAndCcpa = Set.of(ComplianceRegulation.GDPR, ComplianceRegulation.CCPA);

        var table = new EnumMap<DataCategory, RetentionPolicy>(DataCategory.class);
        table.put(DataCategory.PERSONAL_INFO, new RetentionPolicy(2555, 1095, gdprAndCcpa, true, true, true));
        table.put(DataCategory.EXPERIENCE_DATA, new RetentionPolicy(1825, 730, gdpr, true, false, true));
        table.put(DataCategory.SOLUTION_DATA, new RetentionPolicy(1095, 365, gdpr, true, false, false));
        table.put(DataCategory.RATING_DATA, new RetentionPolicy(730, null, gdpr, true, false, false));
        table.put(DataCategory.MEDIA_FILES, new RetentionPolicy(1825, 730, gdprAndCcpa, true, true, true));
        table.put(DataCategory.ACTIVITY_LOGS, new RetentionPolicy(365, null, gdpr, true, false, false));
        return table;
    }

    public RetentionPolicy policyFor(DataCategory category) {
        return policies.get(category);
    }

    public Map<DataCategory, RetentionPolicy> all() {
        return policies;
    }
}
