package com.stardust.api.config;

import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for encryption keys, schemas, retention policies and sweeps.
 * Entries given here override the built-in schemas and policies per entity type or category.
 */
@Validated
@ConfigurationProperties(prefix = "stardust")
public class StardustProperties {

    @Valid
    private Encryption encryption = new Encryption();

    @Valid
    private Retention retention = new Retention();

    public Encryption getEncryption() { return encryption; }
    public void setEncryption(Encryption encryption) { this.encryption = encryption; }
    public Retention getRetention() { return retention; }
    public void setRetention(Retention retention) { this.retention = retention; }

    public static class Encryption {

        @NotBlank
        private String passphrase;
        private Map<DataCategory, String> categoryPassphrases = new EnumMap<>(DataCategory.class);
        // Paths contain dots: bind them with bracket keys, e.g. [profile.firstName]
        private Map<String, Map<String, Boolean>> schemas = new LinkedHashMap<>();
        private Map<DataCategory, String> categorySchemas = new EnumMap<>(DataCategory.class);

        public String getPassphrase() { return passphrase; }
        public void setPassphrase(String passphrase) { this.passphrase = passphrase; }
        public Map<DataCategory, String> getCategoryPassphrases() { return categoryPassphrases; }
        public void setCategoryPassphrases(Map<DataCategory, String> map) { this.categoryPassphrases = map; }
        public Map<String, Map<String, Boolean>> getSchemas() { return schemas; }
        public void setSchemas(Map<String, Map<String, Boolean>> schemas) { this.schemas = schemas; }
        public Map<DataCategory, String> getCategorySchemas() { return categorySchemas; }
        public void setCategorySchemas(Map<DataCategory, String> map) { this.categorySchemas = map; }
    }

    public static class Retention {

        private Map<DataCategory, Policy> policies = new EnumMap<>(DataCategory.class);
        @Valid
        private Sweep sweep = new Sweep();

        public Map<DataCategory, Policy> getPolicies() { return policies; }
        public void setPolicies(Map<DataCategory, Policy> policies) { this.policies = policies; }
        public Sweep getSweep() { return sweep; }
        public void setSweep(Sweep sweep) { this.sweep = sweep; }
    }

    public static class Policy {

        private int retentionPeriodDays;
        private Integer archiveAfterDays;
        private List<ComplianceRegulation> regulations = List.of();
        private boolean autoDelete = true;
        private boolean requireConsent = false;
        private boolean backupBeforeDeletion = false;

        public RetentionPolicy toPolicy() {
            return new RetentionPolicy(retentionPeriodDays, archiveAfterDays,
                    regulations.isEmpty() ? EnumSet.noneOf(ComplianceRegulation.class) : EnumSet.copyOf(regulations),
                    autoDelete, requireConsent, backupBeforeDeletion);
        }

        public int getRetentionPeriodDays() { return retentionPeriodDays; }
        public void setRetentionPeriodDays(int days) { this.retentionPeriodDays = days; }
        public Integer getArchiveAfterDays() { return archiveAfterDays; }
        public void setArchiveAfterDays(Integer days) { this.archiveAfterDays = days; }
        public List<ComplianceRegulation> getRegulations() { return regulations; }
        public void setRegulations(List<ComplianceRegulation> regulations) { this.regulations = regulations; }
        public boolean isAutoDelete() { return autoDelete; }
        public void setAutoDelete(boolean autoDelete) { this.autoDelete = autoDelete; }
        public boolean isRequireConsent() { return requireConsent; }
        public void setRequireConsent(boolean requireConsent) { this.requireConsent = requireConsent; }
        public boolean isBackupBeforeDeletion() { return backupBeforeDeletion; }
        public void setBackupBeforeDeletion(boolean backup) { this.backupBeforeDeletion = backup; }
    }

    public static class Sweep {

        private boolean enabled = false;
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration interval = Duration.ofHours(24);
        private Duration jitter = Duration.ofMinutes(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public Duration getJitter() { return jitter; }
        public void setJitter(Duration jitter) { this.jitter = jitter; }
    }
}
