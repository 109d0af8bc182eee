package com.stardust.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stardust.api.compliance.ComplianceGate;
import com.stardust.api.compliance.ComplianceHandler;
import com.stardust.api.compliance.PermissiveComplianceHandler;
import com.stardust.api.consent.ConsentService;
import com.stardust.api.field.EncryptionSchema;
import com.stardust.api.field.EncryptionSchemaRegistry;
import com.stardust.api.field.FieldEncryptionService;
import com.stardust.api.retention.RetentionPolicyRegistry;
import com.stardust.api.retention.RetentionService;
import com.stardust.api.retention.RetentionSweepScheduler;
import com.stardust.api.retention.SweepResult;
import com.stardust.api.retention.SweepTask;
import com.stardust.api.security.CategoryKeyRing;
import com.stardust.api.storage.PurgeResult;
import com.stardust.api.storage.SecureRecordService;
import com.stardust.core.domain.ComplianceRegulation;
import com.stardust.core.domain.DataCategory;
import com.stardust.core.domain.RetentionPolicy;
import com.stardust.core.repository.AccessLogRepository;
import com.stardust.core.repository.AnonymizedRecordRepository;
import com.stardust.core.repository.ArchiveRepository;
import com.stardust.core.repository.BackupRepository;
import com.stardust.core.repository.ConsentRecordRepository;
import com.stardust.core.repository.DataRequestRepository;
import com.stardust.core.repository.RetentionTrackingRepository;
import com.stardust.core.repository.SecureRecordRepository;
import com.stardust.core.repository.memory.InMemoryAccessLogRepository;
import com.stardust.core.repository.memory.InMemoryAnonymizedRecordRepository;
import com.stardust.core.repository.memory.InMemoryArchiveRepository;
import com.stardust.core.repository.memory.InMemoryBackupRepository;
import com.stardust.core.repository.memory.InMemoryConsentRecordRepository;
import com.stardust.core.repository.memory.InMemoryDataRequestRepository;
import com.stardust.core.repository.memory.InMemoryRetentionTrackingRepository;
import com.stardust.core.repository.memory.InMemorySecureRecordRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wiring of the secure data subsystem.
 *
 * Repositories default to in-memory adapters; declaring a bean of a repository type
 * replaces the adapter with a real document-store implementation.
 */
@Configuration
@EnableConfigurationProperties(StardustProperties.class)
public class SecureDataConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Repositories

    @Bean
    @ConditionalOnMissingBean
    public SecureRecordRepository secureRecordRepository() {
        return new InMemorySecureRecordRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessLogRepository accessLogRepository() {
        return new InMemoryAccessLogRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetentionTrackingRepository retentionTrackingRepository() {
        return new InMemoryRetentionTrackingRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsentRecordRepository consentRecordRepository() {
        return new InMemoryConsentRecordRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public DataRequestRepository dataRequestRepository() {
        return new InMemoryDataRequestRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ArchiveRepository archiveRepository() {
        return new InMemoryArchiveRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupRepository backupRepository() {
        return new InMemoryBackupRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnonymizedRecordRepository anonymizedRecordRepository() {
        return new InMemoryAnonymizedRecordRepository();
    }

    // Static tables, loaded once

    @Bean
    public CategoryKeyRing categoryKeyRing(StardustProperties properties, ObjectMapper objectMapper) {
        StardustProperties.Encryption encryption = properties.getEncryption();
        return new CategoryKeyRing(encryption.getPassphrase(), encryption.getCategoryPassphrases(), objectMapper);
    }

    @Bean
    public EncryptionSchemaRegistry encryptionSchemaRegistry(StardustProperties properties) {
        var schemas = EncryptionSchemaRegistry.defaultSchemas();
        properties.getEncryption().getSchemas()
                .forEach((name, fields) -> schemas.put(name, EncryptionSchema.of(name, fields)));
        var bindings = EncryptionSchemaRegistry.defaultBindings();
        bindings.putAll(properties.getEncryption().getCategorySchemas());
        return new EncryptionSchemaRegistry(schemas, bindings);
    }

    @Bean
    public RetentionPolicyRegistry retentionPolicyRegistry(StardustProperties properties) {
        Map<DataCategory, RetentionPolicy> policies = RetentionPolicyRegistry.defaultPolicies();
        properties.getRetention().getPolicies()
                .forEach((category, policy) -> policies.put(category, policy.toPolicy()));
        return new RetentionPolicyRegistry(policies);
    }

    @Bean
    public FieldEncryptionService fieldEncryptionService(CategoryKeyRing keyRing, EncryptionSchemaRegistry registry) {
        return new FieldEncryptionService(keyRing.root(), registry);
    }

    // Compliance

    @Bean
    public ComplianceHandler ccpaComplianceHandler() {
        return new PermissiveComplianceHandler(ComplianceRegulation.CCPA);
    }

    @Bean
    public ComplianceHandler pipedaComplianceHandler() {
        return new PermissiveComplianceHandler(ComplianceRegulation.PIPEDA);
    }

    @Bean
    public ComplianceHandler lgpdComplianceHandler() {
        return new PermissiveComplianceHandler(ComplianceRegulation.LGPD);
    }

    @Bean
    public ComplianceGate complianceGate(List<ComplianceHandler> handlers, ConsentService consentService, Clock clock) {
        return new ComplianceGate(handlers, consentService, clock);
    }

    // Background sweeps

    @Bean
    @ConditionalOnProperty(prefix = "stardust.retention.sweep", name = "enabled", havingValue = "true")
    public ThreadPoolTaskScheduler retentionTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("retention-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "stardust.retention.sweep", name = "enabled", havingValue = "true")
    public RetentionSweepScheduler retentionSweepScheduler(
            ThreadPoolTaskScheduler retentionTaskScheduler,
            RetentionService retentionService,
            SecureRecordService secureRecordService,
            StardustProperties properties,
            Clock clock) {
        StardustProperties.Sweep sweep = properties.getRetention().getSweep();
        List<SweepTask> tasks = List.of(
                SweepTask.named("expired-records", () -> asSweep(secureRecordService, clock)),
                SweepTask.named("archiving", retentionService::processScheduledArchiving),
                SweepTask.named("deletion", retentionService::processScheduledDeletions),
                SweepTask.named("backup-purge", retentionService::purgeExpiredBackups));
        return new RetentionSweepScheduler(retentionTaskScheduler, tasks, clock,
                sweep.getInitialDelay(), sweep.getInterval(), sweep.getJitter());
    }

    private static SweepResult asSweep(SecureRecordService secureRecordService, Clock clock) {
        Instant startedAt = clock.instant();
        PurgeResult purge = secureRecordService.purgeExpired();
        return new SweepResult("expired-records", purge.deleted() + purge.errors(), 0, purge.deleted(),
                0, 0, purge.errors(), List.of(), startedAt, clock.instant());
    }
}
