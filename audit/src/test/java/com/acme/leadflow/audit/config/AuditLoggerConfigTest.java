package com.acme.leadflow.audit.config;

import com.acme.leadflow.audit.OverflowPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditLoggerConfigTest {

    @Test
    void shouldApplyDefaultsForEmptyEnvironment() {
        AuditLoggerConfig config = AuditLoggerConfig.fromEnvironment(Map.of());

        assertEquals(Path.of("logs/audit.log"), config.logFile());
        assertEquals(Path.of("logs/audit.log").toAbsolutePath().getParent().resolve("security_events.log"),
            config.securityLogFile());
        assertEquals(Path.of("logs/audit.log").toAbsolutePath().getParent().resolve(".audit_secret"),
            config.secretFile());
        assertTrue(config.integrityEnabled());
        assertTrue(config.rotationEnabled());
        assertTrue(config.productionMode());
        assertFalse(config.anonymizePii());
        assertEquals(50L * 1024 * 1024, config.maxFileBytes());
        assertEquals(90, config.retentionDays());
        assertEquals(100, config.batchSize());
        assertEquals(5_000L, config.flushIntervalMs());
        assertEquals(0, config.queueCapacity());
        assertEquals(200, config.rateLimitBurst());
        assertEquals(1_000L, config.rateLimitWindowMs());
        assertEquals(10, config.alertErrorThreshold());
        assertEquals(300L, config.alertCooldownSec());
        assertTrue(config.webhookUrls().isEmpty());
        assertNull(config.secretKey());
        assertFalse(config.metricsHttpEnabled());
    }

    @Test
    void shouldReadOverridesAndClampOutOfRangeValues() {
        AuditLoggerConfig config = AuditLoggerConfig.fromEnvironment(Map.ofEntries(
            Map.entry("AUDIT_LOG_FILE", "/var/log/leadflow/audit.log"),
            Map.entry("AUDIT_SECURITY_LOG_FILE", "/var/log/leadflow/sec.log"),
            Map.entry("AUDIT_MAX_FILE_MB", "5"),
            Map.entry("AUDIT_RETENTION_DAYS", "0"),
            Map.entry("AUDIT_BATCH_SIZE", "not-a-number"),
            Map.entry("AUDIT_QUEUE_CAPACITY", "5000"),
            Map.entry("AUDIT_OVERFLOW_POLICY", "drop_oldest"),
            Map.entry("AUDIT_ANONYMIZE_PII", "yes"),
            Map.entry("AUDIT_PRODUCTION_MODE", "false"),
            Map.entry("AUDIT_INTEGRITY_ENABLED", "0"),
            Map.entry("AUDIT_WEBHOOK_URLS", " https://a.example.com/h , ,https://b.example.com/h "),
            Map.entry("AUDIT_ALERT_EMAIL_TO", "ops@acme.io,oncall@acme.io"),
            Map.entry("AUDIT_METRICS_HTTP_ENABLED", "true"),
            Map.entry("AUDIT_METRICS_HTTP_PORT", "70000")
        ));

        assertEquals(Path.of("/var/log/leadflow/audit.log"), config.logFile());
        assertEquals(Path.of("/var/log/leadflow/sec.log"), config.securityLogFile());
        assertEquals(Path.of("/var/log/leadflow/.audit_secret"), config.secretFile());
        assertEquals(5L * 1024 * 1024, config.maxFileBytes());
        assertEquals(1, config.retentionDays());
        assertEquals(100, config.batchSize());
        assertEquals(5_000, config.queueCapacity());
        assertEquals(OverflowPolicy.DROP_OLDEST, config.overflowPolicy());
        assertTrue(config.anonymizePii());
        assertFalse(config.productionMode());
        assertFalse(config.integrityEnabled());
        assertEquals(List.of("https://a.example.com/h", "https://b.example.com/h"), config.webhookUrls());
        assertEquals(List.of("ops@acme.io", "oncall@acme.io"), config.alertEmailTo());
        assertTrue(config.metricsHttpEnabled());
        assertEquals(65_535, config.metricsHttpPort());
    }

    @Test
    void shouldSplitCommaSeparatedLists() {
        assertEquals(List.of(), AuditLoggerConfig.splitList(null));
        assertEquals(List.of(), AuditLoggerConfig.splitList("  "));
        assertEquals(List.of("a", "b"), AuditLoggerConfig.splitList("a,,b,"));
    }
}
