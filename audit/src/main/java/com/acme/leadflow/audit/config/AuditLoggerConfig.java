package com.acme.leadflow.audit.config;

import com.acme.leadflow.audit.OverflowPolicy;
import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.util.AuditEnvKeys;
import com.acme.leadflow.audit.util.EnvVars;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable audit logger settings. Unset file paths default to siblings of the log file.
 */
public record AuditLoggerConfig(
    Path logFile,
    Path securityLogFile,
    Path secretFile,
    String secretKey,
    boolean integrityEnabled,
    boolean rotationEnabled,
    long maxFileBytes,
    int retentionDays,
    int batchSize,
    long flushIntervalMs,
    int queueCapacity,
    OverflowPolicy overflowPolicy,
    int rateLimitBurst,
    long rateLimitWindowMs,
    boolean anonymizePii,
    boolean productionMode,
    int alertErrorThreshold,
    long alertCooldownSec,
    List<String> webhookUrls,
    int dispatchThreads,
    int dispatchQueueCapacity,
    long healthLogIntervalSec,
    boolean metricsHttpEnabled,
    int metricsHttpPort,
    String smtpHost,
    int smtpPort,
    String smtpUsername,
    String smtpPassword,
    String alertEmailFrom,
    List<String> alertEmailTo,
    String slackWebhookUrl,
    String discordWebhookUrl
) {
    public AuditLoggerConfig {
        Objects.requireNonNull(logFile, "logFile");
        Path dir = logFile.toAbsolutePath().getParent();
        if (securityLogFile == null) {
            securityLogFile = dir == null ? Path.of(AuditDefaults.SECURITY_LOG_FILE_NAME) : dir.resolve(AuditDefaults.SECURITY_LOG_FILE_NAME);
        }
        if (secretFile == null) {
            secretFile = dir == null ? Path.of(AuditDefaults.SECRET_FILE_NAME) : dir.resolve(AuditDefaults.SECRET_FILE_NAME);
        }
        overflowPolicy = overflowPolicy == null ? OverflowPolicy.DROP_NEWEST : overflowPolicy;
        webhookUrls = webhookUrls == null ? List.of() : List.copyOf(webhookUrls);
        alertEmailTo = alertEmailTo == null ? List.of() : List.copyOf(alertEmailTo);
    }

    public static Builder builder(Path logFile) {
        return new Builder(logFile);
    }

    public static AuditLoggerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static AuditLoggerConfig fromEnvironment(Map<String, String> env) {
        Path logFile = Path.of(EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_LOG_FILE, AuditDefaults.DEFAULT_LOG_FILE));
        String securityLog = EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SECURITY_LOG_FILE, null);
        String secretFile = EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SECRET_FILE, null);
        long maxFileMb = EnvVars.getLongClamped(env, AuditEnvKeys.AUDIT_MAX_FILE_MB,
            AuditDefaults.DEFAULT_MAX_FILE_BYTES / (1024L * 1024L), 1L, 10_240L);

        return builder(logFile)
            .securityLogFile(securityLog == null ? null : Path.of(securityLog))
            .secretFile(secretFile == null ? null : Path.of(secretFile))
            .secretKey(EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SECRET_KEY, null))
            .integrityEnabled(EnvVars.getBoolean(env, AuditEnvKeys.AUDIT_INTEGRITY_ENABLED, true))
            .rotationEnabled(EnvVars.getBoolean(env, AuditEnvKeys.AUDIT_ROTATION_ENABLED, true))
            .maxFileBytes(maxFileMb * 1024L * 1024L)
            .retentionDays(EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_RETENTION_DAYS,
                AuditDefaults.DEFAULT_RETENTION_DAYS, 1, 3650))
            .batchSize(EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_BATCH_SIZE,
                AuditDefaults.DEFAULT_BATCH_SIZE, 1, 100_000))
            .flushIntervalMs(EnvVars.getLongClamped(env, AuditEnvKeys.AUDIT_FLUSH_INTERVAL_MS,
                AuditDefaults.DEFAULT_FLUSH_INTERVAL_MS, 10L, 600_000L))
            .queueCapacity(
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_QUEUE_CAPACITY, 0, 0, 10_000_000),
                OverflowPolicy.parse(env.get(AuditEnvKeys.AUDIT_OVERFLOW_POLICY), OverflowPolicy.DROP_NEWEST))
            .rateLimit(
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_RATE_LIMIT_BURST,
                    AuditDefaults.DEFAULT_RATE_LIMIT_BURST, 1, 1_000_000),
                EnvVars.getLongClamped(env, AuditEnvKeys.AUDIT_RATE_LIMIT_WINDOW_MS,
                    AuditDefaults.DEFAULT_RATE_LIMIT_WINDOW_MS, 1L, 3_600_000L))
            .anonymizePii(EnvVars.getBoolean(env, AuditEnvKeys.AUDIT_ANONYMIZE_PII, false))
            .productionMode(EnvVars.getBoolean(env, AuditEnvKeys.AUDIT_PRODUCTION_MODE, true))
            .alerting(
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_ALERT_ERROR_THRESHOLD,
                    AuditDefaults.DEFAULT_ALERT_ERROR_THRESHOLD, 1, 1_000_000),
                EnvVars.getLongClamped(env, AuditEnvKeys.AUDIT_ALERT_COOLDOWN_SEC,
                    AuditDefaults.DEFAULT_ALERT_COOLDOWN_SEC, 0L, 86_400L))
            .webhookUrls(splitList(env.get(AuditEnvKeys.AUDIT_WEBHOOK_URLS)))
            .dispatch(
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_DISPATCH_THREADS,
                    AuditDefaults.DEFAULT_DISPATCH_THREADS, 1, 256),
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_DISPATCH_QUEUE_CAPACITY,
                    AuditDefaults.DEFAULT_DISPATCH_QUEUE_CAPACITY, 1, 1_000_000))
            .healthLogIntervalSec(EnvVars.getLongClamped(env, AuditEnvKeys.AUDIT_HEALTH_LOG_INTERVAL_SEC,
                AuditDefaults.DEFAULT_HEALTH_LOG_INTERVAL_SEC, 0L, 86_400L))
            .metricsHttp(
                EnvVars.getBoolean(env, AuditEnvKeys.AUDIT_METRICS_HTTP_ENABLED, false),
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_METRICS_HTTP_PORT,
                    AuditDefaults.DEFAULT_METRICS_HTTP_PORT, 0, 65_535))
            .smtp(
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SMTP_HOST, null),
                EnvVars.getIntClamped(env, AuditEnvKeys.AUDIT_SMTP_PORT, AuditDefaults.DEFAULT_SMTP_PORT, 1, 65_535),
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SMTP_USERNAME, null),
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SMTP_PASSWORD, null))
            .alertEmail(
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_ALERT_EMAIL_FROM, null),
                splitList(env.get(AuditEnvKeys.AUDIT_ALERT_EMAIL_TO)))
            .chatWebhooks(
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_SLACK_WEBHOOK_URL, null),
                EnvVars.getOrDefault(env, AuditEnvKeys.AUDIT_DISCORD_WEBHOOK_URL, null))
            .build();
    }

    static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public static final class Builder {
        private final Path logFile;
        private Path securityLogFile;
        private Path secretFile;
        private String secretKey;
        private boolean integrityEnabled = true;
        private boolean rotationEnabled = true;
        private long maxFileBytes = AuditDefaults.DEFAULT_MAX_FILE_BYTES;
        private int retentionDays = AuditDefaults.DEFAULT_RETENTION_DAYS;
        private int batchSize = AuditDefaults.DEFAULT_BATCH_SIZE;
        private long flushIntervalMs = AuditDefaults.DEFAULT_FLUSH_INTERVAL_MS;
        private int queueCapacity;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_NEWEST;
        private int rateLimitBurst = AuditDefaults.DEFAULT_RATE_LIMIT_BURST;
        private long rateLimitWindowMs = AuditDefaults.DEFAULT_RATE_LIMIT_WINDOW_MS;
        private boolean anonymizePii;
        private boolean productionMode = true;
        private int alertErrorThreshold = AuditDefaults.DEFAULT_ALERT_ERROR_THRESHOLD;
        private long alertCooldownSec = AuditDefaults.DEFAULT_ALERT_COOLDOWN_SEC;
        private List<String> webhookUrls = List.of();
        private int dispatchThreads = AuditDefaults.DEFAULT_DISPATCH_THREADS;
        private int dispatchQueueCapacity = AuditDefaults.DEFAULT_DISPATCH_QUEUE_CAPACITY;
        private long healthLogIntervalSec = AuditDefaults.DEFAULT_HEALTH_LOG_INTERVAL_SEC;
        private boolean metricsHttpEnabled;
        private int metricsHttpPort = AuditDefaults.DEFAULT_METRICS_HTTP_PORT;
        private String smtpHost;
        private int smtpPort = AuditDefaults.DEFAULT_SMTP_PORT;
        private String smtpUsername;
        private String smtpPassword;
        private String alertEmailFrom;
        private List<String> alertEmailTo = List.of();
        private String slackWebhookUrl;
        private String discordWebhookUrl;

        private Builder(Path logFile) {
            this.logFile = Objects.requireNonNull(logFile, "logFile");
        }

        public Builder securityLogFile(Path securityLogFile) {
            this.securityLogFile = securityLogFile;
            return this;
        }

        public Builder secretFile(Path secretFile) {
            this.secretFile = secretFile;
            return this;
        }

        public Builder secretKey(String secretKey) {
            this.secretKey = secretKey;
            return this;
        }

        public Builder integrityEnabled(boolean integrityEnabled) {
            this.integrityEnabled = integrityEnabled;
            return this;
        }

        public Builder rotationEnabled(boolean rotationEnabled) {
            this.rotationEnabled = rotationEnabled;
            return this;
        }

        public Builder maxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        public Builder queueCapacity(int queueCapacity, OverflowPolicy overflowPolicy) {
            this.queueCapacity = queueCapacity;
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder rateLimit(int burst, long windowMs) {
            this.rateLimitBurst = burst;
            this.rateLimitWindowMs = windowMs;
            return this;
        }

        public Builder anonymizePii(boolean anonymizePii) {
            this.anonymizePii = anonymizePii;
            return this;
        }

        public Builder productionMode(boolean productionMode) {
            this.productionMode = productionMode;
            return this;
        }

        public Builder alerting(int errorThreshold, long cooldownSec) {
            this.alertErrorThreshold = errorThreshold;
            this.alertCooldownSec = cooldownSec;
            return this;
        }

        public Builder webhookUrls(List<String> webhookUrls) {
            this.webhookUrls = webhookUrls;
            return this;
        }

        public Builder dispatch(int threads, int queueCapacity) {
            this.dispatchThreads = threads;
            this.dispatchQueueCapacity = queueCapacity;
            return this;
        }

        public Builder healthLogIntervalSec(long healthLogIntervalSec) {
            this.healthLogIntervalSec = healthLogIntervalSec;
            return this;
        }

        public Builder metricsHttp(boolean enabled, int port) {
            this.metricsHttpEnabled = enabled;
            this.metricsHttpPort = port;
            return this;
        }

        public Builder smtp(String host, int port, String username, String password) {
            this.smtpHost = host;
            this.smtpPort = port;
            this.smtpUsername = username;
            this.smtpPassword = password;
            return this;
        }

        public Builder alertEmail(String from, List<String> to) {
            this.alertEmailFrom = from;
            this.alertEmailTo = to;
            return this;
        }

        public Builder chatWebhooks(String slackUrl, String discordUrl) {
            this.slackWebhookUrl = slackUrl;
            this.discordWebhookUrl = discordUrl;
            return this;
        }

        public AuditLoggerConfig build() {
            return new AuditLoggerConfig(
                logFile,
                securityLogFile,
                secretFile,
                secretKey,
                integrityEnabled,
                rotationEnabled,
                maxFileBytes,
                retentionDays,
                batchSize,
                flushIntervalMs,
                queueCapacity,
                overflowPolicy,
                rateLimitBurst,
                rateLimitWindowMs,
                anonymizePii,
                productionMode,
                alertErrorThreshold,
                alertCooldownSec,
                webhookUrls,
                dispatchThreads,
                dispatchQueueCapacity,
                healthLogIntervalSec,
                metricsHttpEnabled,
                metricsHttpPort,
                smtpHost,
                smtpPort,
                smtpUsername,
                smtpPassword,
                alertEmailFrom,
                alertEmailTo,
                slackWebhookUrl,
                discordWebhookUrl
            );
        }
    }
}
