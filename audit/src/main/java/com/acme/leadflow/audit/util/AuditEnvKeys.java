package com.acme.leadflow.audit.util;

/**
 * Canonical environment variable names read by the audit runtime.
 */
public final class AuditEnvKeys {
    public static final String AUDIT_LOG_FILE = "AUDIT_LOG_FILE";
    public static final String AUDIT_SECURITY_LOG_FILE = "AUDIT_SECURITY_LOG_FILE";
    public static final String AUDIT_SECRET_FILE = "AUDIT_SECRET_FILE";
    public static final String AUDIT_SECRET_KEY = "AUDIT_SECRET_KEY";

    public static final String AUDIT_INTEGRITY_ENABLED = "AUDIT_INTEGRITY_ENABLED";
    public static final String AUDIT_ROTATION_ENABLED = "AUDIT_ROTATION_ENABLED";
    public static final String AUDIT_MAX_FILE_MB = "AUDIT_MAX_FILE_MB";
    public static final String AUDIT_RETENTION_DAYS = "AUDIT_RETENTION_DAYS";

    public static final String AUDIT_BATCH_SIZE = "AUDIT_BATCH_SIZE";
    public static final String AUDIT_FLUSH_INTERVAL_MS = "AUDIT_FLUSH_INTERVAL_MS";
    public static final String AUDIT_QUEUE_CAPACITY = "AUDIT_QUEUE_CAPACITY";
    public static final String AUDIT_OVERFLOW_POLICY = "AUDIT_OVERFLOW_POLICY";

    public static final String AUDIT_RATE_LIMIT_BURST = "AUDIT_RATE_LIMIT_BURST";
    public static final String AUDIT_RATE_LIMIT_WINDOW_MS = "AUDIT_RATE_LIMIT_WINDOW_MS";

    public static final String AUDIT_ANONYMIZE_PII = "AUDIT_ANONYMIZE_PII";
    public static final String AUDIT_PRODUCTION_MODE = "AUDIT_PRODUCTION_MODE";

    public static final String AUDIT_ALERT_ERROR_THRESHOLD = "AUDIT_ALERT_ERROR_THRESHOLD";
    public static final String AUDIT_ALERT_COOLDOWN_SEC = "AUDIT_ALERT_COOLDOWN_SEC";
    public static final String AUDIT_WEBHOOK_URLS = "AUDIT_WEBHOOK_URLS";
    public static final String AUDIT_DISPATCH_THREADS = "AUDIT_DISPATCH_THREADS";
    public static final String AUDIT_DISPATCH_QUEUE_CAPACITY = "AUDIT_DISPATCH_QUEUE_CAPACITY";

    public static final String AUDIT_HEALTH_LOG_INTERVAL_SEC = "AUDIT_HEALTH_LOG_INTERVAL_SEC";
    public static final String AUDIT_METRICS_HTTP_ENABLED = "AUDIT_METRICS_HTTP_ENABLED";
    public static final String AUDIT_METRICS_HTTP_PORT = "AUDIT_METRICS_HTTP_PORT";

    public static final String AUDIT_SMTP_HOST = "AUDIT_SMTP_HOST";
    public static final String AUDIT_SMTP_PORT = "AUDIT_SMTP_PORT";
    public static final String AUDIT_SMTP_USERNAME = "AUDIT_SMTP_USERNAME";
    public static final String AUDIT_SMTP_PASSWORD = "AUDIT_SMTP_PASSWORD";
    public static final String AUDIT_ALERT_EMAIL_FROM = "AUDIT_ALERT_EMAIL_FROM";
    public static final String AUDIT_ALERT_EMAIL_TO = "AUDIT_ALERT_EMAIL_TO";
    public static final String AUDIT_SLACK_WEBHOOK_URL = "AUDIT_SLACK_WEBHOOK_URL";
    public static final String AUDIT_DISCORD_WEBHOOK_URL = "AUDIT_DISCORD_WEBHOOK_URL";

    private AuditEnvKeys() {
    }
}
