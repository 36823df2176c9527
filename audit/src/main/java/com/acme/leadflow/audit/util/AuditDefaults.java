package com.acme.leadflow.audit.util;

/**
 * Default sizes, limits and intervals for the audit runtime.
 * <p>
 * Used whenever the matching environment variable is unset or malformed.
 */
public final class AuditDefaults {

    // ---- Files ----
    public static final String DEFAULT_LOG_FILE = "logs/audit.log";
    public static final String SECURITY_LOG_FILE_NAME = "security_events.log";
    public static final String SECRET_FILE_NAME = ".audit_secret";

    // ---- Event limits ----
    public static final int MAX_DETAILS_BYTES = 50 * 1024;
    public static final int MAX_EVENT_TYPE_LENGTH = 50;
    public static final int MAX_ACTOR_LENGTH = 200;
    public static final int MAX_IDENTIFIER_LENGTH = 100;
    public static final String DEFAULT_ACTOR = "system";

    // ---- Write pipeline ----
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final long DEFAULT_FLUSH_INTERVAL_MS = 5_000L;
    public static final long WRITER_POLL_MS = 25L;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_FLUSH_TIMEOUT_MS = 5_000L;

    // ---- Rotation ----
    public static final long DEFAULT_MAX_FILE_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_RETENTION_DAYS = 90;
    public static final int COMPRESSION_LEVEL = 6;
    public static final int COMPRESSION_CHUNK_BYTES = 64 * 1024;

    // ---- Rate limiting ----
    public static final int DEFAULT_RATE_LIMIT_BURST = 200;
    public static final long DEFAULT_RATE_LIMIT_WINDOW_MS = 1_000L;
    public static final int RATE_LIMIT_KEY_SWEEP_THRESHOLD = 10_000;

    // ---- Query ----
    public static final int QUERY_CACHE_CAPACITY = 128;
    public static final long QUERY_CACHE_TTL_MS = 30_000L;
    public static final int DEFAULT_QUERY_LIMIT = 100;
    public static final int LEAD_HISTORY_LIMIT = 10_000;
    public static final int STATISTICS_MAX_DISTINCT_LEADS = 10_000;

    // ---- Security monitor / performance ----
    public static final int SECURITY_EVENT_BUFFER = 1_000;
    public static final int PERFORMANCE_SAMPLES_PER_OPERATION = 1_000;

    // ---- Alerts & webhooks ----
    public static final int DEFAULT_ALERT_ERROR_THRESHOLD = 10;
    public static final long DEFAULT_ALERT_COOLDOWN_SEC = 300L;
    public static final int WEBHOOK_TIMEOUT_MS = 2_000;
    public static final int CHAT_WEBHOOK_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 2_000;
    public static final int DEFAULT_DISPATCH_THREADS = 4;
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 1_000;
    public static final int ALERT_QUEUE_CAPACITY = 32;
    public static final int WEBHOOK_RESPONSE_LIMIT = 64 * 1024;
    public static final int MAX_WEBHOOK_URL_LENGTH = 2048;
    public static final int HTTPS_DEFAULT_PORT = 443;
    public static final int HTTP_DEFAULT_PORT = 80;
    public static final int DEFAULT_SMTP_PORT = 587;

    // ---- Health reporting ----
    public static final long DEFAULT_HEALTH_LOG_INTERVAL_SEC = 0L;
    public static final int DEFAULT_METRICS_HTTP_PORT = 9464;
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 2048;

    private AuditDefaults() {
    }
}
