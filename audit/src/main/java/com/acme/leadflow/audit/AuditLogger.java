package com.acme.leadflow.audit;

import com.acme.leadflow.audit.alert.AlertManager;
import com.acme.leadflow.audit.alert.AlertSink;
import com.acme.leadflow.audit.alert.ChatWebhookAlertSink;
import com.acme.leadflow.audit.alert.EmailAlertSink;
import com.acme.leadflow.audit.alert.MailTransport;
import com.acme.leadflow.audit.alert.SmtpMailTransport;
import com.acme.leadflow.audit.config.AuditLoggerConfig;
import com.acme.leadflow.audit.integrity.IntegritySigner;
import com.acme.leadflow.audit.query.AuditQuery;
import com.acme.leadflow.audit.query.AuditQueryEngine;
import com.acme.leadflow.audit.query.AuditStatistics;
import com.acme.leadflow.audit.query.QueryCache;
import com.acme.leadflow.audit.ratelimit.RateLimitStats;
import com.acme.leadflow.audit.ratelimit.RateLimiter;
import com.acme.leadflow.audit.ratelimit.SlidingWindowRateLimiter;
import com.acme.leadflow.audit.security.AuditValidationException;
import com.acme.leadflow.audit.security.DefaultEventValidator;
import com.acme.leadflow.audit.security.EmailValidator;
import com.acme.leadflow.audit.security.EventValidator;
import com.acme.leadflow.audit.security.HostResolver;
import com.acme.leadflow.audit.security.PiiAnonymizer;
import com.acme.leadflow.audit.security.SecurityEvent;
import com.acme.leadflow.audit.security.SecurityMonitor;
import com.acme.leadflow.audit.security.ValidatedEvent;
import com.acme.leadflow.audit.security.WebhookUrlValidator;
import com.acme.leadflow.audit.telemetry.AuditHealth;
import com.acme.leadflow.audit.telemetry.OperationStats;
import com.acme.leadflow.audit.telemetry.PerformanceTracker;
import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.webhook.NettyWebhookClient;
import com.acme.leadflow.audit.webhook.WebhookClient;
import com.acme.leadflow.audit.webhook.WebhookDispatcher;
import com.acme.leadflow.audit.webhook.WebhookRegistry;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Entry point of the audit pipeline: validation, rate limiting, optional PII redaction,
 * signing and enqueue on the write path, plus every read operation.
 *
 * <p>Build one instance per process and pass it around. {@link #record} never waits for
 * disk or network; only {@link #flush(Duration)} and {@link #shutdown(Duration)} block,
 * and both are bounded.</p>
 */
public final class AuditLogger implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AuditLogger.class.getName());
    private static final String ERROR_EVENT_TYPE = "error";
    private static final int MAX_EMAIL_DETAIL_HEADER = 500;

    private final AuditLoggerConfig config;
    private final EventValidator validator;
    private final SecurityMonitor securityMonitor;
    private final SlidingWindowRateLimiter rateLimiter;
    private final IntegritySigner signer;
    private final PerformanceTracker performance;
    private final AsyncFileAuditSink sink;
    private final AuditQueryEngine queryEngine;
    private final AlertManager alertManager;
    private final ThreadPoolExecutor alertExecutor;
    private final WebhookUrlValidator webhookUrlValidator;
    private final WebhookRegistry webhookRegistry;
    private final WebhookClient webhookClient;
    private final boolean ownsWebhookClient;
    private final WebhookDispatcher dispatcher;
    private final AtomicBoolean closed = new AtomicBoolean();

    private AuditLogger(Builder b) {
        this.config = b.config;
        this.validator = b.validator == null ? new DefaultEventValidator() : b.validator;
        this.securityMonitor = new SecurityMonitor(config.securityLogFile());
        this.rateLimiter = new SlidingWindowRateLimiter(
            config.rateLimitBurst(),
            config.rateLimitWindowMs(),
            securityMonitor
        );
        this.signer = config.integrityEnabled() ? createSigner(config) : null;
        this.performance = new PerformanceTracker();

        LogRotator rotator = config.rotationEnabled()
            ? new LogRotator(config.maxFileBytes(), config.retentionDays(), Clock.systemUTC())
            : null;
        this.queryEngine = new AuditQueryEngine(config.logFile(), new QueryCache<>(), performance);
        if (rotator != null) {
            rotator.addListener(archive -> queryEngine.invalidateCache());
        }
        this.sink = AsyncFileAuditSink.builder(config.logFile())
            .batchSize(config.batchSize())
            .flushIntervalMs(config.flushIntervalMs())
            .queueCapacity(config.queueCapacity(), config.overflowPolicy())
            .rotator(rotator)
            .appender(b.appender)
            .overflowListener(this::onOverflow)
            .build();

        this.alertManager = new AlertManager(
            config.alertErrorThreshold(),
            Duration.ofSeconds(config.alertCooldownSec())
        );
        this.alertExecutor = new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(AuditDefaults.ALERT_QUEUE_CAPACITY),
            r -> {
                Thread t = new Thread(r, "audit-alert");
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
        this.webhookUrlValidator = new WebhookUrlValidator(b.hostResolver == null ? HostResolver.SYSTEM : b.hostResolver);
        this.webhookRegistry = new WebhookRegistry(webhookUrlValidator);
        this.ownsWebhookClient = b.webhookClient == null;
        this.webhookClient = ownsWebhookClient ? new NettyWebhookClient() : b.webhookClient;
        this.dispatcher = new WebhookDispatcher(
            webhookRegistry,
            webhookClient,
            securityMonitor,
            config.dispatchThreads(),
            config.dispatchQueueCapacity(),
            AuditDefaults.WEBHOOK_TIMEOUT_MS
        );

        for (String url : config.webhookUrls()) {
            try {
                webhookRegistry.register(url);
            } catch (AuditValidationException e) {
                LOG.warning("Configured webhook rejected: " + e.code());
            }
        }
        configureAlertSinks(b.mailTransport);
        for (AlertSink sink : b.alertSinks) {
            alertManager.addSink(sink);
        }
        LOG.info(() -> "Audit logger started: file=" + config.logFile()
            + " integrity=" + (signer != null)
            + " rotation=" + (rotator != null)
            + " webhooks=" + webhookRegistry.targets().size()
            + " alertSinks=" + alertManager.sinkCount());
    }

    public static Builder builder(AuditLoggerConfig config) {
        return new Builder(config);
    }

    public static AuditLogger create(AuditLoggerConfig config) {
        return builder(config).build();
    }

    // ---- Ingestion ----

    /**
     * Validates, rate limits, signs and enqueues one event.
     *
     * @return {@code false} if the event was dropped by the rate limiter
     * @throws AuditValidationException if validation fails; nothing is enqueued
     */
    public boolean record(String eventType, Map<String, ?> details, String actor, String leadId, String workflow) {
        long started = System.nanoTime();
        try {
            ValidatedEvent valid = validate(eventType, details, actor, leadId, workflow);
            String key = RateLimiter.key(valid.workflow(), valid.leadId());
            if (!rateLimiter.tryAcquire(key)) {
                LOG.warning("Audit event rate limited: " + key);
                return false;
            }
            Map<String, Object> stored = config.anonymizePii()
                ? PiiAnonymizer.anonymize(valid.details())
                : valid.details();
            AuditEvent event = new AuditEvent(
                Instant.now().toString(),
                valid.eventType(),
                valid.actor(),
                valid.leadId(),
                valid.workflow(),
                stored,
                null
            );
            if (signer != null) {
                event = event.withSignature(signer.sign(event));
            }
            sink.append(event);
            afterEnqueue(event);
            return true;
        } finally {
            performance.recordNanos("record_event", System.nanoTime() - started);
        }
    }

    public boolean record(String eventType, Map<String, ?> details, String leadId, String workflow) {
        return record(eventType, details, null, leadId, workflow);
    }

    public boolean record(String eventType, Map<String, ?> details) {
        return record(eventType, details, null, null, null);
    }

    private ValidatedEvent validate(String eventType, Map<String, ?> details, String actor, String leadId, String workflow) {
        try {
            return validator.validate(eventType, details, actor, leadId, workflow);
        } catch (AuditValidationException e) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("event_type", truncate(eventType, AuditDefaults.MAX_EVENT_TYPE_LENGTH));
            info.put("error", truncate(e.getMessage(), 200));
            info.put("lead_id", truncate(leadId, 50));
            securityMonitor.record(SecurityMonitor.VALIDATION_ERROR, info);
            if (config.productionMode()) {
                LOG.warning("Audit event rejected: " + e.code());
            } else {
                LOG.warning("Audit event rejected: " + e.code() + " " + e.getMessage()
                    + " (event_type=" + eventType + ", lead_id=" + leadId + ")");
            }
            throw e;
        }
    }

    private void afterEnqueue(AuditEvent event) {
        if (ERROR_EVENT_TYPE.equals(event.eventType())) {
            String alert = alertManager.record(event);
            if (alert != null) {
                deliverAlert(alert);
            }
        }
        dispatcher.dispatch(event);
    }

    // Sink calls never run on the webhook dispatcher pool.
    private void deliverAlert(String alert) {
        try {
            alertExecutor.execute(() -> alertManager.notifySinks(alert));
        } catch (RejectedExecutionException e) {
            LOG.warning("Alert delivery dropped: alert queue full or stopped");
        }
    }

    private void onOverflow(AuditEvent lost) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("event_type", lost.eventType());
        info.put("lead_id", lost.leadId());
        info.put("policy", config.overflowPolicy().name());
        securityMonitor.record(SecurityMonitor.WRITE_QUEUE_OVERFLOW, info);
    }

    // ---- Domain wrappers ----

    public boolean logLeadIngested(String leadId, String source, Map<String, ?> leadData, String workflow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source);
        details.put("fields", leadData == null ? List.of() : new ArrayList<>(leadData.keySet()));
        Object email = leadData == null ? null : leadData.get("email");
        details.put("email", email == null ? "N/A" : email);
        return record("lead_ingested", details, leadId, workflow);
    }

    public boolean logLeadQualified(String leadId, boolean qualified, String reason, String workflow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("qualified", qualified);
        details.put("reason", reason);
        return record("lead_qualified", details, leadId, workflow);
    }

    public boolean logLeadRouted(String leadId, String destination, String condition, String workflow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("destination", destination);
        details.put("condition", condition);
        return record("lead_routed", details, leadId, workflow);
    }

    public boolean logCrmCreate(String leadId, String crmRecordId, String crmType, String workflow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("crm_record_id", crmRecordId);
        details.put("crm_type", crmType);
        return record("crm_create", details, leadId, workflow);
    }

    public boolean logCrmUpdate(String leadId, String crmRecordId, List<String> fieldsUpdated, String workflow) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("crm_record_id", crmRecordId);
        details.put("fields_updated", fieldsUpdated == null ? List.of() : fieldsUpdated);
        return record("crm_update", details, leadId, workflow);
    }

    public boolean logEmailSent(String leadId, String recipient, String subject, int sequenceStep, String workflow) {
        String email = validatedRecipient(recipient, workflow);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipient", email);
        details.put("subject", EmailValidator.sanitizeHeader(subject, MAX_EMAIL_DETAIL_HEADER));
        details.put("sequence_step", sequenceStep);
        return record("email_sent", details, leadId, workflow);
    }

    public boolean logEmailScheduled(String leadId, String recipient, int sequenceLength, String workflow) {
        String email = validatedRecipient(recipient, workflow);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipient", email);
        details.put("sequence_length", sequenceLength);
        return record("email_scheduled", details, leadId, workflow);
    }

    public boolean logEmailCancelled(String leadId, String recipient, String reason, String workflow) {
        String email = validatedRecipient(recipient, workflow);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipient", email);
        details.put("reason", EmailValidator.sanitizeHeader(reason, MAX_EMAIL_DETAIL_HEADER));
        return record("email_cancelled", details, leadId, workflow);
    }

    public boolean logWorkflowStarted(String workflow) {
        return record("workflow_started", Map.of(), null, workflow);
    }

    public boolean logWorkflowStopped(String workflow, String reason) {
        return record("workflow_stopped", Map.of("reason", reason == null ? "manual" : reason), null, workflow);
    }

    public boolean logError(String errorType, String errorMessage, String leadId, String workflow, String stackTrace) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_type", errorType);
        details.put("error_message", errorMessage);
        details.put("traceback", stackTrace);
        return record(ERROR_EVENT_TYPE, details, leadId, workflow);
    }

    private String validatedRecipient(String recipient, String workflow) {
        try {
            return EmailValidator.validate(recipient);
        } catch (AuditValidationException e) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("error", e.getMessage());
            info.put("workflow", workflow);
            securityMonitor.record(SecurityMonitor.INVALID_EMAIL_LOGGED, info);
            throw e;
        }
    }

    // ---- Read paths ----

    public List<AuditEvent> query(AuditQuery query) {
        return queryEngine.query(query);
    }

    public List<AuditEvent> leadHistory(String leadId) {
        return queryEngine.leadHistory(leadId);
    }

    public AuditStatistics statistics(String workflow) {
        return queryEngine.statistics(workflow);
    }

    public RateLimitStats rateLimitStats() {
        return rateLimiter.stats();
    }

    public List<SecurityEvent> recentSecurityEvents(String type, int limit) {
        return securityMonitor.recentEvents(type, limit);
    }

    public Map<String, OperationStats> performanceStats() {
        return performance.stats();
    }

    public Optional<OperationStats> performanceStats(String operation) {
        return performance.stats(operation);
    }

    public Optional<IntegritySigner> signer() {
        return Optional.ofNullable(signer);
    }

    public Path logFile() {
        return config.logFile();
    }

    public AuditHealth health() {
        RateLimitStats limits = rateLimiter.stats();
        long activeBytes;
        try {
            activeBytes = Files.exists(config.logFile()) ? Files.size(config.logFile()) : 0L;
        } catch (IOException e) {
            LOG.fine("Active log size unavailable: " + e.getClass().getSimpleName());
            activeBytes = -1L;
        }
        return new AuditHealth(
            sink.queueDepth(),
            sink.enqueuedCount(),
            sink.writtenCount(),
            sink.writeErrorCount(),
            sink.droppedCount(),
            limits.blockedTotal(),
            limits.activeKeys(),
            securityMonitor.countsByType(),
            dispatcher.deliveredCount(),
            dispatcher.failedCount(),
            dispatcher.droppedCount(),
            alertManager.alertsSent(),
            queryEngine.cacheSize(),
            activeBytes
        );
    }

    // ---- Webhooks & alerts ----

    /**
     * @throws AuditValidationException if the URL fails the SSRF checks
     */
    public URI registerWebhook(String url) {
        return webhookRegistry.register(url);
    }

    public void addAlertSink(AlertSink sink) {
        alertManager.addSink(sink);
    }

    private void configureAlertSinks(MailTransport overrideTransport) {
        if (config.alertEmailFrom() != null && !config.alertEmailTo().isEmpty()
            && (overrideTransport != null || config.smtpHost() != null)) {
            try {
                MailTransport transport = overrideTransport != null
                    ? overrideTransport
                    : new SmtpMailTransport(config.smtpHost(), config.smtpPort(), config.smtpUsername(), config.smtpPassword());
                alertManager.addSink(new EmailAlertSink(transport, config.alertEmailFrom(), config.alertEmailTo()));
            } catch (IllegalArgumentException | AuditValidationException e) {
                LOG.warning("Email alert sink disabled: " + e.getMessage());
            }
        }
        addChatSink(ChatWebhookAlertSink.Format.SLACK, config.slackWebhookUrl());
        addChatSink(ChatWebhookAlertSink.Format.DISCORD, config.discordWebhookUrl());
    }

    private void addChatSink(ChatWebhookAlertSink.Format format, String url) {
        if (url == null || url.isBlank()) {
            return;
        }
        try {
            URI target = webhookUrlValidator.validate(url);
            alertManager.addSink(new ChatWebhookAlertSink(format, target, webhookClient));
        } catch (AuditValidationException e) {
            LOG.warning(format + " alert sink disabled: " + e.code());
        }
    }

    // ---- Lifecycle ----

    public boolean flush(Duration timeout) {
        long started = System.nanoTime();
        try {
            return sink.flush(timeout);
        } finally {
            performance.recordNanos("flush", System.nanoTime() - started);
        }
    }

    public boolean flush() {
        return flush(Duration.ofMillis(AuditDefaults.DEFAULT_FLUSH_TIMEOUT_MS));
    }

    /**
     * Drains and closes the write pipeline, then stops dispatch. Idempotent.
     *
     * @return {@code true} if the writer drained within {@code timeout}
     */
    public boolean shutdown(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return true;
        }
        boolean drained = sink.shutdown(timeout);
        alertExecutor.shutdown();
        try {
            if (!alertExecutor.awaitTermination(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                alertExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            alertExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            dispatcher.shutdown(timeout);
        } catch (RuntimeException e) {
            LOG.fine("Shutdown: dispatcher stop failed: " + e.getClass().getSimpleName());
        }
        if (ownsWebhookClient) {
            try {
                webhookClient.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: webhook client stop failed: " + e.getClass().getSimpleName());
            }
        }
        LOG.info("Audit logger stopped: written=" + sink.writtenCount() + " writeErrors=" + sink.writeErrorCount());
        return drained;
    }

    @Override
    public void close() {
        shutdown(Duration.ofMillis(AuditDefaults.DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    private static IntegritySigner createSigner(AuditLoggerConfig config) {
        String explicit = config.secretKey();
        if (explicit != null && !explicit.isBlank()) {
            return new IntegritySigner(explicit.trim());
        }
        return IntegritySigner.fromSecretFile(config.secretFile());
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    public static final class Builder {
        private final AuditLoggerConfig config;
        private EventValidator validator;
        private HostResolver hostResolver;
        private WebhookClient webhookClient;
        private MailTransport mailTransport;
        private LineAppender appender;
        private final List<AlertSink> alertSinks = new ArrayList<>();

        private Builder(AuditLoggerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder validator(EventValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder hostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        /** The logger does not close a client supplied here. */
        public Builder webhookClient(WebhookClient webhookClient) {
            this.webhookClient = webhookClient;
            return this;
        }

        public Builder mailTransport(MailTransport mailTransport) {
            this.mailTransport = mailTransport;
            return this;
        }

        public Builder appender(LineAppender appender) {
            this.appender = appender;
            return this;
        }

        public Builder alertSink(AlertSink sink) {
            this.alertSinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public AuditLogger build() {
            return new AuditLogger(this);
        }
    }
}
