package com.acme.leadflow.audit.telemetry;

import com.acme.leadflow.audit.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs the audit health snapshot as one JSON line per interval.
 */
public final class PeriodicHealthReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicHealthReporter.class.getName());

    private final Supplier<AuditHealth> health;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicHealthReporter(Supplier<AuditHealth> health, long intervalSeconds) {
        this.health = Objects.requireNonNull(health, "health");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "audit-health-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    void emit() {
        try {
            LOG.info(render(health.get()));
        } catch (RuntimeException e) {
            LOG.warning("Health reporter failure: " + e.getClass().getSimpleName());
        }
    }

    static String render(AuditHealth h) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "audit");
        payload.put("type", "audit_health");
        payload.put("queueDepth", h.queueDepth());
        payload.put("eventsEnqueued", h.eventsEnqueued());
        payload.put("eventsWritten", h.eventsWritten());
        payload.put("writeErrors", h.writeErrors());
        payload.put("eventsDropped", h.eventsDropped());
        payload.put("rateLimitedEvents", h.rateLimitedEvents());
        payload.put("rateLimitedKeys", h.rateLimitedKeys());
        payload.put("securityEvents", h.securityEvents());
        payload.put("webhooksDelivered", h.webhooksDelivered());
        payload.put("webhooksFailed", h.webhooksFailed());
        payload.put("dispatchDropped", h.dispatchDropped());
        payload.put("alertsSent", h.alertsSent());
        payload.put("queryCacheSize", h.queryCacheSize());
        payload.put("activeLogBytes", h.activeLogBytes());
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
