package com.acme.leadflow.audit.alert;

import com.acme.leadflow.audit.AuditEvent;
import com.acme.leadflow.audit.util.AuditDefaults;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Counts {@code error} events and notifies every sink once the count reaches the threshold,
 * at most once per cooldown. The counter resets after each alert.
 */
public final class AlertManager {
    private static final Logger LOG = Logger.getLogger(AlertManager.class.getName());
    static final String ERROR_EVENT_TYPE = "error";

    private final int threshold;
    private final long cooldownNanos;
    private final LongSupplier nanoClock;
    private final List<AlertSink> sinks = new CopyOnWriteArrayList<>();
    private final AtomicLong alertsSent = new AtomicLong();
    private final AtomicLong sinkFailures = new AtomicLong();

    private int errorCount;
    private boolean alerted;
    private long lastAlertNanos;

    public AlertManager() {
        this(AuditDefaults.DEFAULT_ALERT_ERROR_THRESHOLD, Duration.ofSeconds(AuditDefaults.DEFAULT_ALERT_COOLDOWN_SEC));
    }

    public AlertManager(int threshold, Duration cooldown) {
        this(threshold, cooldown, System::nanoTime);
    }

    public AlertManager(int threshold, Duration cooldown, LongSupplier nanoClock) {
        this.threshold = Math.max(1, threshold);
        this.cooldownNanos = Math.max(0L, cooldown.toNanos());
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public void addSink(AlertSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public int sinkCount() {
        return sinks.size();
    }

    /** Counts the event and, when an alert is due, notifies every sink on the calling thread. */
    public void onEvent(AuditEvent event) {
        String message = record(event);
        if (message != null) {
            notifySinks(message);
        }
    }

    /**
     * Counts an {@code error} event. Returns the alert summary when the threshold is reached
     * outside the cooldown, otherwise {@code null}. Never calls a sink.
     */
    public String record(AuditEvent event) {
        if (!ERROR_EVENT_TYPE.equals(event.eventType())) {
            return null;
        }
        String message;
        synchronized (this) {
            errorCount++;
            long now = nanoClock.getAsLong();
            boolean cooledDown = !alerted || now - lastAlertNanos >= cooldownNanos;
            if (errorCount < threshold || !cooledDown || sinks.isEmpty()) {
                return null;
            }
            message = summary(errorCount, event);
            errorCount = 0;
            alerted = true;
            lastAlertNanos = now;
        }
        alertsSent.incrementAndGet();
        return message;
    }

    public void notifySinks(String message) {
        for (AlertSink sink : sinks) {
            try {
                sink.notify(message);
            } catch (Exception e) {
                sinkFailures.incrementAndGet();
                LOG.warning("Alert sink " + sink.getClass().getSimpleName() + " failed: " + e.getClass().getSimpleName());
            }
        }
    }

    public synchronized int pendingErrorCount() {
        return errorCount;
    }

    public long alertsSent() {
        return alertsSent.get();
    }

    public long sinkFailures() {
        return sinkFailures.get();
    }

    static String summary(int count, AuditEvent latest) {
        Object errorMessage = latest.details().get("error_message");
        return "Audit alert: " + count + " errors detected\n"
            + "Latest error: " + (errorMessage == null ? "unknown" : errorMessage) + "\n"
            + "Workflow: " + (latest.workflow() == null ? "global" : latest.workflow()) + "\n"
            + "Time: " + latest.timestamp();
    }
}
