package com.acme.leadflow.audit.webhook;

import com.acme.leadflow.audit.AuditEvent;
import com.acme.leadflow.audit.security.SecurityMonitor;
import com.acme.leadflow.audit.util.AuditDefaults;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Fire-and-forget side effects of ingestion: webhook delivery and alert evaluation.
 *
 * <p>Runs on a fixed-size pool with a bounded queue; when the queue is full the task is
 * dropped and counted. Deliveries are never retried.</p>
 */
public final class WebhookDispatcher implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(WebhookDispatcher.class.getName());
    private static final String CONTENT_TYPE = "application/json";

    private final WebhookRegistry registry;
    private final WebhookClient client;
    private final SecurityMonitor securityMonitor;
    private final int timeoutMillis;
    private final ThreadPoolExecutor executor;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public WebhookDispatcher(WebhookRegistry registry, WebhookClient client, SecurityMonitor securityMonitor) {
        this(
            registry,
            client,
            securityMonitor,
            AuditDefaults.DEFAULT_DISPATCH_THREADS,
            AuditDefaults.DEFAULT_DISPATCH_QUEUE_CAPACITY,
            AuditDefaults.WEBHOOK_TIMEOUT_MS
        );
    }

    public WebhookDispatcher(WebhookRegistry registry,
                             WebhookClient client,
                             SecurityMonitor securityMonitor,
                             int threads,
                             int queueCapacity,
                             int timeoutMillis) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.client = Objects.requireNonNull(client, "client");
        this.securityMonitor = securityMonitor;
        this.timeoutMillis = Math.max(1, timeoutMillis);
        int poolSize = Math.max(1, threads);
        AtomicInteger seq = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
            poolSize,
            poolSize,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
            r -> {
                Thread t = new Thread(r, "audit-dispatch-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /** Returns {@code false} if the task was dropped because the pool is saturated or stopped. */
    public boolean submit(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.warning("Dispatch task failed: " + e.getClass().getSimpleName());
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            LOG.fine("Dispatch task dropped: pool saturated");
            return false;
        }
    }

    public void dispatch(AuditEvent event) {
        if (registry.isEmpty()) {
            return;
        }
        byte[] payload = event.toJsonLine().getBytes(StandardCharsets.UTF_8);
        for (URI target : registry.targets()) {
            submit(() -> deliver(target, payload));
        }
    }

    void deliver(URI target, byte[] payload) {
        try {
            int status = client.post(target, payload, CONTENT_TYPE, timeoutMillis)
                .get(timeoutMillis + 500L, TimeUnit.MILLISECONDS);
            if (status >= 200 && status < 300) {
                delivered.incrementAndGet();
            } else {
                failed.incrementAndGet();
                LOG.warning("Webhook " + target.getHost() + " returned status " + status);
            }
        } catch (ExecutionException e) {
            failed.incrementAndGet();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (isTlsFailure(cause) && securityMonitor != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("url", truncate(target.toString(), 50));
                details.put("error", truncate(String.valueOf(cause.getMessage()), 200));
                securityMonitor.record(SecurityMonitor.WEBHOOK_TLS_ERROR, details);
            }
            LOG.warning("Webhook delivery to " + target.getHost() + " failed: " + cause.getClass().getSimpleName());
        } catch (TimeoutException e) {
            failed.incrementAndGet();
            LOG.warning("Webhook delivery to " + target.getHost() + " timed out");
        } catch (InterruptedException e) {
            failed.incrementAndGet();
            Thread.currentThread().interrupt();
        }
    }

    static boolean isTlsFailure(Throwable error) {
        Throwable t = error;
        for (int depth = 0; t != null && depth < 8; depth++) {
            if (t instanceof SSLException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    public long deliveredCount() {
        return delivered.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pendingTasks() {
        return executor.getQueue().size();
    }

    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }
}
