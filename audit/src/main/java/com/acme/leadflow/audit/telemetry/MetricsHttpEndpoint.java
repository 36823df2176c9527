package com.acme.leadflow.audit.telemetry;

import com.acme.leadflow.audit.util.AuditDefaults;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Prometheus text endpoint for audit health and operation latencies.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());
    private static final int OK = 200;
    private static final int METHOD_NOT_ALLOWED = 405;
    private static final int INTERNAL_ERROR = 500;

    private final Supplier<AuditHealth> health;
    private final Supplier<Map<String, OperationStats>> latencies;
    private final String path;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsHttpEndpoint(Supplier<AuditHealth> health,
                               Supplier<Map<String, OperationStats>> latencies,
                               int port,
                               String path) throws IOException {
        this.health = Objects.requireNonNull(health, "health");
        this.latencies = latencies == null ? Map::of : latencies;
        this.path = normalizePath(path);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path, this::handle);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "audit-metrics-endpoint");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOG.info("Metrics endpoint started on :" + port() + path);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, METHOD_NOT_ALLOWED, "method not allowed\n");
                return;
            }
            write(exchange, OK, renderPrometheus(health.get(), latencies.get()));
        } catch (RuntimeException e) {
            LOG.warning("Metrics render failed: " + e.getClass().getSimpleName());
            write(exchange, INTERNAL_ERROR, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return "/metrics";
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(AuditHealth h, Map<String, OperationStats> latencies) {
        StringBuilder sb = new StringBuilder(AuditDefaults.DEFAULT_METRICS_RENDER_BUFFER);

        appendHelpType(sb, "audit_events_total", "Audit events by pipeline stage", "counter");
        appendMetric(sb, "audit_events_total", Map.of("stage", "enqueued"), h.eventsEnqueued());
        appendMetric(sb, "audit_events_total", Map.of("stage", "written"), h.eventsWritten());
        appendMetric(sb, "audit_events_total", Map.of("stage", "dropped"), h.eventsDropped());
        appendMetric(sb, "audit_events_total", Map.of("stage", "rate_limited"), h.rateLimitedEvents());

        appendHelpType(sb, "audit_write_errors_total", "Events that could not be written", "counter");
        appendMetric(sb, "audit_write_errors_total", Map.of(), h.writeErrors());

        appendHelpType(sb, "audit_queue_depth", "Events waiting for the writer", "gauge");
        appendMetric(sb, "audit_queue_depth", Map.of(), h.queueDepth());

        appendHelpType(sb, "audit_rate_limited_keys", "Keys with a non-empty rate window", "gauge");
        appendMetric(sb, "audit_rate_limited_keys", Map.of(), h.rateLimitedKeys());

        appendHelpType(sb, "audit_security_events_total", "Security events by type", "counter");
        for (Map.Entry<String, Long> e : h.securityEvents().entrySet()) {
            appendMetric(sb, "audit_security_events_total", Map.of("type", e.getKey()), e.getValue());
        }

        appendHelpType(sb, "audit_webhook_deliveries_total", "Webhook deliveries by outcome", "counter");
        appendMetric(sb, "audit_webhook_deliveries_total", Map.of("outcome", "delivered"), h.webhooksDelivered());
        appendMetric(sb, "audit_webhook_deliveries_total", Map.of("outcome", "failed"), h.webhooksFailed());
        appendMetric(sb, "audit_webhook_deliveries_total", Map.of("outcome", "dropped"), h.dispatchDropped());

        appendHelpType(sb, "audit_alerts_sent_total", "Alerts sent", "counter");
        appendMetric(sb, "audit_alerts_sent_total", Map.of(), h.alertsSent());

        appendHelpType(sb, "audit_query_cache_entries", "Cached query results", "gauge");
        appendMetric(sb, "audit_query_cache_entries", Map.of(), h.queryCacheSize());

        appendHelpType(sb, "audit_active_log_bytes", "Size of the active log file", "gauge");
        appendMetric(sb, "audit_active_log_bytes", Map.of(), h.activeLogBytes());

        if (latencies != null && !latencies.isEmpty()) {
            appendHelpType(sb, "audit_operation_seconds", "Operation latency quantiles in seconds", "summary");
            for (Map.Entry<String, OperationStats> e : latencies.entrySet()) {
                OperationStats s = e.getValue();
                appendQuantile(sb, e.getKey(), "0.5", s.p50());
                appendQuantile(sb, e.getKey(), "0.95", s.p95());
                appendQuantile(sb, e.getKey(), "0.99", s.p99());
                appendMetric(sb, "audit_operation_seconds_count", Map.of("operation", e.getKey()), s.count());
            }
        }
        return sb.toString();
    }

    private static void appendQuantile(StringBuilder sb, String operation, String quantile, double value) {
        sb.append("audit_operation_seconds{operation=\"").append(escapeLabelValue(operation))
            .append("\",quantile=\"").append(quantile).append("\"} ")
            .append(String.format(Locale.ROOT, "%.6f", value)).append('\n');
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, Map<String, String> labels, long value) {
        sb.append(name);
        if (labels != null && !labels.isEmpty()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, String> e : labels.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                sb.append(e.getKey()).append("=\"").append(escapeLabelValue(e.getValue())).append('"');
            }
            sb.append('}');
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
