package com.acme.leadflow.audit;

import com.acme.leadflow.audit.config.AuditLoggerConfig;
import com.acme.leadflow.audit.integrity.IntegritySigner;
import com.acme.leadflow.audit.integrity.IntegrityVerifier;
import com.acme.leadflow.audit.integrity.VerificationReport;
import com.acme.leadflow.audit.query.AuditQuery;
import com.acme.leadflow.audit.query.AuditStatistics;
import com.acme.leadflow.audit.security.AuditValidationException;
import com.acme.leadflow.audit.security.SecurityEvent;
import com.acme.leadflow.audit.security.SecurityMonitor;
import com.acme.leadflow.audit.security.ValidationErrorCode;
import com.acme.leadflow.audit.telemetry.AuditHealth;
import com.acme.leadflow.audit.webhook.WebhookClient;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditLoggerTest {
    private static final String SECRET = "a1".repeat(32);

    private static AuditLoggerConfig.Builder config(Path dir) {
        return AuditLoggerConfig.builder(dir.resolve("audit.log"))
            .secretKey(SECRET)
            .flushIntervalMs(60_000L);
    }

    private static AuditLogger logger(AuditLoggerConfig config, RecordingClient client) {
        return AuditLogger.builder(config)
            .hostResolver(host -> new InetAddress[]{InetAddress.getByName("93.184.216.34")})
            .webhookClient(client)
            .build();
    }

    @Test
    void shouldRecordSignedLeadLifecycle() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).build(), new RecordingClient())) {
            Map<String, Object> lead = new LinkedHashMap<>();
            lead.put("email", "jane@example.com");
            lead.put("name", "Jane Doe");

            assertTrue(audit.logLeadIngested("LEAD-001", "webform", lead, "inbound"));
            assertTrue(audit.logLeadQualified("LEAD-001", true, "score 87", "inbound"));
            assertTrue(audit.logLeadRouted("LEAD-001", "sales", "score > 80", "inbound"));
            assertTrue(audit.logCrmCreate("LEAD-001", "CRM-42", "hubspot", "inbound"));
            assertTrue(audit.logEmailSent("LEAD-001", "Jane@Example.com", "Welcome\r\nBcc: x@y.com", 1, "inbound"));
            assertTrue(audit.flush(Duration.ofSeconds(5)));

            List<AuditEvent> history = audit.leadHistory("LEAD-001");
            assertEquals(
                List.of("lead_ingested", "lead_qualified", "lead_routed", "crm_create", "email_sent"),
                history.stream().map(AuditEvent::eventType).toList()
            );
            AuditEvent ingested = history.get(0);
            assertEquals("system", ingested.actor());
            assertEquals("inbound", ingested.workflow());
            assertEquals(List.of("email", "name"), ingested.details().get("fields"));
            assertEquals("jane@example.com", ingested.details().get("email"));
            assertEquals("jane@example.com", history.get(4).details().get("recipient"));
            assertEquals("Welcome Bcc: x@y.com", history.get(4).details().get("subject"));

            IntegritySigner signer = audit.signer().orElseThrow();
            for (AuditEvent event : history) {
                assertTrue(event.signed());
                assertTrue(signer.verify(event), event.eventType());
            }
            VerificationReport report = new IntegrityVerifier(signer).verify(audit.logFile());
            assertTrue(report.intact());
            assertEquals(5L, report.validLines());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldRejectInvalidInputWithoutWriting() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).build(), new RecordingClient())) {
            AuditValidationException e = assertThrows(AuditValidationException.class,
                () -> audit.record("lead_ingested", Map.of(), null, "<script>alert(1)</script>", "inbound"));
            assertEquals(ValidationErrorCode.INVALID_LEAD_ID, e.code());

            assertThrows(AuditValidationException.class,
                () -> audit.record("lead_ingested", Map.of("blob", "x".repeat(60_000)), "LEAD-1", "inbound"));

            List<SecurityEvent> rejected = audit.recentSecurityEvents(SecurityMonitor.VALIDATION_ERROR, 10);
            assertEquals(2, rejected.size());
            assertEquals("lead_ingested", rejected.get(0).details().get("event_type"));
            assertEquals("<script>alert(1)</script>", rejected.get(0).details().get("lead_id"));

            assertTrue(audit.flush(Duration.ofSeconds(5)));
            assertEquals(0L, Files.size(audit.logFile()));
            assertTrue(Files.readString(dir.resolve("security_events.log"), StandardCharsets.UTF_8)
                .contains("\"type\":\"validation_error\""));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldRecordInvalidRecipientAsSecurityEvent() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).build(), new RecordingClient())) {
            assertThrows(AuditValidationException.class,
                () -> audit.logEmailScheduled("LEAD-001", "not-an-email", 3, "nurture"));
            assertThrows(AuditValidationException.class,
                () -> audit.logEmailCancelled("LEAD-001", "a@b.com\nBcc: c@d.com", "unsubscribed", "nurture"));

            List<SecurityEvent> events = audit.recentSecurityEvents(SecurityMonitor.INVALID_EMAIL_LOGGED, 10);
            assertEquals(2, events.size());
            assertEquals("nurture", events.get(0).details().get("workflow"));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldRateLimitPerWorkflowAndLead() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).rateLimit(5, 60_000L).build(), new RecordingClient())) {
            for (int i = 0; i < 5; i++) {
                assertTrue(audit.record("lead_touched", Map.of("i", i), "LEAD-001", "inbound"));
            }
            assertFalse(audit.record("lead_touched", Map.of("i", 5), "LEAD-001", "inbound"));
            assertTrue(audit.record("lead_touched", Map.of("i", 0), "LEAD-002", "inbound"));
            assertTrue(audit.flush(Duration.ofSeconds(5)));

            assertEquals(6, audit.query(AuditQuery.builder().eventType("lead_touched").build()).size());
            AuditHealth health = audit.health();
            assertEquals(1L, health.rateLimitedEvents());
            assertEquals(1L, health.securityEvents().get(SecurityMonitor.RATE_LIMIT_EXCEEDED));
            assertEquals(1L, audit.rateLimitStats().blockedTotal());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldAnonymizePiiWhenEnabled() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).anonymizePii(true).build(), new RecordingClient())) {
            audit.logLeadIngested("LEAD-009", "import", Map.of("email", "pii@example.com"), "inbound");
            assertTrue(audit.flush(Duration.ofSeconds(5)));

            String raw = Files.readString(audit.logFile(), StandardCharsets.UTF_8);
            assertFalse(raw.contains("pii@example.com"));
            AuditEvent stored = audit.leadHistory("LEAD-009").get(0);
            assertTrue(String.valueOf(stored.details().get("email")).startsWith("[REDACTED_"));
            assertTrue(audit.signer().orElseThrow().verify(stored));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldAlertAfterErrorThreshold() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        List<String> alerts = new CopyOnWriteArrayList<>();
        AuditLoggerConfig config = config(dir).alerting(2, 0L).build();
        try (AuditLogger audit = AuditLogger.builder(config)
            .webhookClient(new RecordingClient())
            .alertSink(alerts::add)
            .build()) {
            audit.logError("CrmTimeout", "HubSpot did not answer", "LEAD-001", "inbound", "trace-1");
            audit.logError("CrmTimeout", "HubSpot still down", "LEAD-002", "inbound", "trace-2");

            waitUntil(() -> !alerts.isEmpty());
            assertEquals(1, alerts.size());
            assertTrue(alerts.get(0).startsWith("Audit alert: 2 errors detected\nLatest error: HubSpot "));
            assertTrue(alerts.get(0).contains("Workflow: inbound"));
            assertEquals(1L, audit.health().alertsSent());

            assertTrue(audit.flush(Duration.ofSeconds(5)));
            AuditStatistics stats = audit.statistics("inbound");
            assertEquals(2L, stats.errors());
            assertEquals(2, stats.uniqueLeads());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldAlertWhileWebhookPoolIsSaturated() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        List<String> alerts = new CopyOnWriteArrayList<>();
        StalledClient stalled = new StalledClient();
        AuditLoggerConfig config = config(dir).dispatch(1, 1).alerting(5, 0L).build();
        try (AuditLogger audit = AuditLogger.builder(config)
            .hostResolver(host -> new InetAddress[]{InetAddress.getByName("93.184.216.34")})
            .webhookClient(stalled)
            .alertSink(alerts::add)
            .build()) {
            audit.registerWebhook("https://hooks.example.com/audit");
            try {
                for (int i = 0; i < 5; i++) {
                    audit.logError("CrmTimeout", "HubSpot down " + i, "LEAD-00" + i, "inbound", null);
                }
                waitUntil(() -> !alerts.isEmpty());
                assertEquals(1, alerts.size());
                assertEquals(1L, audit.health().alertsSent());
                assertTrue(audit.health().dispatchDropped() >= 1L);
            } finally {
                stalled.release();
            }
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldDeliverEventsToRegisteredWebhooks() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        RecordingClient client = new RecordingClient();
        try (AuditLogger audit = logger(config(dir).build(), client)) {
            URI target = audit.registerWebhook("https://hooks.example.com/audit");
            assertThrows(AuditValidationException.class, () -> audit.registerWebhook("http://127.0.0.1/hook"));

            audit.logWorkflowStarted("inbound");
            waitUntil(() -> audit.health().webhooksDelivered() == 1L);

            assertEquals(target, client.targets.get(0));
            assertTrue(client.bodies.get(0).contains("\"event_type\":\"workflow_started\""));
            assertTrue(client.bodies.get(0).contains("\"signature\":"));
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldKeepEveryLineIntactUnderConcurrentWriters() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try (AuditLogger audit = logger(config(dir).batchSize(17).build(), new RecordingClient())) {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        audit.record("lead_touched", Map.of("worker", worker, "i", i), "LEAD-" + worker + "-" + i, "bulk");
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            assertTrue(audit.flush(Duration.ofSeconds(10)));

            List<String> lines = Files.readAllLines(audit.logFile(), StandardCharsets.UTF_8);
            assertEquals(400, lines.size());
            VerificationReport report = new IntegrityVerifier(audit.signer().orElseThrow()).verify(audit.logFile());
            assertTrue(report.intact());
            assertEquals(400L, report.validLines());
            assertEquals(400L, audit.health().eventsWritten());
        } finally {
            pool.shutdownNow();
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldInvalidateQueryCacheOnRotation() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).maxFileBytes(200L).build(), new RecordingClient())) {
            audit.logLeadRouted("LEAD-001", "sales", "score > 80", "inbound");
            assertTrue(audit.flush(Duration.ofSeconds(5)));
            assertEquals(1, audit.leadHistory("LEAD-001").size());
            assertEquals(1, audit.health().queryCacheSize());

            audit.logLeadRouted("LEAD-001", "support", "reassigned", "inbound");
            assertTrue(audit.flush(Duration.ofSeconds(5)));

            assertEquals(0, audit.health().queryCacheSize());
            List<AuditEvent> afterRotation = audit.leadHistory("LEAD-001");
            assertEquals(1, afterRotation.size());
            assertEquals("support", afterRotation.get(0).details().get("destination"));
            try (var files = Files.list(dir)) {
                assertEquals(1L, files.filter(p -> p.getFileName().toString().endsWith(".log.gz")).count());
            }
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldGenerateSecretFileWhenNoKeyConfigured() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try {
            AuditLoggerConfig config = AuditLoggerConfig.builder(dir.resolve("audit.log")).build();
            String firstSignature;
            try (AuditLogger audit = logger(config, new RecordingClient())) {
                audit.logWorkflowStopped("inbound", null);
                assertTrue(audit.flush(Duration.ofSeconds(5)));
                AuditEvent stopped = audit.query(AuditQuery.builder().eventType("workflow_stopped").build()).get(0);
                assertEquals("manual", stopped.details().get("reason"));
                firstSignature = stopped.signature();
            }
            assertTrue(Files.exists(dir.resolve(".audit_secret")));

            try (AuditLogger reopened = logger(config, new RecordingClient())) {
                VerificationReport report = new IntegrityVerifier(reopened.signer().orElseThrow()).verify(reopened.logFile());
                assertTrue(report.intact());
                assertNotNull(firstSignature);
            }
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldWriteUnsignedEventsWhenIntegrityDisabled() throws Exception {
        Path dir = Files.createTempDirectory("audit-logger-test");
        try (AuditLogger audit = logger(config(dir).integrityEnabled(false).build(), new RecordingClient())) {
            audit.logCrmUpdate("LEAD-001", "CRM-42", List.of("stage", "owner"), "inbound");
            assertTrue(audit.flush(Duration.ofSeconds(5)));

            assertTrue(audit.signer().isEmpty());
            AuditEvent event = audit.leadHistory("LEAD-001").get(0);
            assertFalse(event.signed());
            assertEquals(List.of("stage", "owner"), event.details().get("fields_updated"));
            assertTrue(audit.performanceStats("record_event").isPresent());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 5s");
    }

    private static final class StalledClient implements WebhookClient {
        private final List<CompletableFuture<Integer>> pending = new CopyOnWriteArrayList<>();
        private volatile boolean released;

        @Override
        public CompletableFuture<Integer> post(URI target, byte[] body, String contentType, int timeoutMillis) {
            if (released) {
                return CompletableFuture.completedFuture(200);
            }
            CompletableFuture<Integer> future = new CompletableFuture<>();
            pending.add(future);
            return future;
        }

        void release() {
            released = true;
            pending.forEach(f -> f.complete(200));
        }

        @Override
        public void close() {
        }
    }

    private static final class RecordingClient implements WebhookClient {
        private final List<URI> targets = new CopyOnWriteArrayList<>();
        private final List<String> bodies = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<Integer> post(URI target, byte[] body, String contentType, int timeoutMillis) {
            targets.add(target);
            bodies.add(new String(body, StandardCharsets.UTF_8));
            return CompletableFuture.completedFuture(200);
        }

        @Override
        public void close() {
        }
    }
}
