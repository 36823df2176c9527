package com.acme.leadflow.audit.runtime;

import com.acme.leadflow.audit.AuditLogger;
import com.acme.leadflow.audit.TestFiles;
import com.acme.leadflow.audit.config.AuditLoggerConfig;
import com.acme.leadflow.audit.telemetry.MetricsHttpEndpoint;
import com.acme.leadflow.audit.telemetry.PeriodicHealthReporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditServiceMainTest {

    @Test
    void shouldDrainLoggerAndStopEndpointsOnce() throws Exception {
        Path dir = Files.createTempDirectory("audit-service-main-test");
        try {
            AuditLoggerConfig config = AuditLoggerConfig.builder(dir.resolve("audit.log"))
                .secretKey("b2".repeat(32))
                .flushIntervalMs(60_000L)
                .build();
            AuditLogger auditLogger = AuditLogger.builder(config).build();
            PeriodicHealthReporter reporter = new PeriodicHealthReporter(auditLogger::health, 60L);
            MetricsHttpEndpoint endpoint = new MetricsHttpEndpoint(auditLogger::health, auditLogger::performanceStats, 0, "/metrics");
            reporter.start();
            endpoint.start();
            int port = endpoint.port();

            assertTrue(auditLogger.record("workflow_started", Map.of(), null, "inbound"));

            AtomicBoolean stopped = new AtomicBoolean(false);
            AuditServiceMain.stopAll(reporter, endpoint, auditLogger, stopped);
            assertTrue(stopped.get());
            assertDoesNotThrow(() -> AuditServiceMain.stopAll(reporter, endpoint, auditLogger, stopped));

            List<String> lines = Files.readAllLines(dir.resolve("audit.log"), StandardCharsets.UTF_8);
            assertEquals(1, lines.size());
            assertTrue(lines.get(0).contains("\"event_type\":\"workflow_started\""));
            assertThrows(IOException.class, () -> {
                try (Socket socket = new Socket()) {
                    socket.connect(new InetSocketAddress("127.0.0.1", port), 500);
                }
            });
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }

    @Test
    void shouldToleratePartiallyStartedService() throws Exception {
        Path dir = Files.createTempDirectory("audit-service-main-test");
        try {
            AuditLogger auditLogger = AuditLogger.builder(
                AuditLoggerConfig.builder(dir.resolve("audit.log")).integrityEnabled(false).build()
            ).build();
            AtomicBoolean stopped = new AtomicBoolean(false);

            assertDoesNotThrow(() -> AuditServiceMain.stopAll(null, null, auditLogger, stopped));
            assertTrue(stopped.get());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }
}
