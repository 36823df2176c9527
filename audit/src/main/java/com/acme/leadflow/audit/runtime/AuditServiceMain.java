package com.acme.leadflow.audit.runtime;

import com.acme.leadflow.audit.AuditLogger;
import com.acme.leadflow.audit.config.AuditLoggerConfig;
import com.acme.leadflow.audit.telemetry.MetricsHttpEndpoint;
import com.acme.leadflow.audit.telemetry.PeriodicHealthReporter;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Standalone audit host: opens the audit log from {@code AUDIT_*} environment variables,
 * optionally exposes health over logs and HTTP, and drains everything on shutdown.
 */
public final class AuditServiceMain {
    private static final Logger LOG = Logger.getLogger(AuditServiceMain.class.getName());

    private AuditServiceMain() {
    }

    public static void main(String[] args) throws Exception {
        AuditLoggerConfig config = AuditLoggerConfig.fromEnvironment();
        AuditLogger auditLogger = AuditLogger.create(config);

        PeriodicHealthReporter healthReporter = config.healthLogIntervalSec() > 0
            ? new PeriodicHealthReporter(auditLogger::health, config.healthLogIntervalSec())
            : null;
        MetricsHttpEndpoint metricsEndpoint = config.metricsHttpEnabled()
            ? new MetricsHttpEndpoint(auditLogger::health, auditLogger::performanceStats, config.metricsHttpPort(), "/metrics")
            : null;

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runnable stopAndSignal = () -> {
            try {
                stopAll(healthReporter, metricsEndpoint, auditLogger, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Runtime.getRuntime().addShutdownHook(new Thread(stopAndSignal, "audit-shutdown-hook"));

        try {
            if (healthReporter != null) {
                healthReporter.start();
            }
            if (metricsEndpoint != null) {
                metricsEndpoint.start();
            }
            LOG.info(() -> "Audit service running: log=" + config.logFile()
                + " healthLogIntervalSec=" + config.healthLogIntervalSec()
                + " metricsHttp=" + (metricsEndpoint == null ? "off" : String.valueOf(metricsEndpoint.port())));
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopAll(healthReporter, metricsEndpoint, auditLogger, stopped);
        } catch (RuntimeException e) {
            LOG.severe("Audit service failed: " + e.getClass().getSimpleName());
            stopAll(healthReporter, metricsEndpoint, auditLogger, stopped);
            throw e;
        }
    }

    static void stopAll(PeriodicHealthReporter healthReporter,
                        MetricsHttpEndpoint metricsEndpoint,
                        AuditLogger auditLogger,
                        AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (healthReporter != null) {
            try {
                healthReporter.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: healthReporter stop failed: " + e.getClass().getSimpleName());
            }
        }
        if (metricsEndpoint != null) {
            try {
                metricsEndpoint.close();
            } catch (RuntimeException e) {
                LOG.fine("Shutdown: metricsEndpoint stop failed: " + e.getClass().getSimpleName());
            }
        }
        try {
            auditLogger.close();
        } catch (RuntimeException e) {
            LOG.fine("Shutdown: auditLogger stop failed: " + e.getClass().getSimpleName());
        }
    }
}
