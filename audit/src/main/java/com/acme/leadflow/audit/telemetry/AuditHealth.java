package com.acme.leadflow.audit.telemetry;

import java.util.Map;

/**
 * Point-in-time health counters of one audit logger.
 */
public record AuditHealth(
    int queueDepth,
    long eventsEnqueued,
    long eventsWritten,
    long writeErrors,
    long eventsDropped,
    long rateLimitedEvents,
    int rateLimitedKeys,
    Map<String, Long> securityEvents,
    long webhooksDelivered,
    long webhooksFailed,
    long dispatchDropped,
    long alertsSent,
    int queryCacheSize,
    long activeLogBytes
) {
    public AuditHealth {
        securityEvents = Map.copyOf(securityEvents);
    }
}
