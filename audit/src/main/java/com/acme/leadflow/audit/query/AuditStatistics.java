package com.acme.leadflow.audit.query;

import java.util.Map;

/**
 * Result of one full scan. {@code truncated} means the distinct-lead cap was hit and
 * every count is partial.
 */
public record AuditStatistics(
    long totalEvents,
    Map<String, Long> eventsByType,
    int uniqueLeads,
    long errors,
    boolean truncated
) {
    public AuditStatistics {
        eventsByType = Map.copyOf(eventsByType);
    }
}
