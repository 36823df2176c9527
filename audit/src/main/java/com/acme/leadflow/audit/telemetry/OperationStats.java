package com.acme.leadflow.audit.telemetry;

/**
 * Latency summary for one operation, in seconds.
 */
public record OperationStats(
    int count,
    double min,
    double max,
    double avg,
    double p50,
    double p95,
    double p99
) {}
