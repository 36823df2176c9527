package com.acme.leadflow.audit.ratelimit;

/**
 * Per-key admission control for the ingestion path.
 */
public interface RateLimiter {
    /** Returns {@code false} when the key's window is already full. Never blocks. */
    boolean tryAcquire(String key);

    RateLimitStats stats();

    static String key(String workflow, String leadId) {
        return (workflow == null ? "global" : workflow) + ":" + (leadId == null ? "none" : leadId);
    }
}
