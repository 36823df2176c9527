package com.acme.leadflow.audit;

import java.time.Duration;

/**
 * Durable destination for audit events.
 *
 * <p>Implementations must be thread-safe. {@link #append} only enqueues; callers that need
 * the event on disk use {@link #flush(Duration)}.</p>
 */
public interface AuditSink extends AutoCloseable {
    /** Enqueues an event for asynchronous write. Never blocks the caller. */
    void append(AuditEvent event);

    /**
     * Requests a write of everything enqueued so far and waits at most {@code timeout}.
     *
     * @return {@code true} if the drain completed within the timeout
     */
    boolean flush(Duration timeout);

    @Override
    void close();
}
