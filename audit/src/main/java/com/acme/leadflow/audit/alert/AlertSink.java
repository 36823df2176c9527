package com.acme.leadflow.audit.alert;

/**
 * Receives alert summaries. Failures are logged by the caller and do not affect other
 * sinks.
 */
@FunctionalInterface
public interface AlertSink {
    void notify(String message) throws Exception;
}
