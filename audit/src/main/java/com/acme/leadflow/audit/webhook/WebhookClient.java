package com.acme.leadflow.audit.webhook;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound HTTP POST. The future completes with the response status code, or
 * exceptionally on connect, TLS, write or timeout failure.
 */
public interface WebhookClient extends AutoCloseable {

    CompletableFuture<Integer> post(URI target, byte[] body, String contentType, int timeoutMillis);

    @Override
    void close();
}
