package com.acme.leadflow.audit.alert;

import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.util.JsonCodec;
import com.acme.leadflow.audit.webhook.WebhookClient;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Posts alert summaries to a Slack or Discord incoming webhook.
 */
public final class ChatWebhookAlertSink implements AlertSink {

    public enum Format {
        SLACK("text"),
        DISCORD("content");

        private final String field;

        Format(String field) {
            this.field = field;
        }
    }

    private final Format format;
    private final URI target;
    private final WebhookClient client;

    public ChatWebhookAlertSink(Format format, URI target, WebhookClient client) {
        this.format = Objects.requireNonNull(format, "format");
        this.target = Objects.requireNonNull(target, "target");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void notify(String message) throws Exception {
        byte[] payload = payload(format, message).getBytes(StandardCharsets.UTF_8);
        int timeout = AuditDefaults.CHAT_WEBHOOK_TIMEOUT_MS;
        int status = client.post(target, payload, "application/json", timeout)
            .get(timeout + 500L, TimeUnit.MILLISECONDS);
        if (status < 200 || status >= 300) {
            throw new IOException(format + " webhook returned status " + status);
        }
    }

    static String payload(Format format, String message) throws IOException {
        return JsonCodec.writeString(Map.of(format.field, message == null ? "" : message));
    }
}
