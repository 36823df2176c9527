package com.acme.leadflow.audit.webhook;

import com.acme.leadflow.audit.security.WebhookUrlValidator;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Webhook targets that passed {@link WebhookUrlValidator}. Validation happens once, here.
 */
public final class WebhookRegistry {
    private static final Logger LOG = Logger.getLogger(WebhookRegistry.class.getName());

    private final WebhookUrlValidator validator;
    private final List<URI> targets = new CopyOnWriteArrayList<>();

    public WebhookRegistry(WebhookUrlValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @throws com.acme.leadflow.audit.security.AuditValidationException if the URL is rejected
     */
    public URI register(String url) {
        URI uri = validator.validate(url);
        if (targets.contains(uri)) {
            return uri;
        }
        targets.add(uri);
        LOG.info("Webhook registered: " + uri.getHost());
        return uri;
    }

    public boolean unregister(URI uri) {
        return targets.remove(uri);
    }

    public List<URI> targets() {
        return List.copyOf(targets);
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }
}
