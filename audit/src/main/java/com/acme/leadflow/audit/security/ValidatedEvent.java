package com.acme.leadflow.audit.security;

import java.util.Map;

/**
 * Inputs that passed validation. {@code details} is already JSON-normalized.
 */
public record ValidatedEvent(
    String eventType,
    String actor,
    String leadId,
    String workflow,
    Map<String, Object> details
) {}
