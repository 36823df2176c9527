package com.acme.leadflow.audit.security;

import java.util.Map;

/**
 * Checks and normalizes the raw inputs of one audit record call.
 */
public interface EventValidator {

    /**
     * @throws AuditValidationException when any input is rejected
     */
    ValidatedEvent validate(String eventType,
                            Map<String, ?> details,
                            String actor,
                            String leadId,
                            String workflow);
}
