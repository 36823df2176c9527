package com.acme.leadflow.audit.security;

import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.util.JsonCodec;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Default rules: bounded event type, identifier charset, actor sanitization and a
 * hard cap on the serialized size of {@code details}.
 */
public final class DefaultEventValidator implements EventValidator {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_-]{1,"
        + AuditDefaults.MAX_IDENTIFIER_LENGTH + "}$");

    private final int maxDetailsBytes;

    public DefaultEventValidator() {
        this(AuditDefaults.MAX_DETAILS_BYTES);
    }

    public DefaultEventValidator(int maxDetailsBytes) {
        this.maxDetailsBytes = Math.max(1, maxDetailsBytes);
    }

    @Override
    public ValidatedEvent validate(String eventType,
                                   Map<String, ?> details,
                                   String actor,
                                   String leadId,
                                   String workflow) {
        return new ValidatedEvent(
            validateEventType(eventType),
            sanitizeActor(actor),
            validateIdentifier(leadId, ValidationErrorCode.INVALID_LEAD_ID, "lead_id"),
            validateIdentifier(workflow, ValidationErrorCode.INVALID_WORKFLOW, "workflow"),
            normalizeDetails(details)
        );
    }

    static String validateEventType(String eventType) {
        String cleaned = stripControl(eventType == null ? "" : eventType).trim();
        if (cleaned.isEmpty()) {
            throw new AuditValidationException(ValidationErrorCode.EMPTY_EVENT_TYPE, "event_type cannot be empty");
        }
        if (cleaned.length() > AuditDefaults.MAX_EVENT_TYPE_LENGTH) {
            throw new AuditValidationException(
                ValidationErrorCode.EVENT_TYPE_TOO_LONG,
                "event_type longer than " + AuditDefaults.MAX_EVENT_TYPE_LENGTH + " chars"
            );
        }
        return cleaned;
    }

    static String sanitizeActor(String actor) {
        if (actor == null || actor.isBlank()) {
            return AuditDefaults.DEFAULT_ACTOR;
        }
        String cleaned = stripControl(actor);
        if (cleaned.length() > AuditDefaults.MAX_ACTOR_LENGTH) {
            cleaned = cleaned.substring(0, AuditDefaults.MAX_ACTOR_LENGTH);
        }
        return cleaned.isBlank() ? AuditDefaults.DEFAULT_ACTOR : cleaned;
    }

    private static String validateIdentifier(String value, ValidationErrorCode code, String field) {
        if (value == null) {
            return null;
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new AuditValidationException(code, field + " must match [A-Za-z0-9_-]{1,"
                + AuditDefaults.MAX_IDENTIFIER_LENGTH + "}");
        }
        return value;
    }

    private Map<String, Object> normalizeDetails(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        byte[] encoded;
        try {
            encoded = JsonCodec.writeBytes(details);
        } catch (IOException e) {
            throw new AuditValidationException(
                ValidationErrorCode.DETAILS_NOT_SERIALIZABLE,
                "details are not JSON-serializable",
                e
            );
        }
        if (encoded.length > maxDetailsBytes) {
            throw new AuditValidationException(
                ValidationErrorCode.DETAILS_TOO_LARGE,
                "details too large: " + encoded.length + " bytes, max " + maxDetailsBytes
            );
        }
        try {
            return JsonCodec.readMap(encoded);
        } catch (IOException e) {
            throw new AuditValidationException(
                ValidationErrorCode.DETAILS_NOT_SERIALIZABLE,
                "details could not be normalized",
                e
            );
        }
    }

    /** Drops control characters except tab and newline. */
    static String stripControl(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean keep = (c >= 32 && c != 127) || c == '\t' || c == '\n';
            if (!keep && sb == null) {
                sb = new StringBuilder(value.length());
                sb.append(value, 0, i);
            } else if (keep && sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? value : sb.toString();
    }
}
