package com.acme.leadflow.audit.security;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DefaultEventValidatorTest {
    private final DefaultEventValidator validator = new DefaultEventValidator();

    @Test
    void shouldAcceptWellFormedEvent() {
        ValidatedEvent event = validator.validate(
            "lead_ingested",
            Map.of("source", "webform"),
            "crm-sync",
            "LEAD-001",
            "inbound_web"
        );
        assertEquals("lead_ingested", event.eventType());
        assertEquals("crm-sync", event.actor());
        assertEquals("LEAD-001", event.leadId());
        assertEquals("inbound_web", event.workflow());
        assertEquals("webform", event.details().get("source"));
    }

    @Test
    void shouldStripControlCharactersAndTrimEventType() {
        ValidatedEvent event = validator.validate("  lead\u0000_routed\u0007 ", Map.of(), null, null, null);
        assertEquals("lead_routed", event.eventType());
        assertEquals("system", event.actor());
        assertNull(event.leadId());
        assertNull(event.workflow());
    }

    @Test
    void shouldRejectEmptyOrOverlongEventType() {
        AuditValidationException empty = assertThrows(AuditValidationException.class,
            () -> validator.validate(" \u0001 ", Map.of(), null, null, null));
        assertEquals(ValidationErrorCode.EMPTY_EVENT_TYPE, empty.code());

        AuditValidationException tooLong = assertThrows(AuditValidationException.class,
            () -> validator.validate("x".repeat(51), Map.of(), null, null, null));
        assertEquals(ValidationErrorCode.EVENT_TYPE_TOO_LONG, tooLong.code());

        assertEquals("y".repeat(50), validator.validate("y".repeat(50), Map.of(), null, null, null).eventType());
    }

    @Test
    void shouldRejectIdentifiersOutsideAllowedCharset() {
        AuditValidationException lead = assertThrows(AuditValidationException.class,
            () -> validator.validate("lead_ingested", Map.of(), null, "<script>alert(1)</script>", null));
        assertEquals(ValidationErrorCode.INVALID_LEAD_ID, lead.code());

        AuditValidationException workflow = assertThrows(AuditValidationException.class,
            () -> validator.validate("lead_ingested", Map.of(), null, "LEAD-1", "bad workflow"));
        assertEquals(ValidationErrorCode.INVALID_WORKFLOW, workflow.code());

        assertThrows(AuditValidationException.class,
            () -> validator.validate("lead_ingested", Map.of(), null, "a".repeat(101), null));
        assertEquals("a".repeat(100), validator.validate("lead_ingested", Map.of(), null, "a".repeat(100), null).leadId());
    }

    @Test
    void shouldCapActorLength() {
        ValidatedEvent event = validator.validate("x", Map.of(), "a".repeat(300), null, null);
        assertEquals(200, event.actor().length());
    }

    @Test
    void shouldRejectDetailsOverSizeLimit() {
        AuditValidationException e = assertThrows(AuditValidationException.class,
            () -> validator.validate("x", Map.of("blob", "a".repeat(51_200)), null, null, null));
        assertEquals(ValidationErrorCode.DETAILS_TOO_LARGE, e.code());

        DefaultEventValidator small = new DefaultEventValidator(16);
        assertThrows(AuditValidationException.class,
            () -> small.validate("x", Map.of("k", "0123456789"), null, null, null));
        assertEquals("v", small.validate("x", Map.of("k", "v"), null, null, null).details().get("k"));
    }

    @Test
    void shouldRejectUnserializableDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("bad", new Object());
        AuditValidationException e = assertThrows(AuditValidationException.class,
            () -> validator.validate("x", details, null, null, null));
        assertEquals(ValidationErrorCode.DETAILS_NOT_SERIALIZABLE, e.code());
    }

    @Test
    void shouldNormalizeDetailsToJsonTypes() {
        ValidatedEvent event = validator.validate("x", Map.of("fields", List.of("email", "name"), "n", 3L), null, null, null);
        assertEquals(List.of("email", "name"), event.details().get("fields"));
        assertEquals(3, event.details().get("n"));
    }
}
