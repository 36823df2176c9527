package com.acme.leadflow.audit.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EmailValidatorTest {

    @Test
    void shouldLowercaseValidAddress() {
        assertEquals("jane.doe+leads@example.com", EmailValidator.validate("Jane.Doe+Leads@Example.COM"));
        assertTrue(EmailValidator.isValid("ops@acme.io"));
    }

    @Test
    void shouldRejectHeaderInjectionAndMalformedAddresses() {
        assertThrows(AuditValidationException.class, () -> EmailValidator.validate("a@b.com\r\nBcc: x@y.com"));
        assertFalse(EmailValidator.isValid("not-an-email"));
        assertFalse(EmailValidator.isValid("user@host"));
        assertFalse(EmailValidator.isValid(""));
        assertFalse(EmailValidator.isValid(null));
        assertFalse(EmailValidator.isValid("a".repeat(250) + "@b.com"));
    }

    @Test
    void shouldSanitizeHeaderText() {
        assertEquals("Hello World", EmailValidator.sanitizeHeader("Hello\nWorld\r", 100));
        assertEquals("line1 line2", EmailValidator.sanitizeHeader("line1\r\nline2", 100));
        assertEquals("abc", EmailValidator.sanitizeHeader("abcdef", 3));
        assertEquals("", EmailValidator.sanitizeHeader(null));
    }
}
