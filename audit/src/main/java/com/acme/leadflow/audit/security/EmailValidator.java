package com.acme.leadflow.audit.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email address and mail-header hygiene for the email-related audit wrappers and the
 * email alert sink.
 */
public final class EmailValidator {
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_HEADER_LENGTH = 998;

    private EmailValidator() {
    }

    /**
     * Returns the lower-cased address.
     *
     * @throws AuditValidationException on bad length, CR/LF or a malformed address
     */
    public static String validate(String email) {
        if (email == null || email.isEmpty() || email.length() > MAX_EMAIL_LENGTH) {
            throw new AuditValidationException(ValidationErrorCode.INVALID_EMAIL, "invalid email length");
        }
        if (email.indexOf('\r') >= 0 || email.indexOf('\n') >= 0) {
            throw new AuditValidationException(ValidationErrorCode.INVALID_EMAIL, "email contains CR/LF");
        }
        if (!EMAIL.matcher(email).matches()) {
            throw new AuditValidationException(ValidationErrorCode.INVALID_EMAIL, "invalid email format");
        }
        return email.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String email) {
        try {
            validate(email);
            return true;
        } catch (AuditValidationException e) {
            return false;
        }
    }

    /** Removes CR, turns LF into a space and truncates. */
    public static String sanitizeHeader(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = text.replace("\r", "").replace('\n', ' ');
        int limit = Math.max(0, maxLength);
        return cleaned.length() > limit ? cleaned.substring(0, limit) : cleaned;
    }

    public static String sanitizeHeader(String text) {
        return sanitizeHeader(text, MAX_HEADER_LENGTH);
    }
}
