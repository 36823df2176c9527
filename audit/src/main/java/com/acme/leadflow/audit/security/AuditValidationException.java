package com.acme.leadflow.audit.security;

/**
 * Raised synchronously to the caller when an event or one of its inputs is rejected.
 * Nothing is written for a rejected event.
 */
public final class AuditValidationException extends RuntimeException {
    private final ValidationErrorCode code;

    public AuditValidationException(ValidationErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AuditValidationException(ValidationErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ValidationErrorCode code() {
        return code;
    }
}
