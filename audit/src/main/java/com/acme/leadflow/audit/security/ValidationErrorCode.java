package com.acme.leadflow.audit.security;

public enum ValidationErrorCode {
    EMPTY_EVENT_TYPE,
    EVENT_TYPE_TOO_LONG,
    INVALID_LEAD_ID,
    INVALID_WORKFLOW,
    DETAILS_NOT_SERIALIZABLE,
    DETAILS_TOO_LARGE,
    INVALID_EMAIL,
    INVALID_WEBHOOK_URL,
    WEBHOOK_HOST_BLOCKED,
    WEBHOOK_HOST_UNRESOLVABLE
}
