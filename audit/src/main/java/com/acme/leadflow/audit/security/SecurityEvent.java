package com.acme.leadflow.audit.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record SecurityEvent(String timestamp, String type, Map<String, Object> details) {
    public SecurityEvent {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
