package com.acme.leadflow.audit.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Replaces well-known PII fields with a stable, irreversible marker so redacted
 * events can still be correlated.
 */
public final class PiiAnonymizer {
    public static final Set<String> PII_FIELDS = Set.of("email", "phone", "name", "address", "ssn");

    private PiiAnonymizer() {
    }

    /** Returns a new map. Top-level keys only; nested values are left alone. */
    public static Map<String, Object> anonymize(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return details;
        }
        Map<String, Object> out = new LinkedHashMap<>(details);
        for (Map.Entry<String, Object> e : out.entrySet()) {
            if (PII_FIELDS.contains(e.getKey()) && e.getValue() != null) {
                e.setValue(redact(String.valueOf(e.getValue())));
            }
        }
        return out;
    }

    static String redact(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return "[REDACTED_" + HexFormat.of().formatHex(digest).substring(0, 16) + "]";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
