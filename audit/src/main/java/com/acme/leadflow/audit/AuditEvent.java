package com.acme.leadflow.audit;

import com.acme.leadflow.audit.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One immutable audit log line.
 *
 * <p>{@code details} always holds the JSON-normalized form produced at ingestion, so the
 * field map of an event read back from disk equals the field map it was signed with.
 * Nested maps and lists are copied and frozen, so a cached event cannot be changed
 * through its details.</p>
 */
public record AuditEvent(
    String timestamp,
    String eventType,
    String actor,
    String leadId,
    String workflow,
    Map<String, Object> details,
    String signature
) {
    public static final String F_TIMESTAMP = "timestamp";
    public static final String F_EVENT_TYPE = "event_type";
    public static final String F_ACTOR = "actor";
    public static final String F_LEAD_ID = "lead_id";
    public static final String F_WORKFLOW = "workflow";
    public static final String F_DETAILS = "details";
    public static final String F_SIGNATURE = "signature";

    public AuditEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(actor, "actor");
        details = details == null ? Map.of() : freezeMap(details);
    }

    /** Fields covered by the signature, in log order. */
    public Map<String, Object> signedFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(F_TIMESTAMP, timestamp);
        fields.put(F_EVENT_TYPE, eventType);
        fields.put(F_ACTOR, actor);
        fields.put(F_LEAD_ID, leadId);
        fields.put(F_WORKFLOW, workflow);
        fields.put(F_DETAILS, details);
        return fields;
    }

    public AuditEvent withSignature(String newSignature) {
        return new AuditEvent(timestamp, eventType, actor, leadId, workflow, details, newSignature);
    }

    public boolean signed() {
        return signature != null && !signature.isEmpty();
    }

    public String toJsonLine() {
        Map<String, Object> fields = signedFields();
        if (signed()) {
            fields.put(F_SIGNATURE, signature);
        }
        try {
            return JsonCodec.writeString(fields);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses one log line.
     *
     * @throws JsonProcessingException when the line is not a JSON object
     * @throws IllegalArgumentException when a required field is missing
     */
    public static AuditEvent fromJsonLine(String line) throws JsonProcessingException {
        return fromFields(JsonCodec.readMap(line));
    }

    @SuppressWarnings("unchecked")
    public static AuditEvent fromFields(Map<String, Object> row) {
        Object details = row.get(F_DETAILS);
        return new AuditEvent(
            requiredText(row, F_TIMESTAMP),
            requiredText(row, F_EVENT_TYPE),
            requiredText(row, F_ACTOR),
            optionalText(row, F_LEAD_ID),
            optionalText(row, F_WORKFLOW),
            details instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(),
            optionalText(row, F_SIGNATURE)
        );
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            copy.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> m) {
            return freezeMap(m);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static String requiredText(Map<String, Object> row, String field) {
        Object v = row.get(field);
        if (!(v instanceof String s)) {
            throw new IllegalArgumentException("missing required text field: " + field);
        }
        return s;
    }

    private static String optionalText(Map<String, Object> row, String field) {
        Object v = row.get(field);
        return v instanceof String s ? s : null;
    }
}
