package com.acme.leadflow.audit.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared JSON codec.
 *
 * <p>{@link #writeCanonical(Object)} sorts map keys at every depth and is the only
 * serialization signatures are computed over.</p>
 */
public final class JsonCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonCodec() {
    }

    public static JsonNode readTree(String raw) throws JsonProcessingException {
        return MAPPER.readTree(raw);
    }

    public static Map<String, Object> readMap(String raw) throws JsonProcessingException {
        return MAPPER.readValue(raw, MAP_TYPE);
    }

    public static Map<String, Object> readMap(byte[] raw) throws java.io.IOException {
        return MAPPER.readValue(raw, MAP_TYPE);
    }

    public static String writeString(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static byte[] writeBytes(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsBytes(value);
    }

    public static String writeCanonical(Object value) throws JsonProcessingException {
        return CANONICAL.writeValueAsString(value);
    }
}
