package com.acme.leadflow.audit.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonCodecTest {

    @Test
    void shouldWriteCanonicalJsonWithSortedKeysAtEveryLevel() throws Exception {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("z", 1);
        nested.put("a", "x");
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("workflow", null);
        root.put("details", nested);
        root.put("actor", "system");

        assertEquals(
            "{\"actor\":\"system\",\"details\":{\"a\":\"x\",\"z\":1},\"workflow\":null}",
            JsonCodec.writeCanonical(root)
        );
    }

    @Test
    void shouldPreserveFieldOrderWhenReadingMap() throws Exception {
        Map<String, Object> parsed = JsonCodec.readMap("{\"b\":1,\"a\":2}");
        assertEquals("[b, a]", parsed.keySet().toString());
    }
}
