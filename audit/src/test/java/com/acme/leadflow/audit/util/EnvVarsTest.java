package com.acme.leadflow.audit.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldReturnDefaultForMissingOrBlank() {
        Map<String, String> env = Map.of("EMPTY", "   ");
        assertEquals("fallback", EnvVars.getOrDefault(env, "MISSING", "fallback"));
        assertEquals("fallback", EnvVars.getOrDefault(env, "EMPTY", "fallback"));
    }

    @Test
    void shouldParseBooleanAliases() {
        Map<String, String> env = Map.of(
            "TRUE", "true",
            "ONE", "1",
            "YES", " Yes ",
            "FALSE", "false",
            "JUNK", "maybe"
        );
        assertTrue(EnvVars.getBoolean(env, "TRUE", false));
        assertTrue(EnvVars.getBoolean(env, "ONE", false));
        assertTrue(EnvVars.getBoolean(env, "YES", false));
        assertFalse(EnvVars.getBoolean(env, "FALSE", true));
        assertFalse(EnvVars.getBoolean(env, "JUNK", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampIntAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "9000",
            "OK", " 42 ",
            "BAD", "abc"
        );
        assertEquals(1, EnvVars.getIntClamped(env, "LOW", 10, 1, 100));
        assertEquals(100, EnvVars.getIntClamped(env, "HIGH", 10, 1, 100));
        assertEquals(42, EnvVars.getIntClamped(env, "OK", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "BAD", 10, 1, 100));
        assertEquals(10, EnvVars.getIntClamped(env, "MISSING", 10, 1, 100));
    }

    @Test
    void shouldClampLong() {
        Map<String, String> env = Map.of("BIG", "99999999999");
        assertEquals(3_600_000L, EnvVars.getLongClamped(env, "BIG", 1_000L, 1L, 3_600_000L));
        assertEquals(1_000L, EnvVars.getLongClamped(env, "MISSING", 1_000L, 1L, 3_600_000L));
    }
}
