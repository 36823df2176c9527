package com.acme.leadflow.audit.integrity;

import com.acme.leadflow.audit.AuditEvent;
import com.acme.leadflow.audit.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HMAC-SHA256 over the canonical (key-sorted, compact) JSON of every event field except
 * {@code signature}.
 */
public final class IntegritySigner {
    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;
    private final ThreadLocal<Mac> macs;

    public IntegritySigner(String secret) {
        Objects.requireNonNull(secret, "secret");
        if (secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be blank");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.macs = ThreadLocal.withInitial(this::newMac);
        newMac();
    }

    public static IntegritySigner fromSecretFile(Path secretFile) {
        return new IntegritySigner(SecretKeyStore.loadOrCreate(secretFile));
    }

    public String sign(AuditEvent event) {
        return sign(event.signedFields());
    }

    public String sign(Map<String, ?> fields) {
        Map<String, Object> unsigned = new LinkedHashMap<>(fields);
        unsigned.remove(AuditEvent.F_SIGNATURE);
        String canonical;
        try {
            canonical = JsonCodec.writeCanonical(unsigned);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("event fields are not serializable", e);
        }
        byte[] mac = macs.get().doFinal(canonical.getBytes(StandardCharsets.UTF_8));
        return HexFormat.of().formatHex(mac);
    }

    public boolean verify(AuditEvent event) {
        return event.signed() && constantTimeEquals(sign(event), event.signature());
    }

    /** False when the map carries no signature. */
    public boolean verify(Map<String, ?> fields) {
        Object signature = fields.get(AuditEvent.F_SIGNATURE);
        if (!(signature instanceof String s) || s.isEmpty()) {
            return false;
        }
        return constantTimeEquals(sign(fields), s);
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            actual.getBytes(StandardCharsets.US_ASCII)
        );
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
