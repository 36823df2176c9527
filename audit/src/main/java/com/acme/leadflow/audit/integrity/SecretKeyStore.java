package com.acme.leadflow.audit.integrity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Persists the HMAC secret as 64 lowercase hex characters in an owner-only file.
 *
 * <p>An existing file is never overwritten: a malformed secret fails startup, because
 * regenerating it would make every previously signed event unverifiable.</p>
 */
public final class SecretKeyStore {
    private static final Logger LOG = Logger.getLogger(SecretKeyStore.class.getName());
    private static final Pattern HEX_64 = Pattern.compile("^[0-9a-fA-F]{64}$");
    private static final int SECRET_BYTES = 32;

    private SecretKeyStore() {
    }

    public static String loadOrCreate(Path file) {
        if (Files.exists(file)) {
            return load(file);
        }
        String secret = HexFormat.of().formatHex(randomBytes());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, secret, StandardCharsets.US_ASCII, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException raced) {
            return load(file);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot persist audit secret at " + file, e);
        }
        restrictPermissions(file);
        LOG.info("Generated new audit secret at " + file);
        return secret;
    }

    static String load(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.US_ASCII).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read audit secret at " + file, e);
        }
        if (!HEX_64.matcher(raw).matches()) {
            throw new IllegalStateException("Audit secret at " + file + " is malformed; refusing to regenerate");
        }
        return raw.toLowerCase(Locale.ROOT);
    }

    private static void restrictPermissions(Path file) {
        try {
            if (Files.getFileStore(file).supportsFileAttributeView("posix")) {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
            }
        } catch (IOException | UnsupportedOperationException e) {
            LOG.warning("Could not restrict audit secret permissions: " + e.getClass().getSimpleName());
        }
    }

    private static byte[] randomBytes() {
        byte[] bytes = new byte[SECRET_BYTES];
        new SecureRandom().nextBytes(bytes);
        return bytes;
    }
}
