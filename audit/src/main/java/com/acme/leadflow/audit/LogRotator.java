package com.acme.leadflow.audit;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPOutputStream;

/**
 * Size-triggered rotation into timestamped gzip archives, plus age-based retention of
 * those archives. Callers serialize {@link #rotate(Path)} against appends.
 */
public final class LogRotator {
    private static final Logger LOG = Logger.getLogger(LogRotator.class.getName());
    private static final String TS_PATTERN = "yyyyMMdd_HHmmss";
    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern(TS_PATTERN).withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TS_PARSE = DateTimeFormatter.ofPattern(TS_PATTERN);

    /** Called after a successful rotation with the archive path. */
    @FunctionalInterface
    public interface RotationListener {
        void rotated(Path archive);
    }

    private final long maxFileBytes;
    private final int retentionDays;
    private final Clock clock;
    private final List<RotationListener> listeners = new CopyOnWriteArrayList<>();

    public LogRotator() {
        this(AuditDefaults.DEFAULT_MAX_FILE_BYTES, AuditDefaults.DEFAULT_RETENTION_DAYS, Clock.systemUTC());
    }

    public LogRotator(long maxFileBytes, int retentionDays, Clock clock) {
        this.maxFileBytes = Math.max(1L, maxFileBytes);
        this.retentionDays = Math.max(1, retentionDays);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(RotationListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean rotationNeeded(Path active) {
        try {
            return Files.exists(active) && Files.size(active) >= maxFileBytes;
        } catch (IOException e) {
            LOG.fine("Rotation size check failed: " + e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Compresses {@code active} into an archive, truncates it to a fresh empty file and
     * sweeps expired archives. On failure the active file is left untouched.
     */
    public Path rotate(Path active) throws IOException {
        Path archive = archivePath(active, clock.instant());
        try (InputStream in = Files.newInputStream(active);
             OutputStream out = new LeveledGzipOutputStream(
                 Files.newOutputStream(archive, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE))) {
            byte[] buf = new byte[AuditDefaults.COMPRESSION_CHUNK_BYTES];
            int n;
            while ((n = in.read(buf)) > 0) {
                out.write(buf, 0, n);
            }
        } catch (IOException e) {
            Files.deleteIfExists(archive);
            throw e;
        }
        Files.delete(active);
        Files.createFile(active);
        LOG.info("Rotated audit log to " + archive.getFileName());

        for (RotationListener listener : listeners) {
            try {
                listener.rotated(archive);
            } catch (RuntimeException e) {
                LOG.warning("Rotation listener failed: " + e.getClass().getSimpleName());
            }
        }
        sweepRetention(active, clock.instant());
        return archive;
    }

    /**
     * Deletes archives of {@code active} whose embedded timestamp is past the retention
     * horizon. Files whose name does not parse are never touched.
     *
     * @return number of archives deleted
     */
    public int sweepRetention(Path active, Instant now) {
        Path dir = directoryOf(active);
        Pattern archiveName = archivePattern(baseName(active));
        LocalDateTime horizon = LocalDateTime.ofInstant(now.minus(Duration.ofDays(retentionDays)), ZoneOffset.UTC);
        int deleted = 0;
        try (var stream = Files.list(dir)) {
            for (Path p : stream.toList()) {
                Matcher m = archiveName.matcher(p.getFileName().toString());
                if (!m.matches()) {
                    continue;
                }
                LocalDateTime stamped;
                try {
                    stamped = LocalDateTime.parse(m.group(1), TS_PARSE);
                } catch (DateTimeParseException e) {
                    continue;
                }
                if (stamped.isBefore(horizon)) {
                    try {
                        Files.deleteIfExists(p);
                        deleted++;
                    } catch (IOException e) {
                        LOG.warning("Retention delete failed for " + p.getFileName() + ": " + e.getClass().getSimpleName());
                    }
                }
            }
        } catch (IOException e) {
            LOG.warning("Retention sweep failed: " + e.getClass().getSimpleName());
        }
        if (deleted > 0) {
            LOG.info("Retention sweep removed " + deleted + " archive(s)");
        }
        return deleted;
    }

    static Path archivePath(Path active, Instant at) {
        Path dir = directoryOf(active);
        String stem = baseName(active) + "." + TS_FMT.format(at);
        Path candidate = dir.resolve(stem + ".log.gz");
        int n = 1;
        while (Files.exists(candidate)) {
            candidate = dir.resolve(stem + "_" + n + ".log.gz");
            n++;
        }
        return candidate;
    }

    static String baseName(Path active) {
        String name = active.getFileName().toString();
        return name.endsWith(".log") ? name.substring(0, name.length() - ".log".length()) : name;
    }

    private static Pattern archivePattern(String base) {
        return Pattern.compile("^" + Pattern.quote(base) + "\\.(\\d{8}_\\d{6})(?:_\\d+)?\\.log\\.gz$");
    }

    private static Path directoryOf(Path active) {
        Path parent = active.toAbsolutePath().getParent();
        return parent == null ? Path.of(".") : parent;
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(OutputStream out) throws IOException {
            super(out, AuditDefaults.COMPRESSION_CHUNK_BYTES);
            def.setLevel(AuditDefaults.COMPRESSION_LEVEL);
        }
    }
}
