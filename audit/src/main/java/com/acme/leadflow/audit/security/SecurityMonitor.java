package com.acme.leadflow.audit.security;

import com.acme.leadflow.audit.util.AuditDefaults;
import com.acme.leadflow.audit.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Keeps the most recent security-relevant occurrences in memory and mirrors every one
 * of them to a JSON Lines side log.
 */
public final class SecurityMonitor {
    private static final Logger LOG = Logger.getLogger(SecurityMonitor.class.getName());

    public static final String VALIDATION_ERROR = "validation_error";
    public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";
    public static final String INVALID_EMAIL_LOGGED = "invalid_email_logged";
    public static final String WEBHOOK_TLS_ERROR = "webhook_tls_error";
    public static final String WRITE_QUEUE_OVERFLOW = "write_queue_overflow";

    private final Path sideLog;
    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<SecurityEvent> recent;
    private final Map<String, LongAdder> countsByType = new ConcurrentHashMap<>();
    private final AtomicLong sideLogErrors = new AtomicLong();

    /**
     * @param sideLog side log path, or {@code null} to keep events in memory only
     */
    public SecurityMonitor(Path sideLog) {
        this(sideLog, AuditDefaults.SECURITY_EVENT_BUFFER, Clock.systemUTC());
    }

    public SecurityMonitor(Path sideLog, int capacity, Clock clock) {
        this.sideLog = sideLog;
        this.capacity = Math.max(1, capacity);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.recent = new ArrayDeque<>(this.capacity);
        if (sideLog != null && sideLog.toAbsolutePath().getParent() != null) {
            try {
                Files.createDirectories(sideLog.toAbsolutePath().getParent());
            } catch (IOException e) {
                LOG.warning("Security side log directory unavailable: " + e.getClass().getSimpleName());
            }
        }
    }

    public void record(String type, Map<String, ?> details) {
        Objects.requireNonNull(type, "type");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (details != null) {
            copy.putAll(details);
        }
        SecurityEvent event = new SecurityEvent(Instant.now(clock).toString(), type, copy);

        lock.lock();
        try {
            if (recent.size() >= capacity) {
                recent.removeFirst();
            }
            recent.addLast(event);
        } finally {
            lock.unlock();
        }
        countsByType.computeIfAbsent(type, k -> new LongAdder()).increment();
        appendSideLog(event, copy);
    }

    /**
     * Takes the last {@code limit} buffered events, then keeps those of the given type.
     * A {@code null} type keeps everything.
     */
    public List<SecurityEvent> recentEvents(String type, int limit) {
        List<SecurityEvent> tail;
        lock.lock();
        try {
            int n = Math.max(0, Math.min(limit, recent.size()));
            tail = new ArrayList<>(n);
            int skip = recent.size() - n;
            int i = 0;
            for (SecurityEvent e : recent) {
                if (i++ >= skip) {
                    tail.add(e);
                }
            }
        } finally {
            lock.unlock();
        }
        if (type == null) {
            return List.copyOf(tail);
        }
        return tail.stream().filter(e -> type.equals(e.type())).toList();
    }

    public Map<String, Long> countsByType() {
        Map<String, Long> out = new TreeMap<>();
        countsByType.forEach((k, v) -> out.put(k, v.sum()));
        return out;
    }

    public long sideLogErrorCount() {
        return sideLogErrors.get();
    }

    private void appendSideLog(SecurityEvent event, Map<String, Object> details) {
        if (sideLog == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", event.timestamp());
        row.put("type", event.type());
        row.put("details", details);
        try {
            String line = JsonCodec.writeString(row) + System.lineSeparator();
            synchronized (this) {
                Files.writeString(
                    sideLog,
                    line,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                );
            }
        } catch (IOException e) {
            sideLogErrors.incrementAndGet();
            LOG.fine("Security side log write failed: " + e.getClass().getSimpleName());
        }
    }
}
