package com.acme.leadflow.audit.query;

import com.acme.leadflow.audit.AuditEvent;
import com.acme.leadflow.audit.telemetry.PerformanceTracker;
import com.acme.leadflow.audit.util.AuditDefaults;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Sequential reader over the active audit log. Malformed lines are skipped.
 */
public final class AuditQueryEngine {
    private static final Logger LOG = Logger.getLogger(AuditQueryEngine.class.getName());
    private static final String ERROR_EVENT_TYPE = "error";

    private final Path file;
    private final QueryCache<AuditQuery, List<AuditEvent>> cache;
    private final PerformanceTracker performance;
    private final int maxDistinctLeads;

    public AuditQueryEngine(Path file) {
        this(file, new QueryCache<>(), null);
    }

    public AuditQueryEngine(Path file, QueryCache<AuditQuery, List<AuditEvent>> cache, PerformanceTracker performance) {
        this(file, cache, performance, AuditDefaults.STATISTICS_MAX_DISTINCT_LEADS);
    }

    AuditQueryEngine(Path file,
                     QueryCache<AuditQuery, List<AuditEvent>> cache,
                     PerformanceTracker performance,
                     int maxDistinctLeads) {
        this.file = Objects.requireNonNull(file, "file");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.performance = performance;
        this.maxDistinctLeads = Math.max(1, maxDistinctLeads);
    }

    /**
     * Returns at most {@code query.limit()} matching events in log order. Non-empty results
     * are cached; an empty one is not.
     */
    public List<AuditEvent> query(AuditQuery query) {
        long started = System.nanoTime();
        try {
            Optional<List<AuditEvent>> cached = cache.get(query);
            if (cached.isPresent()) {
                return cached.get();
            }
            List<AuditEvent> matches = new ArrayList<>();
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                while (matches.size() < query.limit() && (line = reader.readLine()) != null) {
                    AuditEvent event = parse(line);
                    if (event != null && matches(event, query)) {
                        matches.add(event);
                    }
                }
            } catch (NoSuchFileException e) {
                return List.of();
            } catch (IOException e) {
                LOG.warning("Audit query scan failed: " + e.getClass().getSimpleName());
                return List.copyOf(matches);
            }
            List<AuditEvent> result = List.copyOf(matches);
            if (!result.isEmpty()) {
                cache.put(query, result);
            }
            return result;
        } finally {
            track("query", started);
        }
    }

    public List<AuditEvent> leadHistory(String leadId) {
        return query(AuditQuery.forLead(leadId, AuditDefaults.LEAD_HISTORY_LIMIT));
    }

    /**
     * Single pass over the log. {@code workflow} may be {@code null} for all workflows.
     */
    public AuditStatistics statistics(String workflow) {
        long started = System.nanoTime();
        long total = 0L;
        long errors = 0L;
        boolean truncated = false;
        Map<String, Long> byType = new TreeMap<>();
        Set<String> leads = new HashSet<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                AuditEvent event = parse(line);
                if (event == null || (workflow != null && !workflow.equals(event.workflow()))) {
                    continue;
                }
                if (event.leadId() != null && leads.add(event.leadId()) && leads.size() > maxDistinctLeads) {
                    leads.remove(event.leadId());
                    truncated = true;
                    LOG.warning("Audit statistics truncated at " + maxDistinctLeads + " distinct leads");
                    break;
                }
                total++;
                byType.merge(event.eventType(), 1L, Long::sum);
                if (ERROR_EVENT_TYPE.equals(event.eventType())) {
                    errors++;
                }
            }
        } catch (NoSuchFileException e) {
            return new AuditStatistics(0L, Map.of(), 0, 0L, false);
        } catch (IOException e) {
            LOG.warning("Audit statistics scan failed: " + e.getClass().getSimpleName());
        } finally {
            track("statistics", started);
        }
        return new AuditStatistics(total, byType, leads.size(), errors, truncated);
    }

    public void invalidateCache() {
        cache.invalidateAll();
    }

    public int cacheSize() {
        return cache.size();
    }

    private static AuditEvent parse(String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return AuditEvent.fromJsonLine(line);
        } catch (IOException | IllegalArgumentException ignored) {
            return null;
        }
    }

    private static boolean matches(AuditEvent event, AuditQuery query) {
        if (query.eventType() != null && !query.eventType().equals(event.eventType())) {
            return false;
        }
        if (query.leadId() != null && !query.leadId().equals(event.leadId())) {
            return false;
        }
        if (query.workflow() != null && !query.workflow().equals(event.workflow())) {
            return false;
        }
        if (query.startTime() == null && query.endTime() == null) {
            return true;
        }
        Instant ts;
        try {
            ts = Instant.parse(event.timestamp());
        } catch (DateTimeParseException e) {
            return false;
        }
        if (query.startTime() != null && ts.isBefore(query.startTime())) {
            return false;
        }
        return query.endTime() == null || !ts.isAfter(query.endTime());
    }

    private void track(String operation, long startedNanos) {
        if (performance != null) {
            performance.recordNanos(operation, System.nanoTime() - startedNanos);
        }
    }
}
