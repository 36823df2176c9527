package com.acme.leadflow.audit.ratelimit;

import com.acme.leadflow.audit.security.SecurityMonitor;
import com.acme.leadflow.audit.util.AuditDefaults;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Sliding-window limiter: at most {@code burst} admissions per key within any
 * {@code window}. Uses the monotonic clock.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {
    private final int burst;
    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final SecurityMonitor securityMonitor;
    private final Map<String, ArrayDeque<Long>> windows = new HashMap<>();
    private final AtomicLong blocked = new AtomicLong();

    public SlidingWindowRateLimiter(SecurityMonitor securityMonitor) {
        this(AuditDefaults.DEFAULT_RATE_LIMIT_BURST, AuditDefaults.DEFAULT_RATE_LIMIT_WINDOW_MS, securityMonitor);
    }

    public SlidingWindowRateLimiter(int burst, long windowMillis, SecurityMonitor securityMonitor) {
        this(burst, windowMillis, securityMonitor, System::nanoTime);
    }

    public SlidingWindowRateLimiter(int burst, long windowMillis, SecurityMonitor securityMonitor, LongSupplier nanoClock) {
        this.burst = Math.max(1, burst);
        this.windowNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(1L, windowMillis));
        this.securityMonitor = securityMonitor;
        this.nanoClock = nanoClock;
    }

    @Override
    public boolean tryAcquire(String key) {
        return tryAcquire(key, nanoClock.getAsLong());
    }

    public boolean tryAcquire(String key, long nowNanos) {
        int count;
        synchronized (windows) {
            if (windows.size() > AuditDefaults.RATE_LIMIT_KEY_SWEEP_THRESHOLD) {
                evictIdle(nowNanos);
            }
            ArrayDeque<Long> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
            prune(window, nowNanos);
            if (window.size() < burst) {
                window.addLast(nowNanos);
                return true;
            }
            count = window.size();
        }
        blocked.incrementAndGet();
        if (securityMonitor != null) {
            securityMonitor.record(SecurityMonitor.RATE_LIMIT_EXCEEDED, Map.of(
                "key", key,
                "count", count,
                "limit", burst
            ));
        }
        return false;
    }

    @Override
    public RateLimitStats stats() {
        long now = nanoClock.getAsLong();
        Map<String, Integer> counts = new HashMap<>();
        synchronized (windows) {
            evictIdle(now);
            windows.forEach((k, w) -> counts.put(k, w.size()));
        }
        return new RateLimitStats(counts.size(), blocked.get(), counts);
    }

    public long blockedTotal() {
        return blocked.get();
    }

    private void evictIdle(long nowNanos) {
        Iterator<ArrayDeque<Long>> it = windows.values().iterator();
        while (it.hasNext()) {
            ArrayDeque<Long> window = it.next();
            prune(window, nowNanos);
            if (window.isEmpty()) {
                it.remove();
            }
        }
    }

    private void prune(ArrayDeque<Long> window, long nowNanos) {
        while (!window.isEmpty() && nowNanos - window.peekFirst() >= windowNanos) {
            window.removeFirst();
        }
    }
}
