package com.acme.leadflow.audit.query;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Fixed-capacity result cache with a time-to-live. Evicts by insertion order.
 */
public final class QueryCache<K, V> {
    private final int capacity;
    private final long ttlNanos;
    private final LongSupplier nanoClock;
    private final LinkedHashMap<K, Entry<V>> entries;

    private record Entry<V>(V value, long insertedAtNanos) {}

    public QueryCache() {
        this(AuditDefaults.QUERY_CACHE_CAPACITY, AuditDefaults.QUERY_CACHE_TTL_MS, System::nanoTime);
    }

    public QueryCache(int capacity, long ttlMillis, LongSupplier nanoClock) {
        this.capacity = Math.max(1, capacity);
        this.ttlNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(1L, ttlMillis));
        this.nanoClock = nanoClock;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, Entry<V>> eldest) {
                return size() > QueryCache.this.capacity;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (nanoClock.getAsLong() - entry.insertedAtNanos() >= ttlNanos) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public synchronized void put(K key, V value) {
        entries.remove(key);
        entries.put(key, new Entry<>(value, nanoClock.getAsLong()));
    }

    public synchronized void invalidateAll() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
