package com.acme.leadflow.audit.telemetry;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling latency samples per operation name.
 *
 * <p>p95 and p99 fall back to the maximum until there are more than 20 and more than 100
 * samples respectively.</p>
 */
public final class PerformanceTracker {
    private final int samplesPerOperation;
    private final Map<String, ArrayDeque<Double>> series = new ConcurrentHashMap<>();

    public PerformanceTracker() {
        this(AuditDefaults.PERFORMANCE_SAMPLES_PER_OPERATION);
    }

    public PerformanceTracker(int samplesPerOperation) {
        this.samplesPerOperation = Math.max(1, samplesPerOperation);
    }

    public void record(String operation, double seconds) {
        ArrayDeque<Double> samples = series.computeIfAbsent(operation, k -> new ArrayDeque<>());
        synchronized (samples) {
            if (samples.size() >= samplesPerOperation) {
                samples.removeFirst();
            }
            samples.addLast(seconds);
        }
    }

    public void recordNanos(String operation, long nanos) {
        record(operation, nanos / 1_000_000_000.0d);
    }

    public Optional<OperationStats> stats(String operation) {
        ArrayDeque<Double> samples = series.get(operation);
        if (samples == null) {
            return Optional.empty();
        }
        double[] values;
        synchronized (samples) {
            values = new double[samples.size()];
            int i = 0;
            for (Double v : samples) {
                values[i++] = v;
            }
        }
        return values.length == 0 ? Optional.empty() : Optional.of(summarize(values));
    }

    public Map<String, OperationStats> stats() {
        Map<String, OperationStats> out = new TreeMap<>();
        for (String operation : series.keySet()) {
            stats(operation).ifPresent(s -> out.put(operation, s));
        }
        return out;
    }

    static OperationStats summarize(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double sum = 0.0d;
        for (double v : sorted) {
            sum += v;
        }
        double max = sorted[n - 1];
        return new OperationStats(
            n,
            sorted[0],
            max,
            sum / n,
            sorted[n / 2],
            n > 20 ? sorted[(int) (n * 0.95)] : max,
            n > 100 ? sorted[(int) (n * 0.99)] : max
        );
    }
}
