package com.platform.faultlab.observability;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-category request counters. Reading a category returns its count and
 * average latency for the interval since the last read, then resets it.
 */
@Component
public class RequestStats {

    public static final String FAILURE = "failure";
    public static final String PERFORMANCE = "performance";
    public static final String GENERAL = "general";

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RequestStats() {
        buckets.put(FAILURE, new Bucket());
        buckets.put(PERFORMANCE, new Bucket());
        buckets.put(GENERAL, new Bucket());
    }

    /**
     * Map a request path to its category.
     */
    public static String categoryOf(String path) {
        if (path == null) {
            return GENERAL;
        }
        if (path.contains("/failure/")) {
            return FAILURE;
        }
        if (path.contains("/performance/")) {
            return PERFORMANCE;
        }
        return GENERAL;
    }

    public void record(String category, long durationNanos) {
        buckets.computeIfAbsent(category, k -> new Bucket()).add(durationNanos);
    }

    /**
     * Snapshot one category and reset it.
     */
    public Interval snapshotAndReset(String category) {
        Bucket bucket = buckets.get(category);
        if (bucket == null) {
            return new Interval(0, 0.0);
        }
        return bucket.drain();
    }

    /**
     * Snapshot every category and reset them all.
     */
    public Map<String, Interval> snapshotAndResetAll() {
        Map<String, Interval> snapshot = new LinkedHashMap<>();
        buckets.keySet().stream().sorted().forEach(category -> snapshot.put(category, snapshotAndReset(category)));
        return snapshot;
    }

    /**
     * Requests counted in one interval and their mean latency in seconds.
     */
    public record Interval(long throughput, double avgLatency) {
    }

    private static final class Bucket {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();

        void add(long nanos) {
            synchronized (this) {
                count.incrementAndGet();
                totalNanos.addAndGet(nanos);
            }
        }

        Interval drain() {
            long n;
            long total;
            synchronized (this) {
                n = count.getAndSet(0);
                total = totalNanos.getAndSet(0);
            }
            double avg = n > 0 ? (total / 1_000_000_000.0) / n : 0.0;
            return new Interval(n, avg);
        }
    }
}
