package io.fairsched.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Lock-free latency histogram over fixed upper bucket edges in microseconds, with an overflow bucket.
 */
public class LatencyHistogram {
    static final long[] BUCKET_UPPER_EDGES_MICROS = {
            100, 250, 500, 750, 1_000, 1_500, 2_000, 3_000, 4_000, 5_000,
            7_500, 10_000, 15_000, 20_000, 30_000, 40_000, 50_000, 75_000, 100_000, 150_000,
            200_000, 300_000, 500_000, 750_000, 1_000_000, 1_500_000, 2_000_000, 3_000_000, 5_000_000, 10_000_000,
            20_000_000, 50_000_000
    };

    private final AtomicLongArray counts = new AtomicLongArray(BUCKET_UPPER_EDGES_MICROS.length);
    private final AtomicLong overflow = new AtomicLong();
    private final AtomicLong total = new AtomicLong();

    public void record(long latencyNanos) {
        long micros = TimeUnit.NANOSECONDS.toMicros(latencyNanos);
        total.incrementAndGet();
        for (int i = 0; i < BUCKET_UPPER_EDGES_MICROS.length; i++) {
            if (micros <= BUCKET_UPPER_EDGES_MICROS[i]) {
                counts.incrementAndGet(i);
                return;
            }
        }
        overflow.incrementAndGet();
    }

    /** Counts keyed by upper bucket edge (µs), ascending, empty buckets left out. */
    public Map<Long, Long> buckets() {
        Map<Long, Long> out = new LinkedHashMap<>();
        for (int i = 0; i < BUCKET_UPPER_EDGES_MICROS.length; i++) {
            long c = counts.get(i);
            if (c > 0) out.put(BUCKET_UPPER_EDGES_MICROS[i], c);
        }
        return out;
    }

    public long overflow() { return overflow.get(); }
    public long total() { return total.get(); }
}
