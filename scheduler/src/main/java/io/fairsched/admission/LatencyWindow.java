package io.fairsched.admission;

import java.util.ArrayDeque;

/** Rolling window over the last {@code capacity} latency samples. Not thread-safe. */
final class LatencyWindow {
    private final int capacity;
    private final ArrayDeque<Long> samples;
    private long sum;

    LatencyWindow(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("window capacity must be positive");
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    void add(long sample) {
        if (samples.size() == capacity) {
            sum -= samples.removeFirst();
        }
        samples.addLast(sample);
        sum += sample;
    }

    int size() { return samples.size(); }

    double average() { return samples.isEmpty() ? 0.0 : (double) sum / samples.size(); }
}
