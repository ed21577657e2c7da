package io.fairsched.queue;

/**
 * DRR quantum per priority level, growing geometrically with the ordinal: urgent levels get short
 * quanta, background levels long ones.
 */
public final class QuantumSchedule {
    private final long[] quanta;

    public QuantumSchedule(int levels, double baseMillis, double multiplier) {
        if (levels <= 0) throw new IllegalArgumentException("levels must be positive");
        this.quanta = new long[levels];
        for (int i = 0; i < levels; i++) {
            quanta[i] = Math.max(1L, Math.round(baseMillis * Math.pow(multiplier, i) * 1_000_000d));
        }
    }

    public long quantumNanos(int level) { return quanta[level]; }

    public int levels() { return quanta.length; }
}
