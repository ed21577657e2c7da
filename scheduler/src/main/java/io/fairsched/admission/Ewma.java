package io.fairsched.admission;

/** Exponentially weighted moving average; the first sample seeds the value. Not thread-safe. */
public final class Ewma {
    private final double alpha;
    private double value;
    private boolean initialized;

    public Ewma(double alpha) {
        this.alpha = Math.max(0.001, Math.min(0.999, alpha));
    }

    public void update(double sample) {
        if (!initialized) {
            value = sample;
            initialized = true;
            return;
        }
        value = alpha * sample + (1.0 - alpha) * value;
    }

    public double get() { return value; }
    public boolean hasValue() { return initialized; }
    public double alpha() { return alpha; }
}
