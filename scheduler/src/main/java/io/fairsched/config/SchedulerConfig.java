package io.fairsched.config;

/**
 * Scheduler tuning. Durations carry their unit in the component name.
 *
 * @param workers                   worker threads in the execution pool
 * @param priorityLevels            MLFQ levels per tenant, level 0 most urgent
 * @param hardCapacity              maximum number of queued tasks
 * @param softThresholdPct          queue fill (percent of hard capacity) that flags soft backpressure
 * @param arenaCapacity             task control blocks available (queued + running)
 * @param resourceCount             exclusive resources, ids 1..resourceCount
 * @param ceilingRate               admission rate ceiling and token cap, tasks per second
 * @param floorRate                 lowest admission rate congestion backoff may reach
 * @param targetLatencyMillis       completion latency the rate controller steers toward
 * @param latencyWindow             rolling latency samples kept for rate adaptation
 * @param minLatencySamples         samples required before the rate adapts
 * @param ewmaAlpha                 smoothing factor for the service-time estimate
 * @param initialServiceMicros      service-time estimate before any completion
 * @param quantumBaseMillis         DRR quantum of level 0
 * @param quantumMultiplier         geometric growth of the quantum per level
 * @param starvationThresholdMillis wait after which aging promotes a task one level
 * @param agingIntervalMillis       period of the aging pass
 * @param sliceMicros               execution slice, 0 runs each task to completion
 * @param referenceWeight           weight at which vruntime advances at wall-clock speed
 * @param hardDeadlineMultiplier    hard deadline = arrival + offset x multiplier
 * @param contentionBackoffMicros   base pause after a resource conflict
 * @param executorAttempts          attempts given to the work executor before a task fails
 * @param adminPort                 port of the read-only admin endpoint
 */
public record SchedulerConfig(
        int workers,
        int priorityLevels,
        int hardCapacity,
        int softThresholdPct,
        int arenaCapacity,
        int resourceCount,
        double ceilingRate,
        double floorRate,
        long targetLatencyMillis,
        int latencyWindow,
        int minLatencySamples,
        double ewmaAlpha,
        long initialServiceMicros,
        double quantumBaseMillis,
        double quantumMultiplier,
        long starvationThresholdMillis,
        long agingIntervalMillis,
        long sliceMicros,
        long referenceWeight,
        double hardDeadlineMultiplier,
        long contentionBackoffMicros,
        int executorAttempts,
        int adminPort
) {
    public SchedulerConfig {
        require(workers > 0, "workers must be positive");
        require(priorityLevels > 0, "priorityLevels must be positive");
        require(hardCapacity > 0, "hardCapacity must be positive");
        require(softThresholdPct > 0 && softThresholdPct <= 100, "softThresholdPct must be in (0, 100]");
        require(arenaCapacity >= hardCapacity, "arenaCapacity must cover hardCapacity");
        require(resourceCount >= 0, "resourceCount must not be negative");
        require(floorRate > 0 && floorRate <= ceilingRate, "need 0 < floorRate <= ceilingRate");
        require(targetLatencyMillis > 0, "targetLatencyMillis must be positive");
        require(latencyWindow > 0 && minLatencySamples > 0, "latency window and samples must be positive");
        require(ewmaAlpha > 0 && ewmaAlpha < 1, "ewmaAlpha must be in (0, 1)");
        require(quantumBaseMillis > 0 && quantumMultiplier >= 1.0, "quantum base must be positive, multiplier >= 1");
        require(starvationThresholdMillis > 0 && agingIntervalMillis > 0, "aging settings must be positive");
        require(sliceMicros >= 0, "sliceMicros must not be negative");
        require(referenceWeight > 0, "referenceWeight must be positive");
        require(hardDeadlineMultiplier > 1.0, "hardDeadlineMultiplier must be > 1");
        require(executorAttempts > 0, "executorAttempts must be positive");
    }

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .workers(workers).priorityLevels(priorityLevels).hardCapacity(hardCapacity)
                .softThresholdPct(softThresholdPct).arenaCapacity(arenaCapacity).resourceCount(resourceCount)
                .ceilingRate(ceilingRate).floorRate(floorRate).targetLatencyMillis(targetLatencyMillis)
                .latencyWindow(latencyWindow).minLatencySamples(minLatencySamples).ewmaAlpha(ewmaAlpha)
                .initialServiceMicros(initialServiceMicros).quantumBaseMillis(quantumBaseMillis)
                .quantumMultiplier(quantumMultiplier).starvationThresholdMillis(starvationThresholdMillis)
                .agingIntervalMillis(agingIntervalMillis).sliceMicros(sliceMicros).referenceWeight(referenceWeight)
                .hardDeadlineMultiplier(hardDeadlineMultiplier).contentionBackoffMicros(contentionBackoffMicros)
                .executorAttempts(executorAttempts).adminPort(adminPort);
    }

    /**
     * Reads every setting from system property {@code fairsched.<name>}, then environment variable
     * {@code FAIRSCHED_<NAME>}, then the default.
     */
    public static SchedulerConfig fromEnv() {
        SchedulerConfig d = defaults();
        int workers = intProp("workers", d.workers());
        int hard = intProp("hardCapacity", d.hardCapacity());
        return new SchedulerConfig(
                workers,
                intProp("priorityLevels", d.priorityLevels()),
                hard,
                intProp("softThresholdPct", d.softThresholdPct()),
                intProp("arenaCapacity", hard + workers),
                intProp("resourceCount", d.resourceCount()),
                doubleProp("ceilingRate", d.ceilingRate()),
                doubleProp("floorRate", d.floorRate()),
                longProp("targetLatencyMillis", d.targetLatencyMillis()),
                intProp("latencyWindow", d.latencyWindow()),
                intProp("minLatencySamples", d.minLatencySamples()),
                doubleProp("ewmaAlpha", d.ewmaAlpha()),
                longProp("initialServiceMicros", d.initialServiceMicros()),
                doubleProp("quantumBaseMillis", d.quantumBaseMillis()),
                doubleProp("quantumMultiplier", d.quantumMultiplier()),
                longProp("starvationThresholdMillis", d.starvationThresholdMillis()),
                longProp("agingIntervalMillis", d.agingIntervalMillis()),
                longProp("sliceMicros", d.sliceMicros()),
                longProp("referenceWeight", d.referenceWeight()),
                doubleProp("hardDeadlineMultiplier", d.hardDeadlineMultiplier()),
                longProp("contentionBackoffMicros", d.contentionBackoffMicros()),
                intProp("executorAttempts", d.executorAttempts()),
                intProp("adminPort", d.adminPort()));
    }

    static String envName(String name) {
        return "FAIRSCHED_" + name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
    }

    private static String raw(String name, String fallback) {
        return System.getProperty("fairsched." + name, System.getenv().getOrDefault(envName(name), fallback));
    }

    private static int intProp(String name, int fallback) { return Integer.parseInt(raw(name, Integer.toString(fallback))); }
    private static long longProp(String name, long fallback) { return Long.parseLong(raw(name, Long.toString(fallback))); }
    private static double doubleProp(String name, double fallback) { return Double.parseDouble(raw(name, Double.toString(fallback))); }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }

    public static final class Builder {
        private int workers = 4;
        private int priorityLevels = 8;
        private int hardCapacity = 10_000;
        private int softThresholdPct = 75;
        private int arenaCapacity = -1;
        private int resourceCount = 16;
        private double ceilingRate = 2_000;
        private double floorRate = 10;
        private long targetLatencyMillis = 100;
        private int latencyWindow = 50;
        private int minLatencySamples = 10;
        private double ewmaAlpha = 0.18;
        private long initialServiceMicros = 1_200;
        private double quantumBaseMillis = 10.0;
        private double quantumMultiplier = 1.5;
        private long starvationThresholdMillis = 1_000;
        private long agingIntervalMillis = 100;
        private long sliceMicros = 0;
        private long referenceWeight = 1024;
        private double hardDeadlineMultiplier = 1.4;
        private long contentionBackoffMicros = 50;
        private int executorAttempts = 1;
        private int adminPort = 8080;

        private Builder() {}

        public Builder workers(int n) { this.workers = n; return this; }
        public Builder priorityLevels(int n) { this.priorityLevels = n; return this; }
        public Builder hardCapacity(int n) { this.hardCapacity = n; return this; }
        public Builder softThresholdPct(int pct) { this.softThresholdPct = pct; return this; }
        /** Defaults to hard capacity plus workers when left unset. */
        public Builder arenaCapacity(int n) { this.arenaCapacity = n; return this; }
        public Builder resourceCount(int n) { this.resourceCount = n; return this; }
        public Builder ceilingRate(double r) { this.ceilingRate = r; return this; }
        public Builder floorRate(double r) { this.floorRate = r; return this; }
        public Builder targetLatencyMillis(long ms) { this.targetLatencyMillis = ms; return this; }
        public Builder latencyWindow(int n) { this.latencyWindow = n; return this; }
        public Builder minLatencySamples(int n) { this.minLatencySamples = n; return this; }
        public Builder ewmaAlpha(double a) { this.ewmaAlpha = a; return this; }
        public Builder initialServiceMicros(long us) { this.initialServiceMicros = us; return this; }
        public Builder quantumBaseMillis(double ms) { this.quantumBaseMillis = ms; return this; }
        public Builder quantumMultiplier(double m) { this.quantumMultiplier = m; return this; }
        public Builder starvationThresholdMillis(long ms) { this.starvationThresholdMillis = ms; return this; }
        public Builder agingIntervalMillis(long ms) { this.agingIntervalMillis = ms; return this; }
        public Builder sliceMicros(long us) { this.sliceMicros = us; return this; }
        public Builder referenceWeight(long w) { this.referenceWeight = w; return this; }
        public Builder hardDeadlineMultiplier(double m) { this.hardDeadlineMultiplier = m; return this; }
        public Builder contentionBackoffMicros(long us) { this.contentionBackoffMicros = us; return this; }
        public Builder executorAttempts(int n) { this.executorAttempts = n; return this; }
        public Builder adminPort(int p) { this.adminPort = p; return this; }

        public SchedulerConfig build() {
            int arena = arenaCapacity > 0 ? arenaCapacity : hardCapacity + workers;
            return new SchedulerConfig(workers, priorityLevels, hardCapacity, softThresholdPct, arena, resourceCount,
                    ceilingRate, floorRate, targetLatencyMillis, latencyWindow, minLatencySamples, ewmaAlpha,
                    initialServiceMicros, quantumBaseMillis, quantumMultiplier, starvationThresholdMillis,
                    agingIntervalMillis, sliceMicros, referenceWeight, hardDeadlineMultiplier,
                    contentionBackoffMicros, executorAttempts, adminPort);
        }
    }
}
