package io.fairsched.core;

/**
 * Priority conventions shared by every component.
 *
 * <p>Priorities are plain {@code int} ordinals where a <b>lower value is more urgent</b>:
 * level {@code 0} is served before level {@code 1}, and so on. Aging and inheritance move a
 * task's priority toward {@code 0}; MLFQ demotion moves it toward the last level. All
 * comparisons go through the helpers below so the direction is spelled out once.
 */
public final class Priority {
    public static final int REALTIME = 0;
    public static final int INTERACTIVE = 1;
    public static final int NORMAL = 2;

    /** Marker for "no waiter recorded" on a resource. Less urgent than any real level. */
    public static final int NONE = Integer.MAX_VALUE;

    private Priority() {}

    /** True when {@code a} must be served before {@code b}. */
    public static boolean isMoreUrgent(int a, int b) { return a < b; }

    /** The more urgent of the two ordinals. */
    public static int mostUrgent(int a, int b) { return Math.min(a, b); }

    /** One level toward urgent, never past {@link #REALTIME}. */
    public static int promote(int level) { return Math.max(REALTIME, level - 1); }

    /** One level toward background, never past {@code lowestLevel}. */
    public static int demote(int level, int lowestLevel) { return Math.min(lowestLevel, level + 1); }

    public static int clamp(int level, int levels) {
        return Math.max(REALTIME, Math.min(levels - 1, level));
    }
}
