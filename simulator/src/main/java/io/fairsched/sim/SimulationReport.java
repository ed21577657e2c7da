package io.fairsched.sim;

import io.fairsched.queue.TenantStats;
import io.fairsched.telemetry.Counters;
import io.fairsched.telemetry.LatencyHistogram;
import io.fairsched.telemetry.SchedulerSnapshot;
import io.fairsched.telemetry.WorkerStats;

import java.util.Locale;
import java.util.Map;

/** Plain-text end-of-run report. */
public final class SimulationReport {
    private SimulationReport() {}

    public static String render(long generated, SchedulerSnapshot s, LatencyHistogram histogram) {
        StringBuilder sb = new StringBuilder();
        long admitted = s.counter(Counters.TASKS_ADMITTED);
        long completed = s.counter(Counters.TASKS_COMPLETED);
        sb.append("================ SCHEDULER REPORT ================\n");
        line(sb, "Generated requests", generated, "");
        line(sb, "Admitted requests", admitted, pct(admitted, generated));
        line(sb, "Rejected requests", s.counter(Counters.TASKS_REJECTED), pct(s.counter(Counters.TASKS_REJECTED), generated));
        for (Map.Entry<String, Long> e : s.counters().entrySet()) {
            if (e.getKey().startsWith(Counters.TASKS_REJECTED + ".") && e.getValue() > 0) {
                line(sb, "  " + e.getKey().substring(Counters.TASKS_REJECTED.length() + 1), e.getValue(), "");
            }
        }
        line(sb, "Completed", completed, pct(completed, generated) + " goodput");
        line(sb, "Failed", s.counter(Counters.TASKS_FAILED), "");
        line(sb, "Soft deadline misses", s.counter(Counters.DEADLINE_MISSES_SOFT), pct(s.counter(Counters.DEADLINE_MISSES_SOFT), completed) + " of completed");
        line(sb, "Hard deadline misses", s.counter(Counters.DEADLINE_MISSES_HARD), "");
        line(sb, "PI boost events", s.counter(Counters.PRIORITY_INHERITANCE_EVENTS), "");
        line(sb, "Resource contention", s.counter(Counters.RESOURCE_CONTENTION), "");
        line(sb, "Aging promotions", s.counter(Counters.AGING_PROMOTIONS), "");
        line(sb, "MLFQ demotions", s.counter(Counters.MLFQ_DEMOTIONS), "");
        sb.append(String.format(Locale.ROOT, "%-24s: %.1f tasks/s%n", "Admitted rate", s.admittedRate()));
        sb.append(String.format(Locale.ROOT, "%-24s: %.1f us%n", "EWMA service time", s.serviceEstimateNanos() / 1_000.0));

        sb.append("\n--- Workers ---\n");
        for (WorkerStats w : s.workers()) {
            sb.append(String.format(Locale.ROOT, "Worker %02d: tasks run=%d, idle=%dus%n",
                    w.index(), w.tasksRun(), w.idleNanos() / 1_000));
        }
        sb.append("\n--- Tenant fairness (virtual runtime) ---\n");
        for (TenantStats t : s.tenants()) {
            sb.append(String.format(Locale.ROOT, "Tenant %2d: weight=%3d, executed=%.2fms, vruntime=%d%n",
                    t.id(), t.weight(), t.executedNanos() / 1_000_000.0, t.vruntime()));
        }
        sb.append("\n--- Latency histogram (us) ---\n");
        for (Map.Entry<Long, Long> b : histogram.buckets().entrySet()) {
            sb.append(String.format(Locale.ROOT, "<= %10d : %d%n", b.getKey(), b.getValue()));
        }
        if (histogram.overflow() > 0) {
            sb.append(String.format(Locale.ROOT, ">  %10s : %d%n", "max", histogram.overflow()));
        }
        sb.append("==================================================\n");
        return sb.toString();
    }

    private static void line(StringBuilder sb, String label, long value, String suffix) {
        sb.append(String.format(Locale.ROOT, "%-24s: %10d  %s%n", label, value, suffix).stripTrailing()).append('\n');
    }

    private static String pct(long part, long whole) {
        return whole == 0 ? "" : String.format(Locale.ROOT, "(%5.1f%%)", 100.0 * part / whole);
    }
}
