package no.boreas.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks success/failure counts and latency of upstream calls (Open-Meteo, NVE).
 *
 * <p>
 * One instance lives for one ingestion run; the orchestrator logs the snapshot
 * when the run ends.
 * </p>
 */
public final class UpstreamCallMetrics {
    private final Map<String, ServiceCounters> services = new ConcurrentHashMap<>();

    /**
     * Records one call outcome for a named upstream service.
     */
    public void record(String service, boolean success, long elapsedMs) {
        if (service == null || service.isBlank())
            return;
        services.computeIfAbsent(service, k -> new ServiceCounters()).record(success, elapsedMs);
    }

    /**
     * Returns call counts and failure rates by service, sorted by service name.
     */
    public Map<String, ServiceSnapshot> snapshot() {
        Map<String, ServiceSnapshot> out = new TreeMap<>();
        services.forEach((name, c) -> out.put(name, c.snapshot()));
        return out;
    }

    /**
     * Summary metrics for a single upstream service.
     */
    public record ServiceSnapshot(long calls, long failures, long avgMs, String status) {
        @Override
        public String toString() {
            return "calls=" + calls + " failures=" + failures + " avgMs=" + avgMs + " status=" + status;
        }
    }

    private static final class ServiceCounters {
        private final LongAdder calls = new LongAdder();
        private final LongAdder failures = new LongAdder();
        private final LongAdder totalMs = new LongAdder();

        void record(boolean success, long elapsedMs) {
            calls.increment();
            totalMs.add(Math.max(0L, elapsedMs));
            if (!success)
                failures.increment();
        }

        ServiceSnapshot snapshot() {
            long n = calls.sum();
            long f = failures.sum();
            double failurePct = n == 0 ? 0.0 : (f * 100.0) / n;
            String status;
            if (n == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new ServiceSnapshot(n, f, n == 0 ? 0L : totalMs.sum() / n, status);
        }
    }
}
