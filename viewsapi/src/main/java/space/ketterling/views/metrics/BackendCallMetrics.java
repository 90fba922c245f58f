package space.ketterling.views.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks success/failure counts and latency of storage backend calls.
 *
 * <p>
 * Every attempt made by the retry policy lands here, so a backend that only
 * succeeds on the third try shows up as degraded. Uses a rolling 60-minute
 * window of per-minute buckets.
 * </p>
 */
public final class BackendCallMetrics {
    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, CallBuckets> CALLS = new ConcurrentHashMap<>();

    /**
     * Utility class; no instances.
     */
    private BackendCallMetrics() {
    }

    /**
     * Records one call attempt, keyed by backend id and operation
     * ({@code load}, {@code replace}, {@code append}).
     */
    public static void record(String backendId, String operation, boolean success, long elapsedMs) {
        if (backendId == null || backendId.isBlank())
            return;
        String key = backendId + " " + (operation == null ? "call" : operation);
        CALLS.computeIfAbsent(key, k -> new CallBuckets()).record(success, elapsedMs);
    }

    /**
     * Returns a snapshot of call counts and failure rates, sorted by key.
     */
    public static Map<String, CallSnapshot> snapshot() {
        Map<String, CallSnapshot> out = new TreeMap<>();
        for (var e : CALLS.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot());
        }
        return out;
    }

    /**
     * Returns the rolling window size (minutes) used for metrics.
     */
    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Drops all counters.
     */
    public static void reset() {
        CALLS.clear();
    }

    /**
     * Summary metrics for one backend operation.
     */
    public record CallSnapshot(long callsLastHour, long failuresLastHour, double failurePct, double avgMs,
            String status) {
    }

    /**
     * Ring buffer of per-minute counts.
     */
    private static final class CallBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] elapsed = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(boolean success, long elapsedMs) {
            long nowMin = System.currentTimeMillis() / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
                elapsed[idx] = 0L;
            }
            total[idx] += 1L;
            elapsed[idx] += Math.max(0L, elapsedMs);
            if (!success) {
                fail[idx] += 1L;
            }
        }

        private synchronized CallSnapshot snapshot() {
            long nowMin = System.currentTimeMillis() / 60000L;
            long totalSum = 0L;
            long failSum = 0L;
            long elapsedSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L)
                    continue;
                if ((nowMin - bucketMin) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
                elapsedSum += elapsed[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            double avgMs = totalSum == 0 ? 0.0 : (double) elapsedSum / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new CallSnapshot(totalSum, failSum, failurePct, avgMs, status);
        }
    }
}
