package space.ketterling.views.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.errors.ForecastApiException;
import space.ketterling.views.metrics.BackendCallMetrics;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for backend I/O.
 *
 * <p>
 * Failures that are already classified ({@link ForecastApiException}) are
 * passed through untouched; anything else is retried until the attempt budget
 * is spent and then surfaced as {@link BackendUnavailableException}.
 * </p>
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
    }

    public static RetryPolicy fromConfig(AppConfig cfg) {
        return new RetryPolicy(cfg.backendMaxAttempts(), cfg.backendBackoff());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code call}, retrying transient failures.
     */
    public <T> T call(String backendId, String operation, IoCall<T> call) {
        long backoffMs = initialBackoff.toMillis();
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long t0 = System.nanoTime();
            try {
                T out = call.call();
                BackendCallMetrics.record(backendId, operation, true, elapsedMs(t0));
                return out;
            } catch (ForecastApiException e) {
                BackendCallMetrics.record(backendId, operation, false, elapsedMs(t0));
                throw e;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new BackendUnavailableException(backendId, operation + " interrupted on " + backendId, ie);
            } catch (Exception e) {
                BackendCallMetrics.record(backendId, operation, false, elapsedMs(t0));
                last = e;
                if (attempt == maxAttempts)
                    break;
                log.warn("{} {} failed attempt={}/{} err={}", backendId, operation, attempt, maxAttempts,
                        e.getMessage());
            }

            // exponential backoff before retry
            if (backoffMs > 0) {
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new BackendUnavailableException(backendId, operation + " interrupted on " + backendId, ie);
                }
                backoffMs *= 2;
            }
        }

        log.error("{} {} failed after {} attempts", backendId, operation, maxAttempts, last);
        throw new BackendUnavailableException(backendId,
                operation + " on " + backendId + " failed after " + maxAttempts + " attempt(s): "
                        + (last == null ? "unknown error" : last.getMessage()),
                last);
    }

    /**
     * Runs a call that returns nothing.
     */
    public void run(String backendId, String operation, IoRunnable call) {
        call(backendId, operation, () -> {
            call.run();
            return null;
        });
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws Exception;
    }

    @FunctionalInterface
    public interface IoRunnable {
        void run() throws Exception;
    }
}
