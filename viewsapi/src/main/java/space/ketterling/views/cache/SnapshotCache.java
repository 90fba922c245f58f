package space.ketterling.views.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.model.ForecastRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * In-memory cache of backend snapshots, one entry per backend id.
 *
 * <p>
 * Concurrent misses for the same backend share one load: the first caller
 * publishes a pending future and runs the loader, everybody else waits on
 * that future. A failed load is dropped from the map so the next request
 * tries again, and every waiter of the failed load sees the same exception.
 * </p>
 */
public final class SnapshotCache {
    private static final Logger log = LoggerFactory.getLogger(SnapshotCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final AtomicLong generations = new AtomicLong();
    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public SnapshotCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public SnapshotCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached snapshot, loading it when missing or expired.
     */
    public ForecastSnapshot getOrLoad(String backendId, Supplier<List<ForecastRecord>> loader) {
        while (true) {
            CacheEntry existing = entries.get(backendId);
            if (existing != null) {
                if (!existing.future.isDone() || existing.future.isCompletedExceptionally())
                    return await(existing.future);
                ForecastSnapshot done = existing.future.join();
                if (!isExpired(done))
                    return done;
                // expired; only the caller that wins the remove triggers a reload
                entries.remove(backendId, existing);
                continue;
            }

            CacheEntry mine = new CacheEntry(new CompletableFuture<>());
            if (entries.putIfAbsent(backendId, mine) != null)
                continue;
            return load(backendId, mine, loader);
        }
    }

    /**
     * Drops the entry of one backend; the next read reloads it.
     */
    public void clear(String backendId) {
        if (entries.remove(backendId) != null)
            log.info("Cleared cached snapshot for {}", backendId);
    }

    /**
     * Drops every entry.
     */
    public void clearAll() {
        entries.clear();
        log.info("Cleared all cached snapshots");
    }

    /**
     * Generation of the loaded snapshot for a backend, or 0 when none is
     * cached.
     */
    public long generation(String backendId) {
        CacheEntry e = entries.get(backendId);
        if (e == null || !e.future.isDone() || e.future.isCompletedExceptionally())
            return 0L;
        return e.future.join().generation();
    }

    private ForecastSnapshot load(String backendId, CacheEntry mine, Supplier<List<ForecastRecord>> loader) {
        long t0 = System.currentTimeMillis();
        try {
            List<ForecastRecord> sorted = new ArrayList<>(loader.get());
            sorted.sort(ForecastRecord.BY_GRID_AND_MONTH);
            ForecastSnapshot snap = new ForecastSnapshot(List.copyOf(sorted), clock.instant(),
                    generations.incrementAndGet());
            mine.future.complete(snap);
            log.info("Loaded snapshot for {} generation={} records={} ({} ms)", backendId, snap.generation(),
                    snap.size(), System.currentTimeMillis() - t0);
            return snap;
        } catch (RuntimeException | Error e) {
            entries.remove(backendId, mine);
            mine.future.completeExceptionally(e);
            throw e;
        }
    }

    private boolean isExpired(ForecastSnapshot s) {
        Instant expiresAt = s.loadedAt().plus(ttl);
        return !clock.instant().isBefore(expiresAt);
    }

    private static ForecastSnapshot await(CompletableFuture<ForecastSnapshot> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw e;
        }
    }

    /**
     * Pending or completed load of one backend.
     */
    private static final class CacheEntry {
        final CompletableFuture<ForecastSnapshot> future;

        CacheEntry(CompletableFuture<ForecastSnapshot> future) {
            this.future = future;
        }
    }
}
