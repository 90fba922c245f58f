package space.ketterling.views.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.cache.ForecastSnapshot;
import space.ketterling.views.cache.SnapshotCache;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.storage.ForecastBackend;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Answers {@link QuerySpec}s against the cached snapshot of one backend.
 *
 * <p>
 * Filters run in a fixed order (grid ids, country, months, thresholds) and
 * projection runs last, so thresholds always see every metric. The snapshot
 * is sorted by (grid_id, month) and filtering keeps that order.
 * </p>
 */
public final class ForecastQueryEngine {
    private static final Logger log = LoggerFactory.getLogger(ForecastQueryEngine.class);

    private final ForecastBackend backend;
    private final SnapshotCache cache;

    public ForecastQueryEngine(ForecastBackend backend, SnapshotCache cache) {
        this.backend = backend;
        this.cache = cache;
    }

    public String backendId() {
        return backend.id();
    }

    /**
     * Current snapshot, loaded through the cache.
     */
    public ForecastSnapshot snapshot() {
        return cache.getOrLoad(backend.id(), backend::loadAll);
    }

    /**
     * Generation of the cached snapshot; 0 before the first load.
     */
    public long cacheGeneration() {
        return cache.generation(backend.id());
    }

    /**
     * Drops the cached snapshot so the next query reloads the backend.
     */
    public void invalidate() {
        cache.clear(backend.id());
    }

    /**
     * Runs the query and returns the full result.
     */
    public List<ForecastRecord> execute(QuerySpec q) {
        long t0 = System.currentTimeMillis();
        List<ForecastRecord> out;
        try (Stream<ForecastRecord> s = stream(q)) {
            out = s.collect(Collectors.toList());
        }
        log.debug("query fullScan={} results={} ({} ms)", q.isFullScan(), out.size(), System.currentTimeMillis() - t0);
        return out;
    }

    /**
     * Lazy result for incremental output. Filtering happens as the consumer
     * pulls, so a consumer that stops early stops the work.
     */
    public Stream<ForecastRecord> stream(QuerySpec q) {
        return project(filtered(snapshot(), q), q);
    }

    /**
     * Match count plus the lazy result, both from the same snapshot. Counting
     * only runs the filters; nothing is projected or kept.
     */
    public CountedStream streamWithCount(QuerySpec q) {
        ForecastSnapshot snap = snapshot();
        long total = filtered(snap, q).count();
        return new CountedStream(total, project(filtered(snap, q), q));
    }

    public record CountedStream(long total, Stream<ForecastRecord> records) {
    }

    private static Stream<ForecastRecord> filtered(ForecastSnapshot snap, QuerySpec q) {
        Stream<ForecastRecord> s = snap.records().stream();
        if (q.gridIds() != null)
            s = s.filter(q::matchesGrid);
        if (q.countryId() != null)
            s = s.filter(q::matchesCountry);
        if (q.hasMonthFilter())
            s = s.filter(r -> q.matchesMonth(r.month()));
        if (!q.thresholds().isEmpty())
            s = s.filter(q::matchesThresholds);
        return s;
    }

    private static Stream<ForecastRecord> project(Stream<ForecastRecord> s, QuerySpec q) {
        if (!q.projectsAllMetrics())
            s = s.map(r -> r.project(q.projection()));
        return s;
    }
}
