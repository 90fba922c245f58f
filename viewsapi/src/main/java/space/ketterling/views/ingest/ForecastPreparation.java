package space.ketterling.views.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.errors.DataException;
import space.ketterling.views.model.ForecastMetrics;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.RawDrawSet;
import space.ketterling.views.storage.ForecastBackend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Summarize, validate, publish.
 *
 * <p>
 * The first malformed draw set aborts the whole batch and nothing is
 * written. Validation runs on the complete batch before the backend is
 * touched.
 * </p>
 */
public final class ForecastPreparation {
    private static final Logger log = LoggerFactory.getLogger(ForecastPreparation.class);

    private final ForecastBackend backend;

    public ForecastPreparation(ForecastBackend backend) {
        this.backend = backend;
    }

    /**
     * How a batch lands in the backend.
     */
    public enum Mode {
        REPLACE,
        APPEND;

        public static Mode parse(String raw) {
            String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
            return switch (v) {
                case "", "replace" -> REPLACE;
                case "append" -> APPEND;
                default -> throw new IllegalArgumentException("Unsupported mode: " + raw + " (replace|append)");
            };
        }
    }

    /**
     * Outcome of one publish.
     */
    public record Result(int records, Mode mode, String backendId, boolean skipped) {
    }

    /**
     * Summarizes every draw set and joins cell metadata onto it.
     *
     * @throws DataException on the first bad draw set or a grid cell without
     *                       coordinates
     */
    public static List<ForecastRecord> summarize(List<RawDrawSet> drawSets, Map<Integer, GridCellMetadata> cells) {
        List<ForecastRecord> out = new ArrayList<>(drawSets.size());
        for (RawDrawSet set : drawSets) {
            GridCellMetadata cell = cells.get(set.gridId());
            if (cell == null)
                throw new DataException(set.gridId(), set.month(), "no latitude/longitude for grid cell");
            ForecastMetrics metrics = DrawSummarizer.summarize(set);
            out.add(new ForecastRecord(set.gridId(), set.month(), cell.latitude(), cell.longitude(), cell.countryId(),
                    cell.admin1Id(), cell.admin2Id(), metrics));
        }
        log.info("Summarized {} draw sets", out.size());
        return out;
    }

    /**
     * Validates and writes a batch.
     *
     * @param overwrite required for a replace into a backend that already holds
     *                  data
     * @throws IllegalStateException when a replace would overwrite data without
     *                               {@code overwrite}
     */
    public Result publish(List<ForecastRecord> records, Mode mode, boolean overwrite) {
        SchemaValidator.validate(records);
        if (mode == Mode.REPLACE && !overwrite && backend.hasData())
            throw new IllegalStateException(backend.id() + " already holds forecasts. Use --overwrite to replace it.");

        long t0 = System.currentTimeMillis();
        if (mode == Mode.REPLACE)
            backend.replaceAll(records);
        else
            backend.append(records);
        log.info("Published {} records to {} mode={} ({} ms)", records.size(), backend.id(), mode,
                System.currentTimeMillis() - t0);
        return new Result(records.size(), mode, backend.id(), false);
    }

    /**
     * Publishes unless the backend already holds data.
     */
    public Result publishIfEmpty(List<ForecastRecord> records, Mode mode) {
        if (backend.hasData()) {
            log.info("{} already holds forecasts; skipping", backend.id());
            return new Result(0, mode, backend.id(), true);
        }
        return publish(records, mode, true);
    }

    /**
     * Full pipeline: summarize, validate, publish.
     */
    public Result run(List<RawDrawSet> drawSets, Map<Integer, GridCellMetadata> cells, Mode mode,
            boolean overwrite) {
        return publish(summarize(drawSets, cells), mode, overwrite);
    }
}
