package space.ketterling.views.model;

import java.time.YearMonth;
import java.util.Comparator;
import java.util.Set;

/**
 * One grid cell forecast for one month.
 *
 * <p>
 * {@code countryId} is the zero-padded numeric country code; it and the admin
 * identifiers may be null.
 * </p>
 */
public record ForecastRecord(
        int gridId,
        YearMonth month,
        double latitude,
        double longitude,
        String countryId,
        String admin1Id,
        String admin2Id,
        ForecastMetrics metrics) {

    /**
     * Ordering used for every published result: grid id, then month.
     */
    public static final Comparator<ForecastRecord> BY_GRID_AND_MONTH = Comparator
            .comparingInt(ForecastRecord::gridId)
            .thenComparing(ForecastRecord::month);

    /**
     * Returns the same record carrying only the given metrics.
     */
    public ForecastRecord project(Set<MetricName> keep) {
        ForecastMetrics projected = metrics.project(keep);
        if (projected == metrics)
            return this;
        return new ForecastRecord(gridId, month, latitude, longitude, countryId, admin1Id, admin2Id, projected);
    }

    /**
     * Identity of the record inside a snapshot.
     */
    public Key key() {
        return new Key(gridId, month);
    }

    /**
     * (grid id, month) pair; unique within a snapshot.
     */
    public record Key(int gridId, YearMonth month) {
        @Override
        public String toString() {
            return "grid_id=" + gridId + " month=" + month;
        }
    }
}
