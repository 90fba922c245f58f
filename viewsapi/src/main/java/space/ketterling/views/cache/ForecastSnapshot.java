package space.ketterling.views.cache;

import space.ketterling.views.model.ForecastRecord;

import java.time.Instant;
import java.util.List;

/**
 * Full record set of one backend as of one load, sorted by (grid_id, month).
 */
public record ForecastSnapshot(List<ForecastRecord> records, Instant loadedAt, long generation) {

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
