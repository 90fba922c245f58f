package space.ketterling.views.storage;

import space.ketterling.views.model.ForecastRecord;

import java.util.List;

/**
 * Read/replace contract shared by every storage variant.
 *
 * <p>
 * Readers call {@link #loadAll()} through the snapshot cache. Writers either
 * swap the whole data set ({@link #replaceAll}) or add to it ({@link #append}).
 * A replace must become visible all at once: a concurrent reader sees either
 * the old or the new record set, never a mix.
 * </p>
 */
public interface ForecastBackend extends AutoCloseable {

    /**
     * Stable identity of this backend instance, used as the cache key.
     */
    String id();

    /**
     * Reads the full current record set.
     */
    List<ForecastRecord> loadAll();

    /**
     * Atomically replaces the record set.
     */
    void replaceAll(List<ForecastRecord> records);

    /**
     * Adds records without removing existing ones. Uniqueness against existing
     * rows is not checked by the contract.
     */
    void append(List<ForecastRecord> records);

    /**
     * True when the backend currently holds at least one record.
     */
    default boolean hasData() {
        return !loadAll().isEmpty();
    }

    @Override
    default void close() {
    }
}
