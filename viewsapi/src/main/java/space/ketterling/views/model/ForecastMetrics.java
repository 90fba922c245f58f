package space.ketterling.views.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable metric values of one forecast record.
 *
 * <p>
 * A full record carries all 13 metrics; a projected record carries the
 * requested subset. Iteration order is always the canonical
 * {@link MetricName} order.
 * </p>
 */
public final class ForecastMetrics {
    private static final ForecastMetrics EMPTY = new ForecastMetrics(new EnumMap<>(MetricName.class));

    private final EnumMap<MetricName, Double> values;

    private ForecastMetrics(EnumMap<MetricName, Double> values) {
        this.values = values;
    }

    /**
     * Copies the given map; null values are dropped.
     */
    public static ForecastMetrics of(Map<MetricName, Double> values) {
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        for (var e : values.entrySet()) {
            if (e.getValue() != null)
                copy.put(e.getKey(), e.getValue());
        }
        return copy.isEmpty() ? EMPTY : new ForecastMetrics(copy);
    }

    public static ForecastMetrics empty() {
        return EMPTY;
    }

    public OptionalDouble get(MetricName name) {
        Double v = values.get(name);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public boolean has(MetricName name) {
        return values.containsKey(name);
    }

    public boolean hasAll(Collection<MetricName> names) {
        return values.keySet().containsAll(names);
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a copy restricted to the given metrics.
     */
    public ForecastMetrics project(Set<MetricName> keep) {
        if (keep.containsAll(values.keySet()))
            return this;
        EnumMap<MetricName, Double> out = new EnumMap<>(MetricName.class);
        for (var e : values.entrySet()) {
            if (keep.contains(e.getKey()))
                out.put(e.getKey(), e.getValue());
        }
        return new ForecastMetrics(out);
    }

    /**
     * Read-only view in canonical order.
     */
    public Map<MetricName, Double> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastMetrics other))
            return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
