package space.ketterling.views.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The 13 published forecast metrics, in canonical output order.
 *
 * <p>
 * Each metric has a kind that decides which range checks apply to it. Interval
 * bounds know their coverage level and probabilities know their fatality
 * threshold, so the summarizer and validator can be driven from this table.
 * </p>
 */
public enum MetricName {
    MAP("map", Kind.POINT_ESTIMATE, 0.0, 0),
    CI_50_LOW("ci_50_low", Kind.INTERVAL_LOW, 0.50, 0),
    CI_50_HIGH("ci_50_high", Kind.INTERVAL_HIGH, 0.50, 0),
    CI_90_LOW("ci_90_low", Kind.INTERVAL_LOW, 0.90, 0),
    CI_90_HIGH("ci_90_high", Kind.INTERVAL_HIGH, 0.90, 0),
    CI_99_LOW("ci_99_low", Kind.INTERVAL_LOW, 0.99, 0),
    CI_99_HIGH("ci_99_high", Kind.INTERVAL_HIGH, 0.99, 0),
    PROB_0("prob_0", Kind.PROBABILITY, 0.0, 0),
    PROB_1("prob_1", Kind.PROBABILITY, 0.0, 1),
    PROB_10("prob_10", Kind.PROBABILITY, 0.0, 10),
    PROB_100("prob_100", Kind.PROBABILITY, 0.0, 100),
    PROB_1000("prob_1000", Kind.PROBABILITY, 0.0, 1000),
    PROB_10000("prob_10000", Kind.PROBABILITY, 0.0, 10000);

    /**
     * Semantic type of a metric.
     */
    public enum Kind {
        POINT_ESTIMATE,
        INTERVAL_LOW,
        INTERVAL_HIGH,
        PROBABILITY
    }

    private final String wireName;
    private final Kind kind;
    private final double level;
    private final int threshold;

    MetricName(String wireName, Kind kind, double level, int threshold) {
        this.wireName = wireName;
        this.kind = kind;
        this.level = level;
        this.threshold = threshold;
    }

    /**
     * Column / JSON name, e.g. {@code ci_90_low}.
     */
    public String wireName() {
        return wireName;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Coverage level for interval bounds (0.5, 0.9, 0.99); 0 otherwise.
     */
    public double level() {
        return level;
    }

    /**
     * Fatality threshold for probability metrics; 0 otherwise.
     */
    public int threshold() {
        return threshold;
    }

    public boolean isProbability() {
        return kind == Kind.PROBABILITY;
    }

    /**
     * For an interval low bound returns its high partner, and vice versa.
     */
    public Optional<MetricName> intervalPartner() {
        return switch (this) {
            case CI_50_LOW -> Optional.of(CI_50_HIGH);
            case CI_50_HIGH -> Optional.of(CI_50_LOW);
            case CI_90_LOW -> Optional.of(CI_90_HIGH);
            case CI_90_HIGH -> Optional.of(CI_90_LOW);
            case CI_99_LOW -> Optional.of(CI_99_HIGH);
            case CI_99_HIGH -> Optional.of(CI_99_LOW);
            default -> Optional.empty();
        };
    }

    /**
     * Looks up a metric by its wire name (case-insensitive, surrounding blanks
     * ignored).
     */
    public static Optional<MetricName> fromWire(String name) {
        if (name == null)
            return Optional.empty();
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (MetricName m : values()) {
            if (m.wireName.equals(n))
                return Optional.of(m);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
