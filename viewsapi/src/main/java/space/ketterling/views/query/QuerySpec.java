package space.ketterling.views.query;

import space.ketterling.views.errors.InvalidFilterException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated, immutable description of one forecast query.
 *
 * <p>
 * Absent filters are null. A spec with neither a country nor grid ids scans
 * the whole snapshot; builders have to ask for that with
 * {@link Builder#fullScan()} so that an accidentally empty filter does not
 * silently turn into a full table read.
 * </p>
 */
public final class QuerySpec {
    private final String countryId;
    private final Set<Integer> gridIds;
    private final Set<YearMonth> months;
    private final YearMonth rangeStart;
    private final YearMonth rangeEnd;
    private final List<MetricName> metrics;
    private final Set<MetricName> projection;
    private final List<ThresholdPredicate> thresholds;
    private final OutputFormat format;

    private QuerySpec(Builder b) {
        this.countryId = b.countryId;
        this.gridIds = b.gridIds == null ? null : Collections.unmodifiableSet(new TreeSet<>(b.gridIds));
        this.months = b.months == null ? null : Collections.unmodifiableSet(new TreeSet<>(b.months));
        this.rangeStart = b.rangeStart;
        this.rangeEnd = b.rangeEnd;
        this.metrics = b.metrics.isEmpty() ? List.of(MetricName.values()) : List.copyOf(b.metrics);
        this.projection = Collections.unmodifiableSet(EnumSet.copyOf(this.metrics));
        this.thresholds = List.copyOf(b.thresholds);
        this.format = b.format;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Zero-padded country code, or null.
     */
    public String countryId() {
        return countryId;
    }

    /**
     * Sorted grid ids, or null.
     */
    public Set<Integer> gridIds() {
        return gridIds;
    }

    /**
     * Explicit months, or null.
     */
    public Set<YearMonth> months() {
        return months;
    }

    public YearMonth rangeStart() {
        return rangeStart;
    }

    public YearMonth rangeEnd() {
        return rangeEnd;
    }

    public boolean hasMonthRange() {
        return rangeStart != null;
    }

    /**
     * Requested metrics in request order, duplicates removed.
     */
    public List<MetricName> metrics() {
        return metrics;
    }

    public Set<MetricName> projection() {
        return projection;
    }

    public boolean projectsAllMetrics() {
        return projection.size() == MetricName.values().length;
    }

    public List<ThresholdPredicate> thresholds() {
        return thresholds;
    }

    public OutputFormat format() {
        return format;
    }

    public boolean isFullScan() {
        return countryId == null && gridIds == null;
    }

    public boolean hasMonthFilter() {
        return months != null || rangeStart != null;
    }

    /**
     * Month filter: union of the explicit months and the inclusive range.
     */
    public boolean matchesMonth(YearMonth m) {
        if (!hasMonthFilter())
            return true;
        if (months != null && months.contains(m))
            return true;
        return rangeStart != null && !m.isBefore(rangeStart) && !m.isAfter(rangeEnd);
    }

    public boolean matchesGrid(ForecastRecord r) {
        return gridIds == null || gridIds.contains(r.gridId());
    }

    public boolean matchesCountry(ForecastRecord r) {
        return countryId == null || countryId.equals(r.countryId());
    }

    public boolean matchesThresholds(ForecastRecord r) {
        for (ThresholdPredicate p : thresholds) {
            if (!p.test(r))
                return false;
        }
        return true;
    }

    /**
     * Builder for {@link QuerySpec}; {@link #build()} validates.
     */
    public static final class Builder {
        private String countryId;
        private Set<Integer> gridIds;
        private Set<YearMonth> months;
        private YearMonth rangeStart;
        private YearMonth rangeEnd;
        private final LinkedHashSet<MetricName> metrics = new LinkedHashSet<>();
        private final List<ThresholdPredicate> thresholds = new ArrayList<>();
        private OutputFormat format = OutputFormat.JSON;
        private boolean fullScan;

        private Builder() {
        }

        public Builder country(String raw) {
            if (raw == null || raw.isBlank()) {
                this.countryId = null;
                return this;
            }
            String code = CountryCode.normalize(raw);
            if (!CountryCode.isValid(code))
                throw new InvalidFilterException(raw, "Invalid country code '" + raw + "' (expected numeric code)");
            this.countryId = code;
            return this;
        }

        /**
         * Restricts to the given grid ids; an empty collection means no grid
         * filter.
         */
        public Builder gridIds(Collection<Integer> ids) {
            this.gridIds = ids == null || ids.isEmpty() ? null : new LinkedHashSet<>(ids);
            return this;
        }

        public Builder gridIds(Integer... ids) {
            return gridIds(Arrays.asList(ids));
        }

        public Builder months(Collection<YearMonth> ms) {
            this.months = ms == null || ms.isEmpty() ? null : new LinkedHashSet<>(ms);
            return this;
        }

        public Builder months(YearMonth... ms) {
            return months(Arrays.asList(ms));
        }

        /**
         * Inclusive range; both ends required.
         */
        public Builder monthRange(YearMonth start, YearMonth end) {
            if (start == null || end == null)
                throw new InvalidFilterException(start + ":" + end, "Month range needs both a start and an end");
            if (end.isBefore(start))
                throw new InvalidFilterException(start + ":" + end,
                        "Month range end " + end + " is before start " + start);
            this.rangeStart = start;
            this.rangeEnd = end;
            return this;
        }

        public Builder metrics(Collection<MetricName> ms) {
            this.metrics.clear();
            if (ms != null)
                this.metrics.addAll(ms);
            return this;
        }

        public Builder metrics(MetricName... ms) {
            return metrics(Arrays.asList(ms));
        }

        public Builder threshold(ThresholdPredicate p) {
            this.thresholds.add(p);
            return this;
        }

        public Builder thresholds(Collection<ThresholdPredicate> ps) {
            this.thresholds.addAll(ps);
            return this;
        }

        public Builder format(OutputFormat f) {
            this.format = f == null ? OutputFormat.JSON : f;
            return this;
        }

        /**
         * Allows a query without any spatial filter.
         */
        public Builder fullScan() {
            this.fullScan = true;
            return this;
        }

        public QuerySpec build() {
            if (countryId == null && gridIds == null && !fullScan)
                throw new InvalidFilterException("",
                        "Query has neither country nor grid_ids; request a full scan explicitly");
            return new QuerySpec(this);
        }
    }
}
