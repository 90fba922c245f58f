package space.ketterling.views.query;

import space.ketterling.views.errors.InvalidFilterException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Metadata views over the current snapshot: months, grid cells, countries and
 * result summaries.
 */
public final class ForecastCatalog {
    private final ForecastQueryEngine engine;

    public ForecastCatalog(ForecastQueryEngine engine) {
        this.engine = engine;
    }

    /**
     * Forecast count and covered countries for one month.
     */
    public record MonthInfo(YearMonth month, long forecastCount, List<String> countries) {
    }

    /**
     * Static attributes of one grid cell.
     */
    public record GridCell(int gridId, double latitude, double longitude, String countryId, String admin1Id,
            String admin2Id) {
    }

    /**
     * Aggregates of a result set; map statistics are rounded to 2 decimals.
     */
    public record Summary(long count, List<String> countries, List<YearMonth> months, long gridCells,
            double avgMap, double minMap, double maxMap) {
    }

    /**
     * Every month in the snapshot, ascending.
     */
    public List<MonthInfo> availableMonths() {
        Map<YearMonth, long[]> counts = new TreeMap<>();
        Map<YearMonth, Set<String>> countries = new TreeMap<>();
        for (ForecastRecord r : engine.snapshot().records()) {
            counts.computeIfAbsent(r.month(), k -> new long[1])[0]++;
            Set<String> cs = countries.computeIfAbsent(r.month(), k -> new TreeSet<>());
            if (r.countryId() != null)
                cs.add(r.countryId());
        }
        List<MonthInfo> out = new ArrayList<>();
        for (var e : counts.entrySet()) {
            out.add(new MonthInfo(e.getKey(), e.getValue()[0], List.copyOf(countries.get(e.getKey()))));
        }
        return out;
    }

    /**
     * Distinct grid cells ordered by id, optionally for one country.
     */
    public List<GridCell> gridCells(String country) {
        String code = null;
        if (country != null && !country.isBlank()) {
            code = CountryCode.normalize(country);
            if (!CountryCode.isValid(code))
                throw new InvalidFilterException(country, "Invalid country code '" + country + "'");
        }
        Map<Integer, GridCell> cells = new LinkedHashMap<>();
        // snapshot is sorted by grid id, so insertion order is id order
        for (ForecastRecord r : engine.snapshot().records()) {
            if (code != null && !code.equals(r.countryId()))
                continue;
            cells.putIfAbsent(r.gridId(), new GridCell(r.gridId(), r.latitude(), r.longitude(), r.countryId(),
                    r.admin1Id(), r.admin2Id()));
        }
        return new ArrayList<>(cells.values());
    }

    /**
     * Sorted distinct country codes.
     */
    public List<String> countries() {
        Set<String> out = new TreeSet<>();
        for (ForecastRecord r : engine.snapshot().records()) {
            if (r.countryId() != null)
                out.add(r.countryId());
        }
        return List.copyOf(out);
    }

    /**
     * Summarizes a result list. Records without {@code map} are counted but
     * do not contribute to the map statistics.
     */
    public static Summary summarize(List<ForecastRecord> records) {
        Set<String> countries = new TreeSet<>();
        Set<YearMonth> months = new TreeSet<>();
        Set<Integer> grids = new HashSet<>();
        double total = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int withMap = 0;
        for (ForecastRecord r : records) {
            if (r.countryId() != null)
                countries.add(r.countryId());
            months.add(r.month());
            grids.add(r.gridId());
            OptionalDouble map = r.metrics().get(MetricName.MAP);
            if (map.isPresent()) {
                double v = map.getAsDouble();
                total += v;
                min = Math.min(min, v);
                max = Math.max(max, v);
                withMap++;
            }
        }
        if (withMap == 0)
            return new Summary(records.size(), List.copyOf(countries), List.copyOf(months), grids.size(), 0.0, 0.0,
                    0.0);
        return new Summary(records.size(), List.copyOf(countries), List.copyOf(months), grids.size(),
                round2(total / withMap), round2(min), round2(max));
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
