package space.ketterling.views.query;

import space.ketterling.views.errors.InvalidFilterException;
import space.ketterling.views.model.MetricName;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw query-string parameters into a {@link QuerySpec}.
 *
 * <p>
 * {@code grid_ids}, {@code months} and {@code metrics} accept repeated
 * parameters as well as comma separated values. Leaving out both
 * {@code country} and {@code grid_ids} selects a full scan. Every failure is
 * raised here, before any backend is touched.
 * </p>
 */
public final class QueryParser {
    public static final String COUNTRY = "country";
    public static final String GRID_IDS = "grid_ids";
    public static final String MONTHS = "months";
    public static final String MONTH_RANGE = "month_range";
    public static final String METRICS = "metrics";
    public static final String METRIC_FILTERS = "metric_filters";
    public static final String FORMAT = "format";

    private static final Pattern MONTH = Pattern.compile("\\d{4}-\\d{2}");

    /**
     * Utility class; no instances.
     */
    private QueryParser() {
    }

    /**
     * Parses the parameter map as delivered by the HTTP layer.
     */
    public static QuerySpec parse(Map<String, List<String>> params) {
        QuerySpec.Builder b = QuerySpec.builder().fullScan();

        b.country(single(params, COUNTRY));
        b.gridIds(parseGridIds(values(params, GRID_IDS)));

        List<YearMonth> months = new ArrayList<>();
        for (String m : values(params, MONTHS)) {
            months.add(parseMonth(m, m));
        }
        b.months(months);

        String range = single(params, MONTH_RANGE);
        if (range != null && !range.isBlank())
            parseMonthRange(b, range.trim());

        b.metrics(parseMetrics(values(params, METRICS)));

        for (String token : rawValues(params, METRIC_FILTERS)) {
            if (!token.isBlank())
                b.threshold(ThresholdPredicate.parse(token));
        }

        b.format(OutputFormat.parse(single(params, FORMAT)));
        return b.build();
    }

    /**
     * Parses {@code YYYY-MM:YYYY-MM} into the builder.
     */
    static void parseMonthRange(QuerySpec.Builder b, String range) {
        String[] parts = range.split(":", -1);
        if (parts.length != 2)
            throw new InvalidFilterException(range, "Invalid month_range '" + range + "' (expected YYYY-MM:YYYY-MM)");
        YearMonth start = parseMonth(parts[0], range);
        YearMonth end = parseMonth(parts[1], range);
        if (end.isBefore(start))
            throw new InvalidFilterException(range, "Invalid month_range '" + range + "': end is before start");
        b.monthRange(start, end);
    }

    static YearMonth parseMonth(String raw, String token) {
        String v = raw == null ? "" : raw.trim();
        if (!MONTH.matcher(v).matches())
            throw new InvalidFilterException(token, "Invalid month '" + raw + "' (expected YYYY-MM)");
        int month = Integer.parseInt(v.substring(5));
        if (month < 1 || month > 12)
            throw new InvalidFilterException(token, "Invalid month '" + raw + "' (expected YYYY-MM)");
        return YearMonth.of(Integer.parseInt(v.substring(0, 4)), month);
    }

    static List<Integer> parseGridIds(List<String> raw) {
        List<Integer> out = new ArrayList<>();
        for (String v : raw) {
            try {
                out.add(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                throw new InvalidFilterException(v, "Invalid grid id '" + v + "'");
            }
        }
        return out;
    }

    static List<MetricName> parseMetrics(List<String> raw) {
        Set<MetricName> out = new LinkedHashSet<>();
        for (String v : raw) {
            out.add(MetricName.fromWire(v)
                    .orElseThrow(() -> new InvalidFilterException(v, "Unknown metric '" + v + "'")));
        }
        return new ArrayList<>(out);
    }

    /**
     * All values of a parameter, comma separated entries split out, blanks
     * dropped.
     */
    private static List<String> values(Map<String, List<String>> params, String name) {
        List<String> out = new ArrayList<>();
        for (String v : rawValues(params, name)) {
            for (String part : v.split(",")) {
                String p = part.trim();
                if (!p.isEmpty())
                    out.add(p);
            }
        }
        return out;
    }

    private static List<String> rawValues(Map<String, List<String>> params, String name) {
        List<String> vs = params.get(name);
        return vs == null ? List.of() : vs;
    }

    private static String single(Map<String, List<String>> params, String name) {
        List<String> vs = rawValues(params, name);
        if (vs.isEmpty())
            return null;
        if (vs.size() > 1)
            throw new InvalidFilterException(String.join(",", vs), "Parameter '" + name + "' given more than once");
        return vs.get(0);
    }
}
