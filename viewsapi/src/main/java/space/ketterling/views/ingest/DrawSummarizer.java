package space.ketterling.views.ingest;

import space.ketterling.views.errors.DataException;
import space.ketterling.views.model.ForecastMetrics;
import space.ketterling.views.model.MetricName;
import space.ketterling.views.model.RawDrawSet;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * Turns posterior fatality draws into the 13 published metrics.
 *
 * <p>
 * {@code map} is the median. Interval bounds at level L are the empirical
 * quantiles at (1-L)/2 and 1-(1-L)/2, using linear interpolation at position
 * q*(n-1) of the sorted draws. {@code prob_T} for T >= 1 is the share of
 * draws >= T.
 * </p>
 *
 * <p>
 * {@code prob_0} does not follow that rule: it is the probability of no
 * fatalities, the share of draws equal to 0 (so {@code prob_0 = 1 - prob_1}).
 * Read as "draws >= 0" it would always be 1.
 * </p>
 *
 * <p>
 * Every metric is rounded to float precision, which is what the storage
 * formats keep.
 * </p>
 */
public final class DrawSummarizer {
    /**
     * Utility class; no instances.
     */
    private DrawSummarizer() {
    }

    /**
     * Summarizes one draw set.
     *
     * @throws DataException for an empty set or a draw that is not a finite,
     *                       non-negative integer
     */
    public static ForecastMetrics summarize(RawDrawSet set) {
        double[] draws = set.draws();
        if (draws == null || draws.length == 0)
            throw new DataException(set.gridId(), set.month(), "no draws");
        for (int i = 0; i < draws.length; i++) {
            double d = draws[i];
            if (!Double.isFinite(d) || d < 0 || d != Math.rint(d))
                throw new DataException(set.gridId(), set.month(),
                        "draw #" + i + " is " + d + " (expected a non-negative integer count)");
        }

        double[] sorted = draws.clone();
        Arrays.sort(sorted);

        Map<MetricName, Double> out = new EnumMap<>(MetricName.class);
        out.put(MetricName.MAP, f32(quantile(sorted, 0.5)));
        for (MetricName m : MetricName.values()) {
            if (m.kind() != MetricName.Kind.INTERVAL_LOW)
                continue;
            double tail = (1.0 - m.level()) / 2.0;
            double low = quantile(sorted, tail);
            double high = Math.max(low, quantile(sorted, 1.0 - tail));
            out.put(m, f32(low));
            out.put(m.intervalPartner().orElseThrow(), f32(high));
        }
        for (MetricName m : MetricName.values()) {
            if (m.isProbability())
                out.put(m, f32(probability(sorted, m.threshold())));
        }
        return ForecastMetrics.of(out);
    }

    /**
     * Empirical quantile of sorted values, linear interpolation between the
     * closest ranks.
     */
    static double quantile(double[] sorted, double q) {
        if (sorted.length == 1)
            return sorted[0];
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(lo + 1, sorted.length - 1);
        double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    /**
     * Share of draws at or above {@code threshold}; for 0, share of draws
     * equal to 0.
     */
    private static double probability(double[] sorted, int threshold) {
        long hits = 0;
        for (double d : sorted) {
            if (threshold == 0 ? d == 0 : d >= threshold)
                hits++;
        }
        return (double) hits / sorted.length;
    }

    private static double f32(double v) {
        return (float) v;
    }
}
