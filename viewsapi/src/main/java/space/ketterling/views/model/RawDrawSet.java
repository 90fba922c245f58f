package space.ketterling.views.model;

import java.time.YearMonth;

/**
 * Posterior fatality-count draws for one grid cell and month.
 *
 * <p>
 * Only lives for the duration of a preparation run. Values are kept as doubles
 * so that malformed input (negative, fractional, NaN) can be reported instead
 * of being lost in a parse.
 * </p>
 */
public record RawDrawSet(int gridId, YearMonth month, double[] draws) {

    public int size() {
        return draws == null ? 0 : draws.length;
    }
}
