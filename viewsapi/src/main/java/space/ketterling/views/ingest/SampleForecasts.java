package space.ketterling.views.ingest;

import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.RawDrawSet;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic sample forecasts for local development.
 *
 * <p>
 * Draws are generated from a seeded zero-inflated log-normal per cell and
 * month and then go through the regular summarizer, so sample data satisfies
 * the same checks as prepared data.
 * </p>
 */
public final class SampleForecasts {
    public static final long DEFAULT_SEED = 42L;
    public static final YearMonth FIRST_MONTH = YearMonth.of(2024, 1);
    public static final int MONTHS = 6;
    public static final int CELLS_PER_COUNTRY = 6;
    static final int DRAWS_PER_SET = 200;

    private static final List<Country> COUNTRIES = List.of(
            new Country("800", 1.37, 32.29, 4.0),
            new Country("404", -0.02, 37.91, 2.5),
            new Country("834", -6.37, 34.89, 1.0),
            new Country("231", 9.14, 40.49, 6.0),
            new Country("646", -1.94, 29.87, 0.5),
            new Country("108", -3.37, 29.92, 1.5));

    private record Country(String code, double lat, double lon, double baseIntensity) {
    }

    /**
     * Utility class; no instances.
     */
    private SampleForecasts() {
    }

    /**
     * Grid cells of the sample data set; ids are 1..36, grouped by country.
     */
    public static Map<Integer, GridCellMetadata> cells() {
        Map<Integer, GridCellMetadata> out = new LinkedHashMap<>();
        int gridId = 1;
        for (Country c : COUNTRIES) {
            for (int i = 0; i < CELLS_PER_COUNTRY; i++) {
                // 0.5 degree grid around the centroid
                double cellLat = c.lat() + (i / 3) * 0.5;
                double cellLon = c.lon() + (i % 3) * 0.5;
                out.put(gridId, new GridCellMetadata(gridId, cellLat, cellLon, c.code(), null, null));
                gridId++;
            }
        }
        return out;
    }

    /**
     * Raw draws for every sample cell and month.
     */
    public static List<RawDrawSet> draws(long seed) {
        Random rnd = new Random(seed);
        List<RawDrawSet> out = new ArrayList<>();
        int gridId = 1;
        for (Country c : COUNTRIES) {
            double base = c.baseIntensity();
            for (int i = 0; i < CELLS_PER_COUNTRY; i++) {
                double cellIntensity = base * (0.25 + rnd.nextDouble() * 1.5);
                for (int m = 0; m < MONTHS; m++) {
                    double intensity = cellIntensity * (0.8 + rnd.nextDouble() * 0.4);
                    double zeroShare = 1.0 / (1.0 + intensity);
                    double[] draws = new double[DRAWS_PER_SET];
                    for (int d = 0; d < draws.length; d++) {
                        if (rnd.nextDouble() < zeroShare)
                            draws[d] = 0;
                        else
                            draws[d] = Math.floor(Math.exp(rnd.nextGaussian() * 1.2 + Math.log1p(intensity)));
                    }
                    out.add(new RawDrawSet(gridId, FIRST_MONTH.plusMonths(m), draws));
                }
                gridId++;
            }
        }
        return out;
    }

    /**
     * Summarized sample records.
     */
    public static List<ForecastRecord> records(long seed) {
        return ForecastPreparation.summarize(draws(seed), cells());
    }
}
