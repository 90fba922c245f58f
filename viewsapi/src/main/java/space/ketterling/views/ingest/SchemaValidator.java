package space.ketterling.views.ingest;

import space.ketterling.views.errors.SchemaException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Checks a batch before it is published. All records are checked and every
 * violation is reported together.
 */
public final class SchemaValidator {
    /**
     * Utility class; no instances.
     */
    private SchemaValidator() {
    }

    /**
     * Returns the batch unchanged or throws listing every violation.
     */
    public static List<ForecastRecord> validate(List<ForecastRecord> batch) {
        List<String> violations = new ArrayList<>();
        Set<ForecastRecord.Key> seen = new HashSet<>();
        for (int i = 0; i < batch.size(); i++) {
            ForecastRecord r = batch.get(i);
            if (r == null) {
                violations.add("row " + i + ": null record");
                continue;
            }
            checkRecord(i, r, violations);
            if (r.month() != null && !seen.add(r.key()))
                violations.add("row " + i + " " + r.key() + ": duplicate (grid_id, month)");
        }
        if (!violations.isEmpty())
            throw new SchemaException(violations);
        return batch;
    }

    private static void checkRecord(int i, ForecastRecord r, List<String> violations) {
        String at = "row " + i + " grid_id=" + r.gridId() + " month=" + r.month() + ": ";
        if (r.month() == null)
            violations.add(at + "missing month");
        if (!Double.isFinite(r.latitude()) || r.latitude() < -90 || r.latitude() > 90)
            violations.add(at + "latitude " + r.latitude() + " outside [-90, 90]");
        if (!Double.isFinite(r.longitude()) || r.longitude() < -180 || r.longitude() > 180)
            violations.add(at + "longitude " + r.longitude() + " outside [-180, 180]");
        if (r.countryId() != null && !CountryCode.isValid(r.countryId()))
            violations.add(at + "country_id '" + r.countryId() + "' is not a 3 digit code");
        if (r.metrics() == null) {
            violations.add(at + "missing metrics");
            return;
        }

        for (MetricName m : MetricName.values()) {
            OptionalDouble v = r.metrics().get(m);
            if (v.isEmpty()) {
                violations.add(at + "missing " + m);
                continue;
            }
            double d = v.getAsDouble();
            if (!Double.isFinite(d))
                violations.add(at + m + " is not finite");
            else if (d < 0)
                violations.add(at + m + "=" + d + " is negative");
            else if (m.isProbability() && d > 1)
                violations.add(at + m + "=" + d + " is above 1");
        }

        for (MetricName m : MetricName.values()) {
            if (m.kind() != MetricName.Kind.INTERVAL_LOW)
                continue;
            MetricName high = m.intervalPartner().orElseThrow();
            OptionalDouble lo = r.metrics().get(m);
            OptionalDouble hi = r.metrics().get(high);
            if (lo.isPresent() && hi.isPresent() && lo.getAsDouble() > hi.getAsDouble())
                violations.add(at + m + "=" + lo.getAsDouble() + " > " + high + "=" + hi.getAsDouble());
        }
    }
}
