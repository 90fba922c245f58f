package space.ketterling.views.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;
import space.ketterling.views.query.QuerySpec;
import space.ketterling.views.query.ThresholdPredicate;

import java.io.IOException;
import java.io.OutputStream;
import java.time.YearMonth;
import java.util.Iterator;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

/**
 * Renders query results either as one JSON document or as NDJSON, one record
 * per line with a flush after each.
 */
public final class ResultStreamer {
    private static final Logger log = LoggerFactory.getLogger(ResultStreamer.class);

    public static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    private final ObjectMapper om;

    public ResultStreamer(ObjectMapper om) {
        this.om = om;
    }

    /**
     * How an incremental write ended.
     */
    public enum Outcome {
        COMPLETED,
        CANCELLED
    }

    public record StreamResult(Outcome outcome, long written) {
    }

    /**
     * {@code {data: [...], count, query: {...}}}.
     */
    public ObjectNode aggregate(List<ForecastRecord> records, QuerySpec q) {
        ObjectNode out = om.createObjectNode();
        ArrayNode data = out.putArray("data");
        for (ForecastRecord r : records) {
            data.add(recordJson(r));
        }
        out.put("count", records.size());
        out.set("query", echo(q));
        return out;
    }

    /**
     * Writes one JSON line per record until the records run out, the client
     * goes away or {@code cancelled} turns true. The stream is closed in every
     * case.
     */
    public StreamResult writeIncremental(Stream<ForecastRecord> records, OutputStream out, BooleanSupplier cancelled) {
        long written = 0;
        try (records) {
            Iterator<ForecastRecord> it = records.iterator();
            while (it.hasNext()) {
                if (cancelled.getAsBoolean()) {
                    log.info("NDJSON stream cancelled after {} records", written);
                    return new StreamResult(Outcome.CANCELLED, written);
                }
                byte[] line = line(it.next());
                try {
                    out.write(line);
                    out.flush();
                } catch (IOException e) {
                    log.info("NDJSON client went away after {} records: {}", written, e.getMessage());
                    return new StreamResult(Outcome.CANCELLED, written);
                }
                written++;
            }
        }
        return new StreamResult(Outcome.COMPLETED, written);
    }

    /**
     * Wire shape of one record.
     */
    public ObjectNode recordJson(ForecastRecord r) {
        ObjectNode row = om.createObjectNode();
        row.put("grid_id", r.gridId());
        row.put("latitude", r.latitude());
        row.put("longitude", r.longitude());
        row.put("country_id", r.countryId());
        row.put("admin_1_id", r.admin1Id());
        row.put("admin_2_id", r.admin2Id());
        row.put("month", r.month().toString());
        ObjectNode metrics = row.putObject("metrics");
        for (var e : r.metrics().asMap().entrySet()) {
            // stored at float precision; print it that way
            metrics.put(e.getKey().wireName(), e.getValue().floatValue());
        }
        return row;
    }

    /**
     * Echo of the effective query; absent filters are left out.
     */
    public ObjectNode echo(QuerySpec q) {
        ObjectNode out = om.createObjectNode();
        if (q.countryId() != null)
            out.put("country", q.countryId());
        if (q.gridIds() != null) {
            ArrayNode ids = out.putArray("grid_ids");
            for (int id : q.gridIds())
                ids.add(id);
        }
        if (q.months() != null) {
            ArrayNode ms = out.putArray("months");
            for (YearMonth m : q.months())
                ms.add(m.toString());
        }
        if (q.hasMonthRange())
            out.put("month_range", q.rangeStart() + ":" + q.rangeEnd());
        ArrayNode metrics = out.putArray("metrics");
        for (MetricName m : q.metrics())
            metrics.add(m.wireName());
        if (!q.thresholds().isEmpty()) {
            ArrayNode filters = out.putArray("metric_filters");
            for (ThresholdPredicate p : q.thresholds())
                filters.add(p.toString());
        }
        out.put("format", q.format().wireName());
        if (q.isFullScan())
            out.put("scan", "full");
        return out;
    }

    private byte[] line(ForecastRecord r) {
        try {
            byte[] json = om.writeValueAsBytes(recordJson(r));
            byte[] out = new byte[json.length + 1];
            System.arraycopy(json, 0, out, 0, json.length);
            out[json.length] = '\n';
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize record " + r.key(), e);
        }
    }
}
