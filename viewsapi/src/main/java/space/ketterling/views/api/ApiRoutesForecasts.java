package space.ketterling.views.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.query.ForecastCatalog;
import space.ketterling.views.query.ForecastQueryEngine;
import space.ketterling.views.query.OutputFormat;
import space.ketterling.views.query.QueryParser;
import space.ketterling.views.query.QuerySpec;

import java.time.YearMonth;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast query and summary endpoints.
 */
final class ApiRoutesForecasts {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesForecasts() {
    }

    /**
     * Registers forecast endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ResultStreamer streamer = api.streamer();

        app.get(api.path("/forecasts"), ctx -> {
            QuerySpec q = QueryParser.parse(ctx.queryParamMap());

            if (q.format() == OutputFormat.NDJSON) {
                // records are produced while writing; only the count is computed up front
                ForecastQueryEngine.CountedStream result = api.engine().streamWithCount(q);
                ctx.status(200);
                ctx.contentType(ResultStreamer.NDJSON_CONTENT_TYPE);
                ctx.header("X-Total-Count", String.valueOf(result.total()));
                var written = streamer.writeIncremental(result.records(), ctx.res().getOutputStream(),
                        () -> Thread.currentThread().isInterrupted());
                if (written.outcome() == ResultStreamer.Outcome.CANCELLED)
                    ctx.attribute("ndjsonCancelled", true);
                return;
            }
            List<ForecastRecord> records = api.engine().execute(q);
            ctx.json(streamer.aggregate(records, q));
        });

        app.get(api.path("/forecasts/summary"), ctx -> {
            // summary works on spatial/temporal filters only and always needs map
            Map<String, List<String>> params = new HashMap<>(ctx.queryParamMap());
            params.remove(QueryParser.METRICS);
            params.remove(QueryParser.FORMAT);
            QuerySpec q = QueryParser.parse(params);

            ForecastCatalog.Summary s = ForecastCatalog.summarize(api.engine().execute(q));
            ObjectNode out = om.createObjectNode();
            out.put("count", s.count());
            ArrayNode countries = out.putArray("countries");
            s.countries().forEach(countries::add);
            ArrayNode months = out.putArray("months");
            for (YearMonth m : s.months())
                months.add(m.toString());
            out.put("grid_cells", s.gridCells());
            ObjectNode metrics = out.putObject("metrics_summary");
            metrics.put("avg_map", s.avgMap());
            metrics.put("min_map", s.minMap());
            metrics.put("max_map", s.maxMap());
            ctx.json(out);
        });
    }
}
