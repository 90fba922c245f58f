package space.ketterling.views.api;

import io.javalin.Javalin;
import space.ketterling.views.config.AppConfig;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service info and health check. Neither needs the API key.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        AppConfig cfg = api.cfg();

        app.get("/", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("service", "views-forecast-api");
            out.put("status", "ok");
            out.put("endpoints", List.of(
                    "GET /health",
                    "GET " + api.path("/forecasts") + "?country=800&month_range=2024-01:2024-03",
                    "GET " + api.path("/forecasts") + "?grid_ids=1,2&metrics=map&format=ndjson",
                    "GET " + api.path("/forecasts/summary"),
                    "GET " + api.path("/metadata/months"),
                    "GET " + api.path("/metadata/grid-cells") + "?country=800",
                    "GET " + api.path("/metadata/countries"),
                    "GET " + api.path("/metrics/backends"),
                    "POST " + api.path("/cache/clear")));
            out.put("auth", cfg.apiKeyRequired() ? "X-API-Key header" : "none");
            ctx.json(out);
        });

        // does not touch the backend; generation 0 means nothing loaded yet
        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            out.put("backend", api.engine().backendId());
            out.put("cache_generation", api.engine().cacheGeneration());
            ctx.json(out);
        });
    }
}
