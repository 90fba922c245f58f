/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for the VIEWS forecast API, a read-only service over
* pre-summarized conflict fatality forecasts.
*
* Loads configuration, builds the configured storage backend and the snapshot cache,
* then starts the API server. The shutdown hook stops the server and releases the
* backend (connection pool or object storage client).
*/

package space.ketterling.views;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.api.ApiServer;
import space.ketterling.views.cache.SnapshotCache;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.query.ForecastQueryEngine;
import space.ketterling.views.storage.BackendFactory;
import space.ketterling.views.storage.ForecastBackend;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = new ObjectMapper();
        ForecastBackend backend = BackendFactory.create(cfg, "api");
        SnapshotCache cache = new SnapshotCache(cfg.cacheTtl());
        ForecastQueryEngine engine = new ForecastQueryEngine(backend, cache);

        ApiServer api = new ApiServer(cfg, om, engine);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        // Warm the cache so the first request doesn't pay for the load
        Thread warmup = new Thread(() -> {
            try {
                org.slf4j.MDC.put("job", "startup-warmup");
                log.info("Loaded {} forecasts from {}", engine.snapshot().size(), backend.id());
            } catch (Exception e) {
                log.warn("Startup cache warmup failed; first request will retry", e);
            } finally {
                org.slf4j.MDC.remove("job");
            }
        }, "startup-warmup");
        warmup.setDaemon(true);
        warmup.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                backend.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
