package space.ketterling.views.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.javalin.http.HttpResponseException;
import io.javalin.http.UnauthorizedResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.errors.InvalidFilterException;
import space.ketterling.views.query.ForecastCatalog;
import space.ketterling.views.query.ForecastQueryEngine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * HTTP surface of the forecast service.
 *
 * <p>
 * Routes live in the {@code ApiRoutes*} classes; this class owns the Javalin
 * instance, request logging, the API key check and the error mapping.
 * </p>
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final String API_KEY_HEADER = "X-API-Key";

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ForecastQueryEngine engine;
    private final ForecastCatalog catalog;
    private final ResultStreamer streamer;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, ForecastQueryEngine engine) {
        this.cfg = cfg;
        this.om = om;
        this.engine = engine;
        this.catalog = new ForecastCatalog(engine);
        this.streamer = new ResultStreamer(om);
    }

    /**
     * Builds the app with every route registered, without binding a port.
     */
    public Javalin createApp() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
            ctx.header("Access-Control-Max-Age", "600");
            checkApiKey(ctx);
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(InvalidFilterException.class, (e, ctx) -> {
            log.info("Rejected {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(400).json(om.createObjectNode()
                    .put("error", e.errorCode())
                    .put("message", e.getMessage())
                    .put("token", e.token()));
        });

        app.exception(BackendUnavailableException.class, (e, ctx) -> {
            log.error("Backend unavailable on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(503).json(om.createObjectNode()
                    .put("error", e.errorCode())
                    .put("message", e.getMessage()));
        });

        app.exception(HttpResponseException.class, (e, ctx) -> {
            ctx.status(e.getStatus()).json(om.createObjectNode()
                    .put("error", e.getStatus() == 401 ? "unauthorized" : "http_" + e.getStatus())
                    .put("message", e.getMessage()));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesForecasts.register(this);
        ApiRoutesMetadata.register(this);
        ApiRoutesMetrics.register(this);
        return app;
    }

    public void start() {
        log.info("Starting API server on port {} prefix='{}' apiKey={}", cfg.apiPort(), cfg.apiPrefix(),
                cfg.apiKeyRequired() ? "required" : "off");
        createApp().start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    AppConfig cfg() {
        return cfg;
    }

    ForecastQueryEngine engine() {
        return engine;
    }

    ForecastCatalog catalog() {
        return catalog;
    }

    ResultStreamer streamer() {
        return streamer;
    }

    /**
     * Prefixed route path, e.g. {@code /api/v1/forecasts}.
     */
    String path(String suffix) {
        return cfg.apiPrefix() + suffix;
    }

    /**
     * Everything under the API prefix needs the key when one is configured;
     * {@code /} and {@code /health} never do.
     */
    private void checkApiKey(Context ctx) {
        if (!cfg.apiKeyRequired() || ctx.method() == HandlerType.OPTIONS)
            return;
        String p = ctx.path();
        if (p.equals("/") || p.equals("/health"))
            return;
        String prefix = cfg.apiPrefix();
        if (!prefix.isEmpty() && !p.equals(prefix) && !p.startsWith(prefix + "/"))
            return;
        String given = ctx.header(API_KEY_HEADER);
        if (given == null || !MessageDigest.isEqual(given.getBytes(StandardCharsets.UTF_8),
                cfg.apiKey().getBytes(StandardCharsets.UTF_8)))
            throw new UnauthorizedResponse("Missing or invalid " + API_KEY_HEADER + " header");
    }
}
