package space.ketterling.views.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.testtools.JavalinTest;
import space.ketterling.views.cache.SnapshotCache;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.query.ForecastQueryEngine;
import space.ketterling.views.query.QuerySpec;
import space.ketterling.views.testsupport.Forecasts;

@Tag("integration")
class ApiServerTest {

    private final ObjectMapper om = new ObjectMapper();
    private Forecasts.MemoryBackend backend;

    @BeforeEach
    void setUp() {
        backend = new Forecasts.MemoryBackend("memory:api", Forecasts.smallSet());
    }

    private static AppConfig config(String apiKey) {
        Properties p = new Properties();
        p.setProperty("api.prefix", "/api/v1");
        p.setProperty("api.key", apiKey);
        return AppConfig.fromProperties(p);
    }

    private ApiServer server(AppConfig cfg) {
        return new ApiServer(cfg, om, new ForecastQueryEngine(backend, new SnapshotCache(Duration.ofHours(1))));
    }

    @Test
    void healthDoesNotTouchTheBackend() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            var res = client.get("/health");

            assertThat(res.code()).isEqualTo(200);
            JsonNode body = om.readTree(res.body().string());
            assertThat(body.get("status").asText()).isEqualTo("ok");
            assertThat(body.get("backend").asText()).isEqualTo("memory:api");
            assertThat(body.get("cache_generation").asLong()).isZero();
            assertThat(backend.loads()).isZero();
        });
    }

    @Test
    void rootListsEndpoints() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            JsonNode body = om.readTree(client.get("/").body().string());

            assertThat(body.get("service").asText()).isEqualTo("views-forecast-api");
            assertThat(body.get("endpoints").toString()).contains("/api/v1/forecasts");
        });
    }

    @Test
    void forecastsAsJson() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts?grid_ids=1,2&metrics=map");

            assertThat(res.code()).isEqualTo(200);
            JsonNode body = om.readTree(res.body().string());
            assertThat(body.get("count").asInt()).isEqualTo(6);
            assertThat(body.get("data").get(0).get("metrics").size()).isEqualTo(1);
            assertThat(body.get("query").get("grid_ids").size()).isEqualTo(2);
        });
    }

    @Test
    void forecastsAsNdjson() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts?country=404&format=ndjson");

            assertThat(res.code()).isEqualTo(200);
            assertThat(res.header("Content-Type")).startsWith("application/x-ndjson");
            assertThat(res.header("X-Total-Count")).isEqualTo("6");
            String[] lines = res.body().string().split("\n");
            assertThat(lines).hasSize(6);
            assertThat(om.readTree(lines[0]).get("country_id").asText()).isEqualTo("404");
        });
    }

    @Test
    void ndjsonIsProducedWhileWritingNotCollectedFirst() {
        ForecastQueryEngine engine = spy(new ForecastQueryEngine(backend, new SnapshotCache(Duration.ofHours(1))));
        ApiServer api = new ApiServer(config(""), om, engine);

        JavalinTest.test(api.createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts?country=800&metrics=map&format=ndjson");

            assertThat(res.code()).isEqualTo(200);
            assertThat(res.header("X-Total-Count")).isEqualTo("12");
            String[] lines = res.body().string().split("\n");
            assertThat(lines).hasSize(12);
            assertThat(om.readTree(lines[11]).get("metrics").size()).isEqualTo(1);
        });

        verify(engine).streamWithCount(any(QuerySpec.class));
        verify(engine, never()).execute(any(QuerySpec.class));
        assertThat(backend.loads()).isEqualTo(1);
    }

    @Test
    void invalidFilterIs400WithToken() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts?month_range=2025-10:2025-08");

            assertThat(res.code()).isEqualTo(400);
            JsonNode body = om.readTree(res.body().string());
            assertThat(body.get("error").asText()).isEqualTo("invalid_filter");
            assertThat(body.get("token").asText()).isEqualTo("2025-10:2025-08");
            assertThat(backend.loads()).isZero();
        });
    }

    @Test
    void backendFailureIs503() {
        Forecasts.MemoryBackend failing = new Forecasts.MemoryBackend("memory:down", List.of()) {
            @Override
            public List<ForecastRecord> loadAll() {
                throw new BackendUnavailableException(id(), "load on memory:down failed", null);
            }
        };
        ApiServer api = new ApiServer(config(""), om,
                new ForecastQueryEngine(failing, new SnapshotCache(Duration.ofHours(1))));

        JavalinTest.test(api.createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts");

            assertThat(res.code()).isEqualTo(503);
            assertThat(om.readTree(res.body().string()).get("error").asText()).isEqualTo("backend_unavailable");
        });
    }

    @Test
    void apiKeyIsRequiredUnderPrefixOnly() {
        JavalinTest.test(server(config("s3cret")).createApp(), (srv, client) -> {
            var denied = client.get("/api/v1/forecasts");
            assertThat(denied.code()).isEqualTo(401);
            assertThat(om.readTree(denied.body().string()).get("error").asText()).isEqualTo("unauthorized");

            var wrong = client.get("/api/v1/forecasts", req -> req.header(ApiServer.API_KEY_HEADER, "nope"));
            assertThat(wrong.code()).isEqualTo(401);

            var ok = client.get("/api/v1/metadata/countries", req -> req.header(ApiServer.API_KEY_HEADER, "s3cret"));
            assertThat(ok.code()).isEqualTo(200);
            assertThat(om.readTree(ok.body().string()).get("countries").size()).isEqualTo(2);

            assertThat(client.get("/health").code()).isEqualTo(200);
        });
    }

    @Test
    void summaryIgnoresMetricsParameter() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            var res = client.get("/api/v1/forecasts/summary?country=800&metrics=prob_1");

            assertThat(res.code()).isEqualTo(200);
            JsonNode body = om.readTree(res.body().string());
            assertThat(body.get("count").asInt()).isEqualTo(12);
            assertThat(body.get("grid_cells").asInt()).isEqualTo(4);
            assertThat(body.get("metrics_summary").get("min_map").asDouble()).isEqualTo(11.0);
            assertThat(body.get("metrics_summary").get("max_map").asDouble()).isEqualTo(43.0);
        });
    }

    @Test
    void metadataEndpoints() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            JsonNode months = om.readTree(client.get("/api/v1/metadata/months").body().string());
            assertThat(months.get("count").asInt()).isEqualTo(3);
            assertThat(months.get("data").get(0).get("month").asText()).isEqualTo("2024-01");

            JsonNode cells = om.readTree(client.get("/api/v1/metadata/grid-cells?country=404").body().string());
            assertThat(cells.get("count").asInt()).isEqualTo(2);
            assertThat(cells.get("countries").isNull()).isTrue();

            var bad = client.get("/api/v1/metadata/grid-cells?country=abc");
            assertThat(bad.code()).isEqualTo(400);
        });
    }

    @Test
    void cacheClearForcesReload() {
        JavalinTest.test(server(config("")).createApp(), (srv, client) -> {
            client.get("/api/v1/forecasts?grid_ids=1");
            assertThat(backend.loads()).isEqualTo(1);

            var res = client.post("/api/v1/cache/clear");
            assertThat(res.code()).isEqualTo(200);

            client.get("/api/v1/forecasts?grid_ids=1");
            assertThat(backend.loads()).isEqualTo(2);
        });
    }
}
