package space.ketterling.views.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.views.metrics.BackendCallMetrics;

/**
 * Backend call metrics and the operator cache hook.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers metric and cache endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        // rolling 60 minutes, one row per backend + operation
        app.get(api.path("/metrics/backends"), ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", BackendCallMetrics.windowMinutes());
            ArrayNode backends = out.putArray("backends");
            for (var e : BackendCallMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("backend", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("avg_ms", snap.avgMs());
                row.put("status", snap.status());
                backends.add(row);
            }
            ctx.json(out);
        });

        app.post(api.path("/cache/clear"), ctx -> {
            api.engine().invalidate();
            ctx.json(om.createObjectNode()
                    .put("status", "cleared")
                    .put("backend", api.engine().backendId()));
        });
    }
}
