package space.ketterling.views.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.views.query.ForecastCatalog;

import java.util.List;
import java.util.TreeSet;

/**
 * Metadata endpoints: available months, grid cells and countries.
 */
final class ApiRoutesMetadata {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetadata() {
    }

    /**
     * Registers metadata endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ForecastCatalog catalog = api.catalog();

        app.get(api.path("/metadata/months"), ctx -> {
            List<ForecastCatalog.MonthInfo> months = catalog.availableMonths();
            ObjectNode out = om.createObjectNode();
            ArrayNode data = out.putArray("data");
            for (var m : months) {
                ObjectNode row = om.createObjectNode();
                row.put("month", m.month().toString());
                row.put("forecast_count", m.forecastCount());
                ArrayNode cs = row.putArray("countries");
                m.countries().forEach(cs::add);
                data.add(row);
            }
            out.put("count", months.size());
            ctx.json(out);
        });

        app.get(api.path("/metadata/grid-cells"), ctx -> {
            String country = ctx.queryParam("country");
            List<ForecastCatalog.GridCell> cells = catalog.gridCells(country);
            ObjectNode out = om.createObjectNode();
            ArrayNode data = out.putArray("data");
            TreeSet<String> countries = new TreeSet<>();
            for (var c : cells) {
                ObjectNode row = om.createObjectNode();
                row.put("grid_id", c.gridId());
                row.put("latitude", c.latitude());
                row.put("longitude", c.longitude());
                row.put("country_id", c.countryId());
                row.put("admin_1_id", c.admin1Id());
                row.put("admin_2_id", c.admin2Id());
                data.add(row);
                if (c.countryId() != null)
                    countries.add(c.countryId());
            }
            out.put("count", cells.size());
            if (country == null || country.isBlank()) {
                ArrayNode cs = out.putArray("countries");
                countries.forEach(cs::add);
            } else {
                out.putNull("countries");
            }
            ctx.json(out);
        });

        app.get(api.path("/metadata/countries"), ctx -> {
            List<String> countries = catalog.countries();
            ObjectNode out = om.createObjectNode();
            ArrayNode cs = out.putArray("countries");
            countries.forEach(cs::add);
            out.put("count", countries.size());
            ctx.json(out);
        });
    }
}
