package space.ketterling.views.ingest;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.errors.DataException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.RawDrawSet;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads raw draws and grid cell metadata from CSV files (optionally gzipped).
 *
 * <p>
 * Draws are in long format, one draw per line:
 * {@code grid_id,month,draw}, optionally followed by
 * {@code latitude,longitude,country_id,admin_1_id,admin_2_id}. Metadata files
 * carry {@code grid_id,latitude,longitude,country_id,admin_1_id,admin_2_id}.
 * Columns are matched by header name.
 * </p>
 */
public final class DrawCsvReader {
    private static final Logger log = LoggerFactory.getLogger(DrawCsvReader.class);

    /**
     * Utility class; no instances.
     */
    private DrawCsvReader() {
    }

    /**
     * Draw sets in first-seen order plus any cell metadata found inline.
     */
    public record DrawInput(List<RawDrawSet> drawSets, Map<Integer, GridCellMetadata> cells) {
    }

    /**
     * Reads a long-format draws file.
     */
    public static DrawInput readDraws(Path path) throws IOException {
        Map<ForecastRecord.Key, List<Double>> draws = new LinkedHashMap<>();
        Map<Integer, GridCellMetadata> cells = new LinkedHashMap<>();
        long lines = 0;

        try (BufferedReader br = open(path)) {
            Map<String, Integer> idx = readHeader(br, path, "GRID_ID", "MONTH", "DRAW");
            boolean inlineCells = idx.containsKey("LATITUDE") && idx.containsKey("LONGITUDE");
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank())
                    continue;
                var cols = parseCsvLine(line);
                int gridId = parseGridId(getCol(cols, idx, "GRID_ID"), path, lineNo);
                YearMonth month = parseMonth(getCol(cols, idx, "MONTH"), gridId, path, lineNo);
                String rawDraw = getCol(cols, idx, "DRAW");
                double draw;
                try {
                    draw = Double.parseDouble(rawDraw == null ? "" : rawDraw.trim());
                } catch (NumberFormatException e) {
                    throw new DataException(gridId, month,
                            path.getFileName() + " line " + lineNo + ": draw '" + rawDraw + "' is not a number");
                }

                draws.computeIfAbsent(new ForecastRecord.Key(gridId, month), k -> new ArrayList<>()).add(draw);
                if (inlineCells && !cells.containsKey(gridId))
                    cells.put(gridId, cellFrom(cols, idx, gridId, path, lineNo));
                lines++;
            }
        }

        List<RawDrawSet> sets = new ArrayList<>(draws.size());
        for (var e : draws.entrySet()) {
            double[] values = new double[e.getValue().size()];
            for (int i = 0; i < values.length; i++)
                values[i] = e.getValue().get(i);
            sets.add(new RawDrawSet(e.getKey().gridId(), e.getKey().month(), values));
        }
        log.info("Read {} draws into {} draw sets from {} (inline cells={})", lines, sets.size(), path,
                cells.size());
        return new DrawInput(sets, cells);
    }

    /**
     * Reads a grid cell metadata file keyed by grid id.
     */
    public static Map<Integer, GridCellMetadata> readMetadata(Path path) throws IOException {
        Map<Integer, GridCellMetadata> cells = new LinkedHashMap<>();
        try (BufferedReader br = open(path)) {
            Map<String, Integer> idx = readHeader(br, path, "GRID_ID", "LATITUDE", "LONGITUDE");
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank())
                    continue;
                var cols = parseCsvLine(line);
                int gridId = parseGridId(getCol(cols, idx, "GRID_ID"), path, lineNo);
                cells.put(gridId, cellFrom(cols, idx, gridId, path, lineNo));
            }
        }
        log.info("Read metadata for {} grid cells from {}", cells.size(), path);
        return cells;
    }

    private static BufferedReader open(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".gz"))
            in = new GzipCompressorInputStream(in);
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    private static Map<String, Integer> readHeader(BufferedReader br, Path path, String... required)
            throws IOException {
        String headerLine = br.readLine();
        if (headerLine == null)
            throw new DataException(null, null, path.getFileName() + " is empty");
        if (headerLine.startsWith("\uFEFF"))
            headerLine = headerLine.substring(1);
        Map<String, Integer> idx = new HashMap<>();
        var header = parseCsvLine(headerLine);
        for (int i = 0; i < header.size(); i++)
            idx.put(header.get(i).trim().toUpperCase(Locale.ROOT), i);
        List<String> missing = new ArrayList<>();
        for (String r : required) {
            if (!idx.containsKey(r))
                missing.add(r.toLowerCase(Locale.ROOT));
        }
        if (!missing.isEmpty())
            throw new DataException(null, null, path.getFileName() + " is missing columns " + missing);
        return idx;
    }

    private static GridCellMetadata cellFrom(List<String> cols, Map<String, Integer> idx, int gridId, Path path,
            int lineNo) {
        Double lat = parseMaybeNumber(getCol(cols, idx, "LATITUDE"));
        Double lon = parseMaybeNumber(getCol(cols, idx, "LONGITUDE"));
        if (lat == null || lon == null)
            throw new DataException(gridId, null,
                    path.getFileName() + " line " + lineNo + ": latitude/longitude missing or not numeric");
        return new GridCellMetadata(gridId, lat, lon,
                CountryCode.normalize(getCol(cols, idx, "COUNTRY_ID")),
                blankToNull(getCol(cols, idx, "ADMIN_1_ID")),
                blankToNull(getCol(cols, idx, "ADMIN_2_ID")));
    }

    private static int parseGridId(String raw, Path path, int lineNo) {
        try {
            String v = raw == null ? "" : raw.trim();
            if (v.endsWith(".0"))
                v = v.substring(0, v.length() - 2);
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new DataException(null, null,
                    path.getFileName() + " line " + lineNo + ": grid_id '" + raw + "' is not an integer");
        }
    }

    private static YearMonth parseMonth(String raw, int gridId, Path path, int lineNo) {
        try {
            return YearMonth.parse(raw == null ? "" : raw.trim());
        } catch (DateTimeParseException e) {
            throw new DataException(gridId, null,
                    path.getFileName() + " line " + lineNo + ": month '" + raw + "' is not YYYY-MM");
        }
    }

    /**
     * Gets a CSV column by header name (uppercase keys).
     */
    private static String getCol(List<String> cols, Map<String, Integer> idx, String keyUpper) {
        Integer i = idx.get(keyUpper);
        if (i == null)
            return null;
        if (i < 0 || i >= cols.size())
            return null;
        return cols.get(i);
    }

    /**
     * Splits a CSV line while handling quoted commas.
     */
    static List<String> parseCsvLine(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == ',' && !inQuotes) {
                out.add(cur.toString().trim());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString().trim());
        return out;
    }

    private static Double parseMaybeNumber(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
