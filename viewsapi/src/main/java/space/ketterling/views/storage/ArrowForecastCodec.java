package space.ketterling.views.storage;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import space.ketterling.views.errors.SchemaException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastMetrics;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes forecast records as Arrow IPC files.
 *
 * <p>
 * Layout is one column per field: grid_id (int32), month (utf8, YYYY-MM),
 * latitude/longitude (float64), country_id/admin_1_id/admin_2_id (nullable
 * utf8) and one float32 column per metric. Readers look columns up by name and
 * accept any numeric vector type, so files produced by other tools load as
 * long as the names match.
 * </p>
 */
public final class ArrowForecastCodec {
    static final String GRID_ID = "grid_id";
    static final String MONTH = "month";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final String COUNTRY_ID = "country_id";
    static final String ADMIN_1_ID = "admin_1_id";
    static final String ADMIN_2_ID = "admin_2_id";

    private static final int BATCH_ROWS = 65_536;

    public static final Schema SCHEMA = buildSchema();

    /**
     * Utility class; no instances.
     */
    private ArrowForecastCodec() {
    }

    private static Schema buildSchema() {
        List<Field> fields = new ArrayList<>();
        fields.add(Field.notNullable(GRID_ID, new ArrowType.Int(32, true)));
        fields.add(Field.notNullable(MONTH, ArrowType.Utf8.INSTANCE));
        fields.add(Field.notNullable(LATITUDE, new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)));
        fields.add(Field.notNullable(LONGITUDE, new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)));
        fields.add(Field.nullable(COUNTRY_ID, ArrowType.Utf8.INSTANCE));
        fields.add(Field.nullable(ADMIN_1_ID, ArrowType.Utf8.INSTANCE));
        fields.add(Field.nullable(ADMIN_2_ID, ArrowType.Utf8.INSTANCE));
        for (MetricName m : MetricName.values()) {
            fields.add(Field.nullable(m.wireName(), new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)));
        }
        return new Schema(fields);
    }

    /**
     * Writes all records to the channel as one Arrow file.
     */
    public static void write(List<ForecastRecord> records, WritableByteChannel out) throws IOException {
        try (BufferAllocator allocator = new RootAllocator();
                VectorSchemaRoot root = VectorSchemaRoot.create(SCHEMA, allocator);
                ArrowFileWriter writer = new ArrowFileWriter(root, null, out)) {

            IntVector grid = (IntVector) root.getVector(GRID_ID);
            VarCharVector month = (VarCharVector) root.getVector(MONTH);
            Float8Vector lat = (Float8Vector) root.getVector(LATITUDE);
            Float8Vector lon = (Float8Vector) root.getVector(LONGITUDE);
            VarCharVector country = (VarCharVector) root.getVector(COUNTRY_ID);
            VarCharVector admin1 = (VarCharVector) root.getVector(ADMIN_1_ID);
            VarCharVector admin2 = (VarCharVector) root.getVector(ADMIN_2_ID);
            Map<MetricName, Float4Vector> metricVectors = new EnumMap<>(MetricName.class);
            for (MetricName m : MetricName.values()) {
                metricVectors.put(m, (Float4Vector) root.getVector(m.wireName()));
            }

            writer.start();
            for (int from = 0; from < records.size(); from += BATCH_ROWS) {
                int to = Math.min(records.size(), from + BATCH_ROWS);
                root.allocateNew();
                for (int i = from; i < to; i++) {
                    ForecastRecord r = records.get(i);
                    int row = i - from;
                    grid.setSafe(row, r.gridId());
                    month.setSafe(row, r.month().toString().getBytes(StandardCharsets.UTF_8));
                    lat.setSafe(row, r.latitude());
                    lon.setSafe(row, r.longitude());
                    setString(country, row, r.countryId());
                    setString(admin1, row, r.admin1Id());
                    setString(admin2, row, r.admin2Id());
                    for (var e : metricVectors.entrySet()) {
                        var v = r.metrics().get(e.getKey());
                        if (v.isPresent())
                            e.getValue().setSafe(row, (float) v.getAsDouble());
                        else
                            e.getValue().setNull(row);
                    }
                }
                root.setRowCount(to - from);
                writer.writeBatch();
            }
            writer.end();
        }
    }

    /**
     * Serializes records to an in-memory Arrow file.
     */
    public static byte[] toBytes(List<ForecastRecord> records) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        write(records, Channels.newChannel(bos));
        return bos.toByteArray();
    }

    /**
     * Reads every record of an Arrow file.
     *
     * @param source name used in error messages (path or object key)
     */
    public static List<ForecastRecord> read(SeekableByteChannel in, String source) throws IOException {
        List<ForecastRecord> out = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        try (BufferAllocator allocator = new RootAllocator();
                ArrowFileReader reader = new ArrowFileReader(in, allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            List<String> missing = new ArrayList<>();
            for (String required : List.of(GRID_ID, MONTH, LATITUDE, LONGITUDE)) {
                if (root.getVector(required) == null)
                    missing.add(required);
            }
            if (!missing.isEmpty())
                throw new SchemaException(List.of(source + ": missing required columns " + missing));

            while (reader.loadNextBatch()) {
                readBatch(root, source, out, problems);
            }
        }
        if (!problems.isEmpty())
            throw new SchemaException(problems);
        return out;
    }

    /**
     * Reads records from an in-memory Arrow file.
     */
    public static List<ForecastRecord> fromBytes(byte[] bytes, String source) throws IOException {
        return read(new ByteArrayReadableSeekableByteChannel(bytes), source);
    }

    private static void readBatch(VectorSchemaRoot root, String source, List<ForecastRecord> out,
            List<String> problems) {
        FieldVector grid = root.getVector(GRID_ID);
        FieldVector month = root.getVector(MONTH);
        FieldVector lat = root.getVector(LATITUDE);
        FieldVector lon = root.getVector(LONGITUDE);
        FieldVector country = optionalVector(root, COUNTRY_ID);
        FieldVector admin1 = optionalVector(root, ADMIN_1_ID);
        FieldVector admin2 = optionalVector(root, ADMIN_2_ID);
        Map<MetricName, FieldVector> metrics = new EnumMap<>(MetricName.class);
        for (MetricName m : MetricName.values()) {
            FieldVector v = optionalVector(root, m.wireName());
            if (v != null)
                metrics.put(m, v);
        }

        int rows = root.getRowCount();
        for (int i = 0; i < rows; i++) {
            Number gridId = (Number) grid.getObject(i);
            Object monthObj = month.getObject(i);
            Number latV = (Number) lat.getObject(i);
            Number lonV = (Number) lon.getObject(i);
            if (gridId == null || monthObj == null || latV == null || lonV == null) {
                problems.add(source + " row " + i + ": null in grid_id/month/latitude/longitude");
                continue;
            }
            YearMonth ym;
            try {
                ym = YearMonth.parse(monthObj.toString().trim());
            } catch (DateTimeParseException e) {
                problems.add(source + " row " + i + ": bad month '" + monthObj + "'");
                continue;
            }

            Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
            for (var e : metrics.entrySet()) {
                Object v = e.getValue().getObject(i);
                if (v instanceof Number n)
                    values.put(e.getKey(), n.doubleValue());
            }

            out.add(new ForecastRecord(
                    gridId.intValue(),
                    ym,
                    latV.doubleValue(),
                    lonV.doubleValue(),
                    CountryCode.normalize(country == null ? null : country.getObject(i)),
                    stringAt(admin1, i),
                    stringAt(admin2, i),
                    ForecastMetrics.of(values)));
        }
    }

    private static FieldVector optionalVector(VectorSchemaRoot root, String name) {
        return root.getVector(name);
    }

    private static String stringAt(FieldVector v, int i) {
        if (v == null)
            return null;
        Object o = v.getObject(i);
        if (o == null)
            return null;
        String s = o.toString();
        return s.isBlank() ? null : s;
    }

    private static void setString(VarCharVector v, int row, String value) {
        if (value == null)
            v.setNull(row);
        else
            v.setSafe(row, value.getBytes(StandardCharsets.UTF_8));
    }
}
