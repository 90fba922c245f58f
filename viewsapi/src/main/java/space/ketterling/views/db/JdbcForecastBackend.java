package space.ketterling.views.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.errors.SchemaException;
import space.ketterling.views.model.CountryCode;
import space.ketterling.views.model.ForecastMetrics;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;
import space.ketterling.views.storage.ForecastBackend;
import space.ketterling.views.storage.RetryPolicy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Relational backend: one {@code forecasts} table keyed by (grid_id, month).
 *
 * <p>
 * Months are stored as {@code YYYY-MM} text so ordering and equality match
 * the other backends. The month column is always quoted since MONTH is a
 * keyword in some databases. Replace and append each run in a single transaction.
 * </p>
 */
public class JdbcForecastBackend implements ForecastBackend {
    private static final Logger log = LoggerFactory.getLogger(JdbcForecastBackend.class);
    private static final int BATCH_SIZE = 1_000;

    static final String TABLE = "forecasts";

    private final HikariDataSource ds;
    private final RetryPolicy retry;
    private final int queryTimeoutSeconds;
    private final String id;
    private volatile boolean schemaReady;

    /**
     * Creates a backend on the given pool; the table is created on first use.
     */
    public JdbcForecastBackend(HikariDataSource ds, RetryPolicy retry, int queryTimeoutSeconds) {
        this.ds = ds;
        this.retry = retry;
        this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
        this.id = "jdbc:" + ds.getJdbcUrl();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<ForecastRecord> loadAll() {
        return retry.call(id, "load", () -> {
            ensureSchema();
            long t0 = System.currentTimeMillis();
            List<ForecastRecord> out = new ArrayList<>();
            String sql = "SELECT " + columnList() + " FROM " + TABLE + " ORDER BY grid_id, \"month\"";
            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                ps.setFetchSize(BATCH_SIZE);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(readRow(rs));
                    }
                }
            }
            log.info("Loaded {} records from {} ({} ms)", out.size(), TABLE, System.currentTimeMillis() - t0);
            return out;
        });
    }

    @Override
    public void replaceAll(List<ForecastRecord> records) {
        retry.run(id, "replace", () -> {
            ensureSchema();
            inTransaction(c -> {
                try (Statement st = c.createStatement()) {
                    st.setQueryTimeout(queryTimeoutSeconds);
                    st.executeUpdate("DELETE FROM " + TABLE);
                }
                insert(c, records);
            });
            log.info("Replaced {} with {} records", TABLE, records.size());
        });
    }

    @Override
    public void append(List<ForecastRecord> records) {
        if (records.isEmpty())
            return;
        retry.run(id, "append", () -> {
            ensureSchema();
            inTransaction(c -> insert(c, records));
            log.info("Appended {} records to {}", records.size(), TABLE);
        });
    }

    @Override
    public boolean hasData() {
        return retry.call(id, "list", () -> {
            ensureSchema();
            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1 FROM " + TABLE + " LIMIT 1")) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    @Override
    public void close() {
        ds.close();
    }

    /**
     * Creates the table and its indexes if they do not exist yet.
     */
    void ensureSchema() throws SQLException {
        if (schemaReady)
            return;
        StringBuilder ddl = new StringBuilder();
        ddl.append("CREATE TABLE IF NOT EXISTS ").append(TABLE).append(" (")
                .append("grid_id INTEGER NOT NULL, ")
                .append("\"month\" VARCHAR(7) NOT NULL, ")
                .append("latitude DOUBLE PRECISION NOT NULL, ")
                .append("longitude DOUBLE PRECISION NOT NULL, ")
                .append("country_id VARCHAR(8), ")
                .append("admin_1_id VARCHAR(64), ")
                .append("admin_2_id VARCHAR(64), ");
        for (MetricName m : MetricName.values()) {
            ddl.append(m.wireName()).append(" REAL, ");
        }
        ddl.append("PRIMARY KEY (grid_id, \"month\"))");

        try (Connection c = ds.getConnection();
                Statement st = c.createStatement()) {
            st.setQueryTimeout(queryTimeoutSeconds);
            st.execute(ddl.toString());
            st.execute("CREATE INDEX IF NOT EXISTS idx_forecasts_month ON " + TABLE + " (\"month\")");
            st.execute("CREATE INDEX IF NOT EXISTS idx_forecasts_country ON " + TABLE + " (country_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_forecasts_grid ON " + TABLE + " (grid_id)");
        }
        schemaReady = true;
    }

    private void insert(Connection c, List<ForecastRecord> records) throws SQLException {
        int metricCount = MetricName.values().length;
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(TABLE).append(" (").append(columnList())
                .append(") VALUES (?, ?, ?, ?, ?, ?, ?");
        for (int i = 0; i < metricCount; i++) {
            sql.append(", ?");
        }
        sql.append(")");

        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            int pending = 0;
            for (ForecastRecord r : records) {
                ps.setInt(1, r.gridId());
                ps.setString(2, r.month().toString());
                ps.setDouble(3, r.latitude());
                ps.setDouble(4, r.longitude());
                setString(ps, 5, r.countryId());
                setString(ps, 6, r.admin1Id());
                setString(ps, 7, r.admin2Id());
                int idx = 8;
                for (MetricName m : MetricName.values()) {
                    var v = r.metrics().get(m);
                    if (v.isPresent())
                        ps.setFloat(idx, (float) v.getAsDouble());
                    else
                        ps.setNull(idx, Types.REAL);
                    idx++;
                }
                ps.addBatch();
                if (++pending == BATCH_SIZE) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0)
                ps.executeBatch();
        }
    }

    /**
     * Runs the work in one transaction; integrity violations become schema
     * errors (not retried), anything else is rethrown for the retry policy.
     */
    private void inTransaction(SqlWork work) throws SQLException {
        try (Connection c = ds.getConnection()) {
            boolean prevAutoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                work.run(c);
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                if (isIntegrityViolation(e))
                    throw new SchemaException(List.of("database rejected batch: " + e.getMessage()));
                throw e;
            } catch (RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(prevAutoCommit);
            }
        }
    }

    private static boolean isIntegrityViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            String state = cur.getSQLState();
            if (state != null && state.startsWith("23"))
                return true;
        }
        return false;
    }

    private static ForecastRecord readRow(ResultSet rs) throws SQLException {
        Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
        for (MetricName m : MetricName.values()) {
            float v = rs.getFloat(m.wireName());
            if (!rs.wasNull())
                values.put(m, (double) v);
        }
        return new ForecastRecord(
                rs.getInt("grid_id"),
                YearMonth.parse(rs.getString("month").trim()),
                rs.getDouble("latitude"),
                rs.getDouble("longitude"),
                CountryCode.normalize(rs.getString("country_id")),
                rs.getString("admin_1_id"),
                rs.getString("admin_2_id"),
                ForecastMetrics.of(values));
    }

    private static String columnList() {
        StringBuilder sb = new StringBuilder(
                "grid_id, \"month\", latitude, longitude, country_id, admin_1_id, admin_2_id");
        for (MetricName m : MetricName.values()) {
            sb.append(", ").append(m.wireName());
        }
        return sb.toString();
    }

    private static void setString(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.VARCHAR);
        else
            ps.setString(idx, v);
    }

    @FunctionalInterface
    private interface SqlWork {
        void run(Connection c) throws SQLException;
    }
}
