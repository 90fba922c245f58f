package space.ketterling.views.db;

import space.ketterling.views.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    /**
     * Utility class; no instances.
     */
    private Database() {
    }

    /**
     * Builds the pool used by the forecast backend (API reads and CLI writes).
     */
    public static HikariDataSource createForecastDataSource(AppConfig cfg, String role) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(cfg.dbJdbcUrl());
        hc.setUsername(cfg.dbUsername());
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("viewsapi-" + role);
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        return new HikariDataSource(hc);
    }
}
