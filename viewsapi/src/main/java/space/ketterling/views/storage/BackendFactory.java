package space.ketterling.views.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.db.Database;
import space.ketterling.views.db.JdbcForecastBackend;

import java.nio.file.Path;

/**
 * Picks the storage backend named by {@code DATA_BACKEND}.
 */
public final class BackendFactory {
    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    /**
     * Utility class; no instances.
     */
    private BackendFactory() {
    }

    /**
     * Builds the configured backend. The caller owns it and must close it.
     *
     * @param role pool / log label ({@code api} or {@code cli})
     */
    public static ForecastBackend create(AppConfig cfg, String role) {
        RetryPolicy retry = RetryPolicy.fromConfig(cfg);
        ForecastBackend backend = switch (cfg.dataBackend()) {
            case ARROW -> new ArrowDirectoryBackend(Path.of(cfg.dataPath()), retry);
            case DATABASE -> new JdbcForecastBackend(Database.createForecastDataSource(cfg, role), retry,
                    cfg.dbQueryTimeoutSeconds());
            case S3 -> new S3ForecastBackend(AwsClients.s3Client(cfg), cfg.cloudBucketName(),
                    cfg.cloudDataPrefix(), cfg.cloudDataKey(), retry);
        };
        log.info("Using {} backend {} (maxAttempts={})", cfg.dataBackend(), backend.id(), retry.maxAttempts());
        return backend;
    }
}
