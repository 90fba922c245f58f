package space.ketterling.views.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the storage backends,
 * the snapshot cache and backend retries.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,
        String apiPrefix,
        String apiKey, // blank = no key check

        // Backend selection + local data
        Backend dataBackend,
        String dataPath,

        // Relational
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,
        int dbQueryTimeoutSeconds,

        // Remote object storage
        String cloudBucketName,
        String cloudBucketRegion,
        String cloudDataPrefix,
        String cloudDataKey,
        String awsAccessKeyId,
        String awsSecretAccessKey,
        String cloudEndpointOverride,
        Duration cloudCallTimeout,

        // Cache + retries
        Duration cacheTtl,
        int backendMaxAttempts,
        Duration backendBackoff) {

    /**
     * Storage backend variants.
     */
    public enum Backend {
        ARROW,
        DATABASE,
        S3;

        /**
         * Parses a backend name; accepts the legacy aliases {@code parquet}/
         * {@code columnar} and {@code cloud}.
         */
        public static Backend parse(String s) {
            String v = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
            return switch (v) {
                case "arrow", "columnar", "parquet", "" -> ARROW;
                case "database", "db", "jdbc" -> DATABASE;
                case "s3", "cloud" -> S3;
                default -> throw new IllegalStateException("Unsupported DATA_BACKEND: " + s);
            };
        }
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read application.properties", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env vars and
     * -D properties override them.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8000"));
        String prefix = normalizePrefix(envOr(p, "API_PREFIX", "api.prefix", "/api/v1"));
        String apiKey = envOr(p, "API_KEY", "api.key", "");

        Backend backend = Backend.parse(envOr(p, "DATA_BACKEND", "data.backend", "arrow"));
        String dataPath = envOr(p, "DATA_PATH", "data.path", "data/forecasts");

        String dbUrl = envOr(p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = Integer.parseInt(envOr(p, "DB_POOL_MAX", "db.poolMax", "8"));
        int dbQueryTimeout = Integer.parseInt(envOr(p, "DB_QUERY_TIMEOUT_SECONDS", "db.queryTimeoutSeconds", "30"));

        String bucket = envOr(p, "CLOUD_BUCKET_NAME", "cloud.bucketName", "");
        String region = envOr(p, "CLOUD_BUCKET_REGION", "cloud.bucketRegion", "eu-north-1");
        String dataPrefix = envOr(p, "CLOUD_DATA_PREFIX", "cloud.dataPrefix", "api_ready/");
        String dataKey = envOr(p, "CLOUD_DATA_KEY", "cloud.dataKey", "");
        String accessKey = envOr(p, "AWS_ACCESS_KEY_ID", "aws.accessKeyId", "");
        String secretKey = envOr(p, "AWS_SECRET_ACCESS_KEY", "aws.secretAccessKey", "");
        String endpoint = envOr(p, "CLOUD_ENDPOINT_OVERRIDE", "cloud.endpointOverride", "");
        Duration callTimeout = Duration.parse(envOr(p, "CLOUD_CALL_TIMEOUT", "cloud.callTimeout", "PT30S"));

        Duration cacheTtl = Duration.parse(envOr(p, "CACHE_TTL", "cache.ttl", "PT1H"));
        int maxAttempts = Integer.parseInt(envOr(p, "BACKEND_MAX_ATTEMPTS", "backend.maxAttempts", "3"));
        Duration backoff = Duration.parse(envOr(p, "BACKEND_BACKOFF", "backend.backoff", "PT0.5S"));

        if (backend == Backend.DATABASE)
            requireNonBlank(dbUrl, "DB_JDBC_URL");
        if (backend == Backend.S3)
            requireNonBlank(bucket, "CLOUD_BUCKET_NAME");

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                prefix,
                apiKey,

                backend,
                dataPath,

                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,
                dbQueryTimeout,

                bucket,
                region,
                dataPrefix,
                dataKey,
                accessKey,
                secretKey,
                endpoint,
                callTimeout,

                cacheTtl,
                Math.max(1, maxAttempts),
                backoff);
    }

    /**
     * True when requests must present the shared API key.
     */
    public boolean apiKeyRequired() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Returns a copy pointing at another backend/data path (used by the CLI).
     */
    public AppConfig withBackend(Backend backend, String dataPath) {
        return new AppConfig(apiPort, apiPrefix, apiKey, backend, dataPath, dbJdbcUrl, dbUsername, dbPassword,
                dbPoolMax, dbQueryTimeoutSeconds, cloudBucketName, cloudBucketRegion, cloudDataPrefix, cloudDataKey,
                awsAccessKeyId, awsSecretAccessKey, cloudEndpointOverride, cloudCallTimeout, cacheTtl,
                backendMaxAttempts, backendBackoff);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String name) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    private static String normalizePrefix(String prefix) {
        String p = prefix.trim();
        if (p.isEmpty() || p.equals("/"))
            return "";
        if (!p.startsWith("/"))
            p = "/" + p;
        while (p.endsWith("/"))
            p = p.substring(0, p.length() - 1);
        return p;
    }
}
