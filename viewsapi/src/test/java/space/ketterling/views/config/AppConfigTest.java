package space.ketterling.views.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class AppConfigTest {

    @Test
    void defaultsFromBundledProperties() {
        AppConfig cfg = AppConfig.load();

        assertThat(cfg.apiPrefix()).isEqualTo("/api/v1");
        assertThat(cfg.dataBackend()).isEqualTo(AppConfig.Backend.ARROW);
        assertThat(cfg.cacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(cfg.backendMaxAttempts()).isEqualTo(3);
    }

    @Test
    void prefixIsNormalized() {
        Properties p = new Properties();
        p.setProperty("api.prefix", "api/v2/");

        assertThat(AppConfig.fromProperties(p).apiPrefix()).isEqualTo("/api/v2");

        p.setProperty("api.prefix", "/");
        assertThat(AppConfig.fromProperties(p).apiPrefix()).isEmpty();
    }

    @Test
    void backendAliases() {
        assertThat(AppConfig.Backend.parse("parquet")).isEqualTo(AppConfig.Backend.ARROW);
        assertThat(AppConfig.Backend.parse("DB")).isEqualTo(AppConfig.Backend.DATABASE);
        assertThat(AppConfig.Backend.parse(" cloud ")).isEqualTo(AppConfig.Backend.S3);
        assertThatThrownBy(() -> AppConfig.Backend.parse("mongo")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void remoteBackendsNeedTheirSettings() {
        Properties db = new Properties();
        db.setProperty("data.backend", "database");
        assertThatThrownBy(() -> AppConfig.fromProperties(db))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DB_JDBC_URL");

        Properties s3 = new Properties();
        s3.setProperty("data.backend", "s3");
        assertThatThrownBy(() -> AppConfig.fromProperties(s3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("CLOUD_BUCKET_NAME");
    }

    @Test
    void apiKeyAndBackendSwitch() {
        Properties p = new Properties();
        p.setProperty("api.key", "k");
        AppConfig cfg = AppConfig.fromProperties(p);

        assertThat(cfg.apiKeyRequired()).isTrue();
        AppConfig other = cfg.withBackend(AppConfig.Backend.ARROW, "/tmp/x");
        assertThat(other.dataPath()).isEqualTo("/tmp/x");
        assertThat(other.apiKey()).isEqualTo("k");
    }
}
