package space.ketterling.views.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.storage.ArrowDirectoryBackend;
import space.ketterling.views.storage.RetryPolicy;

@Tag("integration")
class PrepareCliTest {

    @TempDir
    Path dir;

    private AppConfig config(Path dataPath) {
        Properties p = new Properties();
        p.setProperty("data.backend", "arrow");
        p.setProperty("data.path", dataPath.toString());
        p.setProperty("backend.maxAttempts", "1");
        return AppConfig.fromProperties(p);
    }

    private CommandLine cli() {
        return PrepareCli.newCommandLine(config(dir.resolve("configured")));
    }

    private static ArrowDirectoryBackend arrow(Path p) {
        return new ArrowDirectoryBackend(p, new RetryPolicy(1, Duration.ZERO));
    }

    @Test
    void exposesSubcommands() {
        CommandLine cl = cli();

        assertThat(cl.getCommandName()).isEqualTo("views-prepare");
        assertThat(cl.getSubcommands()).containsKeys("summarize", "sample", "copy");
    }

    @Test
    void sampleWritesOnceUnlessOverwritten() {
        Path out = dir.resolve("sample");

        assertThat(cli().execute("sample", "--output", out.toString())).isZero();
        assertThat(arrow(out).loadAll()).hasSize(36 * SampleForecasts.MONTHS);

        // second run is a no-op, not an error
        assertThat(cli().execute("sample", "--output", out.toString(), "--seed", "7")).isZero();
        assertThat(arrow(out).loadAll()).isEqualTo(SampleForecasts.records(SampleForecasts.DEFAULT_SEED));

        assertThat(cli().execute("sample", "--output", out.toString(), "--seed", "7", "--overwrite")).isZero();
        assertThat(arrow(out).loadAll()).isEqualTo(SampleForecasts.records(7));
    }

    @Test
    void summarizeFromCsv() throws Exception {
        Path draws = dir.resolve("draws.csv");
        Files.writeString(draws, "grid_id,month,draw\n1,2025-08,0\n1,2025-08,4\n2,2025-08,1\n");
        Path cells = dir.resolve("cells.csv");
        Files.writeString(cells, "grid_id,latitude,longitude,country_id\n1,0.25,32.25,800\n2,0.75,32.25,800\n");
        Path out = dir.resolve("summarized");

        int code = cli().execute("summarize", "--draws", draws.toString(), "--metadata", cells.toString(),
                "--output", out.toString());

        assertThat(code).isZero();
        assertThat(arrow(out).loadAll()).hasSize(2);

        // replacing populated output needs --overwrite
        assertThat(cli().execute("summarize", "--draws", draws.toString(), "--metadata", cells.toString(),
                "--output", out.toString())).isEqualTo(1);
        assertThat(cli().execute("summarize", "--draws", draws.toString(), "--metadata", cells.toString(),
                "--output", out.toString(), "--mode", "merge")).isEqualTo(1);
    }

    @Test
    void summarizeWithBadDrawsFailsAndWritesNothing() throws Exception {
        Path draws = dir.resolve("draws.csv");
        Files.writeString(draws, "grid_id,month,draw,latitude,longitude\n1,2025-08,-2,0.25,32.25\n");
        Path out = dir.resolve("bad");

        assertThat(cli().execute("summarize", "--draws", draws.toString(), "--output", out.toString()))
                .isEqualTo(1);
        assertThat(arrow(out).hasData()).isFalse();
    }

    @Test
    void copyPublishesIntoConfiguredBackend() {
        Path source = dir.resolve("source");
        assertThat(cli().execute("sample", "--output", source.toString())).isZero();

        assertThat(cli().execute("copy", "--from-dir", source.toString())).isZero();
        assertThat(arrow(dir.resolve("configured")).loadAll()).hasSize(36 * SampleForecasts.MONTHS);

        assertThat(cli().execute("copy", "--from-dir", source.toString(), "--skip-if-exists")).isZero();
        assertThat(cli().execute("copy", "--from-dir", source.toString())).isEqualTo(1);
    }
}
