package space.ketterling.views.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import space.ketterling.views.config.AppConfig;
import space.ketterling.views.errors.ForecastApiException;
import space.ketterling.views.storage.ArrowDirectoryBackend;
import space.ketterling.views.storage.BackendFactory;
import space.ketterling.views.storage.ForecastBackend;
import space.ketterling.views.storage.RetryPolicy;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code views-prepare}: offline preparation of forecast data.
 */
@Command(name = "views-prepare", mixinStandardHelpOptions = true, version = "views-prepare 1.0",
        description = "Summarizes raw forecast draws and publishes them to a storage backend.",
        subcommands = { SummarizeCommand.class, SampleCommand.class, CopyCommand.class })
public class PrepareCli implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(PrepareCli.class);

    private AppConfig config;

    /**
     * CLI entry point.
     */
    public static void main(String[] args) {
        System.exit(newCommandLine(AppConfig.load()).execute(args));
    }

    /**
     * Builds the command line with the given config (tests pass their own).
     */
    public static CommandLine newCommandLine(AppConfig cfg) {
        PrepareCli root = new PrepareCli();
        root.config = cfg;
        return new CommandLine(root);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    AppConfig config() {
        if (config == null)
            config = AppConfig.load();
        return config;
    }

    /**
     * Arrow directory when {@code output} is given, otherwise the configured
     * backend.
     */
    ForecastBackend destination(Path output) {
        AppConfig cfg = config();
        if (output != null)
            return new ArrowDirectoryBackend(output, RetryPolicy.fromConfig(cfg));
        return BackendFactory.create(cfg, "cli");
    }

    /**
     * Runs one job with the MDC job key set; known failures map to exit code 1.
     */
    static int runJob(String name, Callable<Integer> job) {
        MDC.put("job", name);
        try {
            return job.call();
        } catch (ForecastApiException | IllegalStateException | IllegalArgumentException e) {
            log.error("{} failed: {}", name, e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("{} failed", name, e);
            return 2;
        } finally {
            MDC.remove("job");
        }
    }
}
