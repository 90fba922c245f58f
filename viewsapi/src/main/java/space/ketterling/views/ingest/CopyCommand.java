package space.ketterling.views.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import space.ketterling.views.storage.ArrowDirectoryBackend;
import space.ketterling.views.storage.ForecastBackend;
import space.ketterling.views.storage.RetryPolicy;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Copies an Arrow directory into the configured backend (e.g. to seed the
 * database from prepared files).
 */
@Command(name = "copy", mixinStandardHelpOptions = true,
        description = "Validates the records of an Arrow directory and publishes them to the configured backend.")
public class CopyCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CopyCommand.class);

    @Option(names = "--from-dir", required = true, description = "Source Arrow directory")
    Path fromDir;

    @Option(names = "--mode", defaultValue = "replace", description = "replace or append (default: ${DEFAULT-VALUE})")
    String mode;

    @Option(names = "--overwrite", description = "Allow replacing a destination that already holds data")
    boolean overwrite;

    @Option(names = "--skip-if-exists", description = "Do nothing when the destination already holds data")
    boolean skipIfExists;

    @ParentCommand
    PrepareCli parent;

    @Override
    public Integer call() {
        return PrepareCli.runJob("copy", () -> {
            ForecastPreparation.Mode m = ForecastPreparation.Mode.parse(mode);
            var source = new ArrowDirectoryBackend(fromDir, RetryPolicy.fromConfig(parent.config()));
            var records = source.loadAll();
            try (ForecastBackend backend = parent.destination(null)) {
                var prep = new ForecastPreparation(backend);
                var result = skipIfExists ? prep.publishIfEmpty(records, m) : prep.publish(records, m, overwrite);
                if (result.skipped())
                    log.info("copy skipped: {} already has data", result.backendId());
                else
                    log.info("copy done: {} records {} -> {}", result.records(), source.id(), result.backendId());
            }
            return 0;
        });
    }
}
