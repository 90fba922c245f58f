package space.ketterling.views.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import space.ketterling.views.storage.ForecastBackend;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Writes the deterministic sample data set.
 */
@Command(name = "sample", mixinStandardHelpOptions = true,
        description = "Publishes seeded sample forecasts for local development.")
public class SampleCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SampleCommand.class);

    @Option(names = "--output", description = "Arrow output directory (default: configured backend)")
    Path output;

    @Option(names = "--seed", defaultValue = "42", description = "Random seed (default: ${DEFAULT-VALUE})")
    long seed;

    @Option(names = "--overwrite", description = "Replace existing data")
    boolean overwrite;

    @ParentCommand
    PrepareCli parent;

    @Override
    public Integer call() {
        return PrepareCli.runJob("sample", () -> {
            try (ForecastBackend backend = parent.destination(output)) {
                var prep = new ForecastPreparation(backend);
                var records = SampleForecasts.records(seed);
                var result = overwrite
                        ? prep.publish(records, ForecastPreparation.Mode.REPLACE, true)
                        : prep.publishIfEmpty(records, ForecastPreparation.Mode.REPLACE);
                if (result.skipped())
                    log.info("sample skipped: {} already has data (use --overwrite)", result.backendId());
                else
                    log.info("sample done: {} records -> {}", result.records(), result.backendId());
            }
            return 0;
        });
    }
}
