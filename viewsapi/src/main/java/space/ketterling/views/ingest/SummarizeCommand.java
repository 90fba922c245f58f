package space.ketterling.views.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import space.ketterling.views.storage.ForecastBackend;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Draws CSV to published forecasts.
 */
@Command(name = "summarize", mixinStandardHelpOptions = true,
        description = "Summarizes posterior draws into the published metrics and publishes them.")
public class SummarizeCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SummarizeCommand.class);

    @Option(names = "--draws", required = true, description = "Long-format draws CSV (grid_id,month,draw), .gz ok")
    Path draws;

    @Option(names = "--metadata", description = "Grid cell CSV (grid_id,latitude,longitude,country_id,...)")
    Path metadata;

    @Option(names = "--output", description = "Arrow output directory (default: configured backend)")
    Path output;

    @Option(names = "--mode", defaultValue = "replace", description = "replace or append (default: ${DEFAULT-VALUE})")
    String mode;

    @Option(names = "--overwrite", description = "Allow replacing a destination that already holds data")
    boolean overwrite;

    @ParentCommand
    PrepareCli parent;

    @Override
    public Integer call() {
        return PrepareCli.runJob("summarize", () -> {
            ForecastPreparation.Mode m = ForecastPreparation.Mode.parse(mode);
            DrawCsvReader.DrawInput input = DrawCsvReader.readDraws(draws);
            Map<Integer, GridCellMetadata> cells = new LinkedHashMap<>(input.cells());
            if (metadata != null)
                cells.putAll(DrawCsvReader.readMetadata(metadata));

            try (ForecastBackend backend = parent.destination(output)) {
                var result = new ForecastPreparation(backend).run(input.drawSets(), cells, m, overwrite);
                log.info("summarize done: {} records -> {} ({})", result.records(), result.backendId(),
                        result.mode());
            }
            return 0;
        });
    }
}
