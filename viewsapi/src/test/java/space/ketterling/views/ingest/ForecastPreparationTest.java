package space.ketterling.views.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import space.ketterling.views.errors.DataException;
import space.ketterling.views.errors.SchemaException;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.model.MetricName;
import space.ketterling.views.model.RawDrawSet;
import space.ketterling.views.testsupport.Forecasts;

@Tag("unit")
class ForecastPreparationTest {

    private static final Map<Integer, GridCellMetadata> CELLS = Map.of(
            1, new GridCellMetadata(1, 0.25, 32.25, "800", null, null),
            2, new GridCellMetadata(2, 0.75, 32.25, "800", "adm1", null));

    private Forecasts.MemoryBackend backend;
    private ForecastPreparation prep;

    @BeforeEach
    void setUp() {
        backend = new Forecasts.MemoryBackend("memory:prep", List.of());
        prep = new ForecastPreparation(backend);
    }

    private static RawDrawSet set(int grid, double... draws) {
        return new RawDrawSet(grid, YearMonth.of(2025, 8), draws);
    }

    @Test
    void summarizeJoinsCellMetadata() {
        List<ForecastRecord> out = ForecastPreparation.summarize(
                List.of(set(1, 0, 0, 1, 2, 5, 10, 50, 200), set(2, 4)), CELLS);

        assertThat(out).hasSize(2);
        assertThat(out.get(0).latitude()).isEqualTo(0.25);
        assertThat(out.get(0).metrics().get(MetricName.MAP).getAsDouble()).isEqualTo(3.5);
        assertThat(out.get(1).admin1Id()).isEqualTo("adm1");
    }

    @Test
    void oneBadDrawSetAbortsTheBatch() {
        assertThatThrownBy(() -> prep.run(List.of(set(1, 1, 2), set(2, -1)), CELLS,
                ForecastPreparation.Mode.REPLACE, false))
                .isInstanceOf(DataException.class);
        assertThat(backend.hasData()).isFalse();
    }

    @Test
    void cellWithoutCoordinatesIsADataError() {
        assertThatThrownBy(() -> ForecastPreparation.summarize(List.of(set(3, 1)), CELLS))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("grid_id=3");
    }

    @Test
    void replaceRefusesToOverwriteWithoutFlag() {
        prep.publish(Forecasts.smallSet(), ForecastPreparation.Mode.REPLACE, false);

        assertThatThrownBy(() -> prep.publish(List.of(Forecasts.record(1, "2030-01", "800", 1)),
                ForecastPreparation.Mode.REPLACE, false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("--overwrite");

        ForecastPreparation.Result r = prep.publish(List.of(Forecasts.record(1, "2030-01", "800", 1)),
                ForecastPreparation.Mode.REPLACE, true);
        assertThat(r.records()).isEqualTo(1);
        assertThat(backend.loadAll()).hasSize(1);
    }

    @Test
    void appendAddsToExistingData() {
        prep.publish(Forecasts.smallSet(), ForecastPreparation.Mode.REPLACE, false);

        prep.publish(List.of(Forecasts.record(9, "2024-01", "800", 1)), ForecastPreparation.Mode.APPEND, false);

        assertThat(backend.loadAll()).hasSize(19);
    }

    @Test
    void invalidBatchNeverReachesBackend() {
        List<ForecastRecord> dup = List.of(Forecasts.record(1, "2024-01", "800", 1),
                Forecasts.record(1, "2024-01", "800", 1));

        assertThatThrownBy(() -> prep.publish(dup, ForecastPreparation.Mode.APPEND, false))
                .isInstanceOf(SchemaException.class);
        assertThat(backend.hasData()).isFalse();
    }

    @Test
    void publishIfEmptySkipsPopulatedBackend() {
        prep.publish(Forecasts.smallSet(), ForecastPreparation.Mode.REPLACE, false);

        ForecastPreparation.Result r = prep.publishIfEmpty(List.of(), ForecastPreparation.Mode.REPLACE);

        assertThat(r.skipped()).isTrue();
        assertThat(backend.loadAll()).hasSize(18);
    }

    @Test
    void modeParsing() {
        assertThat(ForecastPreparation.Mode.parse("APPEND")).isEqualTo(ForecastPreparation.Mode.APPEND);
        assertThat(ForecastPreparation.Mode.parse(null)).isEqualTo(ForecastPreparation.Mode.REPLACE);
        assertThatThrownBy(() -> ForecastPreparation.Mode.parse("merge")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sampleDataIsDeterministicAndValid() {
        List<ForecastRecord> a = SampleForecasts.records(SampleForecasts.DEFAULT_SEED);
        List<ForecastRecord> b = SampleForecasts.records(SampleForecasts.DEFAULT_SEED);

        assertThat(a).isEqualTo(b);
        assertThat(a).hasSize(36 * SampleForecasts.MONTHS);
        assertThat(SchemaValidator.validate(a)).isSameAs(a);
        assertThat(SampleForecasts.records(7)).isNotEqualTo(a);
    }
}
