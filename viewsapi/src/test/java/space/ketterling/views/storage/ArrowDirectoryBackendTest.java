package space.ketterling.views.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.testsupport.Forecasts;

@Tag("integration")
class ArrowDirectoryBackendTest {

    @TempDir
    Path dir;

    private ArrowDirectoryBackend backend() {
        return new ArrowDirectoryBackend(dir, new RetryPolicy(1, Duration.ZERO));
    }

    private static List<Path> dataFiles(Path dir) throws Exception {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(p -> p.getFileName().toString().endsWith(ArrowDirectoryBackend.SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static List<ForecastRecord> monthSet(String month, int firstGrid, int count) {
        List<ForecastRecord> out = new ArrayList<>();
        for (int g = firstGrid; g < firstGrid + count; g++)
            out.add(Forecasts.record(g, month, "800", g % 50));
        return out;
    }

    @Test
    void emptyDirectoryHasNoData() {
        ArrowDirectoryBackend b = new ArrowDirectoryBackend(dir.resolve("missing"), new RetryPolicy(1, Duration.ZERO));

        assertThat(b.hasData()).isFalse();
        assertThat(b.loadAll()).isEmpty();
    }

    @Test
    void replaceThenLoadRoundTrips() throws Exception {
        ArrowDirectoryBackend b = backend();
        List<ForecastRecord> records = Forecasts.smallSet();

        b.replaceAll(records);

        assertThat(b.hasData()).isTrue();
        assertThat(b.loadAll()).containsExactlyElementsOf(records);
        assertThat(dataFiles(dir)).hasSize(1);
        assertThat(Files.readAllLines(dir.resolve(ArrowDirectoryBackend.MANIFEST)))
                .containsExactly(dataFiles(dir).get(0).getFileName().toString());
        assertThat(b.id()).startsWith("arrow:");
    }

    @Test
    void nullableColumnsSurvive() {
        ArrowDirectoryBackend b = backend();
        ForecastRecord base = Forecasts.record(3, "2024-02", null, 4);
        ForecastRecord withAdmin = new ForecastRecord(4, base.month(), 1.5, 2.5, "024", "adm1-7", null,
                base.metrics());

        b.replaceAll(List.of(base, withAdmin));

        assertThat(b.loadAll()).containsExactly(base, withAdmin);
    }

    @Test
    void appendAddsFilesAndReplaceRemovesThem() throws Exception {
        ArrowDirectoryBackend b = backend();
        b.replaceAll(List.of(Forecasts.record(1, "2024-01", "800", 1)));
        b.append(List.of(Forecasts.record(2, "2024-01", "800", 2)));
        b.append(List.of(Forecasts.record(3, "2024-01", "800", 3)));

        assertThat(b.loadAll()).extracting(ForecastRecord::gridId).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(dataFiles(dir)).hasSize(3);

        b.replaceAll(List.of(Forecasts.record(9, "2024-01", "800", 9)));

        assertThat(b.loadAll()).extracting(ForecastRecord::gridId).containsExactly(9);
        assertThat(dataFiles(dir)).hasSize(1);
    }

    @Test
    void replaceWithEmptyBatchLeavesNoRecords() {
        ArrowDirectoryBackend b = backend();
        b.replaceAll(Forecasts.smallSet());

        b.replaceAll(List.of());

        assertThat(b.loadAll()).isEmpty();
        assertThat(b.hasData()).isFalse();
    }

    @Test
    void concurrentReadersSeeOldOrNewNeverAMix() throws Exception {
        ArrowDirectoryBackend b = backend();
        List<ForecastRecord> setA = Forecasts.smallSet();
        List<ForecastRecord> setB = new ArrayList<>();
        for (int g = 100; g < 130; g++)
            setB.add(Forecasts.record(g, "2025-01", "404", g));
        Set<Integer> idsA = setA.stream().map(ForecastRecord::gridId).collect(Collectors.toSet());
        Set<Integer> idsB = setB.stream().map(ForecastRecord::gridId).collect(Collectors.toSet());
        b.replaceAll(setA);

        AtomicBoolean stop = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 20; i++)
                    b.replaceAll(i % 2 == 0 ? setB : setA);
                stop.set(true);
            });
            List<Future<Integer>> readers = new ArrayList<>();
            for (int r = 0; r < 2; r++) {
                readers.add(pool.submit(() -> {
                    int reads = 0;
                    while (!stop.get()) {
                        Set<Integer> seen = new HashSet<>();
                        for (ForecastRecord rec : b.loadAll())
                            seen.add(rec.gridId());
                        assertThat(seen).satisfiesAnyOf(
                                s -> assertThat(s).isEqualTo(idsA),
                                s -> assertThat(s).isEqualTo(idsB));
                        reads++;
                    }
                    return reads;
                }));
            }
            writer.get(30, TimeUnit.SECONDS);
            for (Future<Integer> r : readers)
                assertThat(r.get(30, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(0);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void separateInstancesNeverSeeAppendedFilesNextToANewReplace() throws Exception {
        // writer and reader share only the directory, as the CLI and the API server do
        ArrowDirectoryBackend writerSide = backend();
        ArrowDirectoryBackend readerSide = backend();
        List<ForecastRecord> january = monthSet("2025-01", 1, 400);
        List<ForecastRecord> januaryExtra = monthSet("2025-01", 1000, 400);
        List<ForecastRecord> february = monthSet("2025-02", 1, 400);
        writerSide.replaceAll(january);

        AtomicBoolean stop = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> writer = pool.submit(() -> {
                try {
                    for (int i = 0; i < 200; i++) {
                        writerSide.replaceAll(january);
                        writerSide.append(januaryExtra);
                        writerSide.replaceAll(february);
                    }
                } finally {
                    stop.set(true);
                }
            });
            Future<Integer> reader = pool.submit(() -> {
                int mixed = 0;
                while (!stop.get()) {
                    Set<String> months = readerSide.loadAll().stream()
                            .map(r -> r.month().toString())
                            .collect(Collectors.toSet());
                    if (months.size() > 1)
                        mixed++;
                }
                return mixed;
            });
            writer.get(120, TimeUnit.SECONDS);
            assertThat(reader.get(120, TimeUnit.SECONDS)).isZero();
        } finally {
            pool.shutdownNow();
        }
        assertThat(readerSide.loadAll()).containsExactlyElementsOf(february);
    }

    @Test
    void fileLeftOutOfTheManifestIsNotRead() throws Exception {
        ArrowDirectoryBackend b = backend();
        b.replaceAll(List.of(Forecasts.record(1, "2024-01", "800", 1)));
        Files.write(dir.resolve("forecasts-leftover.arrow"),
                ArrowForecastCodec.toBytes(List.of(Forecasts.record(2, "2024-01", "800", 2))));

        assertThat(b.loadAll()).extracting(ForecastRecord::gridId).containsExactly(1);

        b.replaceAll(List.of(Forecasts.record(3, "2024-01", "800", 3)));

        assertThat(Files.exists(dir.resolve("forecasts-leftover.arrow"))).isFalse();
    }

    @Test
    void directoryWithoutManifestIsListedAndAdoptedByAppend() throws Exception {
        Files.write(dir.resolve("handmade.arrow"),
                ArrowForecastCodec.toBytes(List.of(Forecasts.record(1, "2024-01", "800", 1))));
        ArrowDirectoryBackend b = backend();

        assertThat(b.hasData()).isTrue();
        assertThat(b.loadAll()).extracting(ForecastRecord::gridId).containsExactly(1);

        b.append(List.of(Forecasts.record(2, "2024-01", "800", 2)));

        assertThat(b.loadAll()).extracting(ForecastRecord::gridId).containsExactlyInAnyOrder(1, 2);
        assertThat(Files.readAllLines(dir.resolve(ArrowDirectoryBackend.MANIFEST))).contains("handmade.arrow");
    }

    @Test
    void unreadableFileSurfacesAsBackendUnavailable() throws Exception {
        Files.write(dir.resolve("broken.arrow"), new byte[] { 1, 2, 3, 4, 5 });

        assertThatThrownBy(() -> backend().loadAll())
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("load");
    }
}
