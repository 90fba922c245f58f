package space.ketterling.views.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.views.model.ForecastRecord;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Columnar backend: a local directory of Arrow IPC files.
 *
 * <p>
 * Data files are written once and never modified. The {@code MANIFEST} file
 * names the files that make up the current data set, one per line, and is the
 * only thing a writer changes in place: it is rewritten through a temp file
 * and an atomic rename. Readers load exactly the files the manifest lists, so
 * a replace or an append becomes visible all at once, also to readers in
 * other processes. Files no longer listed are deleted after the switch; a
 * reader that loses one of its files that way starts over from the new
 * manifest.
 * </p>
 *
 * <p>
 * Writers take an OS file lock on {@code .lock}, which serializes the
 * preparation CLI and any other writer sharing the directory. A directory
 * without a manifest (files dropped in by hand) is read by listing
 * {@code *.arrow}; the first write adopts those files into a manifest.
 * </p>
 */
public final class ArrowDirectoryBackend implements ForecastBackend {
    private static final Logger log = LoggerFactory.getLogger(ArrowDirectoryBackend.class);

    static final String SUFFIX = ".arrow";
    static final String MANIFEST = "MANIFEST";
    private static final String LOCK_FILE = ".lock";
    private static final int MAX_READ_PASSES = 5;

    // FileLock is held per JVM, so writers in this process also queue here
    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_WRITERS = new ConcurrentHashMap<>();

    private final Path dir;
    private final RetryPolicy retry;
    private final String id;

    public ArrowDirectoryBackend(Path dir, RetryPolicy retry) {
        this.dir = dir.toAbsolutePath().normalize();
        this.retry = retry;
        this.id = "arrow:" + this.dir;
    }

    public Path dir() {
        return dir;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<ForecastRecord> loadAll() {
        return retry.call(id, "load", () -> {
            long t0 = System.currentTimeMillis();
            for (int pass = 1;; pass++) {
                List<String> names = currentNames();
                List<ForecastRecord> out = new ArrayList<>();
                try {
                    for (String name : names) {
                        Path f = dir.resolve(name);
                        try (FileChannel ch = FileChannel.open(f, StandardOpenOption.READ)) {
                            out.addAll(ArrowForecastCodec.read(ch, f.toString()));
                        }
                    }
                } catch (NoSuchFileException e) {
                    if (pass >= MAX_READ_PASSES)
                        throw e;
                    log.debug("{} changed while loading ({}), re-reading manifest", dir, e.getFile());
                    continue;
                }
                log.info("Loaded {} records from {} file(s) in {} ({} ms)", out.size(), names.size(), dir,
                        System.currentTimeMillis() - t0);
                return out;
            }
        });
    }

    @Override
    public void replaceAll(List<ForecastRecord> records) {
        retry.run(id, "replace", () -> withWriteLock(() -> {
            List<String> names = new ArrayList<>();
            if (!records.isEmpty())
                names.add(writeDataFile(records));
            publish(names);
            removeUnlisted(names);
            log.info("Replaced {} with {} records", dir, records.size());
        }));
    }

    @Override
    public void append(List<ForecastRecord> records) {
        if (records.isEmpty())
            return;
        retry.run(id, "append", () -> withWriteLock(() -> {
            List<String> names = new ArrayList<>(currentNames());
            String added = writeDataFile(records);
            names.add(added);
            publish(names);
            log.info("Appended {} records to {} as {}", records.size(), dir, added);
        }));
    }

    @Override
    public boolean hasData() {
        return retry.call(id, "list", () -> !currentNames().isEmpty());
    }

    /**
     * File names of the visible data set: the manifest when there is one,
     * otherwise every {@code *.arrow} file.
     */
    private List<String> currentNames() throws IOException {
        List<String> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(dir.resolve(MANIFEST), StandardCharsets.UTF_8)) {
                String name = line.trim();
                if (!name.isEmpty())
                    out.add(name);
            }
            return out;
        } catch (NoSuchFileException e) {
            for (Path p : listedDataFiles())
                out.add(p.getFileName().toString());
            return out;
        }
    }

    private List<Path> listedDataFiles() throws IOException {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir))
            return out;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p))
                    out.add(p);
            }
        }
        out.sort(null);
        return out;
    }

    private void withWriteLock(RetryPolicy.IoRunnable body) throws Exception {
        ReentrantLock local = LOCAL_WRITERS.computeIfAbsent(dir, d -> new ReentrantLock());
        local.lock();
        try {
            Files.createDirectories(dir);
            try (FileChannel ch = FileChannel.open(dir.resolve(LOCK_FILE), StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE);
                    FileLock held = ch.lock()) {
                body.run();
            }
        } finally {
            local.unlock();
        }
    }

    /**
     * Writes a new immutable data file and returns its name.
     */
    private String writeDataFile(List<ForecastRecord> records) throws IOException {
        String name = newDataName();
        Path tmp = Files.createTempFile(dir, ".forecasts-", ".tmp");
        try {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ArrowForecastCodec.write(records, ch);
            }
            Files.move(tmp, dir.resolve(name), StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return name;
    }

    private void publish(List<String> names) throws IOException {
        Path tmp = Files.createTempFile(dir, ".manifest-", ".tmp");
        try {
            Files.write(tmp, names, StandardCharsets.UTF_8);
            Files.move(tmp, dir.resolve(MANIFEST), StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    /**
     * Deletes data files the manifest no longer names. A file that cannot be
     * deleted stays behind unread; the next replace tries again.
     */
    private void removeUnlisted(List<String> names) throws IOException {
        Set<String> keep = new HashSet<>(names);
        for (Path f : listedDataFiles()) {
            if (keep.contains(f.getFileName().toString()))
                continue;
            try {
                Files.deleteIfExists(f);
            } catch (IOException e) {
                log.warn("Could not remove unlisted data file {}: {}", f, e.getMessage());
            }
        }
    }

    static String newDataName() {
        return "forecasts-" + UUID.randomUUID() + SUFFIX;
    }
}
