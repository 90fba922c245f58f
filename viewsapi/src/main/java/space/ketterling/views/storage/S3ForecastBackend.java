package space.ketterling.views.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.model.ForecastRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Remote-object backend: Arrow files in an S3 bucket.
 *
 * <p>
 * With a configured key the backend reads and replaces exactly that object;
 * S3 overwrites a single object atomically. Under a prefix the data set is
 * whatever the {@code <prefix>MANIFEST} object lists. Data objects are
 * written once under fresh keys and the manifest put is the switch, so a
 * reader sees the old or the new set. Objects no longer listed are deleted
 * afterwards; a reader that finds a listed object gone re-reads the manifest.
 * Without a manifest every {@code *.arrow} object under the prefix is read.
 * </p>
 *
 * <p>
 * Appends read, extend and rewrite the manifest without a lock, so writers
 * under one prefix have to take turns.
 * </p>
 */
public final class S3ForecastBackend implements ForecastBackend {
    private static final Logger log = LoggerFactory.getLogger(S3ForecastBackend.class);

    private static final String ARROW_CONTENT_TYPE = "application/vnd.apache.arrow.file";
    private static final int MAX_READ_PASSES = 5;

    private final S3Client s3;
    private final String bucket;
    private final String prefix;
    private final String key; // null = prefix listing
    private final RetryPolicy retry;
    private final String id;

    public S3ForecastBackend(S3Client s3, String bucket, String prefix, String key, RetryPolicy retry) {
        this.s3 = s3;
        this.bucket = bucket;
        this.prefix = normalizePrefix(prefix);
        this.key = key == null || key.isBlank() ? null : key.trim();
        this.retry = retry;
        this.id = "s3://" + bucket + "/" + (this.key != null ? this.key : this.prefix);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public List<ForecastRecord> loadAll() {
        return retry.call(id, "load", () -> {
            long t0 = System.currentTimeMillis();
            if (key != null) {
                byte[] bytes = guarded(() -> download(key));
                List<ForecastRecord> out = bytes == null ? List.of()
                        : ArrowForecastCodec.fromBytes(bytes, "s3://" + bucket + "/" + key);
                log.info("Loaded {} records from {} ({} ms)", out.size(), id, System.currentTimeMillis() - t0);
                return out;
            }
            for (int pass = 1;; pass++) {
                List<String> keys = currentKeys();
                List<ForecastRecord> out = new ArrayList<>();
                String missing = null;
                for (String k : keys) {
                    byte[] bytes = guarded(() -> download(k));
                    if (bytes == null) {
                        missing = k;
                        break;
                    }
                    out.addAll(ArrowForecastCodec.fromBytes(bytes, "s3://" + bucket + "/" + k));
                }
                if (missing == null) {
                    log.info("Loaded {} records from {} object(s) at {} ({} ms)", out.size(), keys.size(), id,
                            System.currentTimeMillis() - t0);
                    return out;
                }
                if (pass >= MAX_READ_PASSES)
                    throw new IOException("Listed object s3://" + bucket + "/" + missing + " kept disappearing");
                log.debug("{} changed while loading ({} gone), re-reading manifest", id, missing);
            }
        });
    }

    @Override
    public void replaceAll(List<ForecastRecord> records) {
        byte[] body = encode(records);
        if (key != null) {
            retry.run(id, "replace", () -> {
                guarded(() -> put(key, body, ARROW_CONTENT_TYPE));
                log.info("Replaced {} with {} records", id, records.size());
            });
            return;
        }
        String target = prefix + ArrowDirectoryBackend.newDataName();
        retry.run(id, "replace", () -> {
            List<String> keys = new ArrayList<>();
            if (!records.isEmpty()) {
                guarded(() -> put(target, body, ARROW_CONTENT_TYPE));
                keys.add(target);
            }
            publish(keys);
            removeUnlisted(keys);
            log.info("Replaced {} with {} records", id, records.size());
        });
    }

    @Override
    public void append(List<ForecastRecord> records) {
        if (records.isEmpty())
            return;
        if (key != null)
            throw new UnsupportedOperationException("append needs a prefix, not a single object key (" + id + ")");
        byte[] body = encode(records);
        String target = prefix + ArrowDirectoryBackend.newDataName();
        retry.run(id, "append", () -> {
            guarded(() -> put(target, body, ARROW_CONTENT_TYPE));
            List<String> keys = new ArrayList<>(currentKeys());
            if (!keys.contains(target))
                keys.add(target);
            publish(keys);
            log.info("Appended {} records to {} as {}", records.size(), id, target);
        });
    }

    @Override
    public boolean hasData() {
        return retry.call(id, "list", () -> {
            if (key != null)
                return guarded(() -> download(key)) != null;
            return !currentKeys().isEmpty();
        });
    }

    /**
     * Keys of the visible data set: the manifest entries when there is a
     * manifest, otherwise every {@code *.arrow} key under the prefix.
     */
    private List<String> currentKeys() throws Exception {
        byte[] manifest = guarded(() -> download(manifestKey()));
        if (manifest == null)
            return guarded(this::listDataKeys);
        List<String> keys = new ArrayList<>();
        for (String line : new String(manifest, StandardCharsets.UTF_8).split("\n")) {
            String name = line.trim();
            if (!name.isEmpty())
                keys.add(prefix + name);
        }
        return keys;
    }

    private void publish(List<String> keys) throws Exception {
        StringBuilder sb = new StringBuilder();
        for (String k : keys)
            sb.append(k.substring(prefix.length())).append('\n');
        byte[] body = sb.toString().getBytes(StandardCharsets.UTF_8);
        guarded(() -> put(manifestKey(), body, "text/plain; charset=utf-8"));
    }

    /**
     * Deletes data objects the manifest no longer names. A failed delete only
     * leaves an unread object behind.
     */
    private void removeUnlisted(List<String> keys) throws Exception {
        for (String k : guarded(this::listDataKeys)) {
            if (keys.contains(k))
                continue;
            try {
                guarded(() -> delete(k));
            } catch (SdkException | BackendUnavailableException e) {
                log.warn("Could not remove unlisted object s3://{}/{}: {}", bucket, k, e.getMessage());
            }
        }
    }

    private String manifestKey() {
        return prefix + ArrowDirectoryBackend.MANIFEST;
    }

    @Override
    public void close() {
        s3.close();
    }

    /**
     * All {@code *.arrow} keys under the prefix, following continuation tokens.
     */
    private List<String> listDataKeys() {
        List<String> keys = new ArrayList<>();
        String token = null;
        do {
            ListObjectsV2Request.Builder req = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
            if (token != null)
                req.continuationToken(token);
            ListObjectsV2Response resp = s3.listObjectsV2(req.build());
            for (S3Object o : resp.contents()) {
                if (o.key().endsWith(ArrowDirectoryBackend.SUFFIX))
                    keys.add(o.key());
            }
            token = Boolean.TRUE.equals(resp.isTruncated()) ? resp.nextContinuationToken() : null;
        } while (token != null);
        keys.sort(null);
        return keys;
    }

    /**
     * Returns the object body, or null when the key does not exist.
     */
    private byte[] download(String k) {
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(k).build()).asByteArray();
        } catch (NoSuchKeyException e) {
            return null;
        }
    }

    private Void put(String k, byte[] body, String contentType) {
        s3.putObject(PutObjectRequest.builder()
                .bucket(bucket)
                .key(k)
                .contentType(contentType)
                .build(), RequestBody.fromBytes(body));
        return null;
    }

    private Void delete(String k) {
        s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(k).build());
        return null;
    }

    /**
     * Client errors (4xx other than 429) will not get better on retry; they are
     * surfaced right away.
     */
    private <T> T guarded(RetryPolicy.IoCall<T> call) throws Exception {
        try {
            return call.call();
        } catch (S3Exception e) {
            int status = e.statusCode();
            if (status >= 400 && status < 500 && status != 429)
                throw new BackendUnavailableException(id, "S3 rejected request on " + id + ": HTTP " + status
                        + " " + e.getMessage(), e);
            throw e;
        }
    }

    private static byte[] encode(List<ForecastRecord> records) {
        try {
            return ArrowForecastCodec.toBytes(records);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode forecasts as Arrow", e);
        }
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank())
            return "";
        String p = prefix.trim();
        while (p.startsWith("/"))
            p = p.substring(1);
        return p.endsWith("/") || p.isEmpty() ? p : p + "/";
    }
}
