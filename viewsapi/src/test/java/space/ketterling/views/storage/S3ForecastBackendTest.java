package space.ketterling.views.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import space.ketterling.views.errors.BackendUnavailableException;
import space.ketterling.views.model.ForecastRecord;
import space.ketterling.views.testsupport.Forecasts;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class S3ForecastBackendTest {

    private static final String MANIFEST = "api_ready/MANIFEST";

    @Mock
    S3Client s3;

    private S3ForecastBackend prefixBackend(int attempts) {
        return new S3ForecastBackend(s3, "bucket", "api_ready", null, new RetryPolicy(attempts, Duration.ZERO));
    }

    private static ResponseBytes<GetObjectResponse> bytes(List<ForecastRecord> records) throws Exception {
        return ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), ArrowForecastCodec.toBytes(records));
    }

    private static S3Object obj(String key) {
        return S3Object.builder().key(key).build();
    }

    private static GetObjectRequest getOf(String key) {
        return argThat(r -> r != null && key.equals(r.key()));
    }

    private static ResponseBytes<GetObjectResponse> text(String body) {
        return ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                body.getBytes(StandardCharsets.UTF_8));
    }

    private void noManifest() {
        doThrow(NoSuchKeyException.builder().statusCode(404).message("no manifest").build())
                .when(s3).getObjectAsBytes(getOf(MANIFEST));
    }

    private static String bodyOf(RequestBody body) throws Exception {
        try (InputStream in = body.contentStreamProvider().newStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void idNamesBucketAndPrefix() {
        assertThat(prefixBackend(1).id()).isEqualTo("s3://bucket/api_ready/");
        assertThat(new S3ForecastBackend(s3, "bucket", "", "data/f.arrow", new RetryPolicy(1, Duration.ZERO)).id())
                .isEqualTo("s3://bucket/data/f.arrow");
    }

    @Test
    void loadFollowsPaginationAndSkipsNonArrowKeys() throws Exception {
        List<ForecastRecord> first = List.of(Forecasts.record(1, "2024-01", "800", 1));
        List<ForecastRecord> second = List.of(Forecasts.record(2, "2024-01", "800", 2));
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(
                ListObjectsV2Response.builder()
                        .contents(obj("api_ready/a.arrow"), obj("api_ready/readme.txt"))
                        .isTruncated(true).nextContinuationToken("t1").build(),
                ListObjectsV2Response.builder()
                        .contents(obj("api_ready/b.arrow"))
                        .isTruncated(false).build());
        doReturn(bytes(first)).when(s3).getObjectAsBytes(getOf("api_ready/a.arrow"));
        doReturn(bytes(second)).when(s3).getObjectAsBytes(getOf("api_ready/b.arrow"));
        noManifest();

        List<ForecastRecord> out = prefixBackend(1).loadAll();

        assertThat(out).extracting(ForecastRecord::gridId).containsExactly(1, 2);
        ArgumentCaptor<ListObjectsV2Request> req = ArgumentCaptor.forClass(ListObjectsV2Request.class);
        verify(s3, times(2)).listObjectsV2(req.capture());
        assertThat(req.getAllValues().get(0).continuationToken()).isNull();
        assertThat(req.getAllValues().get(1).continuationToken()).isEqualTo("t1");
        assertThat(req.getAllValues().get(0).prefix()).isEqualTo("api_ready/");
    }

    @Test
    void forbiddenIsNotRetried() {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("Access Denied").build());
        noManifest();

        assertThatThrownBy(() -> prefixBackend(3).loadAll())
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("HTTP 403");
        verify(s3, times(1)).listObjectsV2(any(ListObjectsV2Request.class));
    }

    @Test
    void serverErrorIsRetried() throws Exception {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
                .thenThrow(S3Exception.builder().statusCode(503).message("Slow Down").build())
                .thenReturn(ListObjectsV2Response.builder().contents(obj("api_ready/a.arrow")).build());
        doReturn(bytes(List.of(Forecasts.record(1, "2024-01", "800", 1))))
                .when(s3).getObjectAsBytes(getOf("api_ready/a.arrow"));
        noManifest();

        assertThat(prefixBackend(3).loadAll()).hasSize(1);
        verify(s3, times(2)).listObjectsV2(any(ListObjectsV2Request.class));
    }

    @Test
    void replaceWritesDataThenSwitchesManifestThenDeletesUnlisted() throws Exception {
        when(s3.listObjectsV2(any(ListObjectsV2Request.class))).thenAnswer(inv -> ListObjectsV2Response.builder()
                .contents(obj("api_ready/forecasts-old.arrow"), obj("api_ready/forecasts-appended.arrow"))
                .build());

        prefixBackend(1).replaceAll(Forecasts.smallSet());

        InOrder order = inOrder(s3);
        ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        order.verify(s3, times(2)).putObject(put.capture(), body.capture());
        order.verify(s3, times(2)).deleteObject(any(DeleteObjectRequest.class));
        String dataKey = put.getAllValues().get(0).key();
        assertThat(dataKey).startsWith("api_ready/forecasts-").endsWith(".arrow");
        assertThat(put.getAllValues().get(1).key()).isEqualTo(MANIFEST);
        assertThat(bodyOf(body.getAllValues().get(1)).trim()).isEqualTo(dataKey.substring("api_ready/".length()));
    }

    @Test
    void objectsLeftOutOfTheManifestAreNotRead() throws Exception {
        doReturn(text("forecasts-live.arrow\n")).when(s3).getObjectAsBytes(getOf(MANIFEST));
        doReturn(bytes(List.of(Forecasts.record(1, "2024-01", "800", 1))))
                .when(s3).getObjectAsBytes(getOf("api_ready/forecasts-live.arrow"));

        assertThat(prefixBackend(1).loadAll()).extracting(ForecastRecord::gridId).containsExactly(1);
        verify(s3, never()).listObjectsV2(any(ListObjectsV2Request.class));
    }

    @Test
    void loadStartsOverWhenAListedObjectWasReplacedMeanwhile() throws Exception {
        doReturn(text("forecasts-old.arrow\n"), text("forecasts-new.arrow\n"))
                .when(s3).getObjectAsBytes(getOf(MANIFEST));
        doThrow(NoSuchKeyException.builder().statusCode(404).message("gone").build())
                .when(s3).getObjectAsBytes(getOf("api_ready/forecasts-old.arrow"));
        doReturn(bytes(List.of(Forecasts.record(7, "2024-01", "800", 7))))
                .when(s3).getObjectAsBytes(getOf("api_ready/forecasts-new.arrow"));

        assertThat(prefixBackend(1).loadAll()).extracting(ForecastRecord::gridId).containsExactly(7);
    }

    @Test
    void appendExtendsTheManifest() throws Exception {
        doReturn(text("forecasts-base.arrow\n")).when(s3).getObjectAsBytes(getOf(MANIFEST));

        prefixBackend(1).append(List.of(Forecasts.record(2, "2024-01", "800", 2)));

        ArgumentCaptor<PutObjectRequest> put = ArgumentCaptor.forClass(PutObjectRequest.class);
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);
        verify(s3, times(2)).putObject(put.capture(), body.capture());
        String added = put.getAllValues().get(0).key().substring("api_ready/".length());
        assertThat(put.getAllValues().get(1).key()).isEqualTo(MANIFEST);
        assertThat(bodyOf(body.getAllValues().get(1)).split("\n")).containsExactly("forecasts-base.arrow", added);
        verify(s3, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void missingSingleKeyMeansNoData() {
        when(s3.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().statusCode(404).message("nope").build());
        S3ForecastBackend b = new S3ForecastBackend(s3, "bucket", "", "f.arrow", new RetryPolicy(1, Duration.ZERO));

        assertThat(b.hasData()).isFalse();
        assertThat(b.loadAll()).isEmpty();
    }

    @Test
    void appendToSingleKeyIsUnsupported() {
        S3ForecastBackend b = new S3ForecastBackend(s3, "bucket", "", "f.arrow", new RetryPolicy(1, Duration.ZERO));

        assertThatThrownBy(() -> b.append(List.of(Forecasts.record(1, "2024-01", "800", 1))))
                .isInstanceOf(UnsupportedOperationException.class);
        verify(s3, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
    }
}
