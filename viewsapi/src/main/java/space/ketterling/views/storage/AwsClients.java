package space.ketterling.views.storage;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import space.ketterling.views.config.AppConfig;

import java.net.URI;

/**
 * Builds the S3 client from app config.
 */
public final class AwsClients {
    /**
     * Utility class; no instances.
     */
    private AwsClients() {
    }

    /**
     * Static credentials when both keys are configured, otherwise the default
     * provider chain (env, profile, instance role).
     */
    public static S3Client s3Client(AppConfig cfg) {
        var b = S3Client.builder()
                .region(Region.of(cfg.cloudBucketRegion()))
                .httpClient(UrlConnectionHttpClient.create())
                .credentialsProvider(credentials(cfg))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(cfg.cloudCallTimeout())
                        .build());
        if (!cfg.cloudEndpointOverride().isBlank())
            b = b.endpointOverride(URI.create(cfg.cloudEndpointOverride())).forcePathStyle(true);
        return b.build();
    }

    private static AwsCredentialsProvider credentials(AppConfig cfg) {
        if (!cfg.awsAccessKeyId().isBlank() && !cfg.awsSecretAccessKey().isBlank()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(cfg.awsAccessKeyId(), cfg.awsSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
