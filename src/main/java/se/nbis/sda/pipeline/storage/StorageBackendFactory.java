package se.nbis.sda.pipeline.storage;

import lombok.extern.slf4j.Slf4j;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import se.nbis.sda.pipeline.config.PipelineProperties;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.nio.file.Path;

/**
 * Creates the {@link StorageBackend} for one storage role from its configuration block.
 */
@Slf4j
public final class StorageBackendFactory {

    private static final int MIN_PART_SIZE = 5 * 1024 * 1024;

    private StorageBackendFactory() {
    }

    public static StorageBackend create(String role, PipelineProperties.Storage config) {
        String type = config.getType() == null ? "" : config.getType().trim().toLowerCase();
        return switch (type) {
            case "posix" -> createPosix(role, config.getPosix());
            case "s3" -> createS3(role, config.getS3());
            default -> throw new StorageConfigurationException(
                    "Unknown storage type '" + config.getType() + "' for " + role + " storage");
        };
    }

    private static StorageBackend createPosix(String role, PipelineProperties.Posix posix) {
        if (posix.getLocation() == null || posix.getLocation().isBlank()) {
            throw new StorageConfigurationException("sda." + role + ".posix.location must be set");
        }
        log.info("Using POSIX storage at '{}' for the {} role.", posix.getLocation(), role);
        return new PosixStorageBackend(Path.of(posix.getLocation()));
    }

    private static StorageBackend createS3(String role, PipelineProperties.S3 s3) {
        if (s3.getUrl() == null || s3.getUrl().isBlank() || s3.getBucket() == null || s3.getBucket().isBlank()) {
            throw new StorageConfigurationException("sda." + role + ".s3.url and sda." + role
                                                    + ".s3.bucket must be set");
        }
        if (s3.getChunkSize() < MIN_PART_SIZE) {
            throw new StorageConfigurationException("sda." + role + ".s3.chunk-size must be at least "
                                                    + MIN_PART_SIZE + " bytes");
        }
        log.info("Using S3 bucket '{}' at {} for the {} role.", s3.getBucket(), endpoint(s3), role);
        return new S3StorageBackend(createS3Client(s3), s3.getBucket(), s3.getChunkSize(),
                                    Math.max(1, s3.getUploadConcurrency()));
    }

    static S3Client createS3Client(PipelineProperties.S3 s3) {
        SSLConnectionSocketFactory socketFactory = new SSLConnectionSocketFactory(
                TlsContextFactory.create(s3.getCacert()), TlsContextFactory.PROTOCOLS, null,
                SSLConnectionSocketFactory.getDefaultHostnameVerifier());

        RetryPolicy retryPolicy = RetryPolicy.forRetryMode(RetryMode.STANDARD).toBuilder()
                                             .numRetries(s3.getRetryCount()).build();

        return S3Client.builder()
                       .httpClientBuilder(ApacheHttpClient.builder().socketFactory(socketFactory))
                       .endpointOverride(URI.create(endpoint(s3)))
                       .region(Region.of(s3.getRegion()))
                       .credentialsProvider(StaticCredentialsProvider.create(
                               AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey())))
                       .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                       .overrideConfiguration(ClientOverrideConfiguration.builder().retryPolicy(retryPolicy).build())
                       .build();
    }

    /**
     * Joins url and port. A url without scheme is taken to be https.
     */
    static String endpoint(PipelineProperties.S3 s3) {
        String url = s3.getUrl().trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            url = "https://" + url;
        }
        return url + ":" + s3.getPort();
    }
}
