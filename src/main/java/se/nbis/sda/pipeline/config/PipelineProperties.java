package se.nbis.sda.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "sda" prefix to a strongly-typed configuration object.
 */
@Data
@ConfigurationProperties(prefix = "sda")
public class PipelineProperties {

    /**
     * Which worker this process runs: {@code copy} or {@code verify}.
     */
    private String worker;

    private Broker broker = new Broker();
    private Storage archive = new Storage();
    private Storage backup = new Storage();
    private C4gh c4gh = new C4gh();
    private Database database = new Database();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Broker {
        private String queue;
        private String exchange = "";
        private String routingKey;
        private String routingError = "error";
        private boolean durable = true;
        private int pollWaitSeconds = 20;
        private long connectionCheckIntervalMs = 30_000;
        private int maxConnectionFailures = 3;
    }

    @Data
    public static class Storage {
        /**
         * {@code posix} or {@code s3}.
         */
        private String type = "posix";
        private Posix posix = new Posix();
        private S3 s3 = new S3();
    }

    @Data
    public static class Posix {
        private String location;
    }

    @Data
    public static class S3 {
        private String url;
        private int port = 443;
        private String region = "us-east-1";
        private String accessKey;
        private String secretKey;
        private String bucket;
        private int uploadConcurrency = 2;
        private int chunkSize = 50 * 1024 * 1024;
        private String cacert;
        private int retryCount = 3;
    }

    @Data
    public static class C4gh {
        private String filePath;
        private String passphrase = "";
    }

    @Data
    public static class Database {
        private RetryConfig retry = new RetryConfig();
    }
}
