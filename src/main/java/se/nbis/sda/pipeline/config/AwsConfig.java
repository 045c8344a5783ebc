package se.nbis.sda.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.SqsAsyncClientBuilder;

import java.net.URI;

/**
 * Configures the SQS client the broker runs on. The credential strategy depends on the active Spring profile.
 * Object storage clients are not created here; each storage role builds its own from {@code sda.*}.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.sqs.endpoint:}")
    private String sqsEndpoint;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(accessKey) || !StringUtils.hasText(secretKey)) {
                throw new IllegalArgumentException(
                        "aws.access-key and aws.secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        } else {
            log.info("Non-local profile active. Using DefaultCredentialsProvider (for IAM role).");
            return DefaultCredentialsProvider.create();
        }
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        SqsAsyncClientBuilder builder = SqsAsyncClient.builder()
                                                      .region(Region.of(awsRegion))
                                                      .credentialsProvider(credentialsProvider);
        if (StringUtils.hasText(sqsEndpoint)) {
            log.info("Using SQS endpoint override: {}", sqsEndpoint);
            builder.endpointOverride(URI.create(sqsEndpoint));
        }
        return builder.build();
    }
}
