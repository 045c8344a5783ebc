package se.nbis.sda.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;
import se.nbis.sda.pipeline.config.PipelineProperties;

/**
 * Entry point of the ingestion workers. One process runs one worker, chosen with {@code sda.worker}:
 * {@code copy} syncs accessioned files to backup storage, {@code verify} decrypts and checksums archived files.
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "se.nbis.sda.pipeline.repository")
@EnableConfigurationProperties(value = PipelineProperties.class)
@EnableRetry
public class SdaPipelineApplication {

    public static void main(final String[] args) {
        log.info("Starting SdaPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(SdaPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "sda-pipeline"));
        log.info("  - Worker:     {}", env.getProperty("sda.worker", "<none>"));
        log.info("  - Queue:      {}", env.getProperty("sda.broker.queue"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
