package se.nbis.sda.pipeline.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import se.nbis.sda.pipeline.storage.StorageBackend;
import se.nbis.sda.pipeline.storage.StorageBackendFactory;

/**
 * One {@link StorageBackend} per storage role. Only the copy worker writes to a backup.
 */
@Configuration
public class StorageConfig {

    @Bean
    public StorageBackend archiveStorage(PipelineProperties properties) {
        return StorageBackendFactory.create("archive", properties.getArchive());
    }

    @Bean
    @ConditionalOnProperty(name = "sda.worker", havingValue = "copy")
    public StorageBackend backupStorage(PipelineProperties properties) {
        return StorageBackendFactory.create("backup", properties.getBackup());
    }
}
