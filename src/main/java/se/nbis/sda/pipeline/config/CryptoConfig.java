package se.nbis.sda.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import se.nbis.sda.pipeline.crypto.Crypt4GhPrivateKeys;
import se.nbis.sda.pipeline.crypto.VerificationPipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Loads the process Crypt4GH key for the verify worker. A key that cannot be loaded stops the application.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "sda.worker", havingValue = "verify")
public class CryptoConfig {

    @Bean
    public VerificationPipeline verificationPipeline(PipelineProperties properties) throws IOException {
        PipelineProperties.C4gh c4gh = properties.getC4gh();
        if (!StringUtils.hasText(c4gh.getFilePath())) {
            throw new IllegalStateException("sda.c4gh.file-path must be set for the verify worker");
        }
        char[] passphrase = c4gh.getPassphrase() == null ? new char[0] : c4gh.getPassphrase().toCharArray();
        try {
            byte[] secretKey = Crypt4GhPrivateKeys.read(Path.of(c4gh.getFilePath()), passphrase);
            VerificationPipeline pipeline = new VerificationPipeline(secretKey);
            Arrays.fill(secretKey, (byte) 0);
            return pipeline;
        } finally {
            Arrays.fill(passphrase, '\0');
        }
    }
}
