package se.nbis.sda.pipeline.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import se.nbis.sda.pipeline.broker.ProcessTerminator;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
public class SqsListenerConfig {

    public static final String WORKER_CONTAINER_FACTORY = "workerContainerFactory";

    /**
     * Container for the work queue. Messages are taken one at a time and only acknowledged by the worker, after
     * the follow-up message has been confirmed.
     */
    @Bean(WORKER_CONTAINER_FACTORY)
    public SqsMessageListenerContainerFactory<Object> workerContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                             PipelineProperties properties) {
        int pollWaitSeconds = properties.getBroker().getPollWaitSeconds();

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);

        // One in flight: the worker steps are strictly sequential
        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.MANUAL)
                                            .maxConcurrentMessages(1).maxMessagesPerPoll(1)
                                            .pollTimeout(Duration.ofSeconds(pollWaitSeconds)));
        return factory;
    }

    /**
     * Closes the context, so the container finishes the message in hand, before exiting with the given status.
     */
    @Bean
    public ProcessTerminator processTerminator(ApplicationContext context) {
        return status -> System.exit(SpringApplication.exit(context, () -> status));
    }
}
