package se.nbis.sda.pipeline.broker;

import io.awspring.cloud.sqs.operations.SqsOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import se.nbis.sda.pipeline.config.PipelineProperties;
import se.nbis.sda.pipeline.exception.PublishException;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.GetQueueUrlRequest;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link MessageBroker} on Amazon SQS.
 * <p>
 * Publishing goes through {@link SqsOperations}; its send only returns once SQS has stored the message, which
 * is the confirmation the workers wait for. The routing key names the destination queue and the exchange, when
 * set, travels as a message attribute. SQS messages are always durable.
 */
@Slf4j
@Component
public class SqsMessageBroker implements MessageBroker {

    public static final String CORRELATION_ID_HEADER = "correlation_id";
    public static final String EXCHANGE_HEADER = "exchange";

    private static final long CHECK_TIMEOUT_SECONDS = 10;

    private final SqsAsyncClient sqsAsyncClient;
    private final SqsOperations sqsOperations;
    private final PipelineProperties.Broker config;

    public SqsMessageBroker(SqsAsyncClient sqsAsyncClient, SqsOperations sqsOperations,
                            PipelineProperties properties) {
        this.sqsAsyncClient = sqsAsyncClient;
        this.sqsOperations = sqsOperations;
        this.config = properties.getBroker();
    }

    @Override
    public void publish(String correlationId, String exchange, String routingKey, boolean durable, byte[] body) {
        String payload = new String(body, StandardCharsets.UTF_8);
        try {
            sqsOperations.send(to -> {
                to.queue(routingKey).payload(payload).header(CORRELATION_ID_HEADER, correlationId);
                if (StringUtils.hasText(exchange)) {
                    to.header(EXCHANGE_HEADER, exchange);
                }
            });
            log.debug("Published message with correlation id {} to '{}'.", correlationId, routingKey);
        } catch (RuntimeException e) {
            throw new PublishException("Publishing to '" + routingKey + "' was not confirmed", e);
        }
    }

    @Override
    public boolean isConnected() {
        try {
            sqsAsyncClient.getQueueUrl(GetQueueUrlRequest.builder().queueName(config.getQueue()).build())
                          .get(CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Broker connection check failed: {}", e.toString());
            return false;
        }
    }
}
