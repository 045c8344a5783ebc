package se.nbis.sda.pipeline.consumer;

import io.awspring.cloud.sqs.annotation.SqsListener;
import io.awspring.cloud.sqs.listener.Visibility;
import io.awspring.cloud.sqs.listener.acknowledgement.Acknowledgement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.handler.annotation.Headers;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import se.nbis.sda.pipeline.broker.SqsListenerDelivery;
import se.nbis.sda.pipeline.broker.SqsMessageBroker;
import se.nbis.sda.pipeline.config.SqsListenerConfig;
import se.nbis.sda.pipeline.worker.DeliveryState;
import se.nbis.sda.pipeline.worker.WorkerLoop;

import java.nio.charset.StandardCharsets;

/**
 * Listens on the work queue of this process and hands every message to the configured worker.
 * <p>
 * The container runs in manual acknowledgement mode, so a message stays on the queue until the worker resolves
 * it. The correlation id is taken from the {@code correlation_id} message attribute, or the SQS message id when
 * the publisher set none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "sda.worker")
public class WorkMessageConsumer {

    private final WorkerLoop<?, ?, ?> worker;

    @SqsListener(value = "${sda.broker.queue}", factory = SqsListenerConfig.WORKER_CONTAINER_FACTORY)
    public void onMessage(@Payload final String body, @Headers final MessageHeaders headers,
                          final Acknowledgement acknowledgement, final Visibility visibility) {
        String correlationId = correlationId(headers);
        log.debug("Received message {} for {}.", correlationId, worker.getClass().getSimpleName());

        DeliveryState state = worker.handle(new SqsListenerDelivery(correlationId,
                                                                    body.getBytes(StandardCharsets.UTF_8),
                                                                    acknowledgement, visibility));
        log.debug("Message {} ended in state {}.", correlationId, state);
    }

    static String correlationId(MessageHeaders headers) {
        Object attribute = headers.get(SqsMessageBroker.CORRELATION_ID_HEADER);
        if (attribute != null && StringUtils.hasText(attribute.toString())) {
            return attribute.toString();
        }
        return String.valueOf(headers.getId());
    }
}
