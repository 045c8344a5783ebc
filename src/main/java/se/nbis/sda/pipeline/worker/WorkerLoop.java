package se.nbis.sda.pipeline.worker;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import se.nbis.sda.pipeline.broker.Delivery;
import se.nbis.sda.pipeline.broker.MessageBroker;
import se.nbis.sda.pipeline.common.json.JsonSerializer;
import se.nbis.sda.pipeline.config.PipelineProperties;
import se.nbis.sda.pipeline.dto.message.ErrorMessage;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.WorkerException;
import se.nbis.sda.pipeline.validation.MessageSchema;
import se.nbis.sda.pipeline.validation.MessageValidator;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Skeleton shared by the workers: take one delivery at a time through validate, work, persist, publish and
 * acknowledge. The SQS listener container calls {@link #handle(Delivery)} on a single consumer thread.
 * <p>
 * Each step either completes or ends the delivery according to the {@link FailurePolicy} of the failure.
 * Rejected messages are reported on the error channel. A delivery is only acknowledged after its state
 * transition was written and the broker confirmed the follow-up message; the steps before that are idempotent
 * and run again on redelivery.
 *
 * @param <M> inbound message type
 * @param <R> result of the unit of work
 * @param <C> outbound completion message type
 */
@Slf4j
public abstract class WorkerLoop<M, R, C> {

    public static final String MDC_CORRELATION_ID = "correlationId";

    protected final MessageBroker broker;
    protected final MessageValidator validator;
    private final JsonSerializer jsonSerializer;
    private final PipelineProperties.Broker brokerConfig;

    protected WorkerLoop(MessageBroker broker, MessageValidator validator, JsonSerializer jsonSerializer,
                         PipelineProperties.Broker brokerConfig) {
        this.broker = broker;
        this.validator = validator;
        this.jsonSerializer = jsonSerializer;
        this.brokerConfig = brokerConfig;
    }

    protected abstract MessageSchema<M> inboundSchema();

    protected abstract MessageSchema<C> outboundSchema();

    /**
     * Performs the unit of work for a validated message.
     */
    protected abstract R process(M message);

    /**
     * @return the follow-up message, or empty when the delivery needs neither a state transition nor a publish.
     */
    protected abstract Optional<C> buildCompletion(M message, R result);

    /**
     * Writes the state transition for a processed message.
     */
    protected abstract void persist(M message, R result);

    /**
     * Identifying fields of a message for log lines.
     */
    protected abstract String describe(M message);

    /**
     * Takes one delivery through every step and resolves it exactly once. Never throws: a failure that escapes
     * the failure policies requeues the delivery, so the consumer thread keeps polling.
     *
     * @return the state the delivery ended in.
     */
    public DeliveryState handle(Delivery delivery) {
        MDC.put(MDC_CORRELATION_ID, delivery.getCorrelationId());
        try {
            return doHandle(delivery);
        } catch (RuntimeException e) {
            log.error("Unhandled failure while handling message {}.", delivery.getCorrelationId(), e);
            if (delivery.isResolved()) {
                log.warn("Message {} was already resolved, leaving it as is.", delivery.getCorrelationId());
            } else {
                resolve(delivery, true);
            }
            return DeliveryState.REQUEUED;
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private DeliveryState doHandle(Delivery delivery) {
        DeliveryState state = DeliveryState.RECEIVED;
        M message = null;
        try {
            message = validator.parse(delivery.getBody(), inboundSchema());
            state = DeliveryState.VALIDATED;

            R result = process(message);
            state = DeliveryState.PROCESSED;

            Optional<C> completion = buildCompletion(message, result);
            if (completion.isPresent()) {
                validator.validate(completion.get(), outboundSchema());
                persist(message, result);
                state = DeliveryState.PERSISTED;

                broker.publish(delivery.getCorrelationId(), brokerConfig.getExchange(), brokerConfig.getRoutingKey(),
                               brokerConfig.isDurable(), jsonSerializer.serializeToBytes(completion.get()));
                state = DeliveryState.PUBLISHED;
            }
        } catch (WorkerException e) {
            return fail(delivery, message, state, e.getPolicy(), e);
        } catch (DataAccessException e) {
            return fail(delivery, message, state, FailurePolicy.REQUEUE, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while handling message {}.", delivery.getCorrelationId(), e);
            return fail(delivery, message, state, FailurePolicy.REQUEUE, e);
        }

        String subject = describe(message);
        try {
            delivery.ack();
            log.info("Message handled and acknowledged: {}.", subject);
        } catch (RuntimeException e) {
            log.error("Failed to acknowledge message {} ({}).", delivery.getCorrelationId(), subject, e);
        }
        return DeliveryState.ACKNOWLEDGED;
    }

    private DeliveryState fail(Delivery delivery, M message, DeliveryState reached, FailurePolicy policy,
                               RuntimeException cause) {
        String subject = message == null ? "unparsed message" : describe(message);
        if (policy == FailurePolicy.REJECT) {
            log.error("Rejecting message {} after {} ({}): {}", delivery.getCorrelationId(), reached, subject,
                      cause.getMessage());
            sendToErrorChannel(delivery, cause.getMessage());
            resolve(delivery, false);
            return DeliveryState.REJECTED;
        }
        log.warn("Requeueing message {} after {} ({}): {}", delivery.getCorrelationId(), reached, subject,
                 cause.getMessage());
        resolve(delivery, true);
        return DeliveryState.REQUEUED;
    }

    private void resolve(Delivery delivery, boolean requeue) {
        try {
            delivery.nack(requeue);
        } catch (RuntimeException e) {
            log.error("Failed to nack message {} (requeue: {}).", delivery.getCorrelationId(), requeue, e);
        }
    }

    /**
     * Best effort: a failure to report is logged and does not change how the delivery is resolved.
     */
    private void sendToErrorChannel(Delivery delivery, String reason) {
        ErrorMessage error = ErrorMessage.builder()
                                         .correlationId(delivery.getCorrelationId())
                                         .reason(reason)
                                         .originalMessage(new String(delivery.getBody(), StandardCharsets.UTF_8))
                                         .build();
        try {
            broker.publish(delivery.getCorrelationId(), brokerConfig.getExchange(), brokerConfig.getRoutingError(),
                           brokerConfig.isDurable(), jsonSerializer.serializeToBytes(error));
        } catch (RuntimeException e) {
            log.error("Failed to report message {} on the error channel.", delivery.getCorrelationId(), e);
        }
    }
}
