package se.nbis.sda.pipeline.broker;

import io.awspring.cloud.sqs.listener.Visibility;
import io.awspring.cloud.sqs.listener.acknowledgement.Acknowledgement;
import se.nbis.sda.pipeline.exception.BrokerOperationException;

/**
 * A message handed over by the SQS listener container in manual acknowledgement mode.
 * <p>
 * Ack and reject both delete the message. A requeue sets its visibility timeout to zero so that the next poll
 * picks it up again.
 */
public class SqsListenerDelivery extends AbstractDelivery {

    private final Acknowledgement acknowledgement;
    private final Visibility visibility;

    public SqsListenerDelivery(String correlationId, byte[] body, Acknowledgement acknowledgement,
                               Visibility visibility) {
        super(correlationId, body);
        this.acknowledgement = acknowledgement;
        this.visibility = visibility;
    }

    @Override
    protected void doAck() {
        acknowledge("ack");
    }

    @Override
    protected void doNack(boolean requeue) {
        if (!requeue) {
            acknowledge("reject");
            return;
        }
        try {
            visibility.changeTo(0);
        } catch (RuntimeException e) {
            throw new BrokerOperationException("Failed to requeue message " + getCorrelationId(), e);
        }
    }

    private void acknowledge(String operation) {
        try {
            acknowledgement.acknowledge();
        } catch (RuntimeException e) {
            throw new BrokerOperationException("Failed to " + operation + " message " + getCorrelationId(), e);
        }
    }
}
