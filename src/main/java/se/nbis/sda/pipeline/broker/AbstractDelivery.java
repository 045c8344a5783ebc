package se.nbis.sda.pipeline.broker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Enforces single resolution of a {@link Delivery}. Subclasses only implement the broker calls.
 */
public abstract class AbstractDelivery implements Delivery {

    private final String correlationId;
    private final byte[] body;
    private final AtomicBoolean resolved = new AtomicBoolean();

    protected AbstractDelivery(String correlationId, byte[] body) {
        this.correlationId = correlationId;
        this.body = body;
    }

    @Override
    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public byte[] getBody() {
        return body;
    }

    @Override
    public final void ack() {
        markResolved("ack");
        doAck();
    }

    @Override
    public final void nack(boolean requeue) {
        markResolved("nack");
        doNack(requeue);
    }

    @Override
    public boolean isResolved() {
        return resolved.get();
    }

    protected abstract void doAck();

    protected abstract void doNack(boolean requeue);

    private void markResolved(String operation) {
        if (!resolved.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot " + operation + " delivery " + correlationId
                                            + ": it has already been resolved");
        }
    }
}
