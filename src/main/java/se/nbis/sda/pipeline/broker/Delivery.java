package se.nbis.sda.pipeline.broker;

/**
 * One message received from the broker, still owned by this consumer until it is resolved.
 * <p>
 * A delivery is resolved exactly once, either by {@link #ack()} or by {@link #nack(boolean)}. Resolving it a
 * second time throws {@link IllegalStateException}.
 */
public interface Delivery {

    String getCorrelationId();

    byte[] getBody();

    /**
     * Confirms the message was handled; the broker forgets it.
     */
    void ack();

    /**
     * Hands the message back. With {@code requeue} the broker redelivers it, otherwise it is dropped.
     */
    void nack(boolean requeue);

    boolean isResolved();
}
