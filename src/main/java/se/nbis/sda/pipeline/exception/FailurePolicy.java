package se.nbis.sda.pipeline.exception;

/**
 * How a failed delivery is handed back to the broker.
 */
public enum FailurePolicy {
    /**
     * The message can never succeed. Negative-acknowledge without requeue and report it on the error channel.
     */
    REJECT,
    /**
     * The failure may clear up later. Negative-acknowledge with requeue so the broker redelivers it.
     */
    REQUEUE
}
