package se.nbis.sda.pipeline.broker;

/**
 * The operations the workers need from a message broker besides consuming, which the listener container owns.
 */
public interface MessageBroker {

    /**
     * Publishes {@code body} and returns once the broker has confirmed it.
     *
     * @param durable whether the message must survive a broker restart, for brokers where that is optional.
     * @throws se.nbis.sda.pipeline.exception.PublishException if the broker did not confirm the message.
     */
    void publish(String correlationId, String exchange, String routingKey, boolean durable, byte[] body);

    /**
     * Cheap liveness check used by the connection watcher.
     */
    boolean isConnected();
}
