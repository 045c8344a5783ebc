package se.nbis.sda.pipeline.broker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.config.PipelineProperties;

/**
 * Checks the broker on a fixed schedule and terminates the process once the connection has been lost for
 * too many consecutive checks. The orchestrator restarts the worker with a fresh connection.
 */
@Slf4j
@Component
public class ConnectionWatcher {

    public static final int EXIT_STATUS = 1;

    private final MessageBroker broker;
    private final ProcessTerminator terminator;
    private final int maxFailures;
    private int consecutiveFailures;

    public ConnectionWatcher(MessageBroker broker, ProcessTerminator terminator, PipelineProperties properties) {
        this.broker = broker;
        this.terminator = terminator;
        this.maxFailures = Math.max(1, properties.getBroker().getMaxConnectionFailures());
    }

    @Scheduled(fixedDelayString = "${sda.broker.connection-check-interval-ms}",
               initialDelayString = "${sda.broker.connection-check-interval-ms}")
    public void checkConnection() {
        if (broker.isConnected()) {
            if (consecutiveFailures > 0) {
                log.info("Broker connection restored after {} failed check(s).", consecutiveFailures);
            }
            consecutiveFailures = 0;
            return;
        }
        consecutiveFailures++;
        log.warn("Broker connection check failed ({} of {}).", consecutiveFailures, maxFailures);
        if (consecutiveFailures >= maxFailures) {
            log.error("Lost connection to the broker, shutting down with exit status {}.", EXIT_STATUS);
            terminator.exit(EXIT_STATUS);
        }
    }
}
