package se.nbis.sda.pipeline.broker;

/**
 * Ends the JVM. Pulled out of {@link ConnectionWatcher} so tests can observe the exit instead of suffering it.
 */
@FunctionalInterface
public interface ProcessTerminator {

    void exit(int status);
}
