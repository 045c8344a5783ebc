package se.nbis.sda.pipeline.worker;

/**
 * How far a delivery got through {@link WorkerLoop}. The last two are the failure terminals.
 */
public enum DeliveryState {
    RECEIVED,
    VALIDATED,
    PROCESSED,
    PERSISTED,
    PUBLISHED,
    ACKNOWLEDGED,
    REJECTED,
    REQUEUED
}
