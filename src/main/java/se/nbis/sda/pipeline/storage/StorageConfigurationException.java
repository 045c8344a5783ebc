package se.nbis.sda.pipeline.storage;

import java.io.Serial;

/**
 * A storage backend could not be built from its configuration. Raised during startup only.
 */
public class StorageConfigurationException extends IllegalStateException {
    @Serial
    private static final long serialVersionUID = -6233409825510375530L;

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
