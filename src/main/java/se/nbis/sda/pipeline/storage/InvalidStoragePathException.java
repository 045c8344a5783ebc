package se.nbis.sda.pipeline.storage;

import java.io.Serial;

/**
 * A caller supplied path that would resolve outside the storage root.
 */
public class InvalidStoragePathException extends IllegalArgumentException {
    @Serial
    private static final long serialVersionUID = 3391254107938262845L;

    public InvalidStoragePathException(String message) {
        super(message);
    }
}
