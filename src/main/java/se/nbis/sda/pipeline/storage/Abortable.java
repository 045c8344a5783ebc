package se.nbis.sda.pipeline.storage;

import java.io.IOException;

/**
 * A writer whose partial output can be thrown away instead of committed.
 * <p>
 * Writers returned by {@link StorageBackend#openWriter(String)} implement this when closing them would publish
 * whatever was written so far. After {@code abort()} the stream is closed and nothing of it is visible at the
 * destination path.
 */
public interface Abortable {

    void abort() throws IOException;
}
