package se.nbis.sda.pipeline.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Streaming access to one storage location, either a POSIX directory tree or an S3 bucket.
 * <p>
 * Implementations never hold a whole file in memory. A missing file is reported as
 * {@link java.nio.file.NoSuchFileException}; every other failure as a plain {@link IOException}.
 */
public interface StorageBackend {

    /**
     * @return the size in bytes of the file stored at {@code path}.
     */
    long size(String path) throws IOException;

    /**
     * Opens the file at {@code path} for reading. The caller must close the stream on every exit path.
     */
    InputStream openReader(String path) throws IOException;

    /**
     * Opens {@code path} for writing, replacing any existing content. The data is only durable once
     * {@link OutputStream#close()} has returned without an exception.
     */
    OutputStream openWriter(String path) throws IOException;
}
