package se.nbis.sda.pipeline.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@link StorageBackend} over a single S3 bucket.
 * <p>
 * Reads stream the object body straight from {@code GetObject}; sizes come from {@code HeadObject} without
 * transferring data. Writes go through {@link S3MultipartOutputStream}, whose part uploads run on a pool owned by
 * this backend.
 */
@Slf4j
public class S3StorageBackend implements StorageBackend, AutoCloseable {

    private static final int NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucket;
    private final int partSize;
    private final int uploadConcurrency;
    private final ExecutorService uploadExecutor;

    public S3StorageBackend(S3Client s3Client, String bucket, int partSize, int uploadConcurrency) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.partSize = partSize;
        this.uploadConcurrency = uploadConcurrency;
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("s3-upload-" + bucket + "-");
        threadFactory.setDaemon(true);
        this.uploadExecutor = Executors.newCachedThreadPool(threadFactory);
        log.info("S3 storage backend initialized for bucket '{}' (part size: {} bytes, upload concurrency: {}).",
                 bucket, partSize, uploadConcurrency);
    }

    /**
     * Reads the object size from its metadata.
     *
     * @param path the object key inside the bucket.
     * @return the content length, {@code 0} if the store reports none.
     * @throws NoSuchFileException if the object does not exist.
     */
    @Override
    public long size(String path) throws IOException {
        try {
            Long length = s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(path).build())
                                  .contentLength();
            return length == null ? 0L : length;
        } catch (SdkException e) {
            throw translate(path, e);
        }
    }

    /**
     * Starts a {@code GetObject} and returns its body stream. The HTTP connection stays leased until the stream
     * is closed.
     *
     * @param path the object key inside the bucket.
     * @throws NoSuchFileException if the object does not exist.
     */
    @Override
    public InputStream openReader(String path) throws IOException {
        log.debug("Opening s3://{}/{} for reading.", bucket, path);
        try {
            return s3Client.getObject(GetObjectRequest.builder().bucket(bucket).key(path).build());
        } catch (SdkException e) {
            throw translate(path, e);
        }
    }

    /**
     * Nothing is sent before the first part is full. The returned stream is {@link Abortable}.
     *
     * @param path the object key inside the bucket.
     */
    @Override
    public OutputStream openWriter(String path) {
        log.debug("Opening s3://{}/{} for writing.", bucket, path);
        return new S3MultipartOutputStream(s3Client, bucket, path, partSize, uploadConcurrency, uploadExecutor);
    }

    /**
     * Stops accepting part uploads and closes the client. Writers still open at this point fail.
     */
    @Override
    public void close() {
        uploadExecutor.shutdown();
        s3Client.close();
    }

    private IOException translate(String path, SdkException e) {
        if (e instanceof NoSuchKeyException
            || (e instanceof S3Exception && ((S3Exception) e).statusCode() == NOT_FOUND)) {
            NoSuchFileException notFound = new NoSuchFileException("s3://" + bucket + "/" + path);
            notFound.initCause(e);
            return notFound;
        }
        return new IOException("S3 request for s3://" + bucket + "/" + path + " failed", e);
    }
}
