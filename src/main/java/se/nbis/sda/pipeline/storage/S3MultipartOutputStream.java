package se.nbis.sda.pipeline.storage;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Output stream that streams into an S3 object through a multipart upload.
 * <p>
 * Written bytes are collected into part-sized chunks. Each full chunk is handed to a background upload task;
 * at most {@code concurrency} chunks are in flight, so a writer that outpaces the network blocks instead of
 * buffering the file. A failed part upload is raised on the next {@link #write} or on {@link #close()}, and the
 * multipart upload is aborted. {@link #close()} blocks until every part is stored and the upload is completed.
 * A stream that never fills one part is stored with a single put. {@link #abort()} drops the upload instead.
 */
@Slf4j
class S3MultipartOutputStream extends OutputStream implements Abortable {

    private static final String CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3Client;
    private final String bucket;
    private final String key;
    private final int partSize;
    private final Executor executor;
    private final Semaphore inFlight;
    private final List<CompletableFuture<CompletedPart>> parts = new ArrayList<>();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();

    private byte[] buffer;
    private int position;
    private String uploadId;
    private int nextPartNumber = 1;
    private boolean closed;
    private boolean aborted;
    private boolean completed;

    S3MultipartOutputStream(S3Client s3Client, String bucket, String key, int partSize, int concurrency,
                            Executor executor) {
        if (partSize <= 0 || concurrency <= 0) {
            throw new IllegalArgumentException("Part size and upload concurrency must be positive");
        }
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.key = key;
        this.partSize = partSize;
        this.executor = executor;
        this.inFlight = new Semaphore(concurrency);
        this.buffer = new byte[partSize];
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        buffer[position++] = (byte) b;
        if (position == partSize) {
            dispatchPart();
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, b.length);
        ensureOpen();
        while (len > 0) {
            int n = Math.min(len, partSize - position);
            System.arraycopy(b, off, buffer, position, n);
            position += n;
            off += n;
            len -= n;
            if (position == partSize) {
                dispatchPart();
            }
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            throwIfFailed();
            if (uploadId == null) {
                putSingleObject();
                completed = true;
                return;
            }
            if (position > 0) {
                dispatchPart();
            }
            List<CompletedPart> completedParts = awaitParts();
            s3Client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                                                                           .bucket(bucket)
                                                                           .key(key)
                                                                           .uploadId(uploadId)
                                                                           .multipartUpload(CompletedMultipartUpload.builder()
                                                                                                                    .parts(completedParts)
                                                                                                                    .build())
                                                                           .build());
            completed = true;
            log.debug("Completed multipart upload {} of s3://{}/{} with {} part(s).", uploadId, bucket, key,
                      completedParts.size());
        } catch (IOException e) {
            abortUpload();
            throw e;
        } catch (RuntimeException e) {
            abortUpload();
            throw new IOException("Upload of s3://" + bucket + "/" + key + " failed", e);
        } finally {
            buffer = null;
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream for s3://" + bucket + "/" + key + " is closed");
        }
        try {
            throwIfFailed();
        } catch (IOException e) {
            abortUpload();
            throw e;
        }
    }

    private void throwIfFailed() throws IOException {
        Throwable cause = failure.get();
        if (cause != null) {
            throw new IOException("Upload of s3://" + bucket + "/" + key + " failed", cause);
        }
    }

    private void dispatchPart() throws IOException {
        if (uploadId == null) {
            uploadId = s3Client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                                                                                  .bucket(bucket)
                                                                                  .key(key)
                                                                                  .contentType(CONTENT_TYPE)
                                                                                  .build()).uploadId();
            log.debug("Started multipart upload {} for s3://{}/{}.", uploadId, bucket, key);
        }
        final byte[] chunk = buffer;
        final int length = position;
        final int partNumber = nextPartNumber++;
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting to upload part " + partNumber, e);
        }
        buffer = closed ? null : new byte[partSize];
        position = 0;
        CompletableFuture<CompletedPart> part = CompletableFuture
                .supplyAsync(() -> uploadPart(partNumber, chunk, length), executor)
                .whenComplete((result, error) -> {
                    inFlight.release();
                    if (error != null) {
                        failure.compareAndSet(null, unwrap(error));
                    }
                });
        parts.add(part);
    }

    private CompletedPart uploadPart(int partNumber, byte[] chunk, int length) {
        UploadPartResponse response = s3Client.uploadPart(UploadPartRequest.builder()
                                                                           .bucket(bucket)
                                                                           .key(key)
                                                                           .uploadId(uploadId)
                                                                           .partNumber(partNumber)
                                                                           .contentLength((long) length)
                                                                           .build(),
                                                          RequestBody.fromContentProvider(
                                                                  () -> new ByteArrayInputStream(chunk, 0, length),
                                                                  length, CONTENT_TYPE));
        log.trace("Uploaded part {} ({} bytes) of s3://{}/{}.", partNumber, length, bucket, key);
        return CompletedPart.builder().partNumber(partNumber).eTag(response.eTag()).build();
    }

    private List<CompletedPart> awaitParts() throws IOException {
        List<CompletedPart> completed = new ArrayList<>(parts.size());
        for (CompletableFuture<CompletedPart> part : parts) {
            try {
                completed.add(part.get());
            } catch (ExecutionException e) {
                throw new IOException("Upload of s3://" + bucket + "/" + key + " failed", unwrap(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for s3://" + bucket + "/" + key, e);
            }
        }
        completed.sort(Comparator.comparing(CompletedPart::partNumber));
        return completed;
    }

    private void putSingleObject() {
        final byte[] chunk = buffer;
        final int length = position;
        s3Client.putObject(PutObjectRequest.builder()
                                           .bucket(bucket)
                                           .key(key)
                                           .contentType(CONTENT_TYPE)
                                           .contentLength((long) length)
                                           .build(),
                           RequestBody.fromContentProvider(() -> new ByteArrayInputStream(chunk, 0, length), length,
                                                           CONTENT_TYPE));
        log.debug("Stored s3://{}/{} ({} bytes) with a single put.", bucket, key, length);
    }

    /**
     * Discards everything written so far. Waits for part uploads already in flight, since a part that lands after
     * the abort would be kept by the store, then aborts the multipart upload. Nothing is stored if no part was
     * dispatched yet.
     */
    @Override
    public void abort() {
        if (completed || aborted) {
            return;
        }
        closed = true;
        buffer = null;
        CompletableFuture.allOf(parts.toArray(new CompletableFuture<?>[0]))
                         .exceptionally(error -> null)
                         .join();
        abortUpload();
    }

    private void abortUpload() {
        closed = true;
        if (aborted || uploadId == null) {
            return;
        }
        aborted = true;
        try {
            s3Client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                                                                     .bucket(bucket)
                                                                     .key(key)
                                                                     .uploadId(uploadId)
                                                                     .build());
            log.warn("Aborted multipart upload {} of s3://{}/{}.", uploadId, bucket, key);
        } catch (RuntimeException e) {
            log.error("Failed to abort multipart upload {} of s3://{}/{}. Parts may be left behind.", uploadId,
                      bucket, key, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException) && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
