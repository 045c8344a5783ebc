package se.nbis.sda.pipeline.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.model.UploadPartResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class S3MultipartOutputStreamTest {

    private static final int PART_SIZE = 10;
    private static final Executor SAME_THREAD = Runnable::run;

    @Mock
    private S3Client s3Client;

    @Test
    void close_smallFileIsASinglePut() throws IOException {
        ArgumentCaptor<RequestBody> body = ArgumentCaptor.forClass(RequestBody.class);

        try (OutputStream out = stream()) {
            out.write(new byte[]{1, 2, 3});
        }

        verify(s3Client).putObject(any(PutObjectRequest.class), body.capture());
        verify(s3Client, never()).createMultipartUpload(any(CreateMultipartUploadRequest.class));
        assertThat(contentOf(body.getValue())).containsExactly(1, 2, 3);
    }

    @Test
    void close_completesUploadWithPartsInOrder() throws IOException {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-1").build());
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenAnswer(invocation -> UploadPartResponse.builder()
                                                            .eTag("etag-" + invocation.<UploadPartRequest>getArgument(0)
                                                                                      .partNumber())
                                                            .build());
        ArgumentCaptor<RequestBody> bodies = ArgumentCaptor.forClass(RequestBody.class);
        ArgumentCaptor<CompleteMultipartUploadRequest> complete =
                ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);

        try (OutputStream out = stream()) {
            out.write(new byte[25]);
        }

        verify(s3Client, times(3)).uploadPart(any(UploadPartRequest.class), bodies.capture());
        verify(s3Client).completeMultipartUpload(complete.capture());
        assertThat(complete.getValue().uploadId()).isEqualTo("upload-1");
        assertThat(complete.getValue().multipartUpload().parts())
                .extracting(CompletedPart::partNumber, CompletedPart::eTag)
                .containsExactly(tuple(1, "etag-1"), tuple(2, "etag-2"), tuple(3, "etag-3"));
        assertThat(contentOf(bodies.getAllValues().get(0))).hasSize(10);
        assertThat(contentOf(bodies.getAllValues().get(1))).hasSize(10);
        assertThat(contentOf(bodies.getAllValues().get(2))).hasSize(5);
    }

    @Test
    void write_failedPartAbortsUpload() throws IOException {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-2").build());
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenThrow(SdkClientException.create("network down"));

        OutputStream out = stream();
        out.write(new byte[PART_SIZE]);

        assertThatThrownBy(() -> out.write(1)).isInstanceOf(IOException.class)
                                              .hasRootCauseMessage("network down");
        verify(s3Client).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
        verify(s3Client, never()).completeMultipartUpload(any(CompleteMultipartUploadRequest.class));
        out.close();
    }

    @Test
    void close_failedCompletionAbortsUpload() {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-3").build());
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenReturn(UploadPartResponse.builder().eTag("e").build());
        when(s3Client.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenThrow(SdkClientException.create("complete failed"));

        assertThatThrownBy(() -> {
            try (OutputStream out = stream()) {
                out.write(new byte[15]);
            }
        }).isInstanceOf(IOException.class);
        verify(s3Client).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
    }

    @Test
    void abort_dropsStartedUploadWithoutCompleting() throws IOException {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("upload-4").build());
        when(s3Client.uploadPart(any(UploadPartRequest.class), any(RequestBody.class)))
                .thenReturn(UploadPartResponse.builder().eTag("e").build());
        ArgumentCaptor<AbortMultipartUploadRequest> abort = ArgumentCaptor.forClass(AbortMultipartUploadRequest.class);

        S3MultipartOutputStream out = stream();
        out.write(new byte[15]);
        out.abort();
        out.close();

        verify(s3Client).abortMultipartUpload(abort.capture());
        assertThat(abort.getValue().uploadId()).isEqualTo("upload-4");
        verify(s3Client, never()).completeMultipartUpload(any(CompleteMultipartUploadRequest.class));
        assertThatThrownBy(() -> out.write(1)).isInstanceOf(IOException.class);
    }

    @Test
    void abort_beforeFirstPartStoresNothing() throws IOException {
        S3MultipartOutputStream out = stream();
        out.write(new byte[3]);
        out.abort();
        out.close();

        verify(s3Client, never()).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        verify(s3Client, never()).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
    }

    @Test
    void abort_afterCompletionLeavesObjectInPlace() throws IOException {
        S3MultipartOutputStream out = stream();
        out.write(new byte[3]);
        out.close();
        out.abort();

        verify(s3Client).putObject(any(PutObjectRequest.class), any(RequestBody.class));
        verify(s3Client, never()).abortMultipartUpload(any(AbortMultipartUploadRequest.class));
    }

    private S3MultipartOutputStream stream() {
        return new S3MultipartOutputStream(s3Client, "backup", "alice/f.txt.c4gh", PART_SIZE, 2, SAME_THREAD);
    }

    private static byte[] contentOf(RequestBody body) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InputStream in = body.contentStreamProvider().newStream()) {
            in.transferTo(out);
        }
        return out.toByteArray();
    }
}
