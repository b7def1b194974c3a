package org.iceforge.hlidskjalf.aws.s3;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AwsSdkS3AccessLayerTest {

    @Mock private S3Client s3Client;

    @TempDir Path tmp;

    private AwsSdkS3AccessLayer requesterPays;
    private AwsSdkS3AccessLayer plain;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        requesterPays = new AwsSdkS3AccessLayer(s3Client, true);
        plain = new AwsSdkS3AccessLayer(s3Client, false);
    }

    @Test
    void download_writesTargetAndSetsRequestPayer() throws Exception {
        S3Models.ObjectRef ref = new S3Models.ObjectRef("sentinel-s2-l1c", "tiles/31/T/CJ/B04.jp2");
        when(s3Client.getObject(any(GetObjectRequest.class))).thenReturn(
                new ResponseInputStream<>(GetObjectResponse.builder().build(), new ByteArrayInputStream("pixels".getBytes())));

        Path target = tmp.resolve("sub/B04.jp2");
        requesterPays.download(ref, target);

        assertEquals("pixels", Files.readString(target));
        ArgumentCaptor<GetObjectRequest> cap = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObject(cap.capture());
        assertEquals(RequestPayer.REQUESTER, cap.getValue().requestPayer());
        assertEquals("tiles/31/T/CJ/B04.jp2", cap.getValue().key());
    }

    @Test
    void download_noSuchKey_isNotFound() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("nope").build());

        assertThrows(S3ObjectNotFoundException.class,
                () -> plain.download(new S3Models.ObjectRef("b", "missing"), tmp.resolve("x")));
    }

    @Test
    void download_forbidden_keepsStatus() {
        when(s3Client.getObject(any(GetObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> plain.download(new S3Models.ObjectRef("b", "k"), tmp.resolve("x")));
        assertTrue(ex.isAccessDenied());
        assertFalse(ex instanceof S3ObjectNotFoundException);
    }

    @Test
    void uploadFile_sendsContentTypeAndMetadata() throws Exception {
        Path src = Files.writeString(tmp.resolve("a.tif"), "data");
        when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
                .thenReturn(PutObjectResponse.builder().eTag("etag").build());

        String eTag = plain.uploadFile(new S3Models.ObjectRef("ewoc-prd", "c/a.tif"), src, "image/tiff",
                Map.of("sha256", "abc"));

        assertEquals("etag", eTag);
        ArgumentCaptor<PutObjectRequest> cap = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(cap.capture(), any(RequestBody.class));
        assertEquals("image/tiff", cap.getValue().contentType());
        assertEquals("abc", cap.getValue().metadata().get("sha256"));
    }

    @Test
    void head_returnsMetadataOrEmpty() {
        S3Models.ObjectRef ref = new S3Models.ObjectRef("b", "k");
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(5L).eTag("e").metadata(Map.of("sha256", "x")).build());

        Optional<S3Models.ObjectMetadata> meta = plain.head(ref);
        assertTrue(meta.isPresent());
        assertEquals(5L, meta.get().contentLength());
        assertEquals("x", meta.get().userMetadata().get("sha256"));

        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(404).message("gone").build());
        assertFalse(plain.exists(ref));
    }

    @Test
    void head_serverError_isWrapped() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(S3Exception.builder().statusCode(500).message("boom").build());

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> plain.head(new S3Models.ObjectRef("b", "k")));
        assertEquals(500, ex.statusCode());
    }

    @Test
    void head_clientFailure_isAccessErrorNotMissingObject() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(SdkClientException.create("connection reset"));

        S3AccessException ex = assertThrows(S3AccessException.class,
                () -> plain.head(new S3Models.ObjectRef("b", "k")));
        assertFalse(ex instanceof S3ObjectNotFoundException);
        assertEquals(0, ex.statusCode());
        assertInstanceOf(SdkClientException.class, ex.getCause());
    }
}
