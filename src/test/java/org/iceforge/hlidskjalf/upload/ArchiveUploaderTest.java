package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.aws.s3.LocalFsS3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3AccessException;
import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3Models;
import org.iceforge.hlidskjalf.bucket.BucketClients;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ArchiveUploaderTest {

    @TempDir Path tmp;

    private Path store;
    private ArchiveUploader uploader;

    @BeforeEach
    void setUp() {
        store = tmp.resolve("store");
        uploader = new ArchiveUploader(BucketClients.shared(new LocalFsS3AccessLayer(store)), new GatewayProperties());
    }

    private Path product() throws IOException {
        Path dir = Files.createDirectories(tmp.resolve("product/bands"));
        Files.writeString(dir.resolve("B04.tif"), "red");
        Files.writeString(dir.resolve("B08.tif"), "nir");
        Files.writeString(tmp.resolve("product/readme.txt"), "notes");
        return tmp.resolve("product");
    }

    @Test
    void namespaceFollowsDevMode() {
        GatewayProperties dev = new GatewayProperties();
        dev.setDevMode(true);
        ArchiveUploader devUploader = new ArchiveUploader(BucketClients.shared(new LocalFsS3AccessLayer(store)), dev);

        assertEquals(ArchiveNamespace.PROD, uploader.namespace());
        assertEquals(ArchiveNamespace.DEV, devUploader.namespace());
        assertEquals("ewoc-ard", uploader.bucket(Archive.ARD, ArchiveNamespace.PROD));
        assertEquals("ewoc-prd-dev", devUploader.bucket(Archive.PRD, devUploader.namespace()));
    }

    @Test
    void uploadFileStoresUnderNamespaceBucket() throws IOException {
        Path f = Files.writeString(tmp.resolve("a.tif"), "pixels");

        uploader.uploadFile(f, "31/TC/J/a.tif", Archive.ARD);

        assertEquals("pixels", Files.readString(store.resolve("ewoc-ard/31/TC/J/a.tif")));
    }

    @Test
    void secondUploadOfSameContentIsSkipped() throws IOException {
        Path f = Files.writeString(tmp.resolve("a.tif"), "pixels");

        assertTrue(uploader.uploadFile(f, "k/a.tif", Archive.PRD, ArchiveNamespace.DEV));
        assertFalse(uploader.uploadFile(f, "k/a.tif", Archive.PRD, ArchiveNamespace.DEV));

        Files.writeString(f, "changed");
        assertTrue(uploader.uploadFile(f, "k/a.tif", Archive.PRD, ArchiveNamespace.DEV));
        assertEquals("changed", Files.readString(store.resolve("ewoc-prd-dev/k/a.tif")));
    }

    @Test
    void uploadProductPreservesLayoutAndIsIdempotent() throws IOException {
        Path dir = product();
        String prefix = ArchiveKeys.join("c2", ArchiveKeys.tilePath(OpticalGridTile.parse("31TCJ")));

        ArchiveUploader.UploadSummary first = uploader.uploadProduct(dir, prefix, Archive.ARD);
        ArchiveUploader.UploadSummary second = uploader.uploadProduct(dir, prefix, Archive.ARD);

        assertEquals(3, first.fileCount());
        assertEquals(0, first.skipped());
        assertEquals(3, second.skipped());
        assertThat(first.keys()).containsExactly("c2/31/TC/J/bands/B04.tif", "c2/31/TC/J/bands/B08.tif", "c2/31/TC/J/readme.txt");
        assertEquals(11L, first.byteTotal());
    }

    @Test
    void suffixFilter() throws IOException {
        ArchiveUploader.UploadSummary s = uploader.uploadProduct(product(), "p", Archive.ARD, ArchiveNamespace.PROD,
                Optional.of(".tif"));

        assertEquals(2, s.fileCount());
        assertFalse(Files.exists(store.resolve("ewoc-ard/p/readme.txt")));
    }

    @Test
    void accessDeniedIsUploadDenied() throws IOException {
        S3AccessLayer layer = mock(S3AccessLayer.class);
        when(layer.head(any())).thenReturn(Optional.empty());
        when(layer.uploadFile(any(), any(), any(), anyMap())).thenThrow(new S3AccessException("forbidden", 403, null));
        ArchiveUploader denied = new ArchiveUploader(BucketClients.shared(layer), new GatewayProperties());
        Path f = Files.writeString(tmp.resolve("a.tif"), "x");

        UploadDeniedException ex = assertThrows(UploadDeniedException.class, () -> denied.uploadFile(f, "k", Archive.ARD));
        assertEquals("UploadDenied", ex.kind().label());
    }

    @Test
    void failureAfterFirstFileIsPartialUpload() throws IOException {
        S3AccessLayer layer = mock(S3AccessLayer.class);
        when(layer.head(any())).thenReturn(Optional.empty());
        when(layer.uploadFile(argThat(r -> r != null && r.key().endsWith("B04.tif")), any(), any(), anyMap()))
                .thenReturn("etag");
        when(layer.uploadFile(argThat(r -> r != null && !r.key().endsWith("B04.tif")), any(), any(), anyMap()))
                .thenThrow(new S3AccessException("connection reset", 0, null));
        ArchiveUploader flaky = new ArchiveUploader(BucketClients.shared(layer), new GatewayProperties());

        PartialUploadException ex = assertThrows(PartialUploadException.class,
                () -> flaky.uploadProduct(product(), "p", Archive.ARD));

        assertEquals("PartialUpload", ex.kind().label());
        assertThat(ex.uploadedKeys()).containsExactly("p/bands/B04.tif");
        assertEquals("p/bands/B08.tif", ex.failedKey());
    }

    @Test
    void failureOnFirstFileIsRethrown() throws IOException {
        S3AccessLayer layer = mock(S3AccessLayer.class);
        when(layer.head(any(S3Models.ObjectRef.class))).thenThrow(new S3AccessException("timeout", 0, null));
        ArchiveUploader broken = new ArchiveUploader(BucketClients.shared(layer), new GatewayProperties());

        assertThrows(ProviderUnavailableException.class, () -> broken.uploadProduct(product(), "p", Archive.ARD));
    }

    @Test
    void missingLocalFileIsUsageError() {
        assertThrows(IllegalArgumentException.class,
                () -> uploader.uploadFile(tmp.resolve("nope.tif"), "k", Archive.ARD));
    }
}
