package org.iceforge.hlidskjalf.bucket;

import org.iceforge.hlidskjalf.aws.s3.LocalFsS3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3AccessException;
import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3Models.ListItem;
import org.iceforge.hlidskjalf.aws.s3.S3Models.ObjectRef;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.provider.InvalidKeyPatternException;
import org.iceforge.hlidskjalf.provider.ObjectNotFoundException;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.tile.DemTile;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BucketAccessAdapterTest {

    @TempDir
    Path tmp;

    private Path store;
    private Path out;
    private BucketAccessAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        store = tmp.resolve("store");
        out = Files.createDirectories(tmp.resolve("out"));
        adapter = new BucketAccessAdapter(BucketClients.shared(new LocalFsS3AccessLayer(store)),
                new BucketKeys(new GatewayProperties()), new TileResolver());
    }

    private void put(String bucket, String key, String content) throws IOException {
        Path p = store.resolve(bucket).resolve(key);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content);
    }

    private void putZip(String bucket, String key, String entry) throws IOException {
        Path p = store.resolve(bucket).resolve(key);
        Files.createDirectories(p.getParent());
        try (OutputStream os = Files.newOutputStream(p); ZipOutputStream zip = new ZipOutputStream(os)) {
            zip.putNextEntry(new ZipEntry(entry));
            zip.write("elevation".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
    }

    @Test
    void listUnderUsesStringPrefix() throws IOException {
        put("b", "a/one.txt", "1");
        put("b", "a/two.txt", "2");
        put("b", "ab/three.txt", "3");

        try (Stream<String> keys = adapter.listUnder(BucketFamily.AWS_PUBLIC, "b", "a/")) {
            assertThat(keys).containsExactly("a/one.txt", "a/two.txt");
        }
        try (Stream<String> keys = adapter.listUnder(BucketFamily.AWS_PUBLIC, "b", "a")) {
            assertThat(keys).hasSize(3);
        }
    }

    @Test
    void fetchSingleObject() throws IOException {
        put("b", "x/y/data.bin", "payload");

        Path p = adapter.fetch(BucketFamily.EWOC, new ObjectRef("b", "x/y/data.bin"), out);

        assertEquals(out.resolve("data.bin"), p);
        assertEquals("payload", Files.readString(p));
        try (Stream<Path> files = Files.list(out)) {
            assertThat(files).containsExactly(p);
        }
    }

    @Test
    void missingObjectIsObjectNotFound() {
        ObjectNotFoundException ex = assertThrows(ObjectNotFoundException.class,
                () -> adapter.fetch(BucketFamily.EWOC, new ObjectRef("b", "nope"), out));
        assertEquals("ObjectNotFound", ex.kind().label());
    }

    @Test
    void fetchDemTileSkipsMissingCellsAndUnzips() throws IOException {
        putZip("DIAS", "auxdata/SRTMGL1/dem/N38W001.SRTMGL1.hgt.zip", "N38W001.hgt");
        putZip("DIAS", "auxdata/SRTMGL1/dem/N37W002.SRTMGL1.hgt.zip", "N37W002.hgt");

        List<Path> files = adapter.fetchTile(BucketFamily.CREODIAS_DIAS, DataKind.DEM_SRTM_1S,
                OpticalGridTile.parse("30SXH"), out);

        assertThat(files).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("N38W001.hgt", "N37W002.hgt");
        assertFalse(Files.exists(out.resolve("N38W001.SRTMGL1.hgt.zip")));
    }

    @Test
    void fetchDemTileFailsWhenNoCellExists() {
        assertThrows(ObjectNotFoundException.class, () -> adapter.fetchTile(BucketFamily.CREODIAS_DIAS,
                DataKind.DEM_SRTM_1S, TileId.parse("N10W030"), out));
    }

    @Test
    void srtm3sGoesThroughCgiarTiles() throws IOException {
        putZip("ewoc-aux-data", "srtm90/srtm_37_04.zip", "srtm_37_04.tif");

        List<Path> files = adapter.fetchDemCells(BucketFamily.EWOC, DataKind.DEM_SRTM_3S,
                Set.of(new DemTile(43, 0), new DemTile(44, 1)), "31TCJ", out);

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("srtm_37_04.tif");
    }

    @Test
    void nonDemKindHasNoTileKey() {
        assertThrows(InvalidKeyPatternException.class,
                () -> adapter.fetchTile(BucketFamily.AWS_PUBLIC, DataKind.LANDSAT8, TileId.parse("31TCJ"), out));
    }

    @Test
    void fetchPrefixKeepsRelativeLayoutAndFilters() throws IOException {
        put("b", "p/prod/B04.tif", "4");
        put("b", "p/prod/B08.tif", "8");
        put("b", "p/prod/meta/info.json", "{}");

        List<Path> files = adapter.fetchPrefix(BucketFamily.AWS_PUBLIC, new ObjectRef("b", "p/prod"), out.resolve("prod"),
                name -> !name.equals("B08.tif"));

        assertThat(files).containsExactlyInAnyOrder(out.resolve("prod/B04.tif"), out.resolve("prod/meta/info.json"));
        assertFalse(Files.exists(out.resolve("prod/B08.tif")));
    }

    @Test
    void emptyPrefixIsObjectNotFound() {
        assertThrows(ObjectNotFoundException.class,
                () -> adapter.fetchPrefix(BucketFamily.AWS_PUBLIC, new ObjectRef("b", "none/"), out, n -> true));
    }

    @Test
    void fetchPrefixRemovesWrittenFilesOnFailure() {
        S3AccessLayer layer = mock(S3AccessLayer.class);
        when(layer.list("b", "p/")).thenReturn(Stream.of(
                new ListItem("p/a.bin", 1, "e", null),
                new ListItem("p/b.bin", 1, "e", null)));
        doAnswer(inv -> {
            Files.writeString(inv.getArgument(1), "a");
            return null;
        }).when(layer).download(eq(new ObjectRef("b", "p/a.bin")), any());
        doThrow(new S3AccessException("connection reset")).when(layer).download(eq(new ObjectRef("b", "p/b.bin")), any());

        BucketAccessAdapter failing = new BucketAccessAdapter(BucketClients.shared(layer),
                new BucketKeys(new GatewayProperties()), new TileResolver());

        assertThrows(ProviderUnavailableException.class,
                () -> failing.fetchPrefix(BucketFamily.AWS_PUBLIC, new ObjectRef("b", "p/"), out, n -> true));
        assertFalse(Files.exists(out.resolve("a.bin")));
        assertFalse(Files.exists(out.resolve("b.bin")));
    }

    @Test
    void discoverFindsAcceptedRoots() throws IOException {
        put("DIAS", "Sentinel-2/MSI/L2A/2020/06/12/S2A_MSIL2A_20200612T103031_N0214_R108_T31TCJ_20200612T134501.SAFE/manifest.safe", "m");
        put("DIAS", "Sentinel-2/MSI/L2A/2020/06/12/S2A_MSIL2A_20200612T103031_N0214_R108_T31TCK_20200612T134501.SAFE/manifest.safe", "m");
        LocalDate d = LocalDate.of(2020, 6, 12);

        List<BucketKeys.DiscoveredRoot> roots = adapter.discover(BucketFamily.CREODIAS_DIAS, adapter.keys().discoveries(
                BucketFamily.CREODIAS_DIAS, DataKind.SENTINEL2_L2A, OpticalGridTile.parse("31TCJ"), d, d,
                RetrievalOptions.DEFAULTS));

        assertThat(roots).extracting(BucketKeys.DiscoveredRoot::localName)
                .containsExactly("S2A_MSIL2A_20200612T103031_N0214_R108_T31TCJ_20200612T134501.SAFE");
        assertEquals("Sentinel-2/MSI/L2A/2020/06/12/S2A_MSIL2A_20200612T103031_N0214_R108_T31TCJ_20200612T134501.SAFE/",
                roots.get(0).prefix().key());
    }
}
