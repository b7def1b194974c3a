package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EsaStepProviderTest {

    private static final String BASE = "http://mirror.example/SRTMGL1/";

    @TempDir Path tmp;

    private final List<String> requested = new ArrayList<>();

    private EsaStepProvider provider(Map<String, byte[]> files) {
        WebClient client = WebClient.builder().exchangeFunction(request -> {
            String url = request.url().toString();
            requested.add(url);
            byte[] body = files.get(url);
            if (body == null) {
                return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
            }
            Flux<DataBuffer> content = Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(body));
            return Mono.just(ClientResponse.create(HttpStatus.OK).body(content).build());
        }).build();
        return new EsaStepProvider(client, new TileResolver(), BASE);
    }

    private static byte[] zip(String entry) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream z = new ZipOutputStream(bytes)) {
            z.putNextEntry(new ZipEntry(entry));
            z.write("hgt".getBytes(StandardCharsets.UTF_8));
            z.closeEntry();
        }
        return bytes.toByteArray();
    }

    private static DataRequest request(String tile) {
        return DataRequest.of(DataKind.DEM_SRTM_1S, new TileLocator(TileId.parse(tile)), Path.of("unused"));
    }

    @Test
    void downloadsAndUnzipsCoveringCells() throws IOException {
        EsaStepProvider esa = provider(Map.of(
                "http://mirror.example/SRTMGL1/N43E000.SRTMGL1.hgt.zip", zip("N43E000.hgt"),
                "http://mirror.example/SRTMGL1/N44E001.SRTMGL1.hgt.zip", zip("N44E001.hgt")));

        List<Path> files = esa.fetch(request("31TCJ"), tmp);

        assertThat(files).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("N43E000.hgt", "N44E001.hgt");
        assertEquals(4, requested.size());
        try (var listing = Files.list(tmp)) {
            assertThat(listing).allMatch(p -> p.toString().endsWith(".hgt"));
        }
    }

    @Test
    void noCellOnMirrorIsObjectNotFound() {
        EsaStepProvider esa = provider(Map.of());

        assertThrows(ObjectNotFoundException.class, () -> esa.fetch(request("N10W030"), tmp));
    }

    @Test
    void otherKindsAndProductIdsAreRejected() {
        EsaStepProvider esa = provider(Map.of());
        DataRequest cop = DataRequest.of(DataKind.DEM_COP_1S, new TileLocator(TileId.parse("N10W030")), tmp);

        assertThrows(InvalidKeyPatternException.class, () -> esa.fetch(cop, tmp));
        assertThrows(InvalidKeyPatternException.class,
                () -> esa.fetchById("LC08_L2SP_227099_20211017_20211026_02_T2", DataKind.LANDSAT8, RetrievalOptions.DEFAULTS, tmp));
        assertEquals("esa", esa.name());
    }
}
