package org.iceforge.hlidskjalf.search;

import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.provider.CredentialSet;
import org.iceforge.hlidskjalf.provider.ObjectNotFoundException;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StacSearchServiceTest {

    private static final String FEATURES = """
            {"type":"FeatureCollection","features":[
              {"id":"S2A_31TCJ_20200612_0_L2A","collection":"sentinel-2-l2a",
               "assets":{"red":{"href":"https://data.example/S2A_31TCJ_20200612_0_L2A/B04.tif"},
                         "thumbnail":{"href":"https://data.example/S2A_31TCJ_20200612_0_L2A/preview.jpg"}}},
              {"id":"S2B_31TCJ_20200617_0_L2A","assets":{}}
            ]}""";

    @TempDir Path tmp;

    private final List<ClientRequest> requests = new ArrayList<>();
    private final Map<String, ClientResponse> responses = new LinkedHashMap<>();
    private GatewayProperties props;

    @BeforeEach
    void setUp() {
        props = new GatewayProperties();
        props.getSearch().setUrl("https://stac.example/v1");
    }

    private StacSearchService service(CredentialSet credentials) {
        ExchangeFunction exchange = request -> {
            requests.add(request);
            ClientResponse r = responses.get(request.url().toString());
            return Mono.just(r != null ? r : ClientResponse.create(HttpStatus.NOT_FOUND).build());
        };
        return new StacSearchService(WebClient.builder().exchangeFunction(exchange), props, credentials);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }

    @Test
    void searchParsesFeaturesAndSendsToken() {
        responses.put("https://stac.example/v1/search", json(FEATURES));
        StacSearchService s = service(CredentialSet.of(Map.of(CredentialSet.SEARCH_TOKEN, "tok")));

        List<SearchModels.SearchHit> hits = s.search(SearchModels.SearchQuery.byArea("sentinel-2-l2a",
                new double[]{0.3, 43.3, 1.7, 44.3}, LocalDate.of(2020, 6, 1), LocalDate.of(2020, 6, 30), 10));

        assertThat(hits).extracting(SearchModels.SearchHit::id)
                .containsExactly("S2A_31TCJ_20200612_0_L2A", "S2B_31TCJ_20200617_0_L2A");
        assertEquals("sentinel-2-l2a", hits.get(1).collection());
        assertEquals(2, hits.get(0).assets().size());
        ClientRequest sent = requests.get(0);
        assertEquals(HttpMethod.POST, sent.method());
        assertEquals("Bearer tok", sent.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void searchWithoutTokenSendsNoAuthorization() {
        responses.put("https://stac.example/v1/search", json("{\"features\":[]}"));

        List<SearchModels.SearchHit> hits = service(CredentialSet.empty())
                .search(SearchModels.SearchQuery.byId("landsat-c2-l2", "LC08_L2SP_227099_20211017_20211026_02_T2"));

        assertTrue(hits.isEmpty());
        assertNull(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void serverErrorIsProviderUnavailable() {
        responses.put("https://stac.example/v1/search", ClientResponse.create(HttpStatus.BAD_GATEWAY).build());

        assertThrows(ProviderUnavailableException.class, () -> service(CredentialSet.empty())
                .search(SearchModels.SearchQuery.byId("sentinel-1-grd", "x")));
    }

    @Test
    void downloadSkipsPreviewsAndNonHttpAssets() throws Exception {
        responses.put("https://data.example/p/B04.tif", ClientResponse.create(HttpStatus.OK).body("red-band").build());
        SearchModels.SearchHit hit = new SearchModels.SearchHit("p", "sentinel-2-l2a", Map.of(
                "red", "https://data.example/p/B04.tif",
                "thumbnail", "https://data.example/p/preview.jpg",
                "granule", "s3://bucket/p/granule.xml"));

        List<Path> files = service(CredentialSet.empty()).download(hit, tmp, name -> true);

        assertEquals(List.of(tmp.resolve("B04.tif")), files);
        assertEquals("red-band", Files.readString(files.get(0)));
        assertEquals(1, requests.size());
    }

    @Test
    void assetFilterMatchesKeyOrFileName() {
        responses.put("https://data.example/p/B04.tif", ClientResponse.create(HttpStatus.OK).body("red").build());
        responses.put("https://data.example/p/B08.tif", ClientResponse.create(HttpStatus.OK).body("nir").build());
        SearchModels.SearchHit hit = new SearchModels.SearchHit("p", "c", Map.of(
                "red", "https://data.example/p/B04.tif",
                "nir", "https://data.example/p/B08.tif"));

        List<Path> files = service(CredentialSet.empty()).download(hit, tmp, name -> name.contains("B08"));

        assertEquals(List.of(tmp.resolve("B08.tif")), files);
    }

    @Test
    void missingAssetIsObjectNotFound() {
        SearchModels.SearchHit hit = new SearchModels.SearchHit("p", "c", Map.of("red", "https://data.example/gone.tif"));

        assertThrows(ObjectNotFoundException.class, () -> service(CredentialSet.empty()).download(hit, tmp, n -> true));
        assertFalse(Files.exists(tmp.resolve("gone.tif")));
    }

    @Test
    void hitWithoutAssetsIsObjectNotFound() {
        SearchModels.SearchHit hit = new SearchModels.SearchHit("p", "c", Map.of());

        assertThrows(ObjectNotFoundException.class, () -> service(CredentialSet.empty()).download(hit, tmp, n -> true));
    }
}
