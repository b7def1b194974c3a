package org.iceforge.hlidskjalf.search;

import com.fasterxml.jackson.databind.JsonNode;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.provider.CredentialSet;
import org.iceforge.hlidskjalf.provider.ObjectNotFoundException;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * {@link SearchService} over a STAC API ({@code POST /search}), downloading asset hrefs over HTTP.
 */
@Service
public class StacSearchService implements SearchService {
    private static final Logger log = LoggerFactory.getLogger(StacSearchService.class);

    private static final Duration SEARCH_TIMEOUT = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final GatewayProperties.Search props;
    private final CredentialSet credentials;

    public StacSearchService(WebClient.Builder builder, GatewayProperties props, CredentialSet credentials) {
        this.webClient = builder.build();
        this.props = props.getSearch();
        this.credentials = credentials;
    }

    @Override
    public List<SearchModels.SearchHit> search(SearchModels.SearchQuery query) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collections", List.of(query.collection()));
        if (!query.bbox().isEmpty()) body.put("bbox", query.bbox());
        if (query.start().isPresent() && query.end().isPresent()) {
            body.put("datetime", query.start().get() + "T00:00:00Z/" + query.end().get() + "T23:59:59Z");
        }
        if (!query.ids().isEmpty()) body.put("ids", query.ids());
        body.put("limit", query.limit());

        JsonNode root;
        try {
            root = webClient.post()
                    .uri(props.getUrl() + "/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> credentials.get(CredentialSet.SEARCH_TOKEN).ifPresent(h::setBearerAuth))
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(SEARCH_TIMEOUT);
        } catch (WebClientResponseException e) {
            throw new ProviderUnavailableException("Search service answered " + e.getStatusCode().value()
                    + " for " + query.collection(), e);
        } catch (WebClientRequestException e) {
            throw new ProviderUnavailableException("Search service unreachable: " + e.getMessage(), e);
        }

        List<SearchModels.SearchHit> hits = new ArrayList<>();
        if (root == null || !root.path("features").isArray()) {
            return hits;
        }
        for (JsonNode f : root.path("features")) {
            Map<String, String> assets = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = f.path("assets").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> a = it.next();
                String href = a.getValue().path("href").asText(null);
                if (href != null) assets.put(a.getKey(), href);
            }
            hits.add(new SearchModels.SearchHit(f.path("id").asText(), f.path("collection").asText(query.collection()), assets));
        }
        log.debug("Search in {} returned {} hit(s)", query.collection(), hits.size());
        return hits;
    }

    @Override
    public List<Path> download(SearchModels.SearchHit hit, Path destDir, Predicate<String> assetFilter) {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> asset : hit.assets().entrySet()) {
            String key = asset.getKey();
            URI href = URI.create(asset.getValue());
            if (props.getSkipAssets().contains(key)) continue;
            String fileName = fileName(href, key);
            if (!assetFilter.test(key) && !assetFilter.test(fileName)) continue;
            String scheme = href.getScheme() == null ? "" : href.getScheme();
            if (!scheme.startsWith("http")) {
                log.warn("Skipping asset {} of {}: unsupported href scheme '{}'", key, hit.id(), scheme);
                continue;
            }
            written.add(streamToFile(href, destDir.resolve(fileName)));
        }
        if (written.isEmpty()) {
            throw new ObjectNotFoundException("No downloadable assets in " + hit.id());
        }
        return written;
    }

    private Path streamToFile(URI href, Path target) {
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".asset-", ".part");
            Flux<DataBuffer> body = webClient.get()
                    .uri(href)
                    .headers(h -> credentials.get(CredentialSet.SEARCH_TOKEN).ifPresent(h::setBearerAuth))
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, tmp).block();
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
            return target;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                throw new ObjectNotFoundException("Asset not found: " + href, e);
            }
            throw new ProviderUnavailableException("Asset download failed (" + e.getStatusCode().value() + "): " + href, e);
        } catch (WebClientRequestException e) {
            throw new ProviderUnavailableException("Asset download failed: " + href, e);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Local write failed for " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove {}", tmp, e);
                }
            }
        }
    }

    private static String fileName(URI href, String assetKey) {
        String path = href.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) return assetKey;
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
