package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.DemArchives;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.AreaLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.iceforge.hlidskjalf.tile.DemTile;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * SRTM 1s tiles from the ESA STEP HTTP mirror ({@code <base>/<tile>.SRTMGL1.hgt.zip}).
 */
@Component
public class EsaStepProvider implements EoProvider {
    private static final Logger log = LoggerFactory.getLogger(EsaStepProvider.class);

    private final WebClient webClient;
    private final TileResolver tileResolver;
    private final String baseUrl;

    public EsaStepProvider(WebClient.Builder builder, TileResolver tileResolver, GatewayProperties props) {
        this(builder.clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true))).build(),
                tileResolver, props.getEsa().getBaseUrl());
    }

    EsaStepProvider(WebClient webClient, TileResolver tileResolver, String baseUrl) {
        this.webClient = webClient;
        this.tileResolver = tileResolver;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String name() {
        return ProviderNames.ESA;
    }

    @Override
    public List<Path> fetch(DataRequest request, Path targetDir) {
        if (request.dataKind() != DataKind.DEM_SRTM_1S) {
            throw new InvalidKeyPatternException("ESA mirror only serves SRTM 1s tiles, not " + request.dataKind());
        }
        Set<DemTile> cells;
        if (request.locator() instanceof TileLocator t) {
            cells = cellsOf(t.tile());
        } else if (request.locator() instanceof AreaLocator a) {
            cells = a.tile().isPresent()
                    ? cellsOf(a.tile().get())
                    : tileResolver.coveringDemTiles(a.footprint().get());
        } else {
            throw new InvalidKeyPatternException("ESA mirror has no product layout");
        }

        List<Path> out = new ArrayList<>();
        for (DemTile cell : cells) {
            String fileName = cell.format(true);
            Path zip;
            try {
                zip = download(baseUrl + "/" + fileName, targetDir.resolve(fileName));
            } catch (ObjectNotFoundException e) {
                log.warn("SRTM tile {} not on the ESA mirror, skipping", cell.id());
                continue;
            }
            try {
                out.addAll(DemArchives.extractAndDelete(zip, targetDir));
            } catch (IOException e) {
                throw new ProviderUnavailableException("Failed to extract " + fileName, e);
            }
        }
        if (out.isEmpty()) {
            throw new ObjectNotFoundException("None of the " + cells.size() + " SRTM tiles for "
                    + request.canonicalName() + " are on the ESA mirror");
        }
        return out;
    }

    @Override
    public List<Path> fetchById(String productId, DataKind kind, RetrievalOptions options, Path targetDir) {
        throw new InvalidKeyPatternException("ESA mirror has no product layout for " + productId);
    }

    private Set<DemTile> cellsOf(TileId tile) {
        return tile instanceof DemTile d ? Set.of(d) : tileResolver.coveringDemTiles((OpticalGridTile) tile);
    }

    /** Stream GET body into a temporary file, then rename into place. */
    private Path download(String url, Path target) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(target.getParent(), ".esa-", ".part");
            Flux<DataBuffer> body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);
            DataBufferUtils.write(body, tmp).block();
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
            return target;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                throw new ObjectNotFoundException("Not found: " + url, e);
            }
            throw new ProviderUnavailableException("ESA mirror answered " + e.getStatusCode().value() + " for " + url, e);
        } catch (WebClientRequestException e) {
            throw new ProviderUnavailableException("ESA mirror unreachable: " + e.getMessage(), e);
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
}
