package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.BucketKeys;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.product.ProductIds;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.AreaLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.ProductLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.search.SearchModels.SearchHit;
import org.iceforge.hlidskjalf.search.SearchModels.SearchQuery;
import org.iceforge.hlidskjalf.search.SearchService;
import org.iceforge.hlidskjalf.tile.Footprint;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Retrieval through the federated search-and-download service. Keeps a rolling window of recent
 * acquisitions, so it is the last resort for Sentinel and Landsat data.
 */
@Component
public class SearchServiceBackedProvider implements EoProvider {
    private static final Logger log = LoggerFactory.getLogger(SearchServiceBackedProvider.class);

    private final SearchService searchService;
    private final TileResolver tileResolver;
    private final Map<DataKind, String> collections;
    private final int limit;

    public SearchServiceBackedProvider(SearchService searchService, TileResolver tileResolver, GatewayProperties props) {
        this.searchService = searchService;
        this.tileResolver = tileResolver;
        this.collections = Map.copyOf(props.getSearch().getCollections());
        this.limit = props.getSearch().getLimit();
    }

    @Override
    public String name() {
        return ProviderNames.SEARCH;
    }

    @Override
    public List<Path> fetch(DataRequest request, Path targetDir) {
        if (request.locator() instanceof ProductLocator p) {
            return fetchById(p.productId(), request.dataKind(), request.options(), targetDir);
        }
        if (!(request.locator() instanceof AreaLocator area)) {
            throw new InvalidKeyPatternException("Search needs a date range to look up " + request.dataKind());
        }
        Footprint footprint = area.footprint().orElseGet(() -> tileResolver.resolveFootprint(area.tile().get()));
        SearchQuery query = SearchQuery.byArea(collection(request.dataKind()), footprint.bbox(),
                area.start(), area.end(), limit);

        List<SearchHit> hits = searchService.search(query);
        if (area.tile().isPresent() && request.dataKind().isSentinel2()) {
            String tileId = area.tile().get().id();
            // the bbox also catches neighbouring tiles
            hits = hits.stream().filter(h -> h.id().contains(tileId)).toList();
        }
        if (hits.isEmpty()) {
            throw new ObjectNotFoundException("Search found no " + request.dataKind() + " for " + request.canonicalName());
        }
        log.info("search: {} hit(s) for {}", hits.size(), request.canonicalName());
        List<Path> out = new ArrayList<>();
        for (SearchHit hit : hits) {
            out.addAll(searchService.download(hit, targetDir.resolve(hit.id()), BucketKeys.itemFilter(request.options())));
        }
        return out;
    }

    @Override
    public List<Path> fetchById(String productId, DataKind kind, RetrievalOptions options, Path targetDir) {
        String id = ProductIds.baseName(productId);
        List<SearchHit> hits = searchService.search(SearchQuery.byId(collection(kind), id));
        if (hits.isEmpty()) {
            throw new ObjectNotFoundException("Search found no product " + id);
        }
        return searchService.download(hits.get(0), targetDir, BucketKeys.itemFilter(options));
    }

    private String collection(DataKind kind) {
        String c = collections.get(kind);
        if (c == null) {
            throw new InvalidKeyPatternException("No search collection configured for " + kind);
        }
        return c;
    }
}
