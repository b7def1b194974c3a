package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.bucket.BucketAccessAdapter;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.bucket.BucketKeys;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.AreaLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.ProductLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A provider whose data sits in one bucket family. Keys are derived from the tile or product ID
 * where the layout allows, and discovered by listing otherwise.
 */
public abstract class BucketBackedProvider implements EoProvider {
    private static final Logger log = LoggerFactory.getLogger(BucketBackedProvider.class);

    protected final BucketAccessAdapter buckets;
    protected final TileResolver tileResolver;
    private final BucketFamily family;

    protected BucketBackedProvider(BucketAccessAdapter buckets, TileResolver tileResolver, BucketFamily family) {
        this.buckets = buckets;
        this.tileResolver = tileResolver;
        this.family = family;
    }

    public BucketFamily family() {
        return family;
    }

    @Override
    public List<Path> fetch(DataRequest request, Path targetDir) {
        DataKind kind = request.dataKind();
        if (request.locator() instanceof TileLocator t) {
            return buckets.fetchTile(family, kind, t.tile(), targetDir);
        }
        if (request.locator() instanceof ProductLocator p) {
            return fetchById(p.productId(), kind, request.options(), targetDir);
        }
        AreaLocator area = (AreaLocator) request.locator();
        if (kind.isDem()) {
            return area.tile().isPresent()
                    ? buckets.fetchTile(family, kind, area.tile().get(), targetDir)
                    : buckets.fetchDemCells(family, kind, tileResolver.coveringDemTiles(area.footprint().get()),
                    request.canonicalName(), targetDir);
        }
        OpticalGridTile tile = area.tile().orElseThrow(() ->
                new InvalidKeyPatternException(name() + " needs a grid tile to locate " + kind + " acquisitions"));

        List<BucketKeys.DiscoveredRoot> roots = buckets.discover(family,
                buckets.keys().discoveries(family, kind, tile, area.start(), area.end(), request.options()));
        if (roots.isEmpty()) {
            throw new ObjectNotFoundException("No " + kind + " acquisition of " + tile.id() + " between "
                    + area.start() + " and " + area.end() + " in " + family);
        }
        log.info("{}: {} acquisition(s) of {} to fetch", name(), roots.size(), tile.id());
        List<Path> out = new ArrayList<>();
        for (BucketKeys.DiscoveredRoot root : roots) {
            out.addAll(buckets.fetchPrefix(family, root.prefix(), targetDir.resolve(root.localName()),
                    BucketKeys.itemFilter(request.options())));
        }
        return out;
    }

    /**
     * Fetches every part of the product. With an item filter a part may hold no matching object;
     * the fetch fails only when nothing matched at all.
     */
    @Override
    public List<Path> fetchById(String productId, DataKind kind, RetrievalOptions options, Path targetDir) {
        List<BucketKeys.ProductPart> parts = buckets.keys().productParts(family, kind, productId, options);
        boolean filtered = options.maskOnly() || !options.items().isEmpty();
        List<Path> out = new ArrayList<>();
        for (BucketKeys.ProductPart part : parts) {
            log.info("{}: fetching {} from {}", name(), productId, part.prefix());
            Path dest = part.subdir().isEmpty() ? targetDir : targetDir.resolve(part.subdir());
            try {
                out.addAll(buckets.fetchPrefix(family, part.prefix(), dest, BucketKeys.itemFilter(options)));
            } catch (ObjectNotFoundException e) {
                if (!filtered || parts.size() == 1) throw e;
                log.debug("{}: no matching object under {}", name(), part.prefix());
            }
        }
        if (out.isEmpty()) {
            throw new ObjectNotFoundException("No object of " + productId + " matches the requested items in " + family);
        }
        return out;
    }
}
