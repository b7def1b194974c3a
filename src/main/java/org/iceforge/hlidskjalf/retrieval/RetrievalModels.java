package org.iceforge.hlidskjalf.retrieval;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.product.ProductIds;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.tile.Footprint;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Request and result values exchanged with the retrieval orchestrator. All immutable.
 */
public final class RetrievalModels {
    private RetrievalModels() {}

    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    /** What to retrieve: a tile, a product, or a tile/area over a date range. */
    public sealed interface Locator permits TileLocator, ProductLocator, AreaLocator {
        /** Provider-independent name of the materialized result for the given kind. */
        String canonicalName(DataKind kind);
    }

    public record TileLocator(TileId tile) implements Locator {
        public TileLocator {
            Objects.requireNonNull(tile, "tile");
        }

        @Override
        public String canonicalName(DataKind kind) {
            return kind.token() + "_" + tile.id();
        }
    }

    public record ProductLocator(String productId) implements Locator {
        public ProductLocator {
            Objects.requireNonNull(productId, "productId");
        }

        @Override
        public String canonicalName(DataKind kind) {
            return ProductIds.baseName(productId);
        }
    }

    /**
     * A date range over either a grid tile or an explicit footprint. When a tile is given its
     * footprint is resolved on demand.
     */
    public record AreaLocator(
            Optional<OpticalGridTile> tile,
            Optional<Footprint> footprint,
            LocalDate start,
            LocalDate end
    ) implements Locator {
        public AreaLocator {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            if (tile.isEmpty() && footprint.isEmpty()) {
                throw new IllegalArgumentException("Area locator needs a tile or a footprint");
            }
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("End date " + end + " is before start date " + start);
            }
        }

        public static AreaLocator ofTile(OpticalGridTile tile, LocalDate start, LocalDate end) {
            return new AreaLocator(Optional.of(tile), Optional.empty(), start, end);
        }

        public static AreaLocator ofFootprint(Footprint footprint, LocalDate start, LocalDate end) {
            return new AreaLocator(Optional.empty(), Optional.of(footprint), start, end);
        }

        @Override
        public String canonicalName(DataKind kind) {
            String where = tile.map(OpticalGridTile::id).orElse("area");
            return kind.token() + "_" + where + "_" + start.format(COMPACT_DATE) + "_" + end.format(COMPACT_DATE);
        }
    }

    /**
     * Per-request retrieval switches.
     *
     * @param maskOnly   Sentinel-2 L2A: fetch only the scene classification layer
     * @param preferCogs Sentinel-2 L2A on AWS: use the COG bucket rather than the JP2 one
     * @param items      optional band/item filter (e.g. "B04", "SR_B4"); empty means everything
     */
    public record RetrievalOptions(boolean maskOnly, boolean preferCogs, List<String> items) {
        public static final RetrievalOptions DEFAULTS = new RetrievalOptions(false, true, List.of());

        public RetrievalOptions {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    public record DataRequest(
            DataKind dataKind,
            Locator locator,
            Path outputDirectory,
            Optional<String> providerOverride,
            RetrievalOptions options
    ) {
        public DataRequest {
            Objects.requireNonNull(dataKind, "dataKind");
            Objects.requireNonNull(locator, "locator");
            providerOverride = providerOverride == null ? Optional.empty() : providerOverride.filter(s -> !s.isBlank());
            options = options == null ? RetrievalOptions.DEFAULTS : options;
        }

        public static DataRequest of(DataKind kind, Locator locator, Path outputDirectory) {
            return new DataRequest(kind, locator, outputDirectory, Optional.empty(), RetrievalOptions.DEFAULTS);
        }

        public DataRequest withProvider(String provider) {
            return new DataRequest(dataKind, locator, outputDirectory, Optional.ofNullable(provider), options);
        }

        public String canonicalName() {
            return locator.canonicalName(dataKind);
        }
    }

    /**
     * Result of a successful retrieval. {@code checksum} is the SHA-256 of the content when the
     * product consists of a single file.
     */
    public record MaterializedProduct(
            Path localPath,
            String sourceProvider,
            long byteSize,
            Instant retrievedAt,
            Optional<String> checksum
    ) {}

    /** One failed provider attempt, as reported in a {@link RetrievalExhaustedException}. */
    public record ProviderFailure(String provider, ErrorKind kind, String message) {
        @Override
        public String toString() {
            return provider + ": " + kind.label() + " (" + message + ")";
        }
    }
}
