package org.iceforge.hlidskjalf.bucket;

import org.iceforge.hlidskjalf.aws.s3.S3Models.ObjectRef;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.product.InvalidProductIdException;
import org.iceforge.hlidskjalf.product.L8ProductId;
import org.iceforge.hlidskjalf.product.ProductIds;
import org.iceforge.hlidskjalf.product.S1ProductId;
import org.iceforge.hlidskjalf.product.S2ProductId;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.provider.InvalidKeyPatternException;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.tile.DemTile;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Object keys in the published layout of each bucket family.
 * <p>
 * AWS keys use unpadded month and day ({@code 2021/7/8}); CREODIAS keys pad them ({@code 2021/07/08}).
 */
@Component
public class BucketKeys {

    private static final DateTimeFormatter PADDED_DAY = DateTimeFormatter.ofPattern("yyyy/MM/dd", Locale.ROOT);
    private static final DateTimeFormatter COMPACT = DateTimeFormatter.BASIC_ISO_DATE;

    static final String AWS_COGS_ROOT = "sentinel-s2-l2a-cogs";
    static final String LANDSAT_ROOT = "collection02/level-2/standard/oli-tirs";
    static final String CREODIAS_SRTM_ROOT = "auxdata/SRTMGL1/dem";

    /**
     * A listing prefix whose immediate children are candidate product roots.
     * {@code acceptRoot} is applied to the child name.
     */
    public record ProductDiscovery(ObjectRef prefix, Predicate<String> acceptRoot, UnaryOperator<String> localName) {
        public ProductDiscovery(ObjectRef prefix, Predicate<String> acceptRoot) {
            this(prefix, acceptRoot, UnaryOperator.identity());
        }
    }

    /** A product root found by discovery and the directory name it is written to locally. */
    public record DiscoveredRoot(ObjectRef prefix, String localName) {}

    /**
     * One prefix of a product. Products split over several prefixes are written into one
     * {@code subdir} each; a single-prefix product has an empty {@code subdir}.
     */
    public record ProductPart(String subdir, ObjectRef prefix) {}

    private final GatewayProperties props;

    public BucketKeys(GatewayProperties props) {
        this.props = props;
    }

    public ObjectRef demTile(BucketFamily family, DataKind kind, DemTile tile) {
        if (family == BucketFamily.CREODIAS_DIAS && kind == DataKind.DEM_SRTM_1S) {
            return new ObjectRef(props.getCreodias().getBucket(), CREODIAS_SRTM_ROOT + "/" + tile.format(true));
        }
        if (family == BucketFamily.AWS_PUBLIC && (kind == DataKind.DEM_COP_1S || kind == DataKind.DEM_COP_3S)) {
            boolean oneSecond = kind == DataKind.DEM_COP_1S;
            String name = "Copernicus_DSM_COG_" + (oneSecond ? "10" : "30") + "_"
                    + tile.latitudePart() + "_00_" + tile.longitudePart() + "_00_DEM";
            String bucket = oneSecond ? props.getAws().getCopDem30Bucket() : props.getAws().getCopDem90Bucket();
            return new ObjectRef(bucket, name + "/" + name + ".tif");
        }
        throw new InvalidKeyPatternException("No DEM tile layout for " + kind + " in " + family);
    }

    /** CGIAR 5x5 degree SRTM 3s tile in the EWoC auxiliary bucket. */
    public ObjectRef cgiarSrtm(String cgiarTileId) {
        if (!cgiarTileId.matches("srtm_\\d{2}_\\d{2}")) {
            throw new InvalidKeyPatternException("Not a CGIAR SRTM tile id: " + cgiarTileId);
        }
        GatewayProperties.Ewoc ewoc = props.getEwoc();
        return new ObjectRef(ewoc.getAuxBucket(), ewoc.getSrtm3sPrefix() + "/" + cgiarTileId + ".zip");
    }

    /** Prefix holding every object of one product, ending with "/". */
    public ObjectRef productPrefix(BucketFamily family, DataKind kind, String productId, RetrievalOptions options) {
        DataKind actual = detect(productId);
        if (actual != kind) {
            throw new InvalidKeyPatternException("Product " + productId + " is " + actual + ", not " + kind);
        }
        return switch (family) {
            case AWS_PUBLIC -> awsProductPrefix(kind, productId, options);
            case CREODIAS_DIAS -> creodiasProductPrefix(kind, productId);
            case EWOC -> throw new InvalidKeyPatternException("EWoC buckets hold no " + kind + " products");
        };
    }

    /**
     * Every prefix holding objects of one product. The AWS Sentinel-2 JP2 buckets keep product
     * metadata under {@code products/} and the rasters under {@code tiles/}; both are returned.
     */
    public List<ProductPart> productParts(BucketFamily family, DataKind kind, String productId, RetrievalOptions options) {
        ObjectRef product = productPrefix(family, kind, productId, options);
        boolean jp2 = kind.isSentinel2() && !(kind == DataKind.SENTINEL2_L2A && options.preferCogs());
        if (family != BucketFamily.AWS_PUBLIC || !jp2) {
            return List.of(new ProductPart("", product));
        }
        S2ProductId p = S2ProductId.parse(productId);
        ObjectRef tile = new ObjectRef(product.bucket(),
                awsTileDayPrefix(p.tile(), p.sensingTime().toLocalDate()) + "0/");
        return List.of(new ProductPart("product", product), new ProductPart("tile", tile));
    }

    private ObjectRef awsProductPrefix(DataKind kind, String productId, RetrievalOptions options) {
        GatewayProperties.Aws aws = props.getAws();
        switch (kind) {
            case SENTINEL1: {
                S1ProductId p = S1ProductId.parse(productId);
                LocalDate d = p.startTime().toLocalDate();
                return new ObjectRef(aws.getSentinel1Bucket(), p.productType() + "/" + awsDay(d) + "/"
                        + p.beamMode() + "/" + p.polarisation() + "/" + p.id() + "/");
            }
            case SENTINEL2_L1C:
            case SENTINEL2_L2A: {
                S2ProductId p = S2ProductId.parse(productId);
                LocalDate d = p.sensingTime().toLocalDate();
                if (kind == DataKind.SENTINEL2_L2A && options.preferCogs()) {
                    OpticalGridTile t = p.tile();
                    String name = p.missionId() + "_" + t.id() + "_" + d.format(COMPACT) + "_0_L2A";
                    return new ObjectRef(aws.getSentinel2CogsBucket(),
                            cogsTilePrefix(t) + d.getYear() + "/" + d.getMonthValue() + "/" + name + "/");
                }
                String bucket = kind == DataKind.SENTINEL2_L1C ? aws.getSentinel2L1cBucket() : aws.getSentinel2L2aBucket();
                return new ObjectRef(bucket, "products/" + awsDay(d) + "/" + p.id() + "/");
            }
            case LANDSAT8: {
                L8ProductId p = L8ProductId.parse(productId);
                return new ObjectRef(aws.getLandsatBucket(), LANDSAT_ROOT + "/" + p.acquisitionDate().getYear() + "/"
                        + p.wrs2Path() + "/" + p.wrs2Row() + "/" + p.id() + "/");
            }
            default:
                throw new InvalidKeyPatternException("No AWS product layout for " + kind);
        }
    }

    private ObjectRef creodiasProductPrefix(DataKind kind, String productId) {
        String bucket = props.getCreodias().getBucket();
        switch (kind) {
            case SENTINEL1: {
                S1ProductId p = S1ProductId.parse(productId);
                return new ObjectRef(bucket, "Sentinel-1/SAR/" + p.productType() + "/"
                        + p.startTime().toLocalDate().format(PADDED_DAY) + "/" + p.id() + ".SAFE/");
            }
            case SENTINEL2_L1C:
            case SENTINEL2_L2A: {
                S2ProductId p = S2ProductId.parse(productId);
                return new ObjectRef(bucket, creodiasS2Root(kind) + p.sensingTime().toLocalDate().format(PADDED_DAY)
                        + "/" + p.id() + ".SAFE/");
            }
            default:
                throw new InvalidKeyPatternException("No CREODIAS product layout for " + kind);
        }
    }

    /**
     * Listing prefixes for Sentinel-2 acquisitions of one tile over a date range, for buckets whose
     * product keys cannot be derived from the tile alone.
     */
    public List<ProductDiscovery> discoveries(BucketFamily family, DataKind kind, OpticalGridTile tile,
                                              LocalDate start, LocalDate end, RetrievalOptions options) {
        if (!kind.isSentinel2()) {
            throw new InvalidKeyPatternException("Date-range discovery is only laid out for Sentinel-2, not " + kind);
        }
        List<ProductDiscovery> out = new ArrayList<>();
        if (family == BucketFamily.AWS_PUBLIC && kind == DataKind.SENTINEL2_L2A && options.preferCogs()) {
            String cogs = props.getAws().getSentinel2CogsBucket();
            for (YearMonth m = YearMonth.from(start); !m.isAfter(YearMonth.from(end)); m = m.plusMonths(1)) {
                String prefix = cogsTilePrefix(tile) + m.getYear() + "/" + m.getMonthValue() + "/";
                out.add(new ProductDiscovery(new ObjectRef(cogs, prefix), name -> cogInRange(name, tile, start, end)));
            }
        } else if (family == BucketFamily.AWS_PUBLIC) {
            String bucket = kind == DataKind.SENTINEL2_L1C
                    ? props.getAws().getSentinel2L1cBucket() : props.getAws().getSentinel2L2aBucket();
            for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
                // roots are sequence numbers ("0", "1"), named after tile and day locally
                String day = tile.id() + "_" + d.format(COMPACT) + "_";
                out.add(new ProductDiscovery(new ObjectRef(bucket, awsTileDayPrefix(tile, d)), name -> true,
                        name -> day + name));
            }
        } else if (family == BucketFamily.CREODIAS_DIAS) {
            String bucket = props.getCreodias().getBucket();
            String marker = "_T" + tile.id() + "_";
            for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
                String prefix = creodiasS2Root(kind) + d.format(PADDED_DAY) + "/";
                out.add(new ProductDiscovery(new ObjectRef(bucket, prefix), name -> name.contains(marker)));
            }
        } else {
            throw new InvalidKeyPatternException("No Sentinel-2 layout in " + family);
        }
        return out;
    }

    /**
     * Object filter for the retrieval options: the scene classification layer only, or the listed items.
     * Applied to the last key segment.
     */
    public static Predicate<String> itemFilter(RetrievalOptions options) {
        if (options.maskOnly()) {
            return name -> name.contains("SCL");
        }
        if (options.items().isEmpty()) {
            return name -> true;
        }
        return name -> options.items().stream().anyMatch(name::contains);
    }

    static String cogsTilePrefix(OpticalGridTile t) {
        return AWS_COGS_ROOT + "/" + t.zonePathComponent() + "/" + t.band() + "/" + t.square() + "/";
    }

    static String awsTileDayPrefix(OpticalGridTile t, LocalDate d) {
        return "tiles/" + t.zonePathComponent() + "/" + t.band() + "/" + t.square() + "/" + awsDay(d) + "/";
    }

    private static String creodiasS2Root(DataKind kind) {
        return "Sentinel-2/MSI/" + (kind == DataKind.SENTINEL2_L1C ? "L1C" : "L2A") + "/";
    }

    private static String awsDay(LocalDate d) {
        return d.getYear() + "/" + d.getMonthValue() + "/" + d.getDayOfMonth();
    }

    // S2B_31TCJ_20210705_0_L2A
    private static boolean cogInRange(String name, OpticalGridTile tile, LocalDate start, LocalDate end) {
        String[] parts = name.split("_");
        if (parts.length < 3 || !parts[1].equals(tile.id())) return false;
        try {
            LocalDate d = LocalDate.parse(parts[2], COMPACT);
            return !d.isBefore(start) && !d.isAfter(end);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static DataKind detect(String productId) {
        try {
            return ProductIds.detectKind(productId);
        } catch (InvalidProductIdException e) {
            throw new InvalidKeyPatternException("Cannot derive a key from " + productId + ": " + e.getMessage(), e);
        }
    }
}
