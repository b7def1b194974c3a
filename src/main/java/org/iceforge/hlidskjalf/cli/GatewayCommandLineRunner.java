package org.iceforge.hlidskjalf.cli;

import org.iceforge.hlidskjalf.GatewayException;
import org.iceforge.hlidskjalf.aws.s3.S3Models.ObjectRef;
import org.iceforge.hlidskjalf.bucket.BucketAccessAdapter;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.retrieval.RetrievalExhaustedException;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.AreaLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.Locator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.MaterializedProduct;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.ProviderFailure;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalOrchestrator;
import org.iceforge.hlidskjalf.tile.DemTile;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.iceforge.hlidskjalf.upload.Archive;
import org.iceforge.hlidskjalf.upload.ArchiveKeys;
import org.iceforge.hlidskjalf.upload.ArchiveUploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Command-line surface of the gateway.
 * <pre>
 *   tile    &lt;TILE&gt; --kind=K [--start=D --end=D] --out=DIR [--provider=P] [--items=A,B] [--mask-only] [--jp2]
 *   dem     &lt;TILE&gt; [--kind=srtm1s] --out=DIR [--provider=P]
 *   id      &lt;PRODUCT_ID&gt; --out=DIR [--provider=P] [--items=A,B] [--mask-only] [--jp2]
 *   dem-ids &lt;TILE&gt; [--with-suffix] [--cgiar]
 *   upload  &lt;PATH&gt; --key=KEY --archive=ard|prd [--tile=T] [--suffix=S]
 *   prefix  &lt;PREFIX&gt; --archive=ard|prd --out=DIR
 * </pre>
 * Exit status: 0 on success, 1 on a gateway error (the error kind is printed), 2 on a usage error.
 */
@Component
public class GatewayCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(GatewayCommandLineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "usage: hlidskjalf <command> [args]",
            "  tile    <TILE> --kind=K [--start=YYYY-MM-DD --end=YYYY-MM-DD] --out=DIR [--provider=P] [--items=A,B] [--mask-only] [--jp2]",
            "  dem     <TILE> [--kind=srtm1s|srtm3s|copdem1s|copdem3s] --out=DIR [--provider=P]",
            "  id      <PRODUCT_ID> --out=DIR [--provider=P] [--items=A,B] [--mask-only] [--jp2]",
            "  dem-ids <TILE> [--with-suffix] [--cgiar]",
            "  upload  <PATH> --key=KEY --archive=ard|prd [--tile=TILE] [--suffix=S]",
            "  prefix  <PREFIX> --archive=ard|prd --out=DIR");

    private final TileResolver tileResolver;
    private final RetrievalOrchestrator orchestrator;
    private final ArchiveUploader uploader;
    private final BucketAccessAdapter buckets;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public GatewayCommandLineRunner(TileResolver tileResolver, RetrievalOrchestrator orchestrator,
                                    ArchiveUploader uploader, BucketAccessAdapter buckets) {
        this(tileResolver, orchestrator, uploader, buckets, System.out, System.err);
    }

    GatewayCommandLineRunner(TileResolver tileResolver, RetrievalOrchestrator orchestrator,
                             ArchiveUploader uploader, BucketAccessAdapter buckets,
                             PrintStream out, PrintStream err) {
        this.tileResolver = tileResolver;
        this.orchestrator = orchestrator;
        this.uploader = uploader;
        this.buckets = buckets;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        try {
            String command = positional.get(0);
            String target = positional.size() > 1 ? positional.get(1) : null;
            switch (command) {
                case "tile" -> tile(required(target, "TILE"), args);
                case "dem" -> dem(required(target, "TILE"), args);
                case "id" -> byId(required(target, "PRODUCT_ID"), args);
                case "dem-ids" -> demIds(required(target, "TILE"), args);
                case "upload" -> upload(required(target, "PATH"), args);
                case "prefix" -> prefix(required(target, "PREFIX"), args);
                default -> throw new UsageException("Unknown command '" + command + "'");
            }
            return EXIT_OK;
        } catch (GatewayException e) {
            log.error("{}: {}", e.kind().label(), e.getMessage());
            err.println("ERROR " + e.kind().label() + ": " + e.getMessage());
            if (e instanceof RetrievalExhaustedException ex) {
                for (ProviderFailure f : ex.failures()) {
                    err.println("  - " + f.provider() + ": " + f.kind().label() + " (" + f.message() + ")");
                }
            }
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("ERROR usage: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
    }

    private void tile(String tileArg, ApplicationArguments args) {
        DataKind kind = DataKind.fromToken(option(args, "kind").orElseThrow(() -> new UsageException("--kind is required")));
        TileId tile = TileId.parse(tileArg);
        Locator locator;
        if (kind.isDem()) {
            locator = new TileLocator(tile);
        } else {
            if (!(tile instanceof OpticalGridTile grid)) {
                throw new UsageException(kind + " needs a Sentinel-2 grid tile, got " + tileArg);
            }
            LocalDate start = date(args, "start");
            LocalDate end = option(args, "end").isPresent() ? date(args, "end") : start;
            locator = AreaLocator.ofTile(grid, start, end);
        }
        retrieve(new DataRequest(kind, locator, outDir(args), option(args, "provider"), options(args)));
    }

    private void dem(String tileArg, ApplicationArguments args) {
        DataKind kind = DataKind.fromToken(option(args, "kind").orElse(DataKind.DEM_SRTM_1S.token()));
        if (!kind.isDem()) {
            throw new UsageException(kind + " is not a DEM kind");
        }
        retrieve(new DataRequest(kind, new TileLocator(TileId.parse(tileArg)), outDir(args),
                option(args, "provider"), RetrievalOptions.DEFAULTS));
    }

    private void byId(String productId, ApplicationArguments args) {
        print(orchestrator.retrieveById(productId, option(args, "provider").orElse(null), outDir(args), options(args)));
    }

    private void demIds(String tileArg, ApplicationArguments args) {
        TileId tile = TileId.parse(tileArg);
        Set<DemTile> cells = tile instanceof DemTile d
                ? Set.of(d)
                : tileResolver.coveringDemTiles((OpticalGridTile) tile);
        if (args.containsOption("cgiar")) {
            out.println(String.join(";", tileResolver.cgiarSrtmTiles(cells)));
        } else {
            out.println(tileResolver.joinDemTiles(cells, args.containsOption("with-suffix")));
        }
    }

    private void upload(String pathArg, ApplicationArguments args) {
        Path path = Path.of(pathArg);
        String key = option(args, "key").orElseThrow(() -> new UsageException("--key is required"));
        Optional<String> tile = option(args, "tile");
        if (tile.isPresent()) {
            key = ArchiveKeys.join(key, ArchiveKeys.tilePath(OpticalGridTile.parse(tile.get())));
            if (!Files.isDirectory(path)) key = ArchiveKeys.join(key, path.getFileName().toString());
        }
        Archive archive = Archive.parse(option(args, "archive").orElse("ard"));
        if (Files.isDirectory(path)) {
            ArchiveUploader.UploadSummary s = uploader.uploadProduct(path, key, archive, uploader.namespace(),
                    option(args, "suffix"));
            out.println(s.fileCount() + " file(s), " + s.byteTotal() + " bytes -> "
                    + uploader.bucket(archive, uploader.namespace()) + "/" + key);
        } else {
            uploader.uploadFile(path, key, archive);
            out.println(path + " -> " + uploader.bucket(archive, uploader.namespace()) + "/" + key);
        }
    }

    private void prefix(String prefixArg, ApplicationArguments args) {
        Archive archive = Archive.parse(option(args, "archive").orElse("prd"));
        ObjectRef ref = new ObjectRef(uploader.bucket(archive, uploader.namespace()), prefixArg);
        Path dest = outDir(args).resolve(ref.baseName());
        List<Path> files = buckets.fetchPrefix(BucketFamily.EWOC, ref, dest, name -> true);
        out.println(files.size() + " file(s) -> " + dest);
    }

    private void retrieve(DataRequest request) {
        print(orchestrator.retrieve(request));
    }

    private void print(MaterializedProduct p) {
        out.println(p.localPath() + " (" + p.sourceProvider() + ", " + p.byteSize() + " bytes"
                + p.checksum().map(c -> ", sha256 " + c).orElse("") + ")");
    }

    private static RetrievalOptions options(ApplicationArguments args) {
        List<String> items = option(args, "items")
                .map(v -> Arrays.stream(v.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList())
                .orElse(List.of());
        return new RetrievalOptions(args.containsOption("mask-only"), !args.containsOption("jp2"), items);
    }

    private static Path outDir(ApplicationArguments args) {
        return Path.of(option(args, "out").orElseThrow(() -> new UsageException("--out is required")));
    }

    private static LocalDate date(ApplicationArguments args, String name) {
        String v = option(args, name).orElseThrow(() -> new UsageException("--" + name + " is required"));
        try {
            return LocalDate.parse(v);
        } catch (DateTimeParseException e) {
            throw new UsageException("--" + name + " must be YYYY-MM-DD, got " + v);
        }
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        String v = values.get(values.size() - 1);
        return v == null || v.isBlank() ? Optional.empty() : Optional.of(v.trim());
    }

    private static String required(String value, String name) {
        if (value == null) throw new UsageException(name + " is required");
        return value;
    }

    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }
}
