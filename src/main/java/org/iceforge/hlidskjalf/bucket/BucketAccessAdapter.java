package org.iceforge.hlidskjalf.bucket;

import org.iceforge.hlidskjalf.aws.s3.S3AccessException;
import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3Models;
import org.iceforge.hlidskjalf.aws.s3.S3Models.ObjectRef;
import org.iceforge.hlidskjalf.aws.s3.S3ObjectNotFoundException;
import org.iceforge.hlidskjalf.provider.DataKind;
import org.iceforge.hlidskjalf.provider.InvalidKeyPatternException;
import org.iceforge.hlidskjalf.provider.ObjectNotFoundException;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.iceforge.hlidskjalf.tile.DemTile;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns logical tile and product requests into object-store keys and local files.
 * <p>
 * Every download lands in a temporary file next to its target and is renamed into place, so a
 * failed fetch never leaves a partial file at its final path.
 */
@Service
public class BucketAccessAdapter {
    private static final Logger log = LoggerFactory.getLogger(BucketAccessAdapter.class);

    private final BucketClients clients;
    private final BucketKeys keys;
    private final TileResolver tileResolver;

    public BucketAccessAdapter(BucketClients clients, BucketKeys keys, TileResolver tileResolver) {
        this.clients = clients;
        this.keys = keys;
        this.tileResolver = tileResolver;
    }

    public BucketKeys keys() {
        return keys;
    }

    /**
     * Keys under a prefix, in listing order. Pages are requested as the stream is consumed;
     * the stream can be consumed once.
     */
    public Stream<String> listUnder(BucketFamily family, String bucket, String prefix) {
        try {
            return clients.layer(family).list(bucket, prefix).map(S3Models.ListItem::key);
        } catch (S3AccessException e) {
            throw translate(new ObjectRef(bucket, prefix), e);
        }
    }

    /** Downloads one object to {@code destDir/<last key segment>}. */
    public Path fetch(BucketFamily family, ObjectRef ref, Path destDir) {
        return fetchTo(clients.layer(family), ref, destDir.resolve(ref.baseName()));
    }

    /**
     * DEM tiles covering {@code tile}, downloaded into {@code destDir} and unzipped. Tiles the provider
     * lacks (open ocean) are skipped; the call fails only when none of them exist.
     */
    public List<Path> fetchTile(BucketFamily family, DataKind kind, TileId tile, Path destDir) {
        return fetchDemCells(family, kind, demCells(tile), tile.id(), destDir);
    }

    /** Same as {@link #fetchTile} for an explicit set of DEM cells; {@code label} is used in messages. */
    public List<Path> fetchDemCells(BucketFamily family, DataKind kind, Set<DemTile> cells, String label, Path destDir) {
        if (!kind.isDem()) {
            throw new InvalidKeyPatternException(kind + " has no key derivable from a tile alone");
        }
        List<ObjectRef> refs = new ArrayList<>();
        if (kind == DataKind.DEM_SRTM_3S) {
            for (String id : tileResolver.cgiarSrtmTiles(cells)) refs.add(keys.cgiarSrtm(id));
        } else {
            for (DemTile t : cells) refs.add(keys.demTile(family, kind, t));
        }

        S3AccessLayer layer = clients.layer(family);
        List<Path> out = new ArrayList<>();
        int missing = 0;
        for (ObjectRef ref : refs) {
            Path local;
            try {
                local = fetchTo(layer, ref, destDir.resolve(ref.baseName()));
            } catch (ObjectNotFoundException e) {
                log.warn("DEM tile {} not found in {}, skipping", ref, family);
                missing++;
                continue;
            }
            out.addAll(unzipIfNeeded(local, destDir));
        }
        if (out.isEmpty()) {
            throw new ObjectNotFoundException("None of the " + refs.size() + " DEM objects for " + label
                    + " exist in " + family);
        }
        log.info("Fetched {} DEM object(s) for {} from {} ({} missing)", refs.size() - missing, label, family, missing);
        return out;
    }

    /**
     * Everything under {@code prefix} accepted by {@code nameFilter} (applied to the last key segment),
     * written below {@code destDir} with the key path relative to the prefix. On failure the files
     * written so far are removed.
     */
    public List<Path> fetchPrefix(BucketFamily family, ObjectRef prefix, Path destDir, Predicate<String> nameFilter) {
        S3AccessLayer layer = clients.layer(family);
        String pfx = prefix.key().endsWith("/") ? prefix.key() : prefix.key() + "/";
        Path base = destDir.toAbsolutePath().normalize();
        List<Path> written = new ArrayList<>();
        try (Stream<String> listed = listUnder(family, prefix.bucket(), pfx)) {
            Iterator<String> it = listed.iterator();
            while (it.hasNext()) {
                String key = it.next();
                String relative = key.substring(pfx.length());
                if (relative.isEmpty() || relative.endsWith("/")) continue;
                if (!nameFilter.test(new ObjectRef(prefix.bucket(), key).baseName())) continue;
                Path target = base.resolve(relative).normalize();
                if (!target.startsWith(base)) {
                    throw new InvalidKeyPatternException("Key escapes target directory: " + key);
                }
                written.add(fetchTo(layer, new ObjectRef(prefix.bucket(), key), target));
            }
        } catch (S3AccessException e) {
            deleteQuietly(written);
            throw translate(prefix, e);
        } catch (RuntimeException e) {
            deleteQuietly(written);
            throw e;
        }
        if (written.isEmpty()) {
            throw new ObjectNotFoundException("No objects under " + new ObjectRef(prefix.bucket(), pfx));
        }
        log.info("Fetched {} object(s) under {}", written.size(), new ObjectRef(prefix.bucket(), pfx));
        return written;
    }

    /**
     * Product roots found by listing the discovery prefixes: the first key segment below each prefix
     * that the discovery accepts, returned as prefixes ending with "/" together with their local name.
     */
    public List<BucketKeys.DiscoveredRoot> discover(BucketFamily family, List<BucketKeys.ProductDiscovery> discoveries) {
        Set<BucketKeys.DiscoveredRoot> roots = new LinkedHashSet<>();
        for (BucketKeys.ProductDiscovery d : discoveries) {
            String pfx = d.prefix().key();
            try (Stream<String> listed = listUnder(family, d.prefix().bucket(), pfx)) {
                roots.addAll(listed
                        .map(k -> k.substring(pfx.length()))
                        .filter(rest -> rest.indexOf('/') > 0)
                        .map(rest -> rest.substring(0, rest.indexOf('/')))
                        .filter(d.acceptRoot())
                        .map(name -> new BucketKeys.DiscoveredRoot(new ObjectRef(d.prefix().bucket(), pfx + name + "/"),
                                d.localName().apply(name)))
                        .collect(Collectors.toCollection(LinkedHashSet::new)));
            } catch (S3AccessException e) {
                throw translate(d.prefix(), e);
            }
        }
        log.debug("Discovered {} product root(s) in {}", roots.size(), family);
        return List.copyOf(roots);
    }

    private Set<DemTile> demCells(TileId tile) {
        if (tile instanceof DemTile dem) {
            return Set.of(dem);
        }
        return tileResolver.coveringDemTiles((OpticalGridTile) tile);
    }

    private static List<Path> unzipIfNeeded(Path local, Path destDir) {
        if (!DemArchives.isZip(local)) return List.of(local);
        try {
            return DemArchives.extractAndDelete(local, destDir);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Failed to extract " + local.getFileName(), e);
        }
    }

    private static Path fetchTo(S3AccessLayer layer, ObjectRef ref, Path target) {
        Path tmp = null;
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            tmp = Files.createTempFile(target.toAbsolutePath().getParent(), ".fetch-", ".part");
            layer.download(ref, tmp);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
            log.debug("Fetched {} -> {}", ref, target);
            return target;
        } catch (S3AccessException e) {
            throw translate(ref, e);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Local write failed for " + ref + " -> " + target, e);
        } finally {
            if (tmp != null) deleteQuietly(List.of(tmp));
        }
    }

    private static RuntimeException translate(ObjectRef ref, S3AccessException e) {
        if (e instanceof S3ObjectNotFoundException) {
            return new ObjectNotFoundException("Object not found: " + ref, e);
        }
        return new ProviderUnavailableException("Storage access failed for " + ref + ": " + e.getMessage(), e);
    }

    private static void deleteQuietly(List<Path> paths) {
        for (Path p : paths) {
            try {
                Files.deleteIfExists(p);
            } catch (IOException e) {
                log.warn("Could not remove {}", p, e);
            }
        }
    }
}
