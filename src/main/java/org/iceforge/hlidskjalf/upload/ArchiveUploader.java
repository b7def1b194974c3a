package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.aws.s3.Checksums;
import org.iceforge.hlidskjalf.aws.s3.S3AccessException;
import org.iceforge.hlidskjalf.aws.s3.S3AccessLayer;
import org.iceforge.hlidskjalf.aws.s3.S3Models;
import org.iceforge.hlidskjalf.bucket.BucketClients;
import org.iceforge.hlidskjalf.bucket.BucketFamily;
import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.provider.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Writes local artifacts into the EWoC archives.
 * <p>
 * Every stored object records the SHA-256 of its content; a file whose key already holds the same
 * content is skipped, which makes re-running an interrupted upload safe.
 */
@Service
public class ArchiveUploader {
    private static final Logger log = LoggerFactory.getLogger(ArchiveUploader.class);

    public record UploadSummary(int fileCount, long byteTotal, int skipped, List<String> keys) {}

    private final S3AccessLayer store;
    private final GatewayProperties.Ewoc ewoc;
    private final ArchiveNamespace namespace;

    public ArchiveUploader(BucketClients clients, GatewayProperties props) {
        this.store = clients.layer(BucketFamily.EWOC);
        this.ewoc = props.getEwoc();
        this.namespace = ArchiveNamespace.fromDevMode(props.isDevMode());
    }

    /** The namespace selected by the dev-mode flag. */
    public ArchiveNamespace namespace() {
        return namespace;
    }

    public String bucket(Archive archive, ArchiveNamespace ns) {
        return ns.bucket(archive.baseBucket(ewoc));
    }

    public void uploadFile(Path localPath, String destKey, Archive archive) {
        uploadFile(localPath, destKey, archive, namespace);
    }

    /**
     * Stores one file. Returns true when it was written, false when identical content was already there.
     */
    public boolean uploadFile(Path localPath, String destKey, Archive archive, ArchiveNamespace ns) {
        if (!Files.isRegularFile(localPath)) {
            throw new IllegalArgumentException("Not a file: " + localPath);
        }
        S3Models.ObjectRef ref = new S3Models.ObjectRef(bucket(archive, ns), destKey);
        String sha256 = Checksums.sha256Hex(localPath);
        try {
            Optional<S3Models.ObjectMetadata> existing = store.head(ref);
            if (existing.isPresent() && sha256.equals(existing.get().userMetadata().get(Checksums.SHA256_METADATA_KEY))) {
                log.debug("Skipping {}: identical content already stored", ref);
                return false;
            }
            store.uploadFile(ref, localPath, contentType(localPath), Map.of(Checksums.SHA256_METADATA_KEY, sha256));
            log.info("Uploaded {} to {}", localPath, ref);
            return true;
        } catch (S3AccessException e) {
            if (e.isAccessDenied()) {
                throw new UploadDeniedException("Upload to " + ref + " denied (" + e.statusCode() + ")", e);
            }
            throw new ProviderUnavailableException("Upload to " + ref + " failed: " + e.getMessage(), e);
        }
    }

    public UploadSummary uploadProduct(Path localDir, String destPrefix, Archive archive) {
        return uploadProduct(localDir, destPrefix, archive, namespace, Optional.empty());
    }

    /**
     * Stores every file under {@code localDir} (optionally only names ending with {@code suffix})
     * below {@code destPrefix}, preserving relative paths.
     */
    public UploadSummary uploadProduct(Path localDir, String destPrefix, Archive archive, ArchiveNamespace ns,
                                       Optional<String> suffix) {
        if (!Files.isDirectory(localDir)) {
            throw new IllegalArgumentException("Not a directory: " + localDir);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(localDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> suffix.map(s -> p.getFileName().toString().endsWith(s)).orElse(true))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + localDir, e);
        }

        List<String> done = new ArrayList<>();
        long bytes = 0;
        int skipped = 0;
        for (Path f : files) {
            String key = ArchiveKeys.join(destPrefix, localDir.relativize(f).toString().replace('\\', '/'));
            try {
                if (!uploadFile(f, key, archive, ns)) skipped++;
                bytes += Files.size(f);
            } catch (RuntimeException | IOException e) {
                if (done.isEmpty()) {
                    if (e instanceof RuntimeException re) throw re;
                    throw new ProviderUnavailableException("Cannot read " + f, e);
                }
                throw new PartialUploadException(done, key, e);
            }
            done.add(key);
        }
        log.info("Uploaded {} file(s), {} bytes ({} unchanged) to {}/{}", done.size(), bytes, skipped,
                bucket(archive, ns), destPrefix);
        return new UploadSummary(done.size(), bytes, skipped, done);
    }

    private static String contentType(Path p) {
        try {
            return Files.probeContentType(p);
        } catch (IOException e) {
            return null;
        }
    }
}
