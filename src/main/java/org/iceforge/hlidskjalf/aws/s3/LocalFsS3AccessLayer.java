package org.iceforge.hlidskjalf.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link S3AccessLayer}.
 *
 * <p>Used in development and tests so the gateway can run without any S3 dependency.
 * Paths are mapped as:
 * <pre>
 *   {baseDir}/{bucket}/{key}
 * </pre>
 * User metadata lives in a {@code .meta} properties file next to each object.
 */
public class LocalFsS3AccessLayer implements S3AccessLayer {
    private static final Logger log = LoggerFactory.getLogger(LocalFsS3AccessLayer.class);

    private static final String META_SUFFIX = ".meta";

    private final Path baseDir;

    public LocalFsS3AccessLayer(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local store dir=" + this.baseDir, e);
        }
        log.info("Using LOCAL object store: baseDir={}", this.baseDir);
    }

    public Path baseDir() {
        return baseDir;
    }

    private Path pathFor(S3Models.ObjectRef ref) {
        // Prevent path traversal by normalizing and verifying base prefix.
        Path p = baseDir.resolve(ref.bucket()).resolve(ref.key()).normalize();
        if (!p.startsWith(baseDir)) {
            throw new IllegalArgumentException("Illegal key (path traversal): bucket=" + ref.bucket() + " key=" + ref.key());
        }
        return p;
    }

    private Path metaPathFor(S3Models.ObjectRef ref) {
        Path p = pathFor(ref);
        return p.resolveSibling(p.getFileName().toString() + META_SUFFIX);
    }

    private void writeMeta(S3Models.ObjectRef ref, String contentType, Map<String, String> userMetadata) throws IOException {
        Properties props = new Properties();
        if (contentType != null) props.setProperty("contentType", contentType);
        if (userMetadata != null) {
            for (var ent : userMetadata.entrySet()) {
                if (ent.getKey() != null && ent.getValue() != null) {
                    props.setProperty("meta." + ent.getKey(), ent.getValue());
                }
            }
        }
        Path meta = metaPathFor(ref);
        try (OutputStream out = Files.newOutputStream(meta)) {
            props.store(out, "hlidskjalf local object metadata");
        }
    }

    private Properties readMeta(S3Models.ObjectRef ref) {
        Properties props = new Properties();
        Path meta = metaPathFor(ref);
        if (!Files.exists(meta)) return props;
        try (InputStream in = Files.newInputStream(meta)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Unreadable local metadata for {}", ref, e);
        }
        return props;
    }

    @Override
    public Stream<S3Models.ListItem> list(String bucket, String prefix) {
        Path bucketRoot = baseDir.resolve(bucket).normalize();
        if (!bucketRoot.startsWith(baseDir)) {
            throw new IllegalArgumentException("Illegal bucket: " + bucket);
        }
        String pfx = prefix == null ? "" : prefix;
        // Walk from the deepest directory named by the prefix; keys are then matched as plain strings.
        int slash = pfx.lastIndexOf('/');
        Path root = slash < 0 ? bucketRoot : bucketRoot.resolve(pfx.substring(0, slash)).normalize();
        if (!root.startsWith(bucketRoot)) {
            throw new IllegalArgumentException("Illegal list prefix: " + prefix);
        }
        if (!Files.isDirectory(root)) return Stream.empty();
        try (Stream<Path> walk = Files.walk(root)) {
            List<S3Models.ListItem> items = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(META_SUFFIX))
                    .map(p -> toItem(bucketRoot, p))
                    .filter(i -> i.key().startsWith(pfx))
                    .sorted(Comparator.comparing(S3Models.ListItem::key))
                    .toList();
            return items.stream();
        } catch (IOException e) {
            throw new S3AccessException("Local list failed bucket=" + bucket + " prefix=" + prefix, e);
        }
    }

    private static S3Models.ListItem toItem(Path bucketRoot, Path p) {
        String key = bucketRoot.relativize(p).toString().replace('\\', '/');
        try {
            return new S3Models.ListItem(key, Files.size(p), "local-etag-" + Files.size(p),
                    Files.getLastModifiedTime(p).toInstant());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void download(S3Models.ObjectRef ref, Path target) {
        Path src = pathFor(ref);
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(src, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchFileException e) {
            throw new S3ObjectNotFoundException("Local object not found: " + ref, e);
        } catch (IOException e) {
            throw new S3AccessException("Local download failed for " + ref, e);
        }
    }

    @Override
    public String uploadFile(S3Models.ObjectRef ref, Path source, String contentType, Map<String, String> userMetadata) {
        try {
            Path dst = pathFor(ref);
            Files.createDirectories(dst.getParent());
            Path tmp = Files.createTempFile(dst.getParent(), "hlidskjalf-", ".tmp");
            Files.copy(source, tmp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            writeMeta(ref, contentType, userMetadata);
            return "local-etag-" + Files.size(dst);
        } catch (IOException e) {
            throw new S3AccessException("Local upload failed for " + ref, e);
        }
    }

    @Override
    public Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref) {
        try {
            Path p = pathFor(ref);
            if (!Files.isRegularFile(p)) return Optional.empty();
            long len = Files.size(p);
            Instant lm = Files.getLastModifiedTime(p).toInstant();
            Properties props = readMeta(ref);
            Map<String, String> userMeta = new LinkedHashMap<>();
            for (String name : props.stringPropertyNames()) {
                if (name.startsWith("meta.")) {
                    userMeta.put(name.substring("meta.".length()), props.getProperty(name));
                }
            }
            return Optional.of(new S3Models.ObjectMetadata(ref.bucket(), ref.key(), len, "local-etag-" + len,
                    props.getProperty("contentType"), lm, userMeta));
        } catch (IOException e) {
            throw new S3AccessException("Local head failed for " + ref, e);
        }
    }
}
