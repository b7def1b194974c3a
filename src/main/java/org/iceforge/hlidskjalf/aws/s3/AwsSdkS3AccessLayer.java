package org.iceforge.hlidskjalf.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link S3AccessLayer} over the AWS SDK. One instance per bucket family; requester-pays buckets
 * get the {@code RequestPayer} header on every read.
 */
public class AwsSdkS3AccessLayer implements S3AccessLayer {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkS3AccessLayer.class);
    private final S3Client s3;
    private final boolean requesterPays;

    public AwsSdkS3AccessLayer(S3Client s3, boolean requesterPays) {
        this.s3 = s3;
        this.requesterPays = requesterPays;
    }

    @Override
    public Stream<S3Models.ListItem> list(String bucket, String prefix) {
        ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix == null ? "" : prefix);
        if (requesterPays) req = req.requestPayer(RequestPayer.REQUESTER);
        String where = "s3://" + bucket + "/" + (prefix == null ? "" : prefix);
        Iterator<S3Object> pages = s3.listObjectsV2Paginator(req.build()).contents().iterator();
        Iterator<S3Models.ListItem> items = new Iterator<>() {
            @Override
            public boolean hasNext() {
                try {
                    return pages.hasNext();
                } catch (S3Exception e) {
                    throw translate("list", where, e);
                } catch (SdkClientException e) {
                    throw new S3AccessException("S3 list failed: " + where, e);
                }
            }

            @Override
            public S3Models.ListItem next() {
                S3Object o = pages.next();
                return new S3Models.ListItem(o.key(), o.size() == null ? 0L : o.size(), o.eTag(), o.lastModified());
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(items, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public void download(S3Models.ObjectRef ref, Path target) {
        GetObjectRequest.Builder req = GetObjectRequest.builder().bucket(ref.bucket()).key(ref.key());
        if (requesterPays) req = req.requestPayer(RequestPayer.REQUESTER);
        try (ResponseInputStream<GetObjectResponse> ris = s3.getObject(req.build())) {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.copy(ris, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (NoSuchKeyException e) {
            throw new S3ObjectNotFoundException("S3 object not found: " + ref, e);
        } catch (S3Exception e) {
            throw translate("download", ref.toString(), e);
        } catch (SdkClientException | IOException e) {
            logger.error("S3 download failed for {}", ref, e);
            throw new S3AccessException("S3 download failed: " + ref, e);
        }
    }

    @Override
    public String uploadFile(S3Models.ObjectRef ref, Path source, String contentType, Map<String, String> userMetadata) {
        try {
            PutObjectRequest.Builder req = PutObjectRequest.builder()
                    .bucket(ref.bucket())
                    .key(ref.key());
            if (contentType != null && !contentType.isBlank()) req = req.contentType(contentType);
            if (userMetadata != null && !userMetadata.isEmpty()) req = req.metadata(userMetadata);

            PutObjectResponse resp = s3.putObject(req.build(), RequestBody.fromFile(source));
            return resp.eTag();
        } catch (S3Exception e) {
            throw translate("upload", ref.toString(), e);
        } catch (SdkClientException e) {
            logger.error("S3 upload failed for {}", ref, e);
            throw new S3AccessException("S3 upload failed: " + ref, e);
        }
    }

    @Override
    public Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref) {
        HeadObjectRequest.Builder req = HeadObjectRequest.builder().bucket(ref.bucket()).key(ref.key());
        if (requesterPays) req = req.requestPayer(RequestPayer.REQUESTER);
        try {
            HeadObjectResponse r = s3.headObject(req.build());
            return Optional.of(new S3Models.ObjectMetadata(
                    ref.bucket(),
                    ref.key(),
                    r.contentLength() == null ? 0L : r.contentLength(),
                    r.eTag(),
                    r.contentType(),
                    r.lastModified(),
                    r.metadata() == null ? Map.of() : r.metadata()
            ));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // Some S3-compatible APIs throw generic 404 as S3Exception; treat 404 as not-found.
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw translate("head", ref.toString(), e);
        } catch (SdkClientException e) {
            logger.error("S3 head failed for {}", ref, e);
            throw new S3AccessException("S3 head failed: " + ref, e);
        }
    }

    private static S3AccessException translate(String op, String where, S3Exception e) {
        logger.error("S3 {} failed for {} (status {})", op, where, e.statusCode(), e);
        if (e.statusCode() == 404) {
            return new S3ObjectNotFoundException("S3 " + op + " failed, not found: " + where, e);
        }
        return new S3AccessException("S3 " + op + " failed: " + where, e.statusCode(), e);
    }
}
