package org.iceforge.hlidskjalf.aws.s3;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public interface S3AccessLayer {

    // List: lazy, pages are fetched as the stream is consumed. Caller closes.
    Stream<S3Models.ListItem> list(String bucket, String prefix);

    // Download to a local file, replacing it. Throws S3ObjectNotFoundException when absent.
    void download(S3Models.ObjectRef ref, Path target);

    // Upload a local file
    String uploadFile(S3Models.ObjectRef ref, Path source, String contentType, Map<String, String> userMetadata);

    // Metadata / existence
    Optional<S3Models.ObjectMetadata> head(S3Models.ObjectRef ref);

    default boolean exists(S3Models.ObjectRef ref) {
        return head(ref).isPresent();
    }
}
