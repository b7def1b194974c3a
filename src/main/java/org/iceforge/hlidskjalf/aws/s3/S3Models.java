package org.iceforge.hlidskjalf.aws.s3;

import java.time.Instant;
import java.util.Map;

public final class S3Models {

    private S3Models() {}

    public record ObjectRef(String bucket, String key) {
        /** Last path segment of the key, ignoring a trailing slash. */
        public String baseName() {
            String k = key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
            int slash = k.lastIndexOf('/');
            return slash < 0 ? k : k.substring(slash + 1);
        }

        @Override
        public String toString() {
            return "s3://" + bucket + "/" + key;
        }
    }

    public record ObjectMetadata(
            String bucket,
            String key,
            long contentLength,
            String eTag,
            String contentType,
            Instant lastModified,
            Map<String, String> userMetadata
    ) {}

    public record ListItem(
            String key,
            long size,
            String eTag,
            Instant lastModified
    ) {}
}
