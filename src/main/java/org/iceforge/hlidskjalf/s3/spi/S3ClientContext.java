package org.iceforge.hlidskjalf.s3.spi;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * What a client provider needs to know about one bucket family.
 * <br>
 * {@code tags} carry non-secret selectors (e.g. "family"="ewoc"); credentials travel separately and are never logged.
 */
public record S3ClientContext(
        Optional<String> region,
        Optional<URI> endpointOverride,
        boolean pathStyleAccess,
        Map<String, String> tags,
        Optional<Duration> apiTimeout,
        Optional<AwsCredentialsProvider> credentials,
        boolean crossRegionAccess
) {
    public static final String FAMILY_TAG = "family";

    public boolean endpointHostEndsWith(String suffix) {
        return endpointOverride.map(URI::getHost).map(h -> h.endsWith(suffix)).orElse(false);
    }
}
