package org.iceforge.hlidskjalf.s3.spi;

import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

class DefaultAwsS3ClientProviderTest {

    private static S3ClientContext ctx(URI endpoint, boolean crossRegion) {
        return new S3ClientContext(Optional.of("eu-central-1"), Optional.ofNullable(endpoint), false,
                Map.of(), Optional.empty(), Optional.empty(), crossRegion);
    }

    @Test
    void awsClientFollowsBucketsIntoOtherRegions() {
        S3ClientBuilder b = mock(S3ClientBuilder.class, RETURNS_SELF);

        DefaultAwsS3ClientProvider.configure(b, ctx(null, true));

        verify(b).region(Region.EU_CENTRAL_1);
        verify(b).crossRegionAccessEnabled(true);
        verify(b, never()).endpointOverride(any());
    }

    @Test
    void customEndpointKeepsItsRegion() {
        S3ClientBuilder b = mock(S3ClientBuilder.class, RETURNS_SELF);

        DefaultAwsS3ClientProvider.configure(b, ctx(URI.create("http://localhost:9000"), true));

        verify(b).endpointOverride(URI.create("http://localhost:9000"));
        verify(b, never()).crossRegionAccessEnabled(anyBoolean());
    }

    @Test
    void crossRegionAccessIsOptIn() {
        S3ClientBuilder b = mock(S3ClientBuilder.class, RETURNS_SELF);

        DefaultAwsS3ClientProvider.configure(b, ctx(null, false));

        verify(b, never()).crossRegionAccessEnabled(anyBoolean());
    }

    @Test
    void publicAwsBucketsEnableCrossRegionByDefault() {
        GatewayProperties props = new GatewayProperties();

        assertTrue(props.getAws().getS3().isCrossRegionAccess());
        assertFalse(props.getCreodias().getS3().isCrossRegionAccess());
        assertTrue(S3ClientFactory.contextFor("aws", props.getAws().getS3(), Optional.empty()).crossRegionAccess());
    }
}
