package org.iceforge.hlidskjalf.s3.spi;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CloudferroS3ClientProviderTest {

    private static S3ClientContext ctx(String endpoint) {
        return new S3ClientContext(Optional.empty(), Optional.ofNullable(endpoint).map(URI::create), true,
                Map.of(), Optional.of(Duration.ofSeconds(30)), Optional.empty(), false);
    }

    @Test
    void supportsOnlyCloudferroHosts() {
        CloudferroS3ClientProvider provider = new CloudferroS3ClientProvider();

        assertTrue(provider.supports(ctx("http://data.cloudferro.com")));
        assertTrue(provider.supports(ctx("https://s3.waw2-1.cloudferro.com")));
        assertFalse(provider.supports(ctx("http://localhost:9000")));
        assertFalse(provider.supports(ctx(null)));
    }

    @Test
    void buildsAnonymousClient() {
        try (S3Client client = new CloudferroS3ClientProvider().s3Client(ctx("http://data.cloudferro.com"))) {
            assertNotNull(client);
        }
    }

    @Test
    void defaultProviderSupportsEverything() {
        DefaultAwsS3ClientProvider provider = new DefaultAwsS3ClientProvider();

        assertEquals("default", provider.id());
        assertTrue(provider.supports(ctx(null)));
    }
}
