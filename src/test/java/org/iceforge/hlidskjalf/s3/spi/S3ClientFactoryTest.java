package org.iceforge.hlidskjalf.s3.spi;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class S3ClientFactoryTest {

    S3ClientProvider minio;
    S3ClientProvider aws;
    S3ClientFactory factory;

    @BeforeEach
    void setUp() {
        minio = provider("minio", true);
        aws = provider("aws", true);
        factory = new S3ClientFactory(List.of(minio, aws), false);
    }

    private static S3ClientProvider provider(String id, boolean supports) {
        S3ClientProvider p = mock(S3ClientProvider.class);
        when(p.id()).thenReturn(id);
        when(p.supports(any())).thenReturn(supports);
        when(p.s3Client(any())).thenReturn(mock(S3Client.class));
        return p;
    }

    @Test
    void configuredProviderWinsOverOrdering() {
        S3ProviderConfig cfg = new S3ProviderConfig("us-east-1", URI.create("http://localhost:9000"), true);
        cfg.setProvider("minio");

        S3ClientFactory.FamilyClient client = factory.clientFor("ewoc", cfg, Optional.empty());

        assertEquals("minio", client.providerId());
        assertEquals("ewoc", client.family());
        verify(aws, never()).s3Client(any());
    }

    @Test
    void lowestSupportingIdIsChosen() {
        S3ClientFactory.FamilyClient client = factory.clientFor("aws", new S3ProviderConfig(), Optional.empty());

        assertEquals("aws", client.providerId());
        verify(minio, never()).s3Client(any());
    }

    @Test
    void contextCarriesFamilyRegionAndCredentials() {
        S3ProviderConfig cfg = new S3ProviderConfig("eu-central-1", null, false);
        factory.clientFor("ewoc", cfg, Optional.of(AnonymousCredentialsProvider.create()));

        ArgumentCaptor<S3ClientContext> ctx = ArgumentCaptor.forClass(S3ClientContext.class);
        verify(aws).s3Client(ctx.capture());
        assertEquals("ewoc", ctx.getValue().tags().get(S3ClientContext.FAMILY_TAG));
        assertEquals(Optional.of("eu-central-1"), ctx.getValue().region());
        assertTrue(ctx.getValue().credentials().isPresent());
    }

    @Test
    void blankRegionMeansSdkDefault() {
        S3ClientContext ctx = S3ClientFactory.contextFor("creodias", new S3ProviderConfig(" ", null, true), null);

        assertTrue(ctx.region().isEmpty());
        assertTrue(ctx.credentials().isEmpty());
        assertTrue(ctx.pathStyleAccess());
    }

    @Test
    void unregisteredConfiguredProviderFails() {
        S3ProviderConfig cfg = new S3ProviderConfig();
        cfg.setProvider("wasabi");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> factory.clientFor("aws", cfg, Optional.empty()));
        assertTrue(ex.getMessage().contains("wasabi"));
    }

    @Test
    void failsWhenNoProviderSupportsFamily() {
        S3ClientFactory picky = new S3ClientFactory(List.of(provider("picky", false)), false);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> picky.clientFor("aws", new S3ProviderConfig(), Optional.empty()));
        assertTrue(ex.getMessage().startsWith("No S3 provider supports aws"));
    }

    @Test
    void cloudferroEndpointGoesToCloudferroProvider() {
        S3ClientFactory real = new S3ClientFactory(
                List.of(new DefaultAwsS3ClientProvider(), new CloudferroS3ClientProvider()), false);
        S3ProviderConfig cfg = new S3ProviderConfig(null, URI.create("http://data.cloudferro.com"), true);

        S3ClientFactory.FamilyClient client = real.clientFor("creodias", cfg, Optional.empty());

        assertEquals("cloudferro", client.providerId());
        assertNotNull(client.s3());
        client.s3().close();
    }
}
