package org.iceforge.hlidskjalf.s3.spi;

import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.time.Duration;

/**
 * Clients for CloudFerro-hosted object stores (the CREODIAS DIAS bucket, EWoC buckets deployed on CREODIAS).
 * These speak S3 with path-style addressing and ignore the region, and the DIAS bucket is read anonymously.
 */
public final class CloudferroS3ClientProvider implements S3ClientProvider {
    static final String HOST_SUFFIX = "cloudferro.com";

    @Override
    public String id() {
        return "cloudferro";
    }

    @Override
    public boolean supports(S3ClientContext context) {
        return context.endpointHostEndsWith(HOST_SUFFIX);
    }

    @Override
    public S3Client s3Client(S3ClientContext ctx) {
        var b = S3Client.builder()
                .region(Region.US_EAST_1)
                .credentialsProvider(ctx.credentials().orElseGet(AnonymousCredentialsProvider::create))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .chunkedEncodingEnabled(false)
                        .build())
                .httpClientBuilder(ApacheHttpClient.builder()
                        .connectionTimeout(Duration.ofSeconds(10))
                        .maxConnections(16));
        ctx.endpointOverride().ifPresent(b::endpointOverride);
        ctx.apiTimeout().ifPresent(t -> b.overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(t)
                .build()));
        return b.build();
    }
}
