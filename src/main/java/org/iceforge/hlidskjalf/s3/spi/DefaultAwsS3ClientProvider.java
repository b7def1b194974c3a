package org.iceforge.hlidskjalf.s3.spi;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

/** Default provider.
 * <br>
 * Uses the credentials from the context, falling back to standard AWS SDK resolution
 * (environment, profile, EC2/ECS roles, etc).
 */
public final class DefaultAwsS3ClientProvider implements S3ClientProvider {
    static final String DEFAULT_REGION = "eu-central-1";

    @Override public String id() { return "default"; }

    @Override
    public boolean supports(S3ClientContext context) {
        // default provider supports everything unless a more specific one claims it
        return true;
    }

    @Override
    public S3Client s3Client(S3ClientContext ctx) {
        return configure(S3Client.builder(), ctx).build();
    }

    static S3ClientBuilder configure(S3ClientBuilder b, S3ClientContext ctx) {
        b.region(Region.of(ctx.region().orElse(DEFAULT_REGION)))
                .credentialsProvider(ctx.credentials().orElseGet(DefaultCredentialsProvider::create))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(ctx.pathStyleAccess())
                        .build());
        ctx.endpointOverride().ifPresent(b::endpointOverride);
        // public buckets sit in several regions (usgs-landsat and sentinel-cogs in us-west-2)
        if (ctx.crossRegionAccess() && ctx.endpointOverride().isEmpty()) {
            b.crossRegionAccessEnabled(true);
        }
        ctx.apiTimeout().ifPresent(t -> b.overrideConfiguration(ClientOverrideConfiguration.builder()
                .apiCallTimeout(t)
                .build()));
        return b;
    }
}
