package org.iceforge.hlidskjalf.s3.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.*;

/**
 * Builds one {@link S3Client} per bucket family from the registered {@link S3ClientProvider}s.
 * Providers come from Spring and from {@link ServiceLoader}; a Spring bean replaces a
 * ServiceLoader entry with the same id.
 */
public final class S3ClientFactory {
    private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

    /** The client built for one bucket family and the provider that built it. */
    public record FamilyClient(String family, String providerId, S3Client s3) {}

    private final Map<String, S3ClientProvider> byId;

    public S3ClientFactory(Collection<S3ClientProvider> springProviders) {
        this(springProviders, true);
    }

    S3ClientFactory(Collection<S3ClientProvider> springProviders, boolean useServiceLoader) {
        Map<String, S3ClientProvider> m = new TreeMap<>();
        if (useServiceLoader) {
            ServiceLoader.load(S3ClientProvider.class).forEach(p -> m.put(p.id(), p));
        }
        if (springProviders != null) {
            springProviders.forEach(p -> m.put(p.id(), p));
        }
        this.byId = Collections.unmodifiableMap(m);
        log.info("S3 client providers: {}", byId.keySet());
    }

    /**
     * Client for {@code family}. The configured provider id wins; otherwise the first provider by id
     * that supports the family's context.
     *
     * @throws IllegalStateException when the configured provider is unknown or none supports the context
     */
    public FamilyClient clientFor(String family, S3ProviderConfig cfg, Optional<AwsCredentialsProvider> credentials) {
        S3ClientContext ctx = contextFor(family, cfg, credentials);
        S3ClientProvider provider = choose(family, cfg.getProvider(), ctx);
        log.info("{} buckets: S3 client from provider '{}' ({})", family, provider.id(), describe(ctx));
        return new FamilyClient(family, provider.id(), provider.s3Client(ctx));
    }

    private S3ClientProvider choose(String family, String configured, S3ClientContext ctx) {
        if (configured != null && !configured.isBlank()) {
            S3ClientProvider p = byId.get(configured);
            if (p == null) {
                throw new IllegalStateException("S3 provider '" + configured + "' configured for " + family
                        + " is not registered. Registered: " + byId.keySet());
            }
            return p;
        }
        // byId is sorted, so the first supporting provider is the lowest id
        return byId.values().stream()
                .filter(p -> p.supports(ctx))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No S3 provider supports " + family
                        + " (" + describe(ctx) + "). Registered: " + byId.keySet()));
    }

    static S3ClientContext contextFor(String family, S3ProviderConfig cfg, Optional<AwsCredentialsProvider> credentials) {
        Map<String, String> tags = new HashMap<>();
        if (cfg.getTags() != null) tags.putAll(cfg.getTags());
        tags.put(S3ClientContext.FAMILY_TAG, family);
        return new S3ClientContext(
                Optional.ofNullable(cfg.getRegion()).filter(r -> !r.isBlank()),
                Optional.ofNullable(cfg.getEndpointOverride()),
                cfg.isPathStyleAccess(),
                Map.copyOf(tags),
                Optional.ofNullable(cfg.getApiTimeout()),
                credentials == null ? Optional.empty() : credentials,
                cfg.isCrossRegionAccess());
    }

    // never includes credential values
    private static String describe(S3ClientContext ctx) {
        return "region=" + ctx.region().orElse("<default>")
                + ", endpoint=" + ctx.endpointOverride().map(Object::toString).orElse("<aws>")
                + ", pathStyle=" + ctx.pathStyleAccess()
                + ", crossRegion=" + ctx.crossRegionAccess()
                + ", credentials=" + (ctx.credentials().isPresent() ? "static" : "default chain");
    }
}
