package org.iceforge.hlidskjalf.provider;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.iceforge.hlidskjalf.provider.DataKind.*;

/**
 * Read-only table of providers and what they can serve. Built once at startup; safe for concurrent reads.
 */
public final class ProviderCapabilityRegistry {

    private final Map<String, ProviderDescriptor> byName;

    public ProviderCapabilityRegistry(List<ProviderDescriptor> descriptors) {
        Map<String, ProviderDescriptor> m = new LinkedHashMap<>();
        descriptors.stream()
                .sorted(Comparator.comparingInt(ProviderDescriptor::rank).thenComparing(ProviderDescriptor::name))
                .forEach(d -> {
                    if (m.putIfAbsent(d.name(), d) != null) {
                        throw new IllegalArgumentException("Duplicate provider name: " + d.name());
                    }
                });
        this.byName = Collections.unmodifiableMap(m);
    }

    /**
     * The providers this gateway ships with. Dedicated buckets first, the DIAS bucket after them,
     * the federated search service last.
     */
    public static ProviderCapabilityRegistry standard() {
        return new ProviderCapabilityRegistry(List.of(
                new ProviderDescriptor(ProviderNames.EWOC,
                        EnumSet.of(DEM_SRTM_3S),
                        CredentialRequirement.of(CredentialSet.EWOC_ACCESS_KEY_ID, CredentialSet.EWOC_SECRET_ACCESS_KEY),
                        AvailabilityClass.ALWAYS_ON, 0),
                new ProviderDescriptor(ProviderNames.AWS,
                        EnumSet.of(SENTINEL1, SENTINEL2_L1C, SENTINEL2_L2A, LANDSAT8, DEM_COP_1S, DEM_COP_3S),
                        CredentialRequirement.of(CredentialSet.AWS_ACCESS_KEY_ID, CredentialSet.AWS_SECRET_ACCESS_KEY),
                        AvailabilityClass.ALWAYS_ON, 1),
                new ProviderDescriptor(ProviderNames.ESA,
                        EnumSet.of(DEM_SRTM_1S),
                        CredentialRequirement.NONE,
                        AvailabilityClass.ALWAYS_ON, 2),
                new ProviderDescriptor(ProviderNames.CREODIAS,
                        EnumSet.of(SENTINEL1, SENTINEL2_L1C, SENTINEL2_L2A, DEM_SRTM_1S),
                        CredentialRequirement.NONE,
                        AvailabilityClass.REGION_RESTRICTED, 3),
                new ProviderDescriptor(ProviderNames.SEARCH,
                        EnumSet.of(SENTINEL1, SENTINEL2_L1C, SENTINEL2_L2A, LANDSAT8),
                        CredentialRequirement.of(CredentialSet.SEARCH_TOKEN),
                        AvailabilityClass.ROLLING_ARCHIVE, 4)
        ));
    }

    /** Providers declaring support for the kind, in rank order. */
    public List<ProviderDescriptor> providersFor(DataKind kind) {
        return byName.values().stream().filter(d -> d.supports(kind)).toList();
    }

    public CredentialRequirement requiredCredentials(String provider) {
        return descriptor(provider).credentialRequirement();
    }

    public ProviderDescriptor descriptor(String provider) {
        ProviderDescriptor d = provider == null ? null : byName.get(provider.trim().toLowerCase(Locale.ROOT));
        if (d == null) {
            throw new UnknownProviderException("Unknown provider '" + provider + "'. Known providers: " + byName.keySet());
        }
        return d;
    }

    public boolean isKnown(String provider) {
        return provider != null && byName.containsKey(provider.trim().toLowerCase(Locale.ROOT));
    }

    public List<ProviderDescriptor> all() {
        return List.copyOf(byName.values());
    }

    /** Fails with {@link UnknownProviderException} on the first name that is not registered. */
    public void requireKnown(Iterable<String> names) {
        for (String n : names) {
            if (n != null && !n.isBlank()) descriptor(n);
        }
    }
}
