package org.iceforge.hlidskjalf.provider;

import java.util.Set;

/**
 * Static description of one provider. {@code rank} is the fallback order: lower ranks are tried first.
 */
public record ProviderDescriptor(
        String name,
        Set<DataKind> supportedDataKinds,
        CredentialRequirement credentialRequirement,
        AvailabilityClass availabilityClass,
        int rank
) {
    public ProviderDescriptor {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Provider name is required");
        supportedDataKinds = Set.copyOf(supportedDataKinds);
    }

    public boolean supports(DataKind kind) {
        return supportedDataKinds.contains(kind);
    }
}
