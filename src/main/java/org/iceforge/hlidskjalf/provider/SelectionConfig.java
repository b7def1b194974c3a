package org.iceforge.hlidskjalf.provider;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-wide inputs to candidate selection, passed explicitly rather than read from the environment.
 *
 * @param cloudContext deployment context ("aws", "creodias"); names a provider that becomes primary when it can serve the kind
 * @param forced       per-kind forced provider, no fallback
 * @param preferred    per-kind primary provider
 * @param demSource    preferred provider for DEM kinds
 * @param credentials  credentials available to this process
 */
public record SelectionConfig(
        Optional<String> cloudContext,
        Map<DataKind, String> forced,
        Map<DataKind, String> preferred,
        Optional<String> demSource,
        CredentialSet credentials
) {
    public SelectionConfig {
        cloudContext = cloudContext == null ? Optional.empty() : cloudContext.filter(s -> !s.isBlank());
        demSource = demSource == null ? Optional.empty() : demSource.filter(s -> !s.isBlank());
        forced = copy(forced);
        preferred = copy(preferred);
        credentials = credentials == null ? CredentialSet.empty() : credentials;
    }

    public static SelectionConfig defaults(CredentialSet credentials) {
        return new SelectionConfig(Optional.empty(), Map.of(), Map.of(), Optional.empty(), credentials);
    }

    public Optional<String> forcedFor(DataKind kind) {
        return Optional.ofNullable(forced.get(kind)).filter(s -> !s.isBlank());
    }

    public Optional<String> preferredFor(DataKind kind) {
        return Optional.ofNullable(preferred.get(kind)).filter(s -> !s.isBlank());
    }

    /** Every provider name this configuration mentions. */
    public List<String> referencedProviders() {
        List<String> out = new ArrayList<>();
        cloudContext.ifPresent(out::add);
        demSource.ifPresent(out::add);
        out.addAll(forced.values());
        out.addAll(preferred.values());
        return out;
    }

    private static Map<DataKind, String> copy(Map<DataKind, String> in) {
        if (in == null || in.isEmpty()) return Map.of();
        return Map.copyOf(new EnumMap<>(in));
    }
}
