package org.iceforge.hlidskjalf.provider;

import java.util.Set;

/** Credential keys a provider needs before it may be selected. */
public record CredentialRequirement(Set<String> keys) {

    public static final CredentialRequirement NONE = new CredentialRequirement(Set.of());

    public CredentialRequirement {
        keys = Set.copyOf(keys);
    }

    public static CredentialRequirement of(String... keys) {
        return new CredentialRequirement(Set.of(keys));
    }

    public boolean satisfiedBy(CredentialSet credentials) {
        return credentials.hasAll(keys);
    }
}
