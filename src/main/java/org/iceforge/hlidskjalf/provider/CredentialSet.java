package org.iceforge.hlidskjalf.provider;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Opaque credential bag resolved once from the environment and configuration.
 * Values are never logged; {@link #toString()} only lists the key names.
 */
public final class CredentialSet {

    public static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String EWOC_ACCESS_KEY_ID = "EWOC_S3_ACCESS_KEY_ID";
    public static final String EWOC_SECRET_ACCESS_KEY = "EWOC_S3_SECRET_ACCESS_KEY";
    public static final String SEARCH_TOKEN = "EO_SEARCH_TOKEN";

    public static final Set<String> KNOWN_KEYS = Set.of(
            AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY, EWOC_ACCESS_KEY_ID, EWOC_SECRET_ACCESS_KEY, SEARCH_TOKEN);

    private static final CredentialSet EMPTY = new CredentialSet(Map.of());

    private final Map<String, String> values;

    private CredentialSet(Map<String, String> values) {
        this.values = Map.copyOf(values);
    }

    public static CredentialSet empty() {
        return EMPTY;
    }

    public static CredentialSet of(Map<String, String> values) {
        Map<String, String> clean = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null && !v.isBlank()) clean.put(k, v);
        });
        return new CredentialSet(clean);
    }

    /**
     * Picks the known credential keys out of the process environment, then lets explicitly
     * configured values win.
     */
    public static CredentialSet fromEnvironment(Map<String, String> env, Map<String, String> configured) {
        Map<String, String> merged = new LinkedHashMap<>();
        for (String key : KNOWN_KEYS) {
            String v = env.get(key);
            if (v != null && !v.isBlank()) merged.put(key, v);
        }
        if (configured != null) {
            configured.forEach((k, v) -> {
                if (v != null && !v.isBlank()) merged.put(k, v);
            });
        }
        return new CredentialSet(merged);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public boolean hasAll(Collection<String> keys) {
        return values.keySet().containsAll(keys);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public String toString() {
        return "CredentialSet" + values.keySet();
    }
}
