package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the ordered candidate list for one request.
 * <p>
 * An explicit override (on the request, or forced per kind in configuration) yields that provider alone.
 * Otherwise the primary candidate comes from the cloud context, then the DEM source preference
 * (DEM kinds only), then the per-kind preference; the remaining supporting providers follow in rank order.
 * Providers missing a required credential are dropped.
 */
@Service
public class SourceSelector {
    private static final Logger log = LoggerFactory.getLogger(SourceSelector.class);

    private final ProviderCapabilityRegistry registry;

    public SourceSelector(ProviderCapabilityRegistry registry) {
        this.registry = registry;
    }

    public List<ProviderDescriptor> selectCandidates(DataRequest request, SelectionConfig config) {
        DataKind kind = request.dataKind();

        Optional<String> override = request.providerOverride().or(() -> config.forcedFor(kind));
        if (override.isPresent()) {
            ProviderDescriptor d = registry.descriptor(override.get());
            if (!d.supports(kind)) {
                throw new NoProviderAvailableException("Provider '" + d.name() + "' does not serve " + kind);
            }
            log.debug("Provider override for {}: {}", kind, d.name());
            return List.of(d);
        }

        List<ProviderDescriptor> supporting = registry.providersFor(kind);
        Optional<ProviderDescriptor> primary = primaryFor(kind, config, supporting);

        List<ProviderDescriptor> ordered = new ArrayList<>(supporting.size());
        primary.ifPresent(ordered::add);
        for (ProviderDescriptor d : supporting) {
            if (!ordered.contains(d)) ordered.add(d);
        }

        List<ProviderDescriptor> eligible = new ArrayList<>(ordered.size());
        for (ProviderDescriptor d : ordered) {
            if (d.credentialRequirement().satisfiedBy(config.credentials())) {
                eligible.add(d);
            } else {
                log.debug("Skipping provider {} for {}: missing credentials {}",
                        d.name(), kind, d.credentialRequirement().keys());
            }
        }
        if (eligible.isEmpty()) {
            throw new NoProviderAvailableException("No provider with valid credentials serves " + kind
                    + " (supporting: " + supporting.stream().map(ProviderDescriptor::name).toList() + ")");
        }
        log.debug("Candidates for {}: {}", kind, eligible.stream().map(ProviderDescriptor::name).toList());
        return List.copyOf(eligible);
    }

    private Optional<ProviderDescriptor> primaryFor(DataKind kind, SelectionConfig config, List<ProviderDescriptor> supporting) {
        List<Optional<String>> preferences = new ArrayList<>(3);
        preferences.add(config.cloudContext());
        if (kind.isDem()) preferences.add(config.demSource());
        preferences.add(config.preferredFor(kind));

        for (Optional<String> name : preferences) {
            if (name.isEmpty()) continue;
            ProviderDescriptor d = registry.descriptor(name.get());
            if (supporting.contains(d)) return Optional.of(d);
        }
        return Optional.empty();
    }
}
