package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;

import java.nio.file.Path;
import java.util.List;

/**
 * Retrieval capability of one provider.
 * <p>
 * Implementations write into {@code targetDir}, an existing empty directory owned by the caller,
 * and report failures with {@link ProviderException} subclasses. They never retry internally.
 */
public interface EoProvider {

    /** Registry name of this provider. */
    String name();

    List<Path> fetch(DataRequest request, Path targetDir);

    List<Path> fetchById(String productId, DataKind kind, RetrievalOptions options, Path targetDir);
}
