package org.iceforge.hlidskjalf.search;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

/**
 * Federated search-and-download service. Implementations report failures with the provider
 * exceptions ({@code ObjectNotFoundException}, {@code ProviderUnavailableException}).
 */
public interface SearchService {

    List<SearchModels.SearchHit> search(SearchModels.SearchQuery query);

    /**
     * Downloads the assets of {@code hit} whose key or file name passes {@code assetFilter} into
     * {@code destDir}. Returns the written files.
     */
    List<Path> download(SearchModels.SearchHit hit, Path destDir, Predicate<String> assetFilter);
}
