package org.iceforge.hlidskjalf.search;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SearchModels {
    private SearchModels() {}

    /**
     * @param bbox [minLon, minLat, maxLon, maxLat], empty when searching by id only
     */
    public record SearchQuery(
            String collection,
            List<Double> bbox,
            Optional<LocalDate> start,
            Optional<LocalDate> end,
            List<String> ids,
            int limit
    ) {
        public SearchQuery {
            bbox = bbox == null ? List.of() : List.copyOf(bbox);
            ids = ids == null ? List.of() : List.copyOf(ids);
            start = start == null ? Optional.empty() : start;
            end = end == null ? Optional.empty() : end;
        }

        public static SearchQuery byId(String collection, String id) {
            return new SearchQuery(collection, List.of(), Optional.empty(), Optional.empty(), List.of(id), 1);
        }

        public static SearchQuery byArea(String collection, double[] bbox, LocalDate start, LocalDate end, int limit) {
            return new SearchQuery(collection, List.of(bbox[0], bbox[1], bbox[2], bbox[3]),
                    Optional.of(start), Optional.of(end), List.of(), limit);
        }
    }

    /** One search result; {@code assets} maps asset key to download href. */
    public record SearchHit(String id, String collection, Map<String, String> assets) {
        public SearchHit {
            assets = assets == null ? Map.of() : Map.copyOf(assets);
        }
    }
}
