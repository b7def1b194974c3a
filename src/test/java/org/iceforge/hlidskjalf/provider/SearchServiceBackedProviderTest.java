package org.iceforge.hlidskjalf.provider;

import org.iceforge.hlidskjalf.config.GatewayProperties;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.AreaLocator;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.DataRequest;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.RetrievalOptions;
import org.iceforge.hlidskjalf.retrieval.RetrievalModels.TileLocator;
import org.iceforge.hlidskjalf.search.SearchModels.SearchHit;
import org.iceforge.hlidskjalf.search.SearchModels.SearchQuery;
import org.iceforge.hlidskjalf.search.SearchService;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;
import org.iceforge.hlidskjalf.tile.TileId;
import org.iceforge.hlidskjalf.tile.TileResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SearchServiceBackedProviderTest {

    @Mock private SearchService searchService;

    @TempDir Path tmp;

    private SearchServiceBackedProvider provider;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        provider = new SearchServiceBackedProvider(searchService, new TileResolver(), new GatewayProperties());
    }

    @Test
    void areaSearchKeepsOnlyHitsOfTheTile() {
        SearchHit own = new SearchHit("S2A_31TCJ_20200612_0_L2A", "sentinel-2-l2a", Map.of("red", "https://x/B04.tif"));
        SearchHit neighbour = new SearchHit("S2A_31TCK_20200612_0_L2A", "sentinel-2-l2a", Map.of("red", "https://x/B04.tif"));
        when(searchService.search(any())).thenReturn(List.of(own, neighbour));
        when(searchService.download(eq(own), any(), any())).thenReturn(List.of(tmp.resolve("B04.tif")));

        DataRequest request = DataRequest.of(DataKind.SENTINEL2_L2A,
                AreaLocator.ofTile(OpticalGridTile.parse("31TCJ"), LocalDate.of(2020, 6, 1), LocalDate.of(2020, 6, 30)), tmp);
        provider.fetch(request, tmp);

        ArgumentCaptor<SearchQuery> q = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchService).search(q.capture());
        assertEquals("sentinel-2-l2a", q.getValue().collection());
        assertEquals(4, q.getValue().bbox().size());
        verify(searchService).download(eq(own), eq(tmp.resolve(own.id())), any());
        verify(searchService, never()).download(eq(neighbour), any(), any());
    }

    @Test
    void byIdSearchesBaseName() {
        String id = "S1A_IW_GRDH_1SDV_20210708T060105_20210708T060130_038682_04908E_8979";
        SearchHit hit = new SearchHit(id, "sentinel-1-grd", Map.of("vv", "https://x/vv.tif"));
        when(searchService.search(any())).thenReturn(List.of(hit));
        when(searchService.download(any(), any(), any())).thenReturn(List.of(tmp.resolve("vv.tif")));

        provider.fetchById(id + ".SAFE", DataKind.SENTINEL1, RetrievalOptions.DEFAULTS, tmp);

        ArgumentCaptor<SearchQuery> q = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchService).search(q.capture());
        assertEquals(List.of(id), q.getValue().ids());
        assertEquals("sentinel-1-grd", q.getValue().collection());
    }

    @Test
    void noHitsIsObjectNotFound() {
        when(searchService.search(any())).thenReturn(List.of());

        assertThrows(ObjectNotFoundException.class, () -> provider.fetchById(
                "LC08_L2SP_227099_20211017_20211026_02_T2", DataKind.LANDSAT8, RetrievalOptions.DEFAULTS, tmp));
    }

    @Test
    void tileLocatorIsNotSearchable() {
        DataRequest request = DataRequest.of(DataKind.DEM_SRTM_1S, new TileLocator(TileId.parse("N38W001")), tmp);

        assertThrows(InvalidKeyPatternException.class, () -> provider.fetch(request, tmp));
        verifyNoInteractions(searchService);
    }
}
