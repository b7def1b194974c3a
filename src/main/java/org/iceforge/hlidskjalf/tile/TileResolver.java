package org.iceforge.hlidskjalf.tile;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps Sentinel-2 grid tiles to their footprint and footprints to the DEM cells covering them.
 * Stateless and pure; safe to share between threads.
 */
@Component
public class TileResolver {

    /** Sentinel-2 tiles are 109.8 km wide, anchored 20 m above the north edge of their MGRS square. */
    static final double TILE_SIZE_M = 109_800d;
    static final double TILE_TOP_OFFSET_M = 100_020d;

    private static final int SAMPLES_PER_EDGE = 8;

    public Footprint resolveFootprint(OpticalGridTile tile) {
        double west = tile.squareMinEasting();
        double east = west + TILE_SIZE_M;
        double north = tile.squareMinNorthing() + TILE_TOP_OFFSET_M;
        double south = north - TILE_SIZE_M;

        // Edges are sampled because they bow in geographic space.
        List<GeoPoint> outline = new ArrayList<>(4 * SAMPLES_PER_EDGE);
        for (int i = 0; i < SAMPLES_PER_EDGE; i++) {
            double t = (double) i / SAMPLES_PER_EDGE;
            outline.add(project(tile, west + t * TILE_SIZE_M, south));
        }
        for (int i = 0; i < SAMPLES_PER_EDGE; i++) {
            double t = (double) i / SAMPLES_PER_EDGE;
            outline.add(project(tile, east, south + t * TILE_SIZE_M));
        }
        for (int i = 0; i < SAMPLES_PER_EDGE; i++) {
            double t = (double) i / SAMPLES_PER_EDGE;
            outline.add(project(tile, east - t * TILE_SIZE_M, north));
        }
        for (int i = 0; i < SAMPLES_PER_EDGE; i++) {
            double t = (double) i / SAMPLES_PER_EDGE;
            outline.add(project(tile, west, north - t * TILE_SIZE_M));
        }
        return Footprint.of(outline);
    }

    /**
     * Every 1x1 degree cell intersecting the footprint, cells touched only along an edge or at a
     * corner included. Rows are clamped to the poles, columns wrap across the antimeridian.
     */
    public Set<DemTile> coveringDemTiles(Footprint footprint) {
        if (footprint == null || footprint.degenerate()) {
            throw new EmptyFootprintException("Footprint has zero area: " + footprint);
        }
        int firstRow = Math.max(-90, (int) Math.ceil(footprint.minLatitude()) - 1);
        int lastRow = Math.min(89, (int) Math.floor(footprint.maxLatitude()));
        int firstCol = (int) Math.ceil(footprint.minLongitude()) - 1;
        int lastCol = (int) Math.floor(footprint.maxLongitude());

        Set<DemTile> cells = new LinkedHashSet<>();
        for (int lat = lastRow; lat >= firstRow; lat--) {
            for (int lon = lastCol; lon >= firstCol; lon--) {
                cells.add(new DemTile(lat, wrapLongitude(lon)));
            }
        }
        return cells;
    }

    public Set<DemTile> coveringDemTiles(OpticalGridTile tile) {
        return coveringDemTiles(resolveFootprint(tile));
    }

    public String formatDemTile(DemTile tile, boolean withSuffix) {
        return tile.format(withSuffix);
    }

    /** Semicolon-joined identifiers, the form printed by the dem-ids command. */
    public String joinDemTiles(Collection<DemTile> tiles, boolean withSuffix) {
        return tiles.stream().map(t -> t.format(withSuffix)).collect(Collectors.joining(";"));
    }

    /** CGIAR 5x5 degree SRTM 3s tiles covering the given cells, in first-seen order. */
    public Set<String> cgiarSrtmTiles(Collection<DemTile> tiles) {
        Set<String> out = new LinkedHashSet<>();
        for (DemTile t : tiles) {
            out.add(t.cgiarSrtmId());
        }
        return out;
    }

    private static GeoPoint project(OpticalGridTile tile, double easting, double northing) {
        return UtmProjection.toGeographic(tile.zone(), tile.northern(), easting, northing);
    }

    private static int wrapLongitude(int lon) {
        return Math.floorMod(lon + 180, 360) - 180;
    }
}
