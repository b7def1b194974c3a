package org.iceforge.hlidskjalf.tile;

/**
 * A grid cell identifier: either a Sentinel-2 (MGRS) tile or a 1x1 degree DEM cell.
 */
public interface TileId {

    /** Canonical identifier, e.g. "31TCJ" or "N38W001". */
    String id();

    /**
     * Parses either form. DEM cells start with a hemisphere letter followed by digits,
     * everything else is treated as a grid tile.
     */
    static TileId parse(String value) {
        if (value != null && DemTile.looksLikeDemTile(value)) {
            return DemTile.parse(value);
        }
        return OpticalGridTile.parse(value);
    }
}
