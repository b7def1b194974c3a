package org.iceforge.hlidskjalf.tile;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DemTileTest {

    @Test
    void parsesHemispheres() {
        DemTile t = DemTile.parse("S05W071");

        assertEquals(-5, t.latitude());
        assertEquals(-71, t.longitude());
        assertEquals("S05W071", t.id());
    }

    @Test
    void formatsWithSourceSuffix() {
        DemTile t = new DemTile(38, -1);

        assertEquals("N38W001", t.format(false));
        assertEquals("N38W001.SRTMGL1.hgt.zip", t.format(true));
        assertEquals("N38", t.latitudePart());
        assertEquals("W001", t.longitudePart());
    }

    @Test
    void cgiarIds() {
        assertEquals("srtm_37_04", new DemTile(43, 0).cgiarSrtmId());
        assertEquals("srtm_37_04", new DemTile(44, 1).cgiarSrtmId());
        assertEquals("srtm_36_05", new DemTile(38, -1).cgiarSrtmId());
        assertEquals("srtm_39_00", new DemTile(61, 14).cgiarSrtmId());
    }

    @Test
    void tileIdParseDispatchesOnShape() {
        assertInstanceOf(DemTile.class, TileId.parse("N44E001"));
        assertInstanceOf(OpticalGridTile.class, TileId.parse("31TCJ"));
        // "N" followed by a letter is not a DEM id
        assertThrows(InvalidTileIdException.class, () -> TileId.parse("NXYZ"));
    }

    @Test
    void rejectsMalformed() {
        assertThrows(InvalidTileIdException.class, () -> DemTile.parse("N38W1"));
        assertThrows(InvalidTileIdException.class, () -> DemTile.parse("N91E000"));
        assertThrows(InvalidTileIdException.class, () -> DemTile.parse("N10E181"));
    }
}
