package org.iceforge.hlidskjalf.tile;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A 1x1 degree elevation cell identified by its lower-left corner, e.g. "N38W001" for the
 * cell spanning 38..39N and 1..0W.
 */
public record DemTile(int latitude, int longitude) implements TileId {

    /** Archive suffix of the SRTM 1 arc-second distribution files. */
    public static final String SOURCE_SUFFIX = ".SRTMGL1.hgt.zip";

    private static final Pattern GRAMMAR = Pattern.compile("^([NS])(\\d{2})([EW])(\\d{3})$");

    public DemTile {
        if (Math.abs(latitude) > 90) {
            throw new InvalidTileIdException("DEM tile latitude out of range: " + latitude);
        }
        if (Math.abs(longitude) > 180) {
            throw new InvalidTileIdException("DEM tile longitude out of range: " + longitude);
        }
    }

    public static DemTile parse(String value) {
        if (value == null) {
            throw new InvalidTileIdException("DEM tile ID is null");
        }
        Matcher m = GRAMMAR.matcher(value.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new InvalidTileIdException("DEM tile ID " + value + " is not valid!");
        }
        int lat = Integer.parseInt(m.group(2));
        int lon = Integer.parseInt(m.group(4));
        if (lat > 90 || lon > 180) {
            throw new InvalidTileIdException("DEM tile ID " + value + " has an out of range magnitude");
        }
        return new DemTile("S".equals(m.group(1)) ? -lat : lat, "W".equals(m.group(3)) ? -lon : lon);
    }

    static boolean looksLikeDemTile(String value) {
        String s = value.trim().toUpperCase(Locale.ROOT);
        return !s.isEmpty() && (s.charAt(0) == 'N' || s.charAt(0) == 'S') && s.length() > 1
                && Character.isDigit(s.charAt(1));
    }

    @Override
    public String id() {
        return format(false);
    }

    public String format(boolean withSuffix) {
        String id = String.format(Locale.ROOT, "%s%02d%s%03d",
                latitude >= 0 ? "N" : "S", Math.abs(latitude),
                longitude >= 0 ? "E" : "W", Math.abs(longitude));
        return withSuffix ? id + SOURCE_SUFFIX : id;
    }

    /** Hemisphere/latitude part, e.g. "N38". */
    public String latitudePart() {
        return id().substring(0, 3);
    }

    /** Hemisphere/longitude part, e.g. "W001". */
    public String longitudePart() {
        return id().substring(3);
    }

    /**
     * Identifier of the CGIAR 5x5 degree SRTM 3 arc-second tile holding this cell, e.g. "srtm_36_05".
     * Rows count southwards from 60N, so cells above 60N land in row 00.
     */
    public String cgiarSrtmId() {
        int column = Math.floorDiv(longitude + 180, 5) + 1;
        int row = Math.floorDiv(59 - latitude, 5) + 1;
        return String.format(Locale.ROOT, "srtm_%02d_%02d", column, row);
    }

    @Override
    public String toString() {
        return id();
    }
}
