package org.iceforge.hlidskjalf.tile;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentinel-2 tile identifier: UTM zone, latitude band and 100 km MGRS square, e.g. "31TCJ".
 * <p>
 * The zone may be written with one or two digits ("5QKB" and "05QKB" are the same tile);
 * {@link #id()} always renders two.
 */
public record OpticalGridTile(int zone, char band, char column, char row) implements TileId {

    static final String BANDS = "CDEFGHJKLMNPQRSTUVWX";
    static final String ROW_LETTERS = "ABCDEFGHJKLMNPQRSTUV";
    private static final String[] COLUMN_SETS = {"ABCDEFGH", "JKLMNPQR", "STUVWXYZ"};

    private static final Pattern GRAMMAR = Pattern.compile("^(\\d{1,2})([A-Z])([A-Z])([A-Z])$");

    public OpticalGridTile {
        if (zone < 1 || zone > 60) {
            throw new InvalidTileIdException("UTM zone out of range [1, 60]: " + zone);
        }
        if (BANDS.indexOf(band) < 0) {
            throw new InvalidTileIdException("Invalid latitude band '" + band + "'");
        }
        if (columnLetters(zone).indexOf(column) < 0) {
            throw new InvalidTileIdException("Column letter '" + column + "' is not used in zone " + zone);
        }
        if (ROW_LETTERS.indexOf(row) < 0) {
            throw new InvalidTileIdException("Invalid row letter '" + row + "'");
        }
    }

    public static OpticalGridTile parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTileIdException("Tile ID is blank");
        }
        String s = value.trim().toUpperCase(Locale.ROOT);
        Matcher m = GRAMMAR.matcher(s);
        if (!m.matches()) {
            throw new InvalidTileIdException("Tile ID " + value + " is not valid!");
        }
        return new OpticalGridTile(Integer.parseInt(m.group(1)), m.group(2).charAt(0),
                m.group(3).charAt(0), m.group(4).charAt(0));
    }

    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (InvalidTileIdException e) {
            return false;
        }
    }

    @Override
    public String id() {
        return String.format(Locale.ROOT, "%02d%c%c%c", zone, band, column, row);
    }

    public boolean northern() {
        return band >= 'N';
    }

    /** Zone digits as used in bucket paths ("5" for zone 05). */
    public String zonePathComponent() {
        return Integer.toString(zone);
    }

    /** The two-letter 100 km square, e.g. "CJ". */
    public String square() {
        return "" + column + row;
    }

    /** Easting of the west edge of the 100 km square, in metres. */
    double squareMinEasting() {
        return (columnLetters(zone).indexOf(column) + 1) * 100_000d;
    }

    /**
     * Northing of the south edge of the 100 km square, in metres (false northing included
     * in the southern hemisphere). Row letters repeat every 2000 km, the latitude band picks the cycle.
     */
    double squareMinNorthing() {
        int rowIndex = ROW_LETTERS.indexOf(row);
        if (zone % 2 == 0) {
            rowIndex = Math.floorMod(rowIndex - 5, ROW_LETTERS.length());
        }
        double northing = rowIndex * 100_000d;
        double bandMin = BandTable.minNorthing(band);
        while (northing < bandMin) {
            northing += 2_000_000d;
        }
        return northing;
    }

    @Override
    public String toString() {
        return id();
    }

    private static String columnLetters(int zone) {
        return COLUMN_SETS[(zone - 1) % 3];
    }

    /** Lowest northing reached by each latitude band, rounded down to 100 km. */
    private static final class BandTable {
        private static final double[] MIN_NORTHING = {
                1_100_000, 2_000_000, 2_800_000, 3_700_000, 4_600_000, 5_500_000, 6_400_000, 7_300_000,
                8_200_000, 9_100_000, 0, 800_000, 1_700_000, 2_600_000, 3_500_000, 4_400_000,
                5_300_000, 6_200_000, 7_000_000, 7_900_000
        };

        static double minNorthing(char band) {
            return MIN_NORTHING[BANDS.indexOf(band)];
        }
    }
}
