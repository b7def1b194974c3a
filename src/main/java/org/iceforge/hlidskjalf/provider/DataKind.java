package org.iceforge.hlidskjalf.provider;

import java.util.Arrays;
import java.util.Locale;

public enum DataKind {
    SENTINEL1("s1"),
    SENTINEL2_L1C("s2l1c"),
    SENTINEL2_L2A("s2l2a"),
    LANDSAT8("l8"),
    DEM_SRTM_1S("srtm1s"),
    DEM_SRTM_3S("srtm3s"),
    DEM_COP_1S("copdem1s"),
    DEM_COP_3S("copdem3s");

    private final String token;

    DataKind(String token) {
        this.token = token;
    }

    /** Short lowercase name used in output directory names and on the command line. */
    public String token() {
        return token;
    }

    public boolean isDem() {
        return this == DEM_SRTM_1S || this == DEM_SRTM_3S || this == DEM_COP_1S || this == DEM_COP_3S;
    }

    public boolean isSentinel2() {
        return this == SENTINEL2_L1C || this == SENTINEL2_L2A;
    }

    /** Accepts either the token ("s2l2a") or the constant name ("SENTINEL2_L2A"). */
    public static DataKind fromToken(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Data kind is required");
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(k -> k.token.equalsIgnoreCase(v) || k.name().equalsIgnoreCase(v.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown data kind '" + value + "', expected one of "
                        + Arrays.stream(values()).map(DataKind::token).toList()));
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
