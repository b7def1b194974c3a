package org.iceforge.hlidskjalf.tile;

/**
 * Inverse transverse Mercator on WGS84 for UTM coordinates (USGS series expansion, Snyder 1987).
 * Accurate to well under a metre inside a zone, which is far below what DEM cell selection needs.
 */
final class UtmProjection {

    private static final double A = 6_378_137.0;
    private static final double F = 1 / 298.257223563;
    private static final double K0 = 0.9996;
    private static final double FALSE_EASTING = 500_000.0;
    private static final double FALSE_NORTHING_SOUTH = 10_000_000.0;

    private static final double E2 = F * (2 - F);
    private static final double EP2 = E2 / (1 - E2);
    private static final double E1 = (1 - Math.sqrt(1 - E2)) / (1 + Math.sqrt(1 - E2));

    private UtmProjection() {}

    static double centralMeridian(int zone) {
        return zone * 6.0 - 183.0;
    }

    static GeoPoint toGeographic(int zone, boolean northern, double easting, double northing) {
        double x = easting - FALSE_EASTING;
        double y = northern ? northing : northing - FALSE_NORTHING_SOUTH;

        double m = y / K0;
        double mu = m / (A * (1 - E2 / 4 - 3 * E2 * E2 / 64 - 5 * E2 * E2 * E2 / 256));

        double phi1 = mu
                + (3 * E1 / 2 - 27 * Math.pow(E1, 3) / 32) * Math.sin(2 * mu)
                + (21 * E1 * E1 / 16 - 55 * Math.pow(E1, 4) / 32) * Math.sin(4 * mu)
                + (151 * Math.pow(E1, 3) / 96) * Math.sin(6 * mu)
                + (1097 * Math.pow(E1, 4) / 512) * Math.sin(8 * mu);

        double sin = Math.sin(phi1);
        double cos = Math.cos(phi1);
        double tan = Math.tan(phi1);

        double n1 = A / Math.sqrt(1 - E2 * sin * sin);
        double t1 = tan * tan;
        double c1 = EP2 * cos * cos;
        double r1 = A * (1 - E2) / Math.pow(1 - E2 * sin * sin, 1.5);
        double d = x / (n1 * K0);

        double lat = phi1 - (n1 * tan / r1) * (d * d / 2
                - (5 + 3 * t1 + 10 * c1 - 4 * c1 * c1 - 9 * EP2) * Math.pow(d, 4) / 24
                + (61 + 90 * t1 + 298 * c1 + 45 * t1 * t1 - 252 * EP2 - 3 * c1 * c1) * Math.pow(d, 6) / 720);

        double lon = (d
                - (1 + 2 * t1 + c1) * Math.pow(d, 3) / 6
                + (5 - 2 * c1 + 28 * t1 - 3 * c1 * c1 + 8 * EP2 + 24 * t1 * t1) * Math.pow(d, 5) / 120) / cos;

        return new GeoPoint(Math.toDegrees(lat), centralMeridian(zone) + Math.toDegrees(lon));
    }
}
