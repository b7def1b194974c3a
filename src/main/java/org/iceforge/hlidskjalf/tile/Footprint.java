package org.iceforge.hlidskjalf.tile;

import java.util.List;
import java.util.Locale;

/**
 * Geographic extent of a tile: the outline polygon and its bounding box.
 * Longitudes are not normalized, so an outline crossing the antimeridian may extend past +/-180.
 */
public record Footprint(List<GeoPoint> outline, double minLatitude, double minLongitude,
                        double maxLatitude, double maxLongitude) {

    public Footprint {
        outline = List.copyOf(outline);
    }

    public static Footprint of(List<GeoPoint> outline) {
        if (outline == null || outline.isEmpty()) {
            throw new EmptyFootprintException("Footprint has no vertices");
        }
        double minLat = Double.POSITIVE_INFINITY;
        double minLon = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double maxLon = Double.NEGATIVE_INFINITY;
        for (GeoPoint p : outline) {
            minLat = Math.min(minLat, p.latitude());
            minLon = Math.min(minLon, p.longitude());
            maxLat = Math.max(maxLat, p.latitude());
            maxLon = Math.max(maxLon, p.longitude());
        }
        return new Footprint(outline, minLat, minLon, maxLat, maxLon);
    }

    public static Footprint ofBounds(double minLongitude, double minLatitude, double maxLongitude, double maxLatitude) {
        return of(List.of(
                new GeoPoint(minLatitude, minLongitude),
                new GeoPoint(minLatitude, maxLongitude),
                new GeoPoint(maxLatitude, maxLongitude),
                new GeoPoint(maxLatitude, minLongitude)));
    }

    public boolean degenerate() {
        return !(maxLatitude > minLatitude) || !(maxLongitude > minLongitude);
    }

    /** [minLon, minLat, maxLon, maxLat], the order used by GeoJSON and STAC. */
    public double[] bbox() {
        return new double[]{minLongitude, minLatitude, maxLongitude, maxLatitude};
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Footprint[lat %.4f..%.4f, lon %.4f..%.4f]",
                minLatitude, maxLatitude, minLongitude, maxLongitude);
    }
}
