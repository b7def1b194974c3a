package org.iceforge.hlidskjalf.tile;

/** WGS84 position in decimal degrees. */
public record GeoPoint(double latitude, double longitude) {
}
