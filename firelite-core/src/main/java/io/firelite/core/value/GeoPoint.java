package io.firelite.core.value;

/**
 * Native geographic point, encoded as a {@code geoPointValue}.
 */
public record GeoPoint(double latitude, double longitude) {
}
