package geoscan.shape;

import java.io.Serializable;

/**
 * A WGS84 coordinate in decimal degrees.
 *
 * @param lat latitude, in [-90, 90]
 * @param lng longitude, in [-180, 180]
 */
public record GeoPoint(double lat, double lng) implements Serializable {

    public GeoPoint {
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("latitude must be in [-90, 90], got: " + lat);
        }
        if (!Double.isFinite(lng) || lng < -180.0 || lng > 180.0) {
            throw new IllegalArgumentException("longitude must be in [-180, 180], got: " + lng);
        }
    }

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }

    /**
     * @return true when both values are usable as a {@link GeoPoint}
     */
    public static boolean isValid(double lat, double lng) {
        return Double.isFinite(lat) && Double.isFinite(lng)
                && lat >= -90.0 && lat <= 90.0
                && lng >= -180.0 && lng <= 180.0;
    }
}
