package io.docmirror.core.model;

/**
 * Geographic point value as stored by the document store.
 *
 * @param latitude  latitude in degrees, in range [-90, 90]
 * @param longitude longitude in degrees, in range [-180, 180]
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!Double.isFinite(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("latitude must be a finite number in [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("longitude must be a finite number in [-180, 180], got " + longitude);
        }
    }
}
