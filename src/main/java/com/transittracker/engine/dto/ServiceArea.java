package com.transittracker.engine.dto;

import org.locationtech.jts.geom.Envelope;

/**
 * Bounding box of the area the service covers. Positions outside it are
 * treated as sensor noise and dropped by the decoder.
 *
 * Backed by a JTS {@link Envelope} with x = longitude and y = latitude.
 */
public record ServiceArea(
    double minLatitude,
    double maxLatitude,
    double minLongitude,
    double maxLongitude
) {

    public ServiceArea {
        if (minLatitude > maxLatitude || minLongitude > maxLongitude) {
            throw new IllegalArgumentException("Service area minimum exceeds maximum");
        }
    }

    public Envelope toEnvelope() {
        return new Envelope(minLongitude, maxLongitude, minLatitude, maxLatitude);
    }

    /**
     * Inclusive containment. Coordinates that are not valid WGS84 values
     * (NaN, |lat| > 90, |lon| > 180) are never contained.
     */
    public boolean contains(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude)) {
            return false;
        }
        if (Math.abs(latitude) > 90.0 || Math.abs(longitude) > 180.0) {
            return false;
        }
        return toEnvelope().contains(longitude, latitude);
    }

    public double latitudeSpan() {
        return maxLatitude - minLatitude;
    }

    public double longitudeSpan() {
        return maxLongitude - minLongitude;
    }
}
