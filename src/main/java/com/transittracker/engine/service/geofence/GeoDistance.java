package com.transittracker.engine.service.geofence;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    /** Length of one degree of latitude, in meters. */
    public static final double METERS_PER_DEGREE_LATITUDE = Math.PI * EARTH_RADIUS_METERS / 180.0;

    private GeoDistance() {
    }

    /**
     * Haversine distance between two WGS84 points, in meters.
     * Symmetric, and exactly 0 for identical points.
     */
    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double deltaPhi = Math.toRadians(lat2 - lat1);
        double deltaLambda = Math.toRadians(lng2 - lng1);

        double sinHalfPhi = Math.sin(deltaPhi / 2);
        double sinHalfLambda = Math.sin(deltaLambda / 2);
        double a = sinHalfPhi * sinHalfPhi
            + Math.cos(phi1) * Math.cos(phi2) * sinHalfLambda * sinHalfLambda;

        // Clamp against rounding pushing a past 1 for antipodal points
        a = Math.min(1.0, Math.max(0.0, a));
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.sqrt(a));
    }
}
