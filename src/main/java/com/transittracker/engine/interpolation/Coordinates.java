package com.transittracker.engine.interpolation;

/**
 * A displayed map point in decimal degrees.
 */
public record Coordinates(double latitude, double longitude) {

    /**
     * Per-axis linear interpolation toward {@code target}. A fraction of 0
     * returns this point, 1 returns the target exactly.
     */
    public Coordinates lerp(Coordinates target, double fraction) {
        if (fraction <= 0.0) {
            return this;
        }
        if (fraction >= 1.0) {
            return target;
        }
        return new Coordinates(
            latitude + (target.latitude - latitude) * fraction,
            longitude + (target.longitude - longitude) * fraction
        );
    }
}
