package com.transittracker.engine.service.geofence;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoDistanceTest {

    @Test
    void shouldBeZeroForSamePoint() {
        assertThat(GeoDistance.haversineMeters(33.7545, -84.4025, 33.7545, -84.4025)).isZero();
    }

    @Test
    void shouldBeSymmetric() {
        double there = GeoDistance.haversineMeters(33.7545, -84.4025, 33.6407, -84.4277);
        double back = GeoDistance.haversineMeters(33.6407, -84.4277, 33.7545, -84.4025);

        assertThat(there).isEqualTo(back, within(1e-6));
    }

    @Test
    void shouldMatchOneDegreeOfLatitude() {
        assertThat(GeoDistance.haversineMeters(0, 0, 1, 0))
            .isEqualTo(GeoDistance.METERS_PER_DEGREE_LATITUDE, within(0.01));
    }

    @Test
    void shouldHandleAntipodes() {
        assertThat(GeoDistance.haversineMeters(0, 0, 0, 180))
            .isEqualTo(Math.PI * GeoDistance.EARTH_RADIUS_METERS, within(1.0));
    }
}
