package com.transittracker.engine.dto;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VehicleFeedResponseTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private static FeedSnapshot snapshot(VehicleClass vehicleClass, Provenance provenance) {
        return new FeedSnapshot(vehicleClass, List.of(), NOW, provenance);
    }

    @Test
    void shouldCombineProvenance() {
        assertThat(combine(Provenance.LIVE, Provenance.LIVE, false)).isEqualTo(Provenance.LIVE);
        assertThat(combine(Provenance.LIVE, Provenance.ERROR, false)).isEqualTo(Provenance.PARTIAL);
        assertThat(combine(Provenance.CACHED, Provenance.LIVE, false)).isEqualTo(Provenance.PARTIAL);
        assertThat(combine(Provenance.CACHED, Provenance.ERROR, false)).isEqualTo(Provenance.ERROR);
        assertThat(combine(Provenance.MOCK, Provenance.MOCK, true)).isEqualTo(Provenance.MOCK);
    }

    @Test
    void shouldAcceptPluralVehicleClassNames() {
        assertThat(VehicleClass.fromString("buses")).isEqualTo(VehicleClass.BUS);
        assertThat(VehicleClass.fromString("Train")).isEqualTo(VehicleClass.TRAIN);
        assertThat(VehicleClass.fromString("TRAINS")).isEqualTo(VehicleClass.TRAIN);
    }

    private static Provenance combine(Provenance bus, Provenance train, boolean mockMode) {
        return VehicleFeedResponse.combine(
            snapshot(VehicleClass.BUS, bus), snapshot(VehicleClass.TRAIN, train), mockMode, NOW).source();
    }
}
