package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;
import java.util.List;

/**
 * Combined response served to collaborators polling for vehicles.
 *
 * Always structurally valid: on upstream failure the arrays are empty and
 * {@code source} says why.
 */
public record VehicleFeedResponse(
    List<VehiclePosition> buses,
    List<VehiclePosition> trains,
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp,
    Provenance source
) {

    public VehicleFeedResponse {
        buses = buses == null ? List.of() : List.copyOf(buses);
        trains = trains == null ? List.of() : List.copyOf(trains);
    }

    /**
     * Combines one snapshot per feed. Mock mode wins; otherwise the result
     * is live only when both feeds are live, error when both degraded and
     * partial in between.
     */
    public static VehicleFeedResponse combine(
        FeedSnapshot busSnapshot,
        FeedSnapshot trainSnapshot,
        boolean mockMode,
        Instant timestamp
    ) {
        Provenance source;
        if (mockMode) {
            source = Provenance.MOCK;
        } else {
            boolean busDegraded = busSnapshot.provenance().isDegraded();
            boolean trainDegraded = trainSnapshot.provenance().isDegraded();
            if (busDegraded && trainDegraded) {
                source = Provenance.ERROR;
            } else if (busDegraded || trainDegraded) {
                source = Provenance.PARTIAL;
            } else {
                source = Provenance.LIVE;
            }
        }

        return new VehicleFeedResponse(
            busSnapshot.positions(),
            trainSnapshot.positions(),
            timestamp,
            source
        );
    }
}
