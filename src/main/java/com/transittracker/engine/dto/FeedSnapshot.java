package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of vehicle positions for one vehicle class at one point in time.
 *
 * Snapshots are never mutated in place. The position cache replaces whole
 * snapshots and the fallback policy derives re-tagged copies.
 *
 * @param vehicleClass Feed the snapshot came from
 * @param positions    Positions ordered as the upstream delivered them
 * @param capturedAt   When the snapshot was taken
 * @param provenance   How the snapshot was obtained
 */
public record FeedSnapshot(
    VehicleClass vehicleClass,
    List<VehiclePosition> positions,
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant capturedAt,
    Provenance provenance
) {

    public FeedSnapshot {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public static FeedSnapshot empty(VehicleClass vehicleClass, Instant capturedAt, Provenance provenance) {
        return new FeedSnapshot(vehicleClass, List.of(), capturedAt, provenance);
    }

    public FeedSnapshot withProvenance(Provenance newProvenance) {
        return new FeedSnapshot(vehicleClass, positions, capturedAt, newProvenance);
    }

    public int size() {
        return positions.size();
    }

    /**
     * Merges this (newer) snapshot over a previously held one so that a
     * vehicle never moves back in time: if the previous snapshot holds a
     * strictly newer observation for the same id, that observation is kept.
     * Vehicles missing from this snapshot are not carried over.
     */
    public FeedSnapshot reconcileWith(FeedSnapshot previous) {
        if (previous == null || previous.positions.isEmpty()) {
            return this;
        }

        Map<String, VehiclePosition> previousById = new LinkedHashMap<>();
        for (VehiclePosition position : previous.positions) {
            previousById.put(position.id(), position);
        }

        List<VehiclePosition> merged = new ArrayList<>(positions.size());
        boolean changed = false;
        for (VehiclePosition position : positions) {
            VehiclePosition held = previousById.get(position.id());
            if (held != null && held.isNewerThan(position)) {
                merged.add(held);
                changed = true;
            } else {
                merged.add(position);
            }
        }

        return changed ? new FeedSnapshot(vehicleClass, merged, capturedAt, provenance) : this;
    }

    public String toLogString() {
        return String.format("Snapshot[%s, vehicles=%d, provenance=%s, at=%s]",
            vehicleClass, positions.size(), provenance, capturedAt);
    }
}
