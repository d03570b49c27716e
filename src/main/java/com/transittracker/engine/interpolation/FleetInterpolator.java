package com.transittracker.engine.interpolation;

import com.transittracker.engine.dto.FeedSnapshot;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps one marker per vehicle and moves them as snapshots arrive.
 *
 * Usage:
 * <pre>
 * interpolator.apply(snapshot, clock.instant());   // every feed update
 * interpolator.frame(clock.instant());             // every rendered frame
 * </pre>
 *
 * Vehicles missing from a newer snapshot of their class are dropped.
 */
@Slf4j
public class FleetInterpolator {

    private final Duration duration;
    private final Map<MarkerKey, Marker> markers = new LinkedHashMap<>();

    private record MarkerKey(VehicleClass vehicleClass, String id) {
    }

    private static final class Marker {
        private final PositionAnimator position;
        private HeadingAnimator heading;
        private String routeId;

        private Marker(PositionAnimator position) {
            this.position = position;
        }
    }

    /**
     * What to draw for one vehicle in one frame.
     */
    public record MarkerFrame(
        String id,
        VehicleClass vehicleClass,
        String routeId,
        double latitude,
        double longitude,
        Double heading,
        boolean moving
    ) {
    }

    public FleetInterpolator() {
        this(PositionAnimator.DEFAULT_DURATION);
    }

    public FleetInterpolator(Duration duration) {
        this.duration = duration;
    }

    /**
     * Feeds a snapshot to the per-vehicle animators.
     *
     * @return number of markers that started a new move
     */
    public synchronized int apply(FeedSnapshot snapshot, Instant now) {
        Set<MarkerKey> seen = new HashSet<>();
        int started = 0;

        for (VehiclePosition vehicle : snapshot.positions()) {
            MarkerKey key = new MarkerKey(vehicle.vehicleClass(), vehicle.id());
            seen.add(key);
            Coordinates target = new Coordinates(vehicle.latitude(), vehicle.longitude());

            Marker marker = markers.get(key);
            if (marker == null) {
                // First sighting: place without animating
                marker = new Marker(new PositionAnimator(target, duration, Easing.EASE_OUT_CUBIC));
                markers.put(key, marker);
            } else if (marker.position.retarget(target, now)) {
                started++;
            }

            marker.routeId = vehicle.routeId();
            if (vehicle.heading() != null) {
                if (marker.heading == null) {
                    marker.heading = new HeadingAnimator(vehicle.heading(), duration, Easing.EASE_OUT_CUBIC);
                } else {
                    marker.heading.retarget(vehicle.heading(), now);
                }
            }
        }

        int removed = 0;
        Iterator<MarkerKey> keys = markers.keySet().iterator();
        while (keys.hasNext()) {
            MarkerKey key = keys.next();
            if (key.vehicleClass() == snapshot.vehicleClass() && !seen.contains(key)) {
                keys.remove();
                removed++;
            }
        }

        log.debug("Applied {}: {} moves started, {} markers removed", snapshot.toLogString(), started, removed);
        return started;
    }

    public synchronized List<MarkerFrame> frame(Instant now) {
        List<MarkerFrame> frames = new ArrayList<>(markers.size());
        for (Map.Entry<MarkerKey, Marker> entry : markers.entrySet()) {
            Marker marker = entry.getValue();
            Coordinates displayed = marker.position.displayedAt(now);
            frames.add(new MarkerFrame(
                entry.getKey().id(),
                entry.getKey().vehicleClass(),
                marker.routeId,
                displayed.latitude(),
                displayed.longitude(),
                marker.heading != null ? marker.heading.displayedAt(now) : null,
                marker.position.isAnimating(now)
            ));
        }
        return frames;
    }

    public synchronized int size() {
        return markers.size();
    }
}
