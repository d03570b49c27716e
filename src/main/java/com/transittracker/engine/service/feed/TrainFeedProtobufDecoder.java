package com.transittracker.engine.service.feed;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.transit.realtime.GtfsRealtime;
import com.transittracker.engine.dto.VehicleClass;
import com.transittracker.engine.dto.VehiclePosition;
import com.transittracker.engine.exception.FeedDecodeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the GTFS-Realtime train feed.
 *
 * Only the vehicle-position subset is read: trip updates and alerts in the
 * same feed message are ignored. An unreadable envelope or header fails the
 * whole payload; entities without a position are skipped one by one.
 */
@Component
@Slf4j
public class TrainFeedProtobufDecoder implements FeedFormatDecoder {

    @Override
    public List<VehiclePosition> decode(byte[] raw, VehicleClass vehicleClass, Instant capturedAt)
        throws FeedDecodeException {

        GtfsRealtime.FeedMessage message;
        try {
            message = GtfsRealtime.FeedMessage.parseFrom(raw);
        } catch (InvalidProtocolBufferException e) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED,
                "Train feed is not a GTFS-Realtime message: " + e.getMessage(), e);
        }

        if (!message.hasHeader()) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED, "Train feed has no header");
        }

        GtfsRealtime.FeedHeader header = message.getHeader();
        String version = header.getGtfsRealtimeVersion();
        if (!isSupportedVersion(version)) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED,
                "Unsupported GTFS-Realtime version: '" + version + "'");
        }

        Instant headerTime;
        try {
            headerTime = header.hasTimestamp() && header.getTimestamp() > 0
                ? Instant.ofEpochSecond(header.getTimestamp())
                : capturedAt;
        } catch (DateTimeException e) {
            throw new FeedDecodeException(FeedDecodeException.Reason.MALFORMED,
                "Train feed header timestamp out of range: " + Long.toUnsignedString(header.getTimestamp()), e);
        }

        List<VehiclePosition> positions = new ArrayList<>(message.getEntityCount());
        int skipped = 0;
        for (GtfsRealtime.FeedEntity entity : message.getEntityList()) {
            VehiclePosition position = toPosition(entity, vehicleClass, headerTime);
            if (position == null) {
                skipped++;
            } else {
                positions.add(position);
            }
        }

        log.debug("Decoded train feed v{}: {} positions, {} entities skipped",
            version, positions.size(), skipped);
        return positions;
    }

    private VehiclePosition toPosition(GtfsRealtime.FeedEntity entity, VehicleClass vehicleClass, Instant headerTime) {
        if (entity.getIsDeleted() || !entity.hasVehicle()) {
            return null;
        }

        GtfsRealtime.VehiclePosition vehicle = entity.getVehicle();
        if (!vehicle.hasPosition()) {
            return null;
        }

        String id = vehicle.hasVehicle() && !vehicle.getVehicle().getId().isBlank()
            ? vehicle.getVehicle().getId()
            : entity.getId();
        if (id == null || id.isBlank()) {
            return null;
        }

        String routeId = vehicle.hasTrip() && vehicle.getTrip().hasRouteId()
            ? vehicle.getTrip().getRouteId()
            : null;

        GtfsRealtime.Position position = vehicle.getPosition();
        Instant observedAt;
        try {
            observedAt = vehicle.hasTimestamp() && vehicle.getTimestamp() > 0
                ? Instant.ofEpochSecond(vehicle.getTimestamp())
                : headerTime;
        } catch (DateTimeException e) {
            log.debug("Unusable timestamp for train {}: {}", id, e.getMessage());
            return null;
        }

        return new VehiclePosition(
            id,
            vehicleClass,
            routeId,
            position.getLatitude(),
            position.getLongitude(),
            position.hasBearing() ? Double.valueOf(position.getBearing()) : null,
            position.hasSpeed() ? Double.valueOf(position.getSpeed()) : null,
            observedAt
        );
    }

    private static boolean isSupportedVersion(String version) {
        if (version == null || version.isBlank()) {
            return false;
        }
        return version.equals("1") || version.equals("2")
            || version.startsWith("1.") || version.startsWith("2.");
    }
}
