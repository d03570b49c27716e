package com.transittracker.engine.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of vehicle a feed describes. Each class has its own upstream feed
 * and its own cache slot.
 */
public enum VehicleClass {
    BUS,
    TRAIN;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used for path variables ("bus", "BUS", "buses").
     */
    public static VehicleClass fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Vehicle class is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (VehicleClass vehicleClass : values()) {
            String name = vehicleClass.name();
            if (normalized.equals(name) || normalized.equals(name + "S") || normalized.equals(name + "ES")) {
                return vehicleClass;
            }
        }
        throw new IllegalArgumentException("Unknown vehicle class: " + value);
    }
}
