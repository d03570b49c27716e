package com.transittracker.engine.exception;

import lombok.Getter;

/**
 * A required configuration parameter is missing or invalid. Raised during
 * context startup and blocks the application from starting.
 */
@Getter
public class MissingConfigurationException extends RuntimeException {

    private final String parameter;

    public MissingConfigurationException(String parameter, String message) {
        super("Missing or invalid configuration '" + parameter + "': " + message);
        this.parameter = parameter;
    }
}
