package com.flow.config;

/**
 * Thrown at construction time when detection settings are invalid.
 * The engine refuses to start rather than score with undefined behaviour.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
