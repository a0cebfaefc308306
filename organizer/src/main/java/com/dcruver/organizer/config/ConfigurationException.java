package com.dcruver.organizer.config;

/**
 * Malformed or incomplete rule/schema configuration. Fatal: raised before any stage runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
