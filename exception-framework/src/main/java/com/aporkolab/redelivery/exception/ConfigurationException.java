package com.aporkolab.redelivery.exception;

/**
 * Invalid startup configuration. Fatal: the consumer must not start.
 */
public class ConfigurationException extends RedeliveryException {

    public ConfigurationException(String option, String message) {
        super("CONFIGURATION_ERROR", String.format("Invalid value for '%s': %s", option, message));
        with("option", option);
    }

    public ConfigurationException(String option, String message, Throwable cause) {
        super("CONFIGURATION_ERROR", String.format("Invalid value for '%s': %s", option, message), cause);
        with("option", option);
    }
}
