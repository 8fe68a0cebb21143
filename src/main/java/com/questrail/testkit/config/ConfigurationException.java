package com.questrail.testkit.config;

/**
 * Thrown when an application or handler configuration is invalid.
 *
 * <p>Configuration is validated once, before an engine is built. No engine
 * exists for an application whose configuration is rejected.</p>
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }
}
