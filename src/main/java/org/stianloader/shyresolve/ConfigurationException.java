package org.stianloader.shyresolve;

/**
 * Thrown when a configuration value (such as a popularity threshold) is malformed.
 * It is raised while the configuration is being constructed, that is before any
 * candidate is processed and before any network or prompt activity.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
