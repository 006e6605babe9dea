package org.ferry.config;

import org.ferry.FerryException;

/**
 * Unknown environment, missing credentials or an unreadable configuration file.
 */
public class ConfigurationException extends FerryException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
