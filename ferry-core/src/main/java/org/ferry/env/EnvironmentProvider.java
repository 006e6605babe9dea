package org.ferry.env;

import org.ferry.model.EnvironmentCredentials;

/**
 * Supplies connection credentials for named environments.
 */
public interface EnvironmentProvider {

    /**
     * @throws org.ferry.config.ConfigurationException if the environment is unknown or incompletely configured
     */
    EnvironmentCredentials credentials(String environment);

    /**
     * Canonical key of an environment name, so aliases of one environment compare equal.
     */
    String canonicalName(String environment);
}
