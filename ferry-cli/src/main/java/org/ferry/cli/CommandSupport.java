package org.ferry.cli;

import org.ferry.FerryException;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ReconciliationConfig;
import org.ferry.model.SyncMode;

import java.util.List;

final class CommandSupport {

    private CommandSupport() {
    }

    /**
     * Exclusions given on the command line win over the profile's.
     */
    static ReconciliationConfig.ReconciliationConfigBuilder config(EnvironmentOptions environments,
                                                                   ProfileConfiguration profile, SyncMode mode) {
        List<String> excluded = !environments.excludedSchemas.isEmpty()
                ? environments.excludedSchemas
                : profile.getExcludedSchemas();
        ReconciliationConfig.ReconciliationConfigBuilder builder = ReconciliationConfig.builder().mode(mode);
        if (excluded != null) {
            builder.excludedSchemas(excluded);
        }
        return builder;
    }

    static String describe(Exception e) {
        if (e instanceof FerryException fe && fe.getStage() != null) {
            return "[" + fe.getStage() + "] " + fe.getMessage();
        }
        return e.getMessage();
    }
}
