package org.ferry.cli;

import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Source/target pair and profile selection shared by every db subcommand.
 */
public class EnvironmentOptions {

    @CommandLine.Parameters(index = "0", description = "Source environment (prod, test, dev or a configured name)")
    String source;

    @CommandLine.Parameters(index = "1", description = "Target environment")
    String target;

    @CommandLine.Option(names = "--profile", description = "Configuration profile to use (overrides FERRY_PROFILE)")
    String profile;

    @CommandLine.Option(names = "--exclude-schema", split = ",",
            description = "Schemas to leave alone; replaces the configured exclusion set")
    List<String> excludedSchemas = new ArrayList<>();
}
