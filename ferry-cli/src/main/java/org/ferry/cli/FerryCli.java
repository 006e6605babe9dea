package org.ferry.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for Ferry.
 * Reconciles schema, policies, grants and rows of one Postgres environment with another.
 */
@CommandLine.Command(
        name = "ferry",
        mixinStandardHelpOptions = true,
        version = "ferry 0.1.0",
        description = "Reconciles a target Postgres environment with a source environment",
        subcommands = {
                DbCommand.class
        }
)
public class FerryCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new FerryCli()).execute(args);
        System.exit(exitCode);
    }
}
