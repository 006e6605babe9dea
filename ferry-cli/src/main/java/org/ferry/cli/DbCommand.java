package org.ferry.cli;

import picocli.CommandLine;

@CommandLine.Command(
        name = "db",
        description = "Database reconciliation commands",
        subcommands = {
                MigrateCommand.class,
                PlanCommand.class,
                VerifyCommand.class
        }
)
public class DbCommand {

}
