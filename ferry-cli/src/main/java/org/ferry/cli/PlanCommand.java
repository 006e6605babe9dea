package org.ferry.cli;

import org.ferry.cli.service.ReconcilerFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ReconciliationConfig;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanScriptWriter;
import org.ferry.reconcile.ConfirmationPrompt;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Dry run: prints the plan a migrate would apply, without touching the target.
 */
@CommandLine.Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        description = "Prints the SQL plan that would reconcile the target with the source, without applying it."
)
public class PlanCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private EnvironmentOptions environments;

    @CommandLine.Mixin
    private ModeOptions modeOptions;

    @CommandLine.Option(names = "--out", description = "Also write plan.sql into this directory")
    private Path outputDir;

    private final ReconcilerFactory factory;

    public PlanCommand() {
        this(new ReconcilerFactory());
    }

    PlanCommand(ReconcilerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Integer call() {
        try {
            ProfileConfiguration profile = factory.loadProfile(environments.profile);
            ReconciliationConfig config = CommandSupport.config(environments, profile, modeOptions.toMode())
                    .migrationDir(outputDir)
                    .build();

            MigrationPlan plan = factory.create(profile, ConfirmationPrompt.always())
                    .plan(environments.source, environments.target, config);

            if (plan.isEmpty()) {
                System.out.println("No changes detected.");
            } else {
                System.out.print(new PlanScriptWriter().render(plan, environments.source, environments.target));
            }
            plan.getWarnings().forEach(w -> System.err.println("Warning: " + w));
            return 0;

        } catch (Exception e) {
            System.err.println("Planning failed: " + CommandSupport.describe(e));
            return 1;
        }
    }
}
