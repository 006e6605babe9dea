package org.ferry.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.ferry.cli.service.ReconcilerFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ReconciliationConfig;
import org.ferry.model.SyncMode;
import org.ferry.reconcile.ConfirmationPrompt;
import org.ferry.verify.DriftItem;
import org.ferry.verify.DriftReport;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Command for checking whether the target still matches the source.
 */
@CommandLine.Command(
        name = "verify",
        mixinStandardHelpOptions = true,
        description = "Compares the target environment with the source and reports drift."
)
public class VerifyCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private EnvironmentOptions environments;

    @CommandLine.Option(names = "--strict", description = "Report target-only objects as drift")
    private boolean strict;

    @CommandLine.Option(names = "--json", description = "Print the drift report as JSON")
    private boolean json;

    private final ReconcilerFactory factory;

    public VerifyCommand() {
        this(new ReconcilerFactory());
    }

    VerifyCommand(ReconcilerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Integer call() {
        try {
            ProfileConfiguration profile = factory.loadProfile(environments.profile);
            SyncMode mode = SyncMode.of(SyncMode.Scope.SCHEMA_ONLY,
                    strict ? SyncMode.Strategy.REPLACE : SyncMode.Strategy.INCREMENTAL);
            ReconciliationConfig config = CommandSupport.config(environments, profile, mode).build();

            DriftReport report = factory.create(profile, ConfirmationPrompt.always())
                    .verify(environments.source, environments.target, config);

            if (json) {
                System.out.println(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(report));
            } else {
                print(report);
            }
            return report.isClean() ? 0 : 1;

        } catch (Exception e) {
            System.err.println("Verification failed: " + CommandSupport.describe(e));
            return 1;
        }
    }

    private void print(DriftReport report) {
        if (report.isClean()) {
            System.out.println(environments.target + " matches " + environments.source);
        } else {
            System.out.println("Drift detected in " + environments.target + ":");
            report.genuineDrift().forEach(item -> System.out.println("   - " + item));
        }
        if (!report.expectedDifferences().isEmpty()) {
            System.out.println("Expected differences (" + report.expectedDifferences().size() + "):");
            for (DriftItem item : report.expectedDifferences()) {
                System.out.println("   - " + item);
            }
        }
        System.out.println("   Excluded schemas: " + String.join(", ", report.getExcludedSchemas()));
        System.out.println("   Source: " + report.getSourceFingerprint());
        System.out.println("   Target: " + report.getTargetFingerprint());
    }
}
