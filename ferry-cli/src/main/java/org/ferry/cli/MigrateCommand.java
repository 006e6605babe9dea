package org.ferry.cli;

import org.ferry.cli.service.ConsoleConfirmationPrompt;
import org.ferry.cli.service.ReconcilerFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ReconciliationConfig;
import org.ferry.options.FerryOptions;
import org.ferry.reconcile.ConfirmationPrompt;
import org.ferry.reconcile.Reconciler;
import org.ferry.report.ReconciliationReport;
import org.ferry.report.RunStatus;
import org.ferry.sync.TableSyncResult;
import org.ferry.verify.DriftItem;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command that brings the target environment in line with the source.
 * Writes report.json and plan.sql into the migration directory.
 */
@CommandLine.Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "Reconciles the target environment with the source: schema, RLS policies, grants and optionally rows."
)
public class MigrateCommand implements Callable<Integer> {

    private static final DateTimeFormatter RUN_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @CommandLine.Mixin
    private EnvironmentOptions environments;

    @CommandLine.Mixin
    private ModeOptions modeOptions;

    @CommandLine.Parameters(index = "2", arity = "0..1",
            description = "Directory for report.json and plan.sql (default: ferry-runs/<timestamp>_<source>_to_<target>)")
    private Path migrationDir;

    @CommandLine.Option(names = "--users", description = "Also copy auth users and identities (always incremental)")
    private boolean includeAuthUsers;

    @CommandLine.Option(names = "--backup", description = "Dump the target into the migration directory before applying")
    private boolean backupTarget;

    @CommandLine.Option(names = {"-y", "--auto-confirm"}, description = "Apply destructive plans without asking")
    private boolean autoConfirm;

    private final ReconcilerFactory factory;
    private final ConfirmationPrompt prompt;

    public MigrateCommand() {
        this(new ReconcilerFactory(), new ConsoleConfirmationPrompt());
    }

    MigrateCommand(ReconcilerFactory factory, ConfirmationPrompt prompt) {
        this.factory = factory;
        this.prompt = prompt;
    }

    @Override
    public Integer call() {
        try {
            ProfileConfiguration profile = factory.loadProfile(environments.profile);
            Reconciler reconciler = factory.create(profile, prompt);
            ReconciliationConfig config = CommandSupport.config(environments, profile, modeOptions.toMode())
                    .includeAuthUsers(includeAuthUsers)
                    .autoConfirm(autoConfirm)
                    .backupTarget(backupTarget)
                    .migrationDir(resolveMigrationDir())
                    .build();

            System.out.println("Reconciling " + environments.target + " from " + environments.source
                    + " (" + config.getMode() + ")");
            ReconciliationReport report = reconciler.reconcile(environments.source, environments.target, config);
            printReport(report, config.getMigrationDir());
            return report.isSuccessful() ? 0 : 1;

        } catch (Exception e) {
            System.err.println("Migration failed: " + CommandSupport.describe(e));
            return 1;
        }
    }

    private Path resolveMigrationDir() {
        if (migrationDir != null) {
            return migrationDir;
        }
        String name = LocalDateTime.now().format(RUN_DIR_FORMAT) + "_" + environments.source + "_to_" + environments.target;
        return Path.of(FerryOptions.Output.DEFAULT_MIGRATION_DIR, name);
    }

    private void printReport(ReconciliationReport report, Path dir) {
        switch (report.getStatus()) {
            case NO_CHANGES -> System.out.println("No changes detected.");
            case CANCELLED -> System.out.println("Migration cancelled; nothing was applied.");
            case FAILED -> {
                System.err.println("Migration failed at stage " + report.getFailedStage() + ": " + report.getError());
                System.err.println("   Re-running is safe: the next run re-plans from the current state.");
            }
            default -> printApplied(report);
        }
        if (report.getBackupFile() != null) {
            System.out.println("Target backup: " + report.getBackupFile());
        }
        System.out.println("Report: " + dir);
    }

    private void printApplied(ReconciliationReport report) {
        System.out.println("Plan: " + report.getPlanSummary() + ", " + report.getOperationCount() + " operations");
        if (report.getExecution() != null) {
            List<String> backfill = report.getExecution().getManualBackfill();
            if (!backfill.isEmpty()) {
                System.out.println("Columns left nullable, backfill and set NOT NULL manually:");
                backfill.forEach(c -> System.out.println("   - " + c));
            }
        }
        if (report.getDataSync() != null) {
            for (TableSyncResult table : report.getDataSync().getTables()) {
                System.out.printf("   %-40s %-6s source=%d target=%d -> %d%n", table.getTable(), table.getStatus(),
                        table.getSourceRows(), table.getTargetRowsBefore(), table.getTargetRowsAfter());
            }
        }
        if (report.getDataSync() != null && !report.getDataSync().getCascadeTruncated().isEmpty()) {
            System.err.println("Also emptied through foreign keys: " + report.getDataSync().getCascadeTruncated());
        }
        if (!report.getWithheldOperations().isEmpty()) {
            System.out.println("Withheld (incremental): " + report.getWithheldOperations().size() + " removals");
        }
        if (report.getStatus() == RunStatus.DRIFTED) {
            System.err.println("Verification found drift:");
            for (DriftItem item : report.getDrift().genuineDrift()) {
                System.err.println("   - " + item);
            }
        } else {
            System.out.println("Migration completed successfully.");
        }
    }
}
