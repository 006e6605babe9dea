package org.ferry.reconcile;

import org.ferry.FerryException;
import org.ferry.config.ConfigurationException;
import org.ferry.connect.ConnectionResolver;
import org.ferry.connect.EndpointCursor;
import org.ferry.diff.SchemaDiff;
import org.ferry.diff.SchemaDiffer;
import org.ferry.env.EnvironmentProvider;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.ExecutionFailure;
import org.ferry.execute.ExecutionReport;
import org.ferry.introspect.SchemaExclusions;
import org.ferry.introspect.SchemaIntrospector;
import org.ferry.model.ReconciliationConfig;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.Operation;
import org.ferry.plan.Phase;
import org.ferry.plan.PlanGenerator;
import org.ferry.report.ReconciliationReport;
import org.ferry.report.ReportWriter;
import org.ferry.report.RunStatus;
import org.ferry.sync.DataSyncEngine;
import org.ferry.sync.GuardedTable;
import org.ferry.sync.RestoreResult;
import org.ferry.sync.SyncReport;
import org.ferry.sync.TargetRowGuard;
import org.ferry.verify.DriftReport;
import org.ferry.verify.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs a reconciliation end to end: connect, introspect, diff, plan, confirm, apply pre-data operations,
 * synchronise rows, apply post-data operations, verify and report.
 * The source is only ever read; every write goes to the target.
 */
public class Reconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Reconciler.class);

    static final List<TableRef> AUTH_TABLES = List.of(TableRef.of("auth", "users"), TableRef.of("auth", "identities"));

    private final EnvironmentProvider environments;
    private final ConnectionResolver resolver;
    private final SchemaIntrospector introspector;
    private final SchemaDiffer differ;
    private final PlanGenerator planGenerator;
    private final ExecutionEngine executionEngine;
    private final DataSyncEngine dataSync;
    private final TargetRowGuard rowGuard;
    private final Verifier verifier;
    private final ReportWriter reportWriter;
    private final ConfirmationPrompt confirmation;
    private final TargetBackup backup;

    public Reconciler(EnvironmentProvider environments, ConnectionResolver resolver, SchemaIntrospector introspector,
                      SchemaDiffer differ, PlanGenerator planGenerator, ExecutionEngine executionEngine,
                      DataSyncEngine dataSync, TargetRowGuard rowGuard, Verifier verifier, ReportWriter reportWriter,
                      ConfirmationPrompt confirmation, TargetBackup backup) {
        this.environments = Objects.requireNonNull(environments, "environments must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
        this.differ = Objects.requireNonNull(differ, "differ must not be null");
        this.planGenerator = Objects.requireNonNull(planGenerator, "planGenerator must not be null");
        this.executionEngine = Objects.requireNonNull(executionEngine, "executionEngine must not be null");
        this.dataSync = Objects.requireNonNull(dataSync, "dataSync must not be null");
        this.rowGuard = Objects.requireNonNull(rowGuard, "rowGuard must not be null");
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter must not be null");
        this.confirmation = Objects.requireNonNull(confirmation, "confirmation must not be null");
        this.backup = Objects.requireNonNull(backup, "backup must not be null");
    }

    /**
     * Reconciles the target with the source. Failures do not propagate: they end the run with a
     * {@link RunStatus#FAILED} report naming the stage and the last error.
     */
    public ReconciliationReport reconcile(String sourceEnv, String targetEnv, ReconciliationConfig config) {
        ReconciliationReport report = new ReconciliationReport();
        report.setSource(sourceEnv);
        report.setTarget(targetEnv);
        report.setMode(config.getMode());
        report.setStartedAt(now());

        try {
            Session session = open(sourceEnv, targetEnv, config, "reconcile");
            MigrationPlan plan = preparePlan(session, config);
            record(report, plan);
            writePlan(config, plan, sourceEnv, targetEnv);

            if (plan.isEmpty() && !config.isIncludeAuthUsers()) {
                LOGGER.info("{} already matches {}; nothing to apply", targetEnv, sourceEnv);
                report.setStatus(RunStatus.NO_CHANGES);
                return finish(config, report);
            }
            if (!confirmed(plan, config, sourceEnv, targetEnv)) {
                LOGGER.warn("Destructive plan declined; nothing applied to {}", targetEnv);
                report.setStatus(RunStatus.CANCELLED);
                return finish(config, report);
            }
            backUp(session, config, report);
            apply(session, plan, config, report);

            DriftReport drift = stage(Stage.VERIFY, () -> verifier.verify(
                    session.source().current(), session.target().current(), session.exclusions(), config.getMode()));
            report.setDrift(drift);
            report.setStatus(drift.isClean() ? RunStatus.SUCCEEDED : RunStatus.DRIFTED);
            failOnSyncErrors(report);
        } catch (FerryException e) {
            LOGGER.error("Reconciliation of {} from {} failed in stage {}: {}",
                    targetEnv, sourceEnv, e.getStage(), e.getMessage());
            report.setStatus(RunStatus.FAILED);
            report.setFailedStage(e.getStage());
            report.setError(e instanceof ExecutionFailure failure && failure.getLastOutput() != null
                    ? failure.getLastOutput() : e.getMessage());
        }
        return finish(config, report);
    }

    /**
     * Computes the plan without applying anything.
     *
     * @throws FerryException carrying the stage that failed
     */
    public MigrationPlan plan(String sourceEnv, String targetEnv, ReconciliationConfig config) {
        Session session = open(sourceEnv, targetEnv, config, "plan");
        MigrationPlan plan = preparePlan(session, config);
        writePlan(config, plan, sourceEnv, targetEnv);
        return plan;
    }

    /**
     * Compares the two environments as they are now.
     *
     * @throws FerryException carrying the stage that failed
     */
    public DriftReport verify(String sourceEnv, String targetEnv, ReconciliationConfig config) {
        Session session = open(sourceEnv, targetEnv, config, "verify");
        return stage(Stage.VERIFY, () -> verifier.verify(
                session.source().current(), session.target().current(), session.exclusions(), config.getMode()));
    }

    private Session open(String sourceEnv, String targetEnv, ReconciliationConfig config, String purpose) {
        return stage(Stage.CONNECT, () -> {
            if (environments.canonicalName(sourceEnv).equals(environments.canonicalName(targetEnv))) {
                throw new ConfigurationException("Source and target environments cannot be the same: "
                        + sourceEnv + " / " + targetEnv);
            }
            EndpointCursor source = resolver.cursor(environments.credentials(sourceEnv), purpose + " (source)");
            EndpointCursor target = resolver.cursor(environments.credentials(targetEnv), purpose + " (target)");
            source.current();
            target.current();
            return new Session(source, target, SchemaExclusions.of(config.getExcludedSchemas()));
        });
    }

    private MigrationPlan preparePlan(Session session, ReconciliationConfig config) {
        Snapshot source = stage(Stage.INTROSPECT, () -> introspector.capture(session.source().current(), session.exclusions()));
        Snapshot target = stage(Stage.INTROSPECT, () -> introspector.capture(session.target().current(), session.exclusions()));
        SchemaDiff diff = stage(Stage.DIFF, () -> differ.diff(source, target));
        LOGGER.info("Diff: {} added, {} removed, {} changed", diff.getAddedCount(), diff.getRemovedCount(), diff.getChangedCount());
        return stage(Stage.PLAN, () -> planGenerator.generate(diff, source, target, config.getMode()));
    }

    private boolean confirmed(MigrationPlan plan, ReconciliationConfig config, String sourceEnv, String targetEnv) {
        if (!plan.isDestructive() || config.isAutoConfirm()) {
            return true;
        }
        return stage(Stage.CONFIRM, () -> confirmation.confirm(plan, sourceEnv, targetEnv));
    }

    private void backUp(Session session, ReconciliationConfig config, ReconciliationReport report) {
        if (!config.isBackupTarget()) {
            return;
        }
        if (config.getMigrationDir() == null) {
            LOGGER.warn("Target backup requested without a migration directory; skipping it");
            return;
        }
        Path file = stage(Stage.BACKUP, () -> backup.create(session.target().current(), config.getMigrationDir(), config.getMode()));
        report.setBackupFile(file == null ? null : file.toString());
    }

    private void apply(Session session, MigrationPlan plan, ReconciliationConfig config, ReconciliationReport report) {
        SyncMode mode = config.getMode();
        ExecutionReport execution = new ExecutionReport();
        report.setExecution(execution);

        List<GuardedTable> guarded = stage(Stage.PRE_DATA, () -> rowGuard.protect(plan, session.target()));
        execution.merge(stage(Stage.PRE_DATA,
                () -> executionEngine.apply(plan.operations(Phase.PRE_DATA), session.target(), mode)));
        List<RestoreResult> restored = stage(Stage.PRE_DATA, () -> rowGuard.restore(guarded, session.target(), mode));
        report.setRestoredTables(restored);

        SyncReport sync = new SyncReport();
        report.setDataSync(sync);
        if (mode.includesData()) {
            sync.merge(stage(Stage.DATA,
                    () -> dataSync.sync(session.source(), session.target(), plan.getDataTables(), mode)));
        }
        if (config.isIncludeAuthUsers()) {
            SyncMode authMode = SyncMode.of(mode.scope(), SyncMode.Strategy.INCREMENTAL);
            LOGGER.info("Copying auth users incrementally");
            sync.merge(stage(Stage.DATA, () -> dataSync.sync(session.source(), session.target(), AUTH_TABLES, authMode)));
        }

        execution.merge(stage(Stage.POST_DATA,
                () -> executionEngine.apply(plan.operations(Phase.POST_DATA), session.target(), mode)));
    }

    private static void failOnSyncErrors(ReconciliationReport report) {
        SyncReport sync = report.getDataSync();
        if (sync == null || !sync.hasFailures()) {
            return;
        }
        String tables = sync.failedTables().stream().map(TableRef::toString).collect(Collectors.joining(", "));
        LOGGER.error("Data sync did not complete for: {}", tables);
        report.setStatus(RunStatus.FAILED);
        report.setFailedStage(Stage.DATA.name());
        report.setError("Data sync failed for: " + tables);
    }

    private <T> T stage(Stage stage, Supplier<T> work) {
        LOGGER.info("==> {}", stage);
        try {
            return work.get();
        } catch (FerryException e) {
            throw e.atStage(stage.name());
        }
    }

    private static void record(ReconciliationReport report, MigrationPlan plan) {
        report.setPlanSummary(plan.getSummary());
        report.setOperationCount(plan.getOperations().size());
        report.setDestructiveOperations(plan.getDestructiveOperations().stream().map(Operation::toString).toList());
        report.setWithheldOperations(plan.getSuppressed().stream().map(s -> s.operation().toString()).toList());
        report.setWarnings(plan.getWarnings());
    }

    private void writePlan(ReconciliationConfig config, MigrationPlan plan, String source, String target) {
        if (config.getMigrationDir() != null) {
            reportWriter.writePlan(config.getMigrationDir(), plan, source, target);
        }
    }

    private ReconciliationReport finish(ReconciliationConfig config, ReconciliationReport report) {
        report.setFinishedAt(now());
        if (config.getMigrationDir() != null) {
            reportWriter.writeReport(config.getMigrationDir(), report);
        }
        LOGGER.info("Run finished: {}", report.getStatus());
        return report;
    }

    private static String now() {
        return LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private record Session(EndpointCursor source, EndpointCursor target, SchemaExclusions exclusions) {
    }
}
