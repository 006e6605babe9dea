package org.ferry.execute;

import org.ferry.connect.DatabaseAccessException;
import org.ferry.connect.EndpointCursor;
import org.ferry.connect.ResolvedConnection;
import org.ferry.connect.ToolResult;
import org.ferry.connect.DatabaseClient;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.SyncMode;
import org.ferry.plan.Operation;
import org.ferry.plan.PostgresDdl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies operations to the target and classifies what the database said.
 * Operations sharing a transaction group run as one {@code BEGIN ... COMMIT} script.
 * Connection-level failures move to the next endpoint and retry; unexpected errors abort.
 */
public class ExecutionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionEngine.class);

    private final DatabaseClient client;
    private final OutputClassifier classifier;

    public ExecutionEngine(DatabaseClient client, OutputClassifier classifier) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Runs every operation that carries SQL, in order. Data loads are left to the data sync engine.
     *
     * @throws ExecutionFailure on unexpected output, or when every endpoint failed at connection level
     */
    public ExecutionReport apply(List<Operation> operations, EndpointCursor target, SyncMode mode) {
        ExecutionReport report = new ExecutionReport();
        List<Operation> runnable = operations.stream().filter(Operation::hasSql).toList();

        int i = 0;
        while (i < runnable.size()) {
            Operation op = runnable.get(i);
            if (op.getTransactionGroup() != null) {
                List<Operation> group = new ArrayList<>();
                while (i < runnable.size() && op.getTransactionGroup().equals(runnable.get(i).getTransactionGroup())) {
                    group.add(runnable.get(i++));
                }
                report.record(runGroup(op.getTransactionGroup(), group, target, mode));
                continue;
            }
            if (op.isDeferred() && !nullFree(op, target, report)) {
                i++;
                continue;
            }
            report.record(runScript(op.toString(), op.getSql(), target, mode));
            i++;
        }
        return report;
    }

    private OperationOutcome runGroup(String group, List<Operation> operations, EndpointCursor target, SyncMode mode) {
        String script = "BEGIN;\n"
                + operations.stream().map(Operation::getSql).collect(Collectors.joining("\n"))
                + "\nCOMMIT;\n";
        return run(group + " (" + operations.size() + " statements)", conn -> client.execute(conn, script), target, mode, true);
    }

    /**
     * Counts NULLs in the column a deferred SET NOT NULL would constrain.
     *
     * @return true if the constraint can be applied
     */
    private boolean nullFree(Operation op, EndpointCursor target, ExecutionReport report) {
        long nulls = withRetry(op.toString(), target,
                conn -> client.query(conn, PostgresDdl.countNulls(op.getTable(), op.getColumn())).singleLong());
        if (nulls == 0) {
            return true;
        }
        LOGGER.warn("{} still holds {} NULL values; leaving it nullable for manual backfill", op.getTargetObject(), nulls);
        report.requireBackfill(op.getTargetObject());
        report.record(OperationOutcome.builder()
                .label(op.toString())
                .status(OperationOutcome.Status.SKIPPED)
                .endpoint(target.current().target().endpoint().label())
                .note(nulls + " NULL values remain; backfill and set NOT NULL manually")
                .build());
        return false;
    }

    public OperationOutcome runScript(String label, String script, EndpointCursor target, SyncMode mode) {
        return run(label, conn -> client.execute(conn, script), target, mode);
    }

    /**
     * Runs an action against the current endpoint of the cursor and classifies its output.
     */
    public OperationOutcome run(String label, Function<ConnectionTarget, ToolResult> action,
                                EndpointCursor target, SyncMode mode) {
        return run(label, action, target, mode, false);
    }

    /**
     * @param atomic the action runs inside one transaction, so any error rolled all of it back
     */
    private OperationOutcome run(String label, Function<ConnectionTarget, ToolResult> action,
                                 EndpointCursor target, SyncMode mode, boolean atomic) {
        while (true) {
            ResolvedConnection conn = target.current();
            LOGGER.debug("Running {} on {}", label, conn);
            ToolResult result = action.apply(conn.target());
            ClassifiedOutput classified = classifier.classify(result, mode.strategy());

            switch (classified.classification()) {
                case IGNORE, CLEAN -> {
                    return outcome(label, OperationOutcome.Status.APPLIED, conn, classified);
                }
                case TOLERABLE -> {
                    if (atomic) {
                        LOGGER.error("{} hit an error inside its transaction; nothing in it was applied: {}",
                                label, classified.toleratedLines());
                        throw new ExecutionFailure(ExecutionFailure.Kind.UNEXPECTED, label,
                                String.join("\n", classified.toleratedLines()) + " (transaction rolled back)");
                    }
                    LOGGER.info("{} completed with tolerated errors: {}", label, classified.toleratedLines());
                    return outcome(label, OperationOutcome.Status.TOLERATED, conn, classified);
                }
                case FATAL -> {
                    LOGGER.warn("{} hit a connection-level failure on {}: {}", label,
                            conn.target().endpoint().label(), classified.lastError());
                    Optional<ResolvedConnection> next = target.advance();
                    if (next.isEmpty()) {
                        throw new ExecutionFailure(ExecutionFailure.Kind.FATAL, label, classified.lastError());
                    }
                    LOGGER.info("Retrying {} on {}", label, next.get().target().endpoint().label());
                }
                case UNEXPECTED -> throw new ExecutionFailure(ExecutionFailure.Kind.UNEXPECTED, label, classified.lastError());
            }
        }
    }

    /**
     * Runs a query-style action, moving to the next endpoint when the session cannot be used.
     */
    public <T> T withRetry(String label, EndpointCursor target, Function<ConnectionTarget, T> action) {
        while (true) {
            ResolvedConnection conn = target.current();
            try {
                return action.apply(conn.target());
            } catch (DatabaseAccessException e) {
                String message = e.getMessage() == null ? "" : e.getMessage();
                if (classifier.classifyLine(message, SyncMode.Strategy.INCREMENTAL) != Classification.FATAL) {
                    throw new ExecutionFailure(ExecutionFailure.Kind.UNEXPECTED, label, e.getMessage(), e);
                }
                LOGGER.warn("{} lost its session on {}: {}", label, conn.target().endpoint().label(), e.getMessage());
                if (target.advance().isEmpty()) {
                    throw new ExecutionFailure(ExecutionFailure.Kind.FATAL, label, e.getMessage(), e);
                }
            }
        }
    }

    private static OperationOutcome outcome(String label, OperationOutcome.Status status, ResolvedConnection conn,
                                            ClassifiedOutput classified) {
        return OperationOutcome.builder()
                .label(label)
                .status(status)
                .endpoint(conn.target().endpoint().label())
                .notes(classified.toleratedLines())
                .build();
    }
}
