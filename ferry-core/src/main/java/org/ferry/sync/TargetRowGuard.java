package org.ferry.sync;

import org.ferry.connect.DatabaseClient;
import org.ferry.connect.EndpointCursor;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.ExecutionFailure;
import org.ferry.model.Sql;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.options.FerryOptions;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.ferry.plan.PostgresDdl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Keeps target rows alive across schema changes that can drop or rewrite them when no data is being synchronised.
 * Affected tables holding rows are copied server-side into {@value FerryOptions.Catalog#BACKUP_SCHEMA}; after the change,
 * rows that went missing are re-inserted over the columns both shapes share.
 */
public class TargetRowGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(TargetRowGuard.class);

    static final Set<OperationKind> RISKY_KINDS =
            EnumSet.of(OperationKind.DROP_COLUMN, OperationKind.ALTER_COLUMN_TYPE, OperationKind.DROP_CONSTRAINT);

    private final DatabaseClient client;
    private final ExecutionEngine engine;

    public TargetRowGuard(DatabaseClient client, ExecutionEngine engine) {
        this.client = client;
        this.engine = engine;
    }

    /**
     * Tables the plan changes in a row-risky way, when the run is schema-only.
     */
    public SortedSet<TableRef> tablesAtRisk(MigrationPlan plan) {
        SortedSet<TableRef> tables = new TreeSet<>();
        if (plan.getMode().scope() != SyncMode.Scope.SCHEMA_ONLY) {
            return tables;
        }
        for (Operation op : plan.operations(Phase.PRE_DATA)) {
            if (RISKY_KINDS.contains(op.getKind()) && op.getTable() != null) {
                tables.add(op.getTable());
            }
        }
        return tables;
    }

    /**
     * Backs up every at-risk table that currently holds rows.
     */
    public List<GuardedTable> protect(MigrationPlan plan, EndpointCursor target) {
        List<GuardedTable> guarded = new ArrayList<>();
        for (TableRef table : tablesAtRisk(plan)) {
            long rows = countRows(target, table);
            if (rows <= 0) {
                continue;
            }
            TableRef backup = backupOf(table);
            String script = "CREATE SCHEMA IF NOT EXISTS " + Sql.ident(FerryOptions.Catalog.BACKUP_SCHEMA) + ";\n"
                    + "DROP TABLE IF EXISTS " + backup.qualified() + ";\n"
                    + "CREATE TABLE " + backup.qualified() + " AS TABLE " + table.qualified() + ";\n";
            engine.runScript("back up " + table, script, target, plan.getMode());
            LOGGER.info("Backed up {} rows of {} to {}", rows, table, backup);
            guarded.add(new GuardedTable(table, backup, rows));
        }
        return guarded;
    }

    /**
     * Re-inserts rows lost by the schema change and drops the backups that are no longer needed.
     * A backup is kept when its rows could not be restored.
     */
    public List<RestoreResult> restore(List<GuardedTable> guarded, EndpointCursor target, SyncMode mode) {
        List<RestoreResult> results = new ArrayList<>();
        for (GuardedTable g : guarded) {
            results.add(restoreOne(g, target, mode));
        }
        return results;
    }

    private RestoreResult restoreOne(GuardedTable g, EndpointCursor target, SyncMode mode) {
        long now = countRows(target, g.table());
        if (now >= g.rowsBefore()) {
            dropBackup(g, target, mode);
            return new RestoreResult(g.table(), g.rowsBefore(), now, 0, "no rows lost");
        }

        Map<String, String> current = engine.withRetry("columns of " + g.table(), target,
                conn -> LoadableColumns.read(client, conn, g.table()));
        Map<String, String> saved = engine.withRetry("columns of " + g.backup(), target,
                conn -> LoadableColumns.read(client, conn, g.backup()));
        List<String> common = current.keySet().stream().filter(saved::containsKey).toList();
        if (common.isEmpty()) {
            LOGGER.warn("{} lost {} rows and shares no columns with its backup; backup {} kept",
                    g.table(), g.rowsBefore() - now, g.backup());
            return new RestoreResult(g.table(), g.rowsBefore(), now, 0, "no common columns; backup kept in " + g.backup());
        }

        String targetColumns = common.stream().map(Sql::ident).collect(Collectors.joining(", "));
        String castColumns = common.stream()
                .map(c -> Sql.ident(c) + "::" + current.get(c))
                .collect(Collectors.joining(", "));
        String script = "SET session_replication_role = replica;\n"
                + "INSERT INTO " + g.table().qualified() + " (" + targetColumns + ")\n"
                + "SELECT " + castColumns + " FROM " + g.backup().qualified() + "\n"
                + "ON CONFLICT DO NOTHING;\n"
                + "SET session_replication_role = DEFAULT;\n";
        try {
            engine.runScript("restore " + g.table(), script, target, mode);
        } catch (ExecutionFailure e) {
            LOGGER.error("Restoring {} failed; rows remain in {}", g.table(), g.backup());
            throw e;
        }
        long after = countRows(target, g.table());
        dropBackup(g, target, mode);
        LOGGER.info("Restored {} rows of {}", after - now, g.table());
        return new RestoreResult(g.table(), g.rowsBefore(), now, after - now, "restored from backup");
    }

    private void dropBackup(GuardedTable g, EndpointCursor target, SyncMode mode) {
        engine.runScript("drop backup " + g.backup(), "DROP TABLE IF EXISTS " + g.backup().qualified() + ";", target, mode);
    }

    private long countRows(EndpointCursor target, TableRef table) {
        return engine.withRetry("count " + table, target,
                conn -> client.query(conn, PostgresDdl.countRows(table)).singleLong());
    }

    static TableRef backupOf(TableRef table) {
        return TableRef.of(FerryOptions.Catalog.BACKUP_SCHEMA, table.schema() + "__" + table.name());
    }
}
