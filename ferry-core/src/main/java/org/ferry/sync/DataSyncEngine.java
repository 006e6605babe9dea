package org.ferry.sync;

import org.ferry.connect.CopyLoad;
import org.ferry.connect.DatabaseClient;
import org.ferry.connect.EndpointCursor;
import org.ferry.connect.QueryResult;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.ExecutionFailure;
import org.ferry.execute.OperationOutcome;
import org.ferry.model.Sql;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.plan.PostgresDdl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Copies table rows from source to target.
 * Replace truncates every table first and loads verbatim; incremental only inserts rows whose key is not present.
 * Rows come from the first extractor that succeeds; loads run with triggers and FK checks disabled for the session.
 */
public class DataSyncEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataSyncEngine.class);

    static final String REPLICA_ROLE = "SET session_replication_role = replica;";
    static final String DEFAULT_ROLE = "SET session_replication_role = DEFAULT;";
    static final String STAGE_TABLE = "ferry_stage";
    static final String FOREIGN_KEYS = """
            SELECT cn.nspname AS child_schema, c.relname AS child_table,
                   pn.nspname AS parent_schema, p.relname AS parent_table
            FROM pg_constraint con
            JOIN pg_class c ON c.oid = con.conrelid
            JOIN pg_namespace cn ON cn.oid = c.relnamespace
            JOIN pg_class p ON p.oid = con.confrelid
            JOIN pg_namespace pn ON pn.oid = p.relnamespace
            WHERE con.contype = 'f' AND con.conrelid <> con.confrelid
            ORDER BY 1, 2""";

    private final DatabaseClient client;
    private final ExecutionEngine engine;
    private final List<TableExtractor> extractors;
    private final InsertConflictTransformer transformer;

    public DataSyncEngine(DatabaseClient client, ExecutionEngine engine) {
        this(client, engine, List.of(new BulkDumpExtractor(client), new CsvCopyExtractor(client)),
                new InsertConflictTransformer());
    }

    public DataSyncEngine(DatabaseClient client, ExecutionEngine engine, List<TableExtractor> extractors,
                          InsertConflictTransformer transformer) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.extractors = List.copyOf(extractors);
        this.transformer = transformer;
    }

    /**
     * @throws ExecutionFailure if a load fails with unexpected output; tables whose rows cannot be extracted
     *                          are reported as failed and the remaining tables still load
     */
    public SyncReport sync(EndpointCursor source, EndpointCursor target, List<TableRef> tables, SyncMode mode) {
        SyncReport report = new SyncReport();
        if (tables.isEmpty()) {
            return report;
        }
        if (!mode.isIncremental()) {
            List<TableRef> cascaded = cascadeTargets(target, tables);
            if (!cascaded.isEmpty()) {
                LOGGER.warn("TRUNCATE ... CASCADE also empties {} target tables outside the sync set: {}",
                        cascaded.size(), cascaded);
                report.cascadeTruncated(cascaded);
            }
            LOGGER.info("Truncating {} target tables", tables.size());
            engine.runScript("truncate " + tables.size() + " tables", PostgresDdl.truncate(tables), target, mode);
        }
        for (TableRef table : tables) {
            report.record(syncTable(source, target, table, mode));
        }
        return report;
    }

    private TableSyncResult syncTable(EndpointCursor source, EndpointCursor target, TableRef table, SyncMode mode) {
        TableSyncResult.TableSyncResultBuilder result = TableSyncResult.builder().table(table);
        long before = count(target, table, result);
        long sourceRows = count(source, table, result);
        result.targetRowsBefore(before).sourceRows(sourceRows);

        ExtractedTable extracted = extract(source, table, result);
        if (extracted == null) {
            LOGGER.warn("No extraction path produced rows for {}; skipping it", table);
            return result.status(TableSyncResult.Status.FAILED).targetRowsAfter(before).build();
        }

        OperationOutcome outcome = load(extracted, target, mode);
        long after = count(target, table, result);
        LOGGER.info("Loaded {} via {}: source {} rows, target {} -> {} rows",
                table, extracted.format(), sourceRows, before, after);
        if (!mode.isIncremental() && sourceRows >= 0 && after >= 0 && after != sourceRows) {
            LOGGER.error("{} holds {} rows after replace but the source has {}", table, after, sourceRows);
            return result.status(TableSyncResult.Status.ROW_COUNT_MISMATCH)
                    .targetRowsAfter(after)
                    .notes(outcome.getNotes())
                    .note("expected " + sourceRows + " rows after replace, found " + after)
                    .build();
        }
        return result.status(TableSyncResult.Status.LOADED)
                .targetRowsAfter(after)
                .notes(outcome.getNotes())
                .build();
    }

    private ExtractedTable extract(EndpointCursor source, TableRef table, TableSyncResult.TableSyncResultBuilder result) {
        for (TableExtractor extractor : extractors) {
            try {
                ExtractedTable extracted = extractor.extract(source.current().target(), table);
                result.path(extractor.name());
                return extracted;
            } catch (ExtractionException e) {
                LOGGER.warn("{} extraction of {} failed: {}", extractor.name(), table, e.getMessage());
                result.note(extractor.name() + " extraction failed: " + e.getMessage());
            }
        }
        return null;
    }

    private OperationOutcome load(ExtractedTable extracted, EndpointCursor target, SyncMode mode) {
        String label = "load " + extracted.table();
        if (extracted.format() == ExtractedTable.Format.SQL_INSERTS) {
            String body = mode.isIncremental() ? transformer.transform(extracted.content()) : extracted.content();
            return engine.runScript(label, REPLICA_ROLE + "\n" + body + "\n" + DEFAULT_ROLE + "\n", target, mode);
        }
        CopyLoad load = csvLoad(extracted, mode);
        return engine.run(label, conn -> client.copyIn(conn, load), target, mode);
    }

    static CopyLoad csvLoad(ExtractedTable extracted, SyncMode mode) {
        TableRef table = extracted.table();
        String columns = CsvCopyExtractor.columnList(extracted.columns());
        String copyOptions = " FROM STDIN WITH (FORMAT csv, HEADER true)";
        List<String> bestEffort = List.of(REPLICA_ROLE);

        if (!mode.isIncremental()) {
            return new CopyLoad(bestEffort, List.of(), "COPY " + table.qualified() + " (" + columns + ")" + copyOptions,
                    extracted.content(), List.of(DEFAULT_ROLE));
        }
        String stage = Sql.ident(STAGE_TABLE);
        List<String> setup = new ArrayList<>();
        setup.add("DROP TABLE IF EXISTS pg_temp." + stage);
        setup.add("CREATE TEMP TABLE " + stage + " AS SELECT " + columns + " FROM " + table.qualified() + " WITH NO DATA");
        List<String> finish = List.of(
                "INSERT INTO " + table.qualified() + " (" + columns + ") SELECT " + columns + " FROM " + stage
                        + " ON CONFLICT DO NOTHING",
                "DROP TABLE IF EXISTS pg_temp." + stage,
                DEFAULT_ROLE);
        return new CopyLoad(bestEffort, setup, "COPY " + stage + " (" + columns + ")" + copyOptions,
                extracted.content(), finish);
    }

    /**
     * Tables outside {@code tables} that reference them, directly or transitively, and are therefore emptied
     * by {@code TRUNCATE ... CASCADE}.
     */
    private List<TableRef> cascadeTargets(EndpointCursor target, List<TableRef> tables) {
        QueryResult edges;
        try {
            edges = engine.withRetry("foreign keys on " + target.getEnvironment(), target,
                    conn -> client.query(conn, FOREIGN_KEYS));
        } catch (ExecutionFailure e) {
            if (e.getKind() == ExecutionFailure.Kind.FATAL) {
                throw e;
            }
            LOGGER.warn("Cannot list foreign keys on {}; tables emptied by CASCADE are not reported: {}",
                    target.getEnvironment(), e.getLastOutput());
            return List.of();
        }

        Set<TableRef> reached = new LinkedHashSet<>(tables);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (QueryResult.Row row : edges.rows()) {
                TableRef parent = TableRef.of(row.require("parent_schema"), row.require("parent_table"));
                if (reached.contains(parent)
                        && reached.add(TableRef.of(row.require("child_schema"), row.require("child_table")))) {
                    grew = true;
                }
            }
        }
        reached.removeAll(tables);
        return List.copyOf(reached);
    }

    private long count(EndpointCursor cursor, TableRef table, TableSyncResult.TableSyncResultBuilder result) {
        try {
            return engine.withRetry("count " + table + " on " + cursor.getEnvironment(), cursor,
                    conn -> client.query(conn, PostgresDdl.countRows(table)).singleLong());
        } catch (ExecutionFailure e) {
            if (e.getKind() == ExecutionFailure.Kind.FATAL) {
                throw e;
            }
            result.note("row count unavailable on " + cursor.getEnvironment() + ": " + e.getLastOutput());
            return -1;
        }
    }
}
