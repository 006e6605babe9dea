package org.ferry.sync;

import org.ferry.connect.CopyLoad;
import org.ferry.connect.DatabaseClient;
import org.ferry.connect.EndpointCursor;
import org.ferry.connect.QueryResult;
import org.ferry.connect.ResolvedConnection;
import org.ferry.connect.ToolResult;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.OutputClassifier;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.Endpoint;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.plan.PostgresDdl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DataSyncEngineTest {

    private static final TableRef A = TableRef.of("public", "a");
    private static final TableRef B = TableRef.of("public", "b");
    private static final SyncMode INCREMENTAL = SyncMode.of(SyncMode.Scope.SCHEMA_AND_DATA, SyncMode.Strategy.INCREMENTAL);
    private static final SyncMode REPLACE = SyncMode.of(SyncMode.Scope.SCHEMA_AND_DATA, SyncMode.Strategy.REPLACE);

    DatabaseClient client;
    TableExtractor bulk;
    TableExtractor csv;
    EndpointCursor source;
    EndpointCursor target;
    ConnectionTarget sourceConn;
    ConnectionTarget targetConn;
    DataSyncEngine engine;

    @BeforeEach
    void setUp() {
        client = mock(DatabaseClient.class);
        bulk = mock(TableExtractor.class);
        csv = mock(TableExtractor.class);
        when(bulk.name()).thenReturn("bulk");
        when(csv.name()).thenReturn("csv");

        sourceConn = new ConnectionTarget(new Endpoint("src.example", 6543, "postgres.src", "shared_pooler"), "pw", "postgres");
        targetConn = new ConnectionTarget(new Endpoint("tgt.example", 6543, "postgres.tgt", "shared_pooler"), "pw", "postgres");
        source = cursor("prod", sourceConn);
        target = cursor("test", targetConn);

        when(client.execute(any(), anyString())).thenReturn(ToolResult.success(""));
        when(client.query(any(), eq(DataSyncEngine.FOREIGN_KEYS))).thenReturn(QueryResult.empty());
        rows(sourceConn, A, 3);
        rows(targetConn, A, 1);
        rows(sourceConn, B, 0);
        rows(targetConn, B, 0);

        ExecutionEngine executionEngine = new ExecutionEngine(client, OutputClassifier.withDefaultRules());
        engine = new DataSyncEngine(client, executionEngine, List.of(bulk, csv), new InsertConflictTransformer());
    }

    private static EndpointCursor cursor(String env, ConnectionTarget conn) {
        EndpointCursor cursor = mock(EndpointCursor.class);
        when(cursor.getEnvironment()).thenReturn(env);
        when(cursor.current()).thenReturn(new ResolvedConnection(env, conn));
        return cursor;
    }

    private void rows(ConnectionTarget conn, TableRef table, long count) {
        when(client.query(conn, PostgresDdl.countRows(table))).thenReturn(count(count));
    }

    private static QueryResult count(long count) {
        return QueryResult.of(List.of(Map.of("row_count", Long.toString(count))));
    }

    private static Map<String, String> foreignKey(TableRef child, TableRef parent) {
        return Map.of("child_schema", child.schema(), "child_table", child.name(),
                "parent_schema", parent.schema(), "parent_table", parent.name());
    }

    @Test
    @DisplayName("Replace truncates every table once, before the first load, and loads dumps verbatim")
    void replaceTruncatesThenLoads() {
        when(bulk.extract(sourceConn, A)).thenReturn(ExtractedTable.sql(A, "INSERT INTO public.a VALUES (1);"));
        when(bulk.extract(sourceConn, B)).thenReturn(ExtractedTable.sql(B, ""));
        when(client.query(targetConn, PostgresDdl.countRows(A))).thenReturn(count(0), count(3));

        SyncReport report = engine.sync(source, target, List.of(A, B), REPLACE);

        InOrder order = inOrder(client);
        order.verify(client).execute(targetConn, "TRUNCATE TABLE \"public\".\"a\", \"public\".\"b\" RESTART IDENTITY CASCADE;");
        order.verify(client).execute(targetConn, DataSyncEngine.REPLICA_ROLE + "\nINSERT INTO public.a VALUES (1);\n"
                + DataSyncEngine.DEFAULT_ROLE + "\n");
        assertThat(report.getTables()).extracting(TableSyncResult::getTable).containsExactly(A, B);
        assertThat(report.hasFailures()).isFalse();
        assertThat(report.getCascadeTruncated()).isEmpty();
    }

    @Test
    @DisplayName("Under replace a target that does not end with the source row count is a failed table")
    void replaceRowCountMismatch() {
        when(bulk.extract(sourceConn, A)).thenReturn(ExtractedTable.sql(A, "INSERT INTO public.a VALUES (1);"));
        when(client.query(targetConn, PostgresDdl.countRows(A))).thenReturn(count(0), count(1));

        SyncReport report = engine.sync(source, target, List.of(A), REPLACE);

        TableSyncResult result = report.getTables().get(0);
        assertThat(result.getStatus()).isEqualTo(TableSyncResult.Status.ROW_COUNT_MISMATCH);
        assertThat(result.getTargetRowsAfter()).isEqualTo(1);
        assertThat(result.getNotes()).contains("expected 3 rows after replace, found 1");
        assertThat(report.hasFailures()).isTrue();
        assertThat(report.failedTables()).containsExactly(A);
    }

    @Test
    @DisplayName("Incremental loads accept a target that already held more rows than the source")
    void incrementalCountsMayDiffer() {
        when(bulk.extract(sourceConn, A)).thenReturn(ExtractedTable.sql(A, "INSERT INTO public.a VALUES (1);"));
        when(client.query(targetConn, PostgresDdl.countRows(A))).thenReturn(count(5), count(6));

        SyncReport report = engine.sync(source, target, List.of(A), INCREMENTAL);

        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    @DisplayName("Target tables emptied through CASCADE that were not synced are reported, transitively")
    void cascadeTargetsReported() {
        TableRef audit = TableRef.of("public", "a_audit");
        TableRef auditNotes = TableRef.of("audit", "notes");
        when(client.query(targetConn, DataSyncEngine.FOREIGN_KEYS)).thenReturn(QueryResult.of(List.of(
                foreignKey(auditNotes, audit),
                foreignKey(audit, A),
                foreignKey(B, A))));
        when(bulk.extract(sourceConn, A)).thenReturn(ExtractedTable.sql(A, "INSERT INTO public.a VALUES (1);"));
        when(bulk.extract(sourceConn, B)).thenReturn(ExtractedTable.sql(B, ""));
        when(client.query(targetConn, PostgresDdl.countRows(A))).thenReturn(count(0), count(3));

        SyncReport report = engine.sync(source, target, List.of(A, B), REPLACE);

        assertThat(report.getCascadeTruncated()).containsExactly(audit, auditNotes);
        assertThat(report.hasFailures()).isFalse();
    }

    @Test
    @DisplayName("Incremental loads never truncate and skip rows whose key already exists")
    void incrementalAddsConflictClause() {
        when(bulk.extract(sourceConn, A)).thenReturn(ExtractedTable.sql(A, "INSERT INTO public.a VALUES (1);"));

        SyncReport report = engine.sync(source, target, List.of(A), INCREMENTAL);

        verify(client, never()).execute(any(), eq(PostgresDdl.truncate(List.of(A))));
        verify(client).execute(targetConn, DataSyncEngine.REPLICA_ROLE
                + "\nINSERT INTO public.a VALUES (1) ON CONFLICT DO NOTHING;\n" + DataSyncEngine.DEFAULT_ROLE + "\n");
        TableSyncResult result = report.getTables().get(0);
        assertThat(result.getStatus()).isEqualTo(TableSyncResult.Status.LOADED);
        assertThat(result.getPath()).isEqualTo("bulk");
        assertThat(result.getSourceRows()).isEqualTo(3);
        assertThat(result.getTargetRowsBefore()).isEqualTo(1);
    }

    @Test
    @DisplayName("When the dump fails the CSV path is used and the failure is noted")
    void fallsBackToCsv() {
        when(bulk.extract(sourceConn, A)).thenThrow(new ExtractionException("pg_dump of public.a failed (exit 127)"));
        when(csv.extract(sourceConn, A)).thenReturn(ExtractedTable.csv(A, "id,name\n1,x\n", List.of("id", "name")));
        when(client.copyIn(eq(targetConn), any())).thenReturn(ToolResult.success("COPY 1"));

        SyncReport report = engine.sync(source, target, List.of(A), INCREMENTAL);

        TableSyncResult result = report.getTables().get(0);
        assertThat(result.getPath()).isEqualTo("csv");
        assertThat(result.getNotes()).contains("bulk extraction failed: pg_dump of public.a failed (exit 127)");
        ArgumentCaptor<CopyLoad> load = ArgumentCaptor.forClass(CopyLoad.class);
        verify(client).copyIn(eq(targetConn), load.capture());
        assertThat(load.getValue().data()).isEqualTo("id,name\n1,x\n");
    }

    @Test
    @DisplayName("A table no extractor can read is reported as failed and the next table still loads")
    void unreadableTableIsSkipped() {
        when(bulk.extract(sourceConn, A)).thenThrow(new ExtractionException("dump failed"));
        when(csv.extract(sourceConn, A)).thenThrow(new ExtractionException("copy failed"));
        when(bulk.extract(sourceConn, B)).thenReturn(ExtractedTable.sql(B, "INSERT INTO public.b VALUES (1);"));

        SyncReport report = engine.sync(source, target, List.of(A, B), INCREMENTAL);

        assertThat(report.hasFailures()).isTrue();
        assertThat(report.getTables()).extracting(TableSyncResult::getStatus)
                .containsExactly(TableSyncResult.Status.FAILED, TableSyncResult.Status.LOADED);
        assertThat(report.getTables().get(0).getTargetRowsAfter()).isEqualTo(1);
    }

    @Test
    void nothingToSync() {
        SyncReport report = engine.sync(source, target, List.of(), REPLACE);

        assertThat(report.getTables()).isEmpty();
        verify(client, never()).execute(any(), anyString());
    }

    @Test
    @DisplayName("Incremental CSV loads stage rows in a temp table and insert with ON CONFLICT DO NOTHING")
    void incrementalCsvLoad() {
        CopyLoad load = DataSyncEngine.csvLoad(ExtractedTable.csv(A, "id\n1\n", List.of("id")), INCREMENTAL);

        assertThat(load.bestEffortStatements()).containsExactly(DataSyncEngine.REPLICA_ROLE);
        assertThat(load.setupStatements()).containsExactly(
                "DROP TABLE IF EXISTS pg_temp.\"ferry_stage\"",
                "CREATE TEMP TABLE \"ferry_stage\" AS SELECT \"id\" FROM \"public\".\"a\" WITH NO DATA");
        assertThat(load.copySql()).isEqualTo("COPY \"ferry_stage\" (\"id\") FROM STDIN WITH (FORMAT csv, HEADER true)");
        assertThat(load.finishStatements()).containsExactly(
                "INSERT INTO \"public\".\"a\" (\"id\") SELECT \"id\" FROM \"ferry_stage\" ON CONFLICT DO NOTHING",
                "DROP TABLE IF EXISTS pg_temp.\"ferry_stage\"",
                DataSyncEngine.DEFAULT_ROLE);
    }

    @Test
    void replaceCsvLoadCopiesStraightIntoTheTable() {
        CopyLoad load = DataSyncEngine.csvLoad(ExtractedTable.csv(A, "id\n1\n", List.of("id")), REPLACE);

        assertThat(load.setupStatements()).isEmpty();
        assertThat(load.copySql()).isEqualTo("COPY \"public\".\"a\" (\"id\") FROM STDIN WITH (FORMAT csv, HEADER true)");
        assertThat(load.finishStatements()).containsExactly(DataSyncEngine.DEFAULT_ROLE);
    }
}
