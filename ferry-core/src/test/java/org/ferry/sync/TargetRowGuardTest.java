package org.ferry.sync;

import org.ferry.connect.DatabaseClient;
import org.ferry.connect.EndpointCursor;
import org.ferry.connect.QueryResult;
import org.ferry.connect.ResolvedConnection;
import org.ferry.connect.ToolResult;
import org.ferry.execute.ExecutionEngine;
import org.ferry.execute.ExecutionFailure;
import org.ferry.execute.OutputClassifier;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.Endpoint;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanGenerator;
import org.ferry.plan.PostgresDdl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.table;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TargetRowGuardTest {

    private static final TableRef T = TableRef.of("public", "t");
    private static final TableRef BACKUP = TableRef.of("ferry_backup", "public__t");
    private static final SyncMode SCHEMA_REPLACE = SyncMode.of(SyncMode.Scope.SCHEMA_ONLY, SyncMode.Strategy.REPLACE);

    DatabaseClient client;
    EndpointCursor target;
    ConnectionTarget conn;
    TargetRowGuard guard;
    MigrationPlan dropColumnPlan;

    @BeforeEach
    void setUp() {
        client = mock(DatabaseClient.class);
        conn = new ConnectionTarget(new Endpoint("tgt.example", 5432, "postgres", "direct"), "pw", "postgres");
        target = mock(EndpointCursor.class);
        when(target.current()).thenReturn(new ResolvedConnection("test", conn));
        when(client.execute(any(), anyString())).thenReturn(ToolResult.success(""));
        guard = new TargetRowGuard(client, new ExecutionEngine(client, OutputClassifier.withDefaultRules()));

        Snapshot source = Snapshot.builder().environment("prod")
                .table(table("t")).column(column("t", "id", "bigint", 1)).column(column("t", "name", "text", 2))
                .build();
        Snapshot current = Snapshot.builder().environment("test")
                .table(table("t")).column(column("t", "id", "bigint", 1)).column(column("t", "name", "text", 2))
                .column(column("t", "legacy", "text", 3))
                .build();
        dropColumnPlan = new PlanGenerator().generate(source, current, SCHEMA_REPLACE);
    }

    private void counts(Long first, Long... rest) {
        when(client.query(conn, PostgresDdl.countRows(T))).thenReturn(count(first), Arrays.stream(rest)
                .map(TargetRowGuardTest::count).toArray(QueryResult[]::new));
    }

    private static QueryResult count(long n) {
        return QueryResult.of(List.of(Map.of("row_count", Long.toString(n))));
    }

    private void columns(String relation, String... names) {
        List<Map<String, String>> rows = Arrays.stream(names)
                .map(n -> Map.of("column_name", n, "formatted_type", n.equals("id") ? "bigint" : "text"))
                .toList();
        when(client.query(eq(conn), argThat((String sql) -> sql != null && sql.contains("pg_attribute")
                && sql.contains("'" + relation + "'")))).thenReturn(QueryResult.of(rows));
    }

    @Test
    @DisplayName("Only schema-only runs with column drops, type changes or constraint drops are guarded")
    void tablesAtRisk() {
        assertThat(guard.tablesAtRisk(dropColumnPlan)).containsExactly(T);

        Snapshot source = Snapshot.builder().environment("prod").table(table("t")).build();
        Snapshot current = Snapshot.builder().environment("test").table(table("t"))
                .column(column("t", "legacy", "text", 1)).build();
        MigrationPlan withData = new PlanGenerator().generate(source, current,
                SyncMode.of(SyncMode.Scope.SCHEMA_AND_DATA, SyncMode.Strategy.REPLACE));
        assertThat(guard.tablesAtRisk(withData)).isEmpty();
    }

    @Test
    void emptyTablesAreNotBackedUp() {
        counts(0L);

        assertThat(guard.protect(dropColumnPlan, target)).isEmpty();
        verify(client, never()).execute(any(), anyString());
    }

    @Test
    @DisplayName("Rows lost by the change are re-inserted over the shared columns and the backup dropped")
    void restoresLostRows() {
        counts(5L, 3L, 5L);
        columns("t", "id", "name");
        columns("public__t", "id", "name", "legacy");

        List<GuardedTable> guarded = guard.protect(dropColumnPlan, target);
        assertThat(guarded).containsExactly(new GuardedTable(T, BACKUP, 5));
        verify(client).execute(conn, """
                CREATE SCHEMA IF NOT EXISTS "ferry_backup";
                DROP TABLE IF EXISTS "ferry_backup"."public__t";
                CREATE TABLE "ferry_backup"."public__t" AS TABLE "public"."t";
                """);

        List<RestoreResult> results = guard.restore(guarded, target, SCHEMA_REPLACE);

        verify(client).execute(conn, """
                SET session_replication_role = replica;
                INSERT INTO "public"."t" ("id", "name")
                SELECT "id"::bigint, "name"::text FROM "ferry_backup"."public__t"
                ON CONFLICT DO NOTHING;
                SET session_replication_role = DEFAULT;
                """);
        verify(client).execute(conn, "DROP TABLE IF EXISTS \"ferry_backup\".\"public__t\";");
        assertThat(results).containsExactly(new RestoreResult(T, 5, 3, 2, "restored from backup"));
    }

    @Test
    void nothingLostOnlyDropsTheBackup() {
        counts(5L, 5L);

        List<RestoreResult> results = guard.restore(guard.protect(dropColumnPlan, target), target, SCHEMA_REPLACE);

        assertThat(results).containsExactly(new RestoreResult(T, 5, 5, 0, "no rows lost"));
        verify(client).execute(conn, "DROP TABLE IF EXISTS \"ferry_backup\".\"public__t\";");
        verify(client, never()).execute(eq(conn), startsWith("SET session_replication_role"));
    }

    @Test
    @DisplayName("A failed restore keeps the backup and propagates")
    void failedRestoreKeepsBackup() {
        counts(5L, 2L);
        columns("t", "id");
        columns("public__t", "id");
        when(client.execute(eq(conn), startsWith("SET session_replication_role")))
                .thenReturn(ToolResult.failure("ERROR:  invalid input syntax for type bigint"));
        List<GuardedTable> guarded = guard.protect(dropColumnPlan, target);

        assertThatThrownBy(() -> guard.restore(guarded, target, SCHEMA_REPLACE))
                .isInstanceOf(ExecutionFailure.class);
        verify(client, never()).execute(conn, "DROP TABLE IF EXISTS \"ferry_backup\".\"public__t\";");
    }
}
