package org.ferry.execute;

import org.ferry.connect.DatabaseAccessException;
import org.ferry.connect.DatabaseClient;
import org.ferry.connect.EndpointCursor;
import org.ferry.connect.QueryResult;
import org.ferry.connect.ResolvedConnection;
import org.ferry.connect.ToolResult;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.Endpoint;
import org.ferry.model.SyncMode;
import org.ferry.model.TableRef;
import org.ferry.plan.Operation;
import org.ferry.plan.OperationKind;
import org.ferry.plan.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionEngineTest {

    private static final SyncMode MODE = SyncMode.schemaOnly();
    private static final TableRef ORDERS = TableRef.of("public", "orders");

    DatabaseClient client;
    EndpointCursor cursor;
    ResolvedConnection pooler;
    ResolvedConnection direct;
    ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        client = mock(DatabaseClient.class);
        cursor = mock(EndpointCursor.class);
        pooler = connection("shared_pooler", "aws-1-us-east-2.pooler.supabase.com");
        direct = connection("direct", "db.tgt.supabase.co");
        when(cursor.current()).thenReturn(pooler);
        engine = new ExecutionEngine(client, OutputClassifier.withDefaultRules());
    }

    private static ResolvedConnection connection(String label, String host) {
        return new ResolvedConnection("test", new ConnectionTarget(new Endpoint(host, 5432, "postgres", label), "pw", "postgres"));
    }

    private static Operation statement(OperationKind kind, String sql) {
        return Operation.builder().kind(kind).phase(Phase.PRE_DATA).targetObject("public.orders").sql(sql).table(ORDERS).build();
    }

    private static Operation grouped(OperationKind kind, String sql) {
        return statement(kind, sql).toBuilder().phase(Phase.POST_DATA).transactionGroup("rls:public.orders").build();
    }

    @Test
    @DisplayName("Operations of one group run as a single BEGIN/COMMIT script")
    void groupRunsInOneTransaction() {
        when(client.execute(any(), anyString())).thenReturn(ToolResult.success(""));

        ExecutionReport report = engine.apply(List.of(
                grouped(OperationKind.ENABLE_RLS, "ALTER TABLE t ENABLE ROW LEVEL SECURITY;"),
                grouped(OperationKind.DROP_POLICY, "DROP POLICY IF EXISTS p ON t;"),
                grouped(OperationKind.CREATE_POLICY, "CREATE POLICY p ON t;"),
                statement(OperationKind.GRANT, "GRANT SELECT ON TABLE t TO anon;")
        ), cursor, MODE);

        ArgumentCaptor<String> scripts = ArgumentCaptor.forClass(String.class);
        verify(client, times(2)).execute(eq(pooler.target()), scripts.capture());
        assertThat(scripts.getAllValues().get(0)).isEqualTo("""
                BEGIN;
                ALTER TABLE t ENABLE ROW LEVEL SECURITY;
                DROP POLICY IF EXISTS p ON t;
                CREATE POLICY p ON t;
                COMMIT;
                """);
        assertThat(report.getOutcomes()).extracting(OperationOutcome::getLabel)
                .containsExactly("rls:public.orders (3 statements)", "GRANT public.orders");
        assertThat(report.count(OperationOutcome.Status.APPLIED)).isEqualTo(2);
    }

    @Test
    @DisplayName("An error psql would tolerate alone fails a group, because the whole transaction was rolled back")
    void toleratedErrorInsideGroupFails() {
        when(client.execute(any(), anyString())).thenReturn(ToolResult.success("""
                ERROR:  role "service_role" does not exist
                ROLLBACK
                """));

        assertThatThrownBy(() -> engine.apply(List.of(
                grouped(OperationKind.DROP_POLICY, "DROP POLICY IF EXISTS p ON t;"),
                grouped(OperationKind.CREATE_POLICY, "CREATE POLICY p ON t TO service_role;")
        ), cursor, MODE))
                .isInstanceOf(ExecutionFailure.class)
                .satisfies(e -> {
                    ExecutionFailure failure = (ExecutionFailure) e;
                    assertThat(failure.getKind()).isEqualTo(ExecutionFailure.Kind.UNEXPECTED);
                    assertThat(failure.getLastOutput()).contains("role \"service_role\" does not exist")
                            .endsWith("(transaction rolled back)");
                });
    }

    @Test
    @DisplayName("The same error outside a group is still tolerated")
    void toleratedErrorOutsideGroup() {
        when(client.execute(any(), anyString())).thenReturn(ToolResult.success("ERROR:  role \"service_role\" does not exist\n"));

        ExecutionReport report = engine.apply(List.of(
                statement(OperationKind.GRANT, "GRANT SELECT ON TABLE t TO service_role;")), cursor, MODE);

        assertThat(report.count(OperationOutcome.Status.TOLERATED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Loads carry no SQL and are left to the data sync")
    void loadsAreSkipped() {
        Operation load = Operation.builder().kind(OperationKind.LOAD_TABLE_DATA).phase(Phase.DATA)
                .targetObject("public.orders").table(ORDERS).build();

        ExecutionReport report = engine.apply(List.of(load), cursor, MODE);

        assertThat(report.getOutcomes()).isEmpty();
        verify(client, never()).execute(any(), anyString());
    }

    @Test
    @DisplayName("Tolerated errors are recorded on the outcome")
    void toleratedOutcome() {
        when(client.execute(any(), anyString()))
                .thenReturn(ToolResult.success("ERROR:  relation \"orders\" already exists"));

        ExecutionReport report = engine.apply(List.of(statement(OperationKind.CREATE_TABLE, "CREATE TABLE orders ();")),
                cursor, MODE);

        assertThat(report.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(OperationOutcome.Status.TOLERATED);
            assertThat(o.getNotes()).containsExactly("ERROR:  relation \"orders\" already exists");
            assertThat(o.getEndpoint()).isEqualTo("shared_pooler");
        });
    }

    @Test
    @DisplayName("A connection-level failure moves to the next endpoint and retries there")
    void fatalFailsOver() {
        when(cursor.current()).thenReturn(pooler, direct);
        when(cursor.advance()).thenReturn(Optional.of(direct));
        when(client.execute(eq(pooler.target()), anyString()))
                .thenReturn(ToolResult.failure("psql: error: FATAL:  Tenant or user not found"));
        when(client.execute(eq(direct.target()), anyString())).thenReturn(ToolResult.success("ALTER TABLE"));

        ExecutionReport report = engine.apply(List.of(statement(OperationKind.ADD_COLUMN, "ALTER TABLE t ADD COLUMN c int;")),
                cursor, MODE);

        assertThat(report.getOutcomes()).singleElement()
                .extracting(OperationOutcome::getEndpoint).isEqualTo("direct");
        verify(cursor).advance();
    }

    @Test
    void fatalOnLastEndpointFails() {
        when(cursor.advance()).thenReturn(Optional.empty());
        when(client.execute(any(), anyString())).thenReturn(ToolResult.failure("FATAL:  too many connections"));

        assertThatThrownBy(() -> engine.apply(List.of(statement(OperationKind.ADD_COLUMN, "ALTER TABLE t ADD COLUMN c int;")),
                cursor, MODE))
                .isInstanceOf(ExecutionFailure.class)
                .satisfies(e -> assertThat(((ExecutionFailure) e).getKind()).isEqualTo(ExecutionFailure.Kind.FATAL));
    }

    @Test
    @DisplayName("Unexpected errors abort without trying other endpoints")
    void unexpectedAborts() {
        when(client.execute(any(), anyString()))
                .thenReturn(ToolResult.success("ERROR:  syntax error at or near \"TABL\""));

        assertThatThrownBy(() -> engine.apply(List.of(
                statement(OperationKind.ADD_COLUMN, "ALTER TABL t;"),
                statement(OperationKind.GRANT, "GRANT SELECT ON TABLE t TO anon;")
        ), cursor, MODE))
                .isInstanceOf(ExecutionFailure.class)
                .satisfies(e -> {
                    ExecutionFailure failure = (ExecutionFailure) e;
                    assertThat(failure.getKind()).isEqualTo(ExecutionFailure.Kind.UNEXPECTED);
                    assertThat(failure.getLastOutput()).isEqualTo("ERROR:  syntax error at or near \"TABL\"");
                    assertThat(failure.getOperation()).isEqualTo("ADD_COLUMN public.orders");
                });
        verify(client, times(1)).execute(any(), anyString());
        verify(cursor, never()).advance();
    }

    @Test
    @DisplayName("Deferred SET NOT NULL is skipped and flagged for backfill while NULLs remain")
    void deferredNotNullWithNulls() {
        Operation setNotNull = Operation.builder()
                .kind(OperationKind.SET_NOT_NULL).phase(Phase.POST_DATA).deferred(true)
                .targetObject("public.orders.status").table(ORDERS).column("status")
                .sql("ALTER TABLE \"public\".\"orders\" ALTER COLUMN \"status\" SET NOT NULL;")
                .build();
        when(client.query(any(), eq("SELECT count(*) AS null_count FROM \"public\".\"orders\" WHERE \"status\" IS NULL")))
                .thenReturn(QueryResult.of(List.of(Map.of("null_count", "4"))));

        ExecutionReport report = engine.apply(List.of(setNotNull), cursor, MODE);

        verify(client, never()).execute(any(), anyString());
        assertThat(report.getManualBackfill()).containsExactly("public.orders.status");
        assertThat(report.getOutcomes()).singleElement().satisfies(o -> {
            assertThat(o.getStatus()).isEqualTo(OperationOutcome.Status.SKIPPED);
            assertThat(o.getNotes()).containsExactly("4 NULL values remain; backfill and set NOT NULL manually");
        });
    }

    @Test
    void deferredNotNullWithoutNullsRuns() {
        Operation setNotNull = Operation.builder()
                .kind(OperationKind.SET_NOT_NULL).phase(Phase.POST_DATA).deferred(true)
                .targetObject("public.orders.status").table(ORDERS).column("status")
                .sql("ALTER TABLE \"public\".\"orders\" ALTER COLUMN \"status\" SET NOT NULL;")
                .build();
        when(client.query(any(), anyString())).thenReturn(QueryResult.of(List.of(Map.of("null_count", "0"))));
        when(client.execute(any(), anyString())).thenReturn(ToolResult.success("ALTER TABLE"));

        ExecutionReport report = engine.apply(List.of(setNotNull), cursor, MODE);

        verify(client).execute(pooler.target(), setNotNull.getSql());
        assertThat(report.getManualBackfill()).isEmpty();
    }

    @Test
    @DisplayName("Queries fail over on lost sessions but not on statement errors")
    void withRetry() {
        when(cursor.current()).thenReturn(pooler, direct);
        when(cursor.advance()).thenReturn(Optional.of(direct));

        String result = engine.withRetry("count", cursor, target -> {
            if (target.equals(pooler.target())) {
                throw new DatabaseAccessException("FATAL: terminating connection due to administrator command");
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");

        assertThatThrownBy(() -> engine.withRetry("count", cursor, target -> {
            throw new DatabaseAccessException("ERROR: relation \"missing\" does not exist");
        }))
                .isInstanceOf(ExecutionFailure.class)
                .hasCauseInstanceOf(DatabaseAccessException.class);
    }
}
