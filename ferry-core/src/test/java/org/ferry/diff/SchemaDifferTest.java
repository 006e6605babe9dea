package org.ferry.diff;

import org.ferry.model.ColumnDescriptor;
import org.ferry.model.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.policy;
import static org.ferry.Fixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaDifferTest {

    static class RecordingDiffer implements Differ {
        private final String name;
        RecordingDiffer(String name) { this.name = name; }
        @Override public void diff(Snapshot source, Snapshot target, SchemaDiff result) {
            result.getWarnings().add("RUN:" + name);
        }
    }

    static class ThrowingDiffer implements Differ {
        @Override public void diff(Snapshot source, Snapshot target, SchemaDiff result) {
            throw new IllegalStateException("boom");
        }
    }

    private static Snapshot empty(String env) {
        return Snapshot.builder().environment(env).build();
    }

    @Test
    void pipeline_runs_in_given_order() {
        SchemaDiffer differ = new SchemaDiffer(List.of(
                new RecordingDiffer("A"), new RecordingDiffer("B"), new RecordingDiffer("C")));

        SchemaDiff out = differ.diff(empty("prod"), empty("test"));

        assertEquals(List.of("RUN:A", "RUN:B", "RUN:C"), out.getWarnings());
    }

    @Test
    void exceptions_from_one_differ_are_captured_and_do_not_block_others() {
        SchemaDiffer differ = new SchemaDiffer(List.of(
                new RecordingDiffer("A"), new ThrowingDiffer(), new RecordingDiffer("C")));

        SchemaDiff out = differ.diff(empty("prod"), empty("test"));

        assertTrue(out.getWarnings().contains("RUN:A"));
        assertTrue(out.getWarnings().stream().anyMatch(s ->
                s.startsWith("Differ failed: ThrowingDiffer") && s.contains("IllegalStateException") && s.contains("boom")));
        assertTrue(out.getWarnings().contains("RUN:C"));
    }

    @Test
    @DisplayName("Column only in source is reported as added")
    void addedColumn() {
        Snapshot source = Snapshot.builder().environment("prod")
                .table(table("orders"))
                .column(column("orders", "id", "bigint", 1))
                .column(column("orders", "total", "numeric", 2))
                .build();
        Snapshot target = Snapshot.builder().environment("test")
                .table(table("orders"))
                .column(column("orders", "id", "bigint", 1))
                .build();

        SchemaDiff diff = new SchemaDiffer().diff(source, target);

        assertThat(diff.getColumns().getAdded()).extracting(ColumnDescriptor::key).containsExactly("public.orders.total");
        assertThat(diff.getColumns().getRemoved()).isEmpty();
        assertThat(diff.getColumns().getChanged()).isEmpty();
        assertThat(diff.getTables().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Role change on a policy is reported as a change of the roles field")
    void policyRoleChange() {
        Snapshot source = Snapshot.builder().environment("prod")
                .table(table("t"))
                .policy(policy("t", "p1", List.of("authenticated"), "true"))
                .build();
        Snapshot target = Snapshot.builder().environment("test")
                .table(table("t"))
                .policy(policy("t", "p1", List.of("anon"), "true"))
                .build();

        SchemaDiff diff = new SchemaDiffer().diff(source, target);

        assertThat(diff.getPolicies().getChanged()).hasSize(1);
        Change<?> change = diff.getPolicies().getChanged().get(0);
        assertThat(change.getKey()).isEqualTo("public.t.p1");
        assertThat(change.getFields()).containsExactly("roles");
    }

    @Test
    @DisplayName("Identical snapshots produce an empty diff")
    void identical() {
        Snapshot a = Snapshot.builder().environment("prod")
                .table(table("t")).column(column("t", "id", "integer", 1)).build();
        Snapshot b = Snapshot.builder().environment("test")
                .table(table("t")).column(column("t", "id", "integer", 1)).build();

        SchemaDiff diff = new SchemaDiffer().diff(a, b);

        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.getWarnings()).isEmpty();
    }
}
