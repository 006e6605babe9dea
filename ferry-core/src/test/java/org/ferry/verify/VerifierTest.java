package org.ferry.verify;

import org.ferry.diff.SchemaDiffer;
import org.ferry.introspect.SchemaIntrospector;
import org.ferry.model.IndexDescriptor;
import org.ferry.model.SequenceDescriptor;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.policy;
import static org.ferry.Fixtures.rlsTable;
import static org.ferry.Fixtures.table;
import static org.mockito.Mockito.mock;

class VerifierTest {

    private final Verifier verifier = new Verifier(mock(SchemaIntrospector.class), new SchemaDiffer());

    private final Snapshot source = Snapshot.builder().environment("prod")
            .table(rlsTable("t"))
            .column(column("t", "id", "int", 1))
            .policy(policy("t", "p1", List.of("authenticated"), "true"))
            .build();

    @Test
    void identicalSnapshotsAreClean() {
        Snapshot target = Snapshot.builder().environment("test")
                .table(rlsTable("t"))
                .column(column("t", "id", "int", 1))
                .policy(policy("t", "p1", List.of("authenticated"), "true"))
                .build();

        DriftReport report = verifier.compare(source, target, SyncMode.schemaOnly());

        assertThat(report.isClean()).isTrue();
        assertThat(report.isIdentical()).isTrue();
        assertThat(report.getItems()).isEmpty();
    }

    @Test
    @DisplayName("A policy whose roles still differ is genuine drift")
    void changedPolicyIsDrift() {
        Snapshot target = Snapshot.builder().environment("test")
                .table(rlsTable("t"))
                .column(column("t", "id", "int", 1))
                .policy(policy("t", "p1", List.of("anon"), "true"))
                .build();

        DriftReport report = verifier.compare(source, target, SyncMode.schemaOnly());

        assertThat(report.isClean()).isFalse();
        assertThat(report.isIdentical()).isFalse();
        assertThat(report.genuineDrift()).extracting(DriftItem::toString)
                .containsExactly("policies CHANGED public.t.p1 (roles)");
    }

    @Test
    @DisplayName("Target-only objects are expected under incremental and drift under replace")
    void targetOnlyObjects() {
        Snapshot target = Snapshot.builder().environment("test")
                .table(rlsTable("t"))
                .column(column("t", "id", "int", 1))
                .column(column("t", "extra", "text", 2))
                .policy(policy("t", "p1", List.of("authenticated"), "true"))
                .table(table("scratch"))
                .build();

        DriftReport incremental = verifier.compare(source, target, SyncMode.schemaOnly());
        DriftReport replace = verifier.compare(source, target,
                SyncMode.of(SyncMode.Scope.SCHEMA_ONLY, SyncMode.Strategy.REPLACE));

        assertThat(incremental.isClean()).isTrue();
        assertThat(incremental.expectedDifferences()).extracting(DriftItem::key)
                .containsExactly("public.scratch", "public.t.extra");
        assertThat(replace.genuineDrift()).extracting(DriftItem::detail).containsOnly("only on target");
    }

    @Test
    @DisplayName("Missing indexes and sequences count as drift like tables and policies")
    void indexesAndSequencesAreVerified() {
        Snapshot withObjects = Snapshot.builder().environment("prod")
                .table(rlsTable("t"))
                .index(IndexDescriptor.builder().schema("public").tableName("t").name("t_id_idx")
                        .definition("CREATE INDEX t_id_idx ON public.t USING btree (id)").build())
                .sequence(SequenceDescriptor.builder().schema("public").name("t_id_seq").dataType("integer").build())
                .build();
        Snapshot target = Snapshot.builder().environment("test").table(rlsTable("t")).build();

        DriftReport report = verifier.compare(withObjects, target, SyncMode.schemaOnly());

        assertThat(report.genuineDrift()).extracting(DriftItem::toString).containsExactlyInAnyOrder(
                "indexes ADDED public.t_id_idx (missing on target)",
                "sequences ADDED public.t_id_seq (missing on target)");
    }

    @Test
    @DisplayName("Objects missing on the target are drift under every strategy that touches the schema")
    void missingObjects() {
        Snapshot target = Snapshot.builder().environment("test").table(rlsTable("t")).build();

        DriftReport report = verifier.compare(source, target, SyncMode.schemaOnly());

        assertThat(report.genuineDrift()).extracting(DriftItem::category).containsExactly("columns", "policies");
        assertThat(report.genuineDrift()).allSatisfy(i -> assertThat(i.detail()).isEqualTo("missing on target"));
    }

    @Test
    void dataOnlyRunsExpectEveryStructuralDifference() {
        Snapshot target = Snapshot.builder().environment("test").build();

        DriftReport report = verifier.compare(source, target,
                SyncMode.of(SyncMode.Scope.DATA_ONLY, SyncMode.Strategy.REPLACE));

        assertThat(report.isClean()).isTrue();
        assertThat(report.expectedDifferences()).hasSize(3);
    }
}
