package org.ferry.plan;

import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.notNullColumn;
import static org.ferry.Fixtures.policy;
import static org.ferry.Fixtures.rlsTable;
import static org.ferry.Fixtures.table;

class PlanScriptWriterTest {

    private final PlanGenerator generator = new PlanGenerator();
    private final PlanScriptWriter writer = new PlanScriptWriter();

    @Test
    @DisplayName("Header names both environments, the mode and the summary")
    void header() {
        Snapshot snapshot = Snapshot.builder().environment("prod").table(table("t")).build();
        MigrationPlan plan = generator.generate(snapshot, snapshot, SyncMode.schemaOnly());

        String script = writer.render(plan, "prod", "test");

        assertThat(script).startsWith("-- Ferry reconciliation plan\n")
                .contains("-- ferry:source=prod\n")
                .contains("-- ferry:target=test\n")
                .contains("-- ferry:mode=SCHEMA_ONLY/INCREMENTAL\n")
                .contains("-- ferry:summary=0 added, 0 removed, 0 changed\n");
    }

    @Test
    @DisplayName("Policy groups are wrapped in BEGIN/COMMIT and phases are labelled")
    void groupsAndPhases() {
        Snapshot source = Snapshot.builder().environment("prod")
                .table(rlsTable("t"))
                .column(column("t", "id", "int", 1))
                .column(notNullColumn("t", "name", "text", 2))
                .policy(policy("t", "p1", List.of("authenticated"), "true"))
                .build();
        Snapshot target = Snapshot.builder().environment("test")
                .table(rlsTable("t"))
                .column(column("t", "id", "int", 1))
                .build();

        String script = writer.render(generator.generate(source, target, SyncMode.schemaOnly()), "prod", "test");

        assertThat(script).contains("\n-- PRE_DATA\nALTER TABLE \"public\".\"t\" ADD COLUMN \"name\" text;\n");
        assertThat(script).contains("-- POST_DATA\n-- runs only if public.t.name holds no NULLs\n"
                + "ALTER TABLE \"public\".\"t\" ALTER COLUMN \"name\" SET NOT NULL;\n"
                + "BEGIN;\n"
                + "ALTER TABLE \"public\".\"t\" ENABLE ROW LEVEL SECURITY;\n"
                + "CREATE POLICY \"p1\" ON \"public\".\"t\" FOR SELECT TO \"authenticated\" USING (true);\n"
                + "COMMIT;\n");
    }

    @Test
    @DisplayName("Destructive statements are flagged and withheld ones listed as comments")
    void destructiveAndWithheld() {
        Snapshot source = Snapshot.builder().environment("prod").table(table("t")).build();
        Snapshot target = Snapshot.builder().environment("test")
                .table(table("t"))
                .column(column("t", "legacy", "text", 1))
                .build();

        String replace = writer.render(generator.generate(source, target,
                SyncMode.of(SyncMode.Scope.SCHEMA_ONLY, SyncMode.Strategy.REPLACE)), "prod", "test");
        String incremental = writer.render(generator.generate(source, target, SyncMode.schemaOnly()), "prod", "test");

        assertThat(replace).contains("-- destructive\nALTER TABLE \"public\".\"t\" DROP COLUMN IF EXISTS \"legacy\";\n")
                .doesNotContain("-- withheld");
        assertThat(incremental).contains("\n-- withheld\n-- ALTER TABLE \"public\".\"t\" DROP COLUMN IF EXISTS \"legacy\";\n")
                .doesNotContain("-- PRE_DATA");
    }

    @Test
    void loadsAreCommentedOut() {
        Snapshot snapshot = Snapshot.builder().environment("prod").table(table("t")).build();
        MigrationPlan plan = generator.generate(snapshot, snapshot,
                SyncMode.of(SyncMode.Scope.DATA_ONLY, SyncMode.Strategy.INCREMENTAL));

        assertThat(writer.render(plan, "prod", "test")).contains("-- DATA\n-- load rows of public.t\n");
    }
}
