package org.ferry.cli;

import org.ferry.FerryException;
import org.ferry.cli.service.ReconcilerFactory;
import org.ferry.config.FerryConfiguration.ProfileConfiguration;
import org.ferry.model.ColumnDescriptor;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.model.TableDescriptor;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanGenerator;
import org.ferry.reconcile.Reconciler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlanCommandTest {

    private ReconcilerFactory factory;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        factory = mock(ReconcilerFactory.class);
        reconciler = mock(Reconciler.class);
        ProfileConfiguration profile = new ProfileConfiguration();
        when(factory.loadProfile(any())).thenReturn(profile);
        when(factory.create(eq(profile), any())).thenReturn(reconciler);
    }

    private int execute(String... args) {
        return new CommandLine(new PlanCommand(factory)).execute(args);
    }

    @Test
    @DisplayName("Prints the plan script for the selected mode")
    void printsScript() {
        Snapshot source = Snapshot.builder()
                .table(TableDescriptor.builder().schema("public").name("orders").build())
                .column(ColumnDescriptor.builder().schema("public").tableName("orders").name("id")
                        .type("bigint").nullable(false).ordinalPosition(1).build())
                .build();
        MigrationPlan plan = new PlanGenerator().generate(source, Snapshot.builder().build(), SyncMode.schemaOnly());
        when(reconciler.plan(eq("prod"), eq("dev"), any())).thenReturn(plan);

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = execute("prod", "dev");

            assertThat(code).isEqualTo(0);
            assertThat(sc.out())
                    .contains("-- ferry:source=prod")
                    .contains("-- ferry:mode=SCHEMA_ONLY/INCREMENTAL")
                    .contains("CREATE TABLE IF NOT EXISTS \"public\".\"orders\"");
        }
    }

    @Test
    void emptyPlan() {
        MigrationPlan plan = new PlanGenerator().generate(Snapshot.builder().build(), Snapshot.builder().build(),
                SyncMode.schemaOnly());
        when(reconciler.plan(any(), any(), any())).thenReturn(plan);

        try (StreamCaptor sc = new StreamCaptor()) {
            assertThat(execute("prod", "dev")).isEqualTo(0);
            assertThat(sc.out()).contains("No changes detected.");
        }
    }

    @Test
    @DisplayName("A failure is reported with the stage it happened in")
    void failureCarriesStage() {
        when(reconciler.plan(any(), any(), any()))
                .thenThrow(new FerryException("Could not connect to environment 'dev'").atStage("CONNECT"));

        try (StreamCaptor sc = new StreamCaptor()) {
            int code = execute("prod", "dev");

            assertThat(code).isEqualTo(1);
            assertThat(sc.err()).contains("Planning failed: [CONNECT] Could not connect to environment 'dev'");
        }
    }
}
