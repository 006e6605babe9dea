package org.ferry.report;

import org.ferry.execute.ExecutionReport;
import org.ferry.execute.OperationOutcome;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanGenerator;
import org.ferry.plan.PlanSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ferry.Fixtures.column;
import static org.ferry.Fixtures.table;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportWriterTest {

    private final ReportWriter writer = new ReportWriter();

    @Test
    @DisplayName("report.json carries status, plan summary and outcomes")
    void writeReport_createsDirectoryAndJson(@TempDir Path tempDir) throws IOException {
        // given
        ReconciliationReport report = new ReconciliationReport();
        report.setSource("prod");
        report.setTarget("test");
        report.setMode(SyncMode.schemaOnly());
        report.setStatus(RunStatus.SUCCEEDED);
        report.setPlanSummary(new PlanSummary(2, 0, 1));
        report.setDestructiveOperations(List.of("DROP_COLUMN public.orders.legacy"));
        ExecutionReport execution = new ExecutionReport();
        execution.record(OperationOutcome.builder()
                .label("ADD_COLUMN public.orders.status")
                .status(OperationOutcome.Status.APPLIED)
                .endpoint("shared_pooler")
                .build());
        report.setExecution(execution);
        Path runDir = tempDir.resolve("20260101_120000_prod_to_test");

        // when
        Path file = writer.writeReport(runDir, report);

        // then
        assertTrue(Files.isRegularFile(file));
        assertThat(file.getFileName().toString()).isEqualTo("report.json");
        assertThat(Files.readString(file))
                .contains("\"status\" : \"SUCCEEDED\"")
                .contains("\"scope\" : \"SCHEMA_ONLY\"")
                .contains("\"added\" : 2")
                .contains("DROP_COLUMN public.orders.legacy")
                .contains("ADD_COLUMN public.orders.status");
    }

    @Test
    void writePlan_rendersScript(@TempDir Path tempDir) throws IOException {
        Snapshot source = Snapshot.builder().table(table("orders")).column(column("orders", "id", "bigint", 1)).build();
        MigrationPlan plan = new PlanGenerator().generate(source, Snapshot.builder().build(), SyncMode.schemaOnly());

        Path file = writer.writePlan(tempDir, plan, "prod", "test");

        assertThat(file.getFileName().toString()).isEqualTo("plan.sql");
        assertThat(Files.readString(file))
                .startsWith("-- Ferry reconciliation plan")
                .contains("-- ferry:source=prod")
                .contains("CREATE TABLE IF NOT EXISTS \"public\".\"orders\"");
    }
}
