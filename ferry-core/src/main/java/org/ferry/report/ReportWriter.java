package org.ferry.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.ferry.options.FerryOptions;
import org.ferry.plan.MigrationPlan;
import org.ferry.plan.PlanScriptWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the run artifacts into the migration directory: the JSON report and the rendered plan script.
 */
public class ReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final PlanScriptWriter scriptWriter;

    public ReportWriter() {
        this(new PlanScriptWriter());
    }

    public ReportWriter(PlanScriptWriter scriptWriter) {
        this.scriptWriter = scriptWriter;
    }

    public Path writeReport(Path migrationDir, ReconciliationReport report) {
        Path file = migrationDir.resolve(FerryOptions.Output.REPORT_FILE);
        try {
            Files.createDirectories(migrationDir);
            objectMapper.writeValue(file.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report to " + file, e);
        }
        LOGGER.info("Report written to {}", file);
        return file;
    }

    public Path writePlan(Path migrationDir, MigrationPlan plan, String source, String target) {
        Path file = migrationDir.resolve(FerryOptions.Output.PLAN_FILE);
        try {
            Files.createDirectories(migrationDir);
            Files.writeString(file, scriptWriter.render(plan, source, target), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write plan to " + file, e);
        }
        LOGGER.info("Plan script written to {}", file);
        return file;
    }
}
