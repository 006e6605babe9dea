package org.ferry.sync;

import org.ferry.connect.DatabaseClient;
import org.ferry.connect.DumpRequest;
import org.ferry.connect.ToolResult;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.TableRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Dumps a table's rows as column-explicit INSERT statements with pg_dump.
 */
public class BulkDumpExtractor implements TableExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkDumpExtractor.class);

    private final DatabaseClient client;

    public BulkDumpExtractor(DatabaseClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "bulk";
    }

    @Override
    public ExtractedTable extract(ConnectionTarget source, TableRef table) {
        Path file = null;
        try {
            file = Files.createTempFile("ferry-data-", ".sql");
            ToolResult result = client.dump(source, DumpRequest.builder()
                    .schema(table.schema())
                    .table(table.name())
                    .dataOnly(true)
                    .columnInserts(true)
                    .outputFile(file)
                    .build());
            if (!result.succeeded()) {
                throw new ExtractionException("pg_dump of " + table + " failed (exit " + result.exitCode() + "): "
                        + lastLine(result.output()));
            }
            return ExtractedTable.sql(table, Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ExtractionException("Could not stage dump of " + table + ": " + e.getMessage(), e);
        } finally {
            if (file != null) {
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    LOGGER.debug("Could not delete {}: {}", file, e.getMessage());
                }
            }
        }
    }

    private static String lastLine(String output) {
        String[] lines = output.strip().split("\\R");
        return lines.length == 0 ? "" : lines[lines.length - 1];
    }
}
