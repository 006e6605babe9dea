package org.ferry.reconcile;

import org.ferry.connect.DatabaseClient;
import org.ferry.connect.DumpRequest;
import org.ferry.connect.ResolvedConnection;
import org.ferry.connect.ToolResult;
import org.ferry.model.SyncMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Dumps the target into the migration directory before anything is applied to it.
 * Schema-only runs back up the schema; runs that touch rows back up the whole database.
 * A failed backup is logged and the run continues.
 */
public class TargetBackup {

    private static final Logger LOGGER = LoggerFactory.getLogger(TargetBackup.class);

    static final String FILE_NAME = "target_backup.sql";

    private final DatabaseClient client;

    public TargetBackup(DatabaseClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    /**
     * @return the written dump, or {@code null} if it could not be created
     */
    public Path create(ResolvedConnection target, Path migrationDir, SyncMode mode) {
        Path file = migrationDir.resolve(FILE_NAME);
        try {
            Files.createDirectories(migrationDir);
        } catch (IOException e) {
            LOGGER.warn("Cannot create {} for the backup of {}: {}", migrationDir, target.environment(), e.getMessage());
            return null;
        }

        boolean schemaOnly = !mode.includesData();
        LOGGER.info("Backing up {} ({}) to {}", target.environment(), schemaOnly ? "schema" : "schema and data", file);
        ToolResult result = client.dump(target.target(), DumpRequest.builder()
                .schemaOnly(schemaOnly)
                .outputFile(file)
                .build());
        if (!result.succeeded()) {
            LOGGER.warn("Backup of {} failed (exit {}), continuing without it: {}",
                    target.environment(), result.exitCode(), result.output().strip());
            return null;
        }
        return file;
    }
}
