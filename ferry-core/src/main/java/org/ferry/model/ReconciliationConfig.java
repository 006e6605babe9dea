package org.ferry.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class ReconciliationConfig {
    @Builder.Default
    SyncMode mode = SyncMode.schemaOnly();
    @Singular
    Set<String> excludedSchemas;
    boolean autoConfirm;
    /** Also copy auth.users and auth.identities rows, incrementally. */
    boolean includeAuthUsers;
    /** Dump the target into the migration directory before applying anything. */
    boolean backupTarget;
    /** Where report.json and plan.sql are written; {@code null} disables the artifacts. */
    Path migrationDir;
}
