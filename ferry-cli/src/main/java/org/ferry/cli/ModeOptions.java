package org.ferry.cli;

import org.ferry.model.SyncMode;
import picocli.CommandLine;

/**
 * Scope and strategy switches. Without any switch a run is schema-only and incremental.
 */
public class ModeOptions {

    @CommandLine.Option(names = "--schema-only", description = "Reconcile structure only (default)")
    boolean schemaOnly;

    @CommandLine.Option(names = "--data", description = "Also copy rows, keeping target rows the source lacks")
    boolean data;

    @CommandLine.Option(names = "--replace-data", description = "Also copy rows, truncating target tables first")
    boolean replaceData;

    @CommandLine.Option(names = "--data-only", description = "Copy rows without touching the schema")
    boolean dataOnly;

    @CommandLine.Option(names = "--replace", description = "Drop target-only objects instead of keeping them")
    boolean replace;

    /**
     * @throws IllegalArgumentException for contradictory switches
     */
    SyncMode toMode() {
        if (schemaOnly && (data || replaceData || dataOnly)) {
            throw new IllegalArgumentException("--schema-only cannot be combined with --data, --replace-data or --data-only");
        }
        SyncMode.Scope scope;
        if (dataOnly) {
            scope = SyncMode.Scope.DATA_ONLY;
        } else if (data || replaceData) {
            scope = SyncMode.Scope.SCHEMA_AND_DATA;
        } else {
            scope = SyncMode.Scope.SCHEMA_ONLY;
        }
        SyncMode.Strategy strategy = replace || replaceData ? SyncMode.Strategy.REPLACE : SyncMode.Strategy.INCREMENTAL;
        return SyncMode.of(scope, strategy);
    }
}
