package org.ferry.model;

import java.util.Objects;

/**
 * What a run touches (scope) and how it treats existing target content (strategy).
 */
public record SyncMode(Scope scope, Strategy strategy) {

    public enum Scope {
        SCHEMA_ONLY,
        SCHEMA_AND_DATA,
        DATA_ONLY
    }

    public enum Strategy {
        /** Add and update only; target-only objects and rows survive. */
        INCREMENTAL,
        /** Make the target match the source, deleting whatever the source lacks. */
        REPLACE
    }

    public SyncMode {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
    }

    public static SyncMode schemaOnly() {
        return new SyncMode(Scope.SCHEMA_ONLY, Strategy.INCREMENTAL);
    }

    public static SyncMode of(Scope scope, Strategy strategy) {
        return new SyncMode(scope, strategy);
    }

    public boolean includesSchema() {
        return scope != Scope.DATA_ONLY;
    }

    public boolean includesData() {
        return scope != Scope.SCHEMA_ONLY;
    }

    public boolean isIncremental() {
        return strategy == Strategy.INCREMENTAL;
    }

    @Override
    public String toString() {
        return scope + "/" + strategy;
    }
}
