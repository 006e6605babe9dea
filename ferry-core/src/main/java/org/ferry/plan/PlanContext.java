package org.ferry.plan;

import org.ferry.diff.SchemaDiff;
import org.ferry.model.Snapshot;
import org.ferry.model.SyncMode;

/**
 * Inputs shared by every plan contributor.
 */
public record PlanContext(SchemaDiff diff, Snapshot source, Snapshot target, SyncMode mode) {

    public boolean incremental() {
        return mode.isIncremental();
    }
}
