package org.ferry.sync;

import org.ferry.model.TableRef;

/**
 * A target table whose rows were copied aside before a risky schema change.
 */
public record GuardedTable(TableRef table, TableRef backup, long rowsBefore) {
}
