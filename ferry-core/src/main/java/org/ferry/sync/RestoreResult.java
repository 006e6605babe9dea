package org.ferry.sync;

import org.ferry.model.TableRef;

/**
 * Row counts around one guarded schema change.
 *
 * @param rowsRestored rows re-inserted from the backup; 0 when nothing was lost
 */
public record RestoreResult(TableRef table, long rowsBefore, long rowsAfterChange, long rowsRestored, String note) {
}
