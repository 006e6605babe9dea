package org.ferry.sync;

import lombok.Getter;
import org.ferry.model.TableRef;

import java.util.ArrayList;
import java.util.List;

@Getter
public class SyncReport {
    private final List<TableSyncResult> tables = new ArrayList<>();
    /** Target tables outside the synced set that a replace truncate emptied through foreign keys. */
    private final List<TableRef> cascadeTruncated = new ArrayList<>();

    public void record(TableSyncResult result) {
        tables.add(result);
    }

    public void cascadeTruncated(List<TableRef> emptied) {
        cascadeTruncated.addAll(emptied);
    }

    public boolean hasFailures() {
        return !failedTables().isEmpty();
    }

    public List<TableRef> failedTables() {
        return tables.stream()
                .filter(t -> t.getStatus() != TableSyncResult.Status.LOADED)
                .map(TableSyncResult::getTable)
                .toList();
    }

    public SyncReport merge(SyncReport other) {
        tables.addAll(other.tables);
        cascadeTruncated.addAll(other.cascadeTruncated);
        return this;
    }
}
