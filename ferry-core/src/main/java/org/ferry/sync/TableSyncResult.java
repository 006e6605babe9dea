package org.ferry.sync;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.ferry.model.TableRef;

import java.util.List;

@Value
@Builder
public class TableSyncResult {

    public enum Status {
        LOADED,
        /** Loaded, but under replace the target row count differs from the source. */
        ROW_COUNT_MISMATCH,
        FAILED
    }

    TableRef table;
    Status status;
    /** Extraction path that produced the rows: bulk or csv. */
    String path;
    long sourceRows;
    long targetRowsBefore;
    long targetRowsAfter;
    @Singular
    List<String> notes;
}
