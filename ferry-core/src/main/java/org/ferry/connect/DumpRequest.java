package org.ferry.connect;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Arguments of one pg_dump invocation.
 */
@Value
@Builder
public class DumpRequest {
    String schema;
    /** Single table to dump; {@code null} dumps the whole schema. */
    String table;
    boolean dataOnly;
    boolean schemaOnly;
    /** Emit one INSERT per row with explicit column names instead of COPY blocks. */
    boolean columnInserts;
    Path outputFile;
}
