package org.ferry.sync;

import org.ferry.model.TableRef;

import java.util.List;

/**
 * Rows of one source table, either as an INSERT script or as CSV with a header line.
 */
public record ExtractedTable(TableRef table, Format format, String content, List<String> columns) {

    public enum Format {
        SQL_INSERTS,
        CSV
    }

    public ExtractedTable {
        columns = List.copyOf(columns);
    }

    public static ExtractedTable sql(TableRef table, String script) {
        return new ExtractedTable(table, Format.SQL_INSERTS, script, List.of());
    }

    public static ExtractedTable csv(TableRef table, String csv, List<String> columns) {
        return new ExtractedTable(table, Format.CSV, csv, columns);
    }
}
