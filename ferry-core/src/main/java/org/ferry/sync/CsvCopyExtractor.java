package org.ferry.sync;

import org.ferry.connect.DatabaseClient;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.Sql;
import org.ferry.model.TableRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads a table's rows as CSV through COPY, using the source column order.
 * Generated columns are left out because they cannot be loaded.
 */
public class CsvCopyExtractor implements TableExtractor {

    private final DatabaseClient client;

    public CsvCopyExtractor(DatabaseClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "csv";
    }

    @Override
    public ExtractedTable extract(ConnectionTarget source, TableRef table) {
        try {
            List<String> columns = List.copyOf(LoadableColumns.read(client, source, table).keySet());
            if (columns.isEmpty()) {
                throw new ExtractionException("Table " + table + " has no loadable columns in the source");
            }
            String csv = client.copyOut(source, "COPY (SELECT " + columnList(columns) + " FROM " + table.qualified()
                    + ") TO STDOUT WITH (FORMAT csv, HEADER true)");
            return ExtractedTable.csv(table, csv, columns);
        } catch (ExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionException("COPY of " + table + " failed: " + e.getMessage(), e);
        }
    }

    static String columnList(List<String> columns) {
        return columns.stream().map(Sql::ident).collect(Collectors.joining(", "));
    }
}
