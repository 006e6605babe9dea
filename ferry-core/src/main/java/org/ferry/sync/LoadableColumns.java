package org.ferry.sync;

import org.ferry.connect.DatabaseClient;
import org.ferry.model.ConnectionTarget;
import org.ferry.model.Sql;
import org.ferry.model.TableRef;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Columns of a live table that accept inserted values, in ordinal order, with their formatted types.
 */
final class LoadableColumns {

    private static final String QUERY = """
            SELECT a.attname AS column_name,
                   pg_catalog.format_type(a.atttypid, a.atttypmod) AS formatted_type
            FROM pg_catalog.pg_attribute a
            JOIN pg_catalog.pg_class c ON c.oid = a.attrelid
            JOIN pg_catalog.pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = %s AND c.relname = %s
              AND a.attnum > 0 AND NOT a.attisdropped AND a.attgenerated = ''
            ORDER BY a.attnum
            """;

    private LoadableColumns() {
    }

    static Map<String, String> read(DatabaseClient client, ConnectionTarget target, TableRef table) {
        Map<String, String> columns = new LinkedHashMap<>();
        client.query(target, String.format(QUERY, Sql.literal(table.schema()), Sql.literal(table.name())))
                .rows()
                .forEach(row -> columns.put(row.get("column_name"), row.get("formatted_type")));
        return columns;
    }
}
