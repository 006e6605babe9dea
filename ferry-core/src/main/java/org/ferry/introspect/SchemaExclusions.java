package org.ferry.introspect;

import org.ferry.model.Sql;
import org.ferry.options.FerryOptions;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Schemas never captured: platform-managed ones plus per-session temporary schemas.
 */
public final class SchemaExclusions {

    private final SortedSet<String> schemas;

    private SchemaExclusions(Collection<String> schemas) {
        this.schemas = new TreeSet<>(schemas);
    }

    public static SchemaExclusions defaults() {
        return new SchemaExclusions(FerryOptions.Catalog.DEFAULT_EXCLUDED_SCHEMAS);
    }

    /**
     * An empty or {@code null} collection keeps the defaults.
     */
    public static SchemaExclusions of(Collection<String> schemas) {
        if (schemas == null || schemas.isEmpty()) {
            return defaults();
        }
        return new SchemaExclusions(schemas);
    }

    public SortedSet<String> getSchemas() {
        return schemas;
    }

    public boolean excludes(String schema) {
        if (schemas.contains(schema)) {
            return true;
        }
        return FerryOptions.Catalog.EXCLUDED_SCHEMA_PREFIXES.stream().anyMatch(schema::startsWith);
    }

    /**
     * SQL predicate over a schema-name column.
     */
    String predicate(String column) {
        StringBuilder sql = new StringBuilder();
        sql.append(column).append(" NOT IN (").append(Sql.literalList(schemas)).append(')');
        for (String prefix : FerryOptions.Catalog.EXCLUDED_SCHEMA_PREFIXES) {
            sql.append(" AND ").append(column).append(" NOT LIKE ").append(Sql.literal(prefix.replace("_", "\\_") + "%"));
        }
        return sql.toString();
    }
}
