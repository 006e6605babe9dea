package org.ferry.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Schema-qualified table name.
 */
public record TableRef(String schema, String name) implements Comparable<TableRef> {

    private static final Comparator<TableRef> ORDER =
            Comparator.comparing(TableRef::schema).thenComparing(TableRef::name);

    public TableRef {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static TableRef of(String schema, String name) {
        return new TableRef(schema, name);
    }

    /**
     * Quoted form usable in SQL, e.g. {@code "public"."orders"}.
     */
    public String qualified() {
        return Sql.ident(schema) + "." + Sql.ident(name);
    }

    public String display() {
        return schema + "." + name;
    }

    @Override
    public int compareTo(TableRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return display();
    }
}
