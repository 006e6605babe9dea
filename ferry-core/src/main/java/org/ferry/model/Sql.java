package org.ferry.model;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Quoting helpers for PostgreSQL identifiers and literals.
 */
public final class Sql {

    private Sql() {
    }

    public static String ident(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    public static String literal(String value) {
        if (value == null) {
            return "NULL";
        }
        return '\'' + value.replace("'", "''") + '\'';
    }

    public static String literalList(Collection<String> values) {
        return values.stream().map(Sql::literal).collect(Collectors.joining(", "));
    }

    /**
     * Role reference in GRANT/REVOKE/POLICY clauses. PUBLIC is a keyword, not a role name.
     */
    public static String role(String role) {
        if ("public".equalsIgnoreCase(role)) {
            return "PUBLIC";
        }
        return ident(role);
    }
}
