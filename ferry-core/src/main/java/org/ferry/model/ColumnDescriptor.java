package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ColumnDescriptor implements Descriptor {
    String schema;
    String tableName;
    String name;
    /** Formatted type as printed by format_type, e.g. {@code character varying(64)}. */
    String type;
    boolean nullable;
    String defaultExpression;
    /** {@code ALWAYS} or {@code BY DEFAULT} for identity columns, otherwise {@code null}. */
    String identity;
    int ordinalPosition;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + tableName + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, tableName);
    }

    public boolean isIdentity() {
        return identity != null;
    }
}
