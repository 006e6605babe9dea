package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConstraintDescriptor implements Descriptor {
    String schema;
    String tableName;
    String name;
    ConstraintType type;
    /** Definition as printed by pg_get_constraintdef. */
    String definition;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + tableName + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, tableName);
    }
}
