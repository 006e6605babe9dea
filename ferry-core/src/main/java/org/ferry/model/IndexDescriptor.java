package org.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A secondary index. Indexes that back a primary key, unique or exclusion constraint belong to the constraint.
 */
@Value
@Builder(toBuilder = true)
public class IndexDescriptor implements Descriptor {
    String schema;
    String tableName;
    String name;
    /** {@code CREATE INDEX} statement as printed by pg_get_indexdef. */
    String definition;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, tableName);
    }
}
