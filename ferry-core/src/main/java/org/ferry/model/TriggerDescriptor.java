package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TriggerDescriptor implements Descriptor {
    String schema;
    String tableName;
    String name;
    /** {@code CREATE TRIGGER} statement as printed by pg_get_triggerdef. */
    String definition;
    boolean enabled;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + tableName + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, tableName);
    }
}
