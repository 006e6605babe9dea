package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TableDescriptor implements Descriptor {
    String schema;
    String name;
    boolean rlsEnabled;
    boolean rlsForced;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, name);
    }
}
