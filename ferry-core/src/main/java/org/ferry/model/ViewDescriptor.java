package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ViewDescriptor implements Descriptor {
    String schema;
    String name;
    /** Query text as printed by pg_get_viewdef, without a trailing semicolon. */
    String query;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + name;
    }

    public TableRef ref() {
        return TableRef.of(schema, name);
    }
}
