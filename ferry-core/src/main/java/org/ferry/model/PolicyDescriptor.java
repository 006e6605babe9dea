package org.ferry.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.SortedSet;

@Value
@Builder(toBuilder = true)
public class PolicyDescriptor implements Descriptor {
    String schema;
    String tableName;
    String name;
    PolicyCommand command;
    @Singular
    SortedSet<String> roles;
    String usingExpression;
    String checkExpression;
    boolean permissive;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + tableName + KEY_DELIMITER + name;
    }

    @Override
    public TableRef table() {
        return TableRef.of(schema, tableName);
    }
}
