package org.ferry.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A user-defined enum type. Labels keep their sort order.
 */
@Value
@Builder(toBuilder = true)
public class EnumTypeDescriptor implements Descriptor {
    String schema;
    String name;
    @Singular
    List<String> labels;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + name;
    }

    public String qualified() {
        return Sql.ident(schema) + "." + Sql.ident(name);
    }
}
