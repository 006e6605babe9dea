package org.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A free-standing or column-owned sequence. Sequences backing identity columns are part of their column instead.
 * Numeric bounds are kept as the catalog prints them.
 */
@Value
@Builder(toBuilder = true)
public class SequenceDescriptor implements Descriptor {
    String schema;
    String name;
    /** {@code smallint}, {@code integer} or {@code bigint}. */
    String dataType;
    String startValue;
    String increment;
    String minValue;
    String maxValue;
    String cache;
    boolean cycle;
    /** Table and column owning the sequence, both {@code null} when it is not owned. */
    String ownedByTable;
    String ownedByColumn;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + name;
    }

    public boolean isOwned() {
        return ownedByTable != null && ownedByColumn != null;
    }

    public TableRef owner() {
        return isOwned() ? TableRef.of(schema, ownedByTable) : null;
    }

    public String qualified() {
        return Sql.ident(schema) + "." + Sql.ident(name);
    }
}
