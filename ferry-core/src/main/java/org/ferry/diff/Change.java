package org.ferry.diff;

import lombok.Value;
import org.ferry.model.Descriptor;

import java.util.List;

/**
 * A descriptor present on both sides whose comparable fields differ.
 */
@Value
public class Change<T extends Descriptor> {
    String key;
    T source;
    T target;
    /** Names of the differing fields, in comparison order. */
    List<String> fields;

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    @Override
    public String toString() {
        return key + " " + fields;
    }
}
