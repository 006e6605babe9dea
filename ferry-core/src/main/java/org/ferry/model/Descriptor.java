package org.ferry.model;

/**
 * A catalog object captured from one environment.
 * Two descriptors describe the same object when their keys are equal.
 */
public interface Descriptor {

    String KEY_DELIMITER = ".";

    /**
     * Identity of the object within its category, e.g. {@code public.orders.total} for a column.
     */
    String key();

    /**
     * Table the object belongs to, or {@code null} for objects that are not table scoped.
     */
    default TableRef table() {
        return null;
    }
}
