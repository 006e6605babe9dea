package org.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A function or procedure, identified by name and identity arguments so overloads stay apart.
 */
@Value
@Builder(toBuilder = true)
public class FunctionDescriptor implements Descriptor {
    String schema;
    String name;
    /** Argument types as printed by pg_get_function_identity_arguments, e.g. {@code uid uuid, n integer}. */
    String identityArguments;
    /** Complete {@code CREATE OR REPLACE} statement as printed by pg_get_functiondef. */
    String definition;
    boolean procedure;

    @Override
    public String key() {
        return schema + KEY_DELIMITER + signature();
    }

    public String signature() {
        return name + "(" + (identityArguments == null ? "" : identityArguments) + ")";
    }
}
