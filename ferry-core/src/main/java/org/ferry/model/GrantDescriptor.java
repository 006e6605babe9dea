package org.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * One privilege held by one grantee on one object.
 * For functions {@code objectName} carries the identity signature, e.g. {@code touch(integer)}.
 * For schemas {@code objectName} equals {@code schema}.
 */
@Value
@Builder(toBuilder = true)
public class GrantDescriptor implements Descriptor {
    GrantObjectType objectType;
    String schema;
    String objectName;
    String grantee;
    String privilege;
    boolean grantable;

    @Override
    public String key() {
        return objectType + ":" + schema + KEY_DELIMITER + objectName + ":" + grantee + ":" + privilege;
    }

    @Override
    public TableRef table() {
        return objectType == GrantObjectType.TABLE ? TableRef.of(schema, objectName) : null;
    }
}
