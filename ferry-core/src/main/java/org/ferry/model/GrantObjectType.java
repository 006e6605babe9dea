package org.ferry.model;

public enum GrantObjectType {
    TABLE,
    SEQUENCE,
    FUNCTION,
    SCHEMA
}
