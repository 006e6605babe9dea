package org.ferry.plan;

public enum OperationKind {
    CREATE_EXTENSION,
    ALTER_EXTENSION_SCHEMA,
    DROP_EXTENSION,
    CREATE_ENUM_TYPE,
    ADD_ENUM_VALUE,
    DROP_ENUM_TYPE,
    CREATE_FUNCTION,
    REPLACE_FUNCTION,
    DROP_FUNCTION,
    CREATE_SEQUENCE,
    ALTER_SEQUENCE,
    SET_SEQUENCE_OWNER,
    DROP_SEQUENCE,
    CREATE_TABLE,
    DROP_TABLE,
    ADD_COLUMN,
    ALTER_COLUMN_TYPE,
    SET_DEFAULT,
    DROP_DEFAULT,
    ADD_IDENTITY,
    SET_IDENTITY_GENERATION,
    DROP_IDENTITY,
    SET_NOT_NULL,
    DROP_NOT_NULL,
    DROP_COLUMN,
    ADD_CONSTRAINT,
    DROP_CONSTRAINT,
    CREATE_VIEW,
    DROP_VIEW,
    CREATE_INDEX,
    DROP_INDEX,
    CREATE_TRIGGER,
    SET_TRIGGER_ENABLED,
    DROP_TRIGGER,
    ENABLE_RLS,
    DISABLE_RLS,
    FORCE_RLS,
    NO_FORCE_RLS,
    DROP_POLICY,
    CREATE_POLICY,
    GRANT,
    REVOKE,
    SCHEDULE_JOB,
    UNSCHEDULE_JOB,
    TRUNCATE_TABLE,
    LOAD_TABLE_DATA
}
