package com.zzf.optrace.trace.gate;

/**
 * Statement classification as reported by the parser.
 */
public enum CommandKind {
    SELECT,
    INSERT,
    INSERT_SELECT,
    UPDATE,
    UPDATE_MULTI,
    DELETE,
    DELETE_MULTI,
    REPLACE,
    REPLACE_SELECT,
    SET_OPTION,
    DO,
    CALL,
    SHOW,
    EXPLAIN,
    PREPARE,
    EXECUTE,
    CREATE_TABLE,
    ALTER_TABLE,
    DROP_TABLE,
    CREATE_VIEW,
    TRUNCATE,
    LOAD,
    BEGIN,
    COMMIT,
    ROLLBACK,
    USE,
    FLUSH,
    KILL,
    OTHER
}
