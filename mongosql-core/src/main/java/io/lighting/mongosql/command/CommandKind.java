package io.lighting.mongosql.command;

public enum CommandKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    TRANSACTION
}
