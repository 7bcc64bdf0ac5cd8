package io.lighting.mongosql.sql.ast;

public enum TransactionDirective {
    BEGIN,
    COMMIT,
    ROLLBACK
}
