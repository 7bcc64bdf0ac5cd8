package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record TransactionStmt(TransactionDirective directive) implements Stmt {
    public TransactionStmt {
        Objects.requireNonNull(directive, "directive");
    }
}
