package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record DeleteStmt(
    TableRef from,
    Expr where
) implements Stmt {
    public DeleteStmt {
        Objects.requireNonNull(from, "from");
    }
}
