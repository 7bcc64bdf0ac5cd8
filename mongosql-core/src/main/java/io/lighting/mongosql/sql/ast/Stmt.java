package io.lighting.mongosql.sql.ast;

public sealed interface Stmt permits SelectStmt, InsertStmt, UpdateStmt, DeleteStmt, TransactionStmt {
}
