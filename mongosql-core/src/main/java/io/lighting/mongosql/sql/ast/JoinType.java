package io.lighting.mongosql.sql.ast;

public enum JoinType {
    INNER,
    LEFT
}
