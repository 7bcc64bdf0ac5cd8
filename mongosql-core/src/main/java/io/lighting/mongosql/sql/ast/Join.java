package io.lighting.mongosql.sql.ast;

import java.util.Objects;

/**
 * A join clause. The parser only builds joins whose predicate is an equality
 * between two columns, so the predicate is kept as its two sides.
 */
public record Join(JoinType type, TableRef table, Expr.Column left, Expr.Column right) {
    public Join {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }
}
