package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record OrderItem(Expr expr, SortDirection direction) {
    public OrderItem {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(direction, "direction");
    }
}
