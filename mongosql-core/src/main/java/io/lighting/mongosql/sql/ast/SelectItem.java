package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record SelectItem(Expr expr, String alias) {
    public SelectItem {
        Objects.requireNonNull(expr, "expr");
    }

    public SelectItem(Expr expr) {
        this(expr, null);
    }
}
