package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record Assignment(String column, Expr value) {
    public Assignment {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
    }
}
