package io.lighting.mongosql.sql.ast;

import java.util.List;
import java.util.Objects;

public record SelectStmt(
    List<SelectItem> columns,
    TableRef from,
    List<Join> joins,
    Expr where,
    List<Expr.Column> groupBy,
    Expr having,
    List<OrderItem> orderBy,
    Integer limit,
    Integer offset
) implements Stmt {
    public SelectStmt {
        Objects.requireNonNull(columns, "columns");
        Objects.requireNonNull(from, "from");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Select list must not be empty");
        }
        columns = List.copyOf(columns);
        joins = joins == null ? List.of() : List.copyOf(joins);
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public boolean isSelectAll() {
        return columns.size() == 1 && columns.get(0).expr() instanceof Expr.Wildcard;
    }
}
