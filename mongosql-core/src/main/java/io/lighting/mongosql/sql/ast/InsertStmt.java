package io.lighting.mongosql.sql.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * INSERT with either VALUES rows or a nested SELECT; exactly one of {@code rows}
 * and {@code select} is present.
 */
public record InsertStmt(
    TableRef into,
    List<String> columns,
    List<List<Expr>> rows,
    SelectStmt select
) implements Stmt {
    public InsertStmt {
        Objects.requireNonNull(into, "into");
        columns = columns == null ? List.of() : List.copyOf(columns);
        if ((rows == null) == (select == null)) {
            throw new IllegalArgumentException("Insert needs either VALUES rows or a SELECT");
        }
        if (rows != null) {
            if (rows.isEmpty()) {
                throw new IllegalArgumentException("Insert rows must not be empty");
            }
            List<List<Expr>> normalizedRows = new ArrayList<>(rows.size());
            for (List<Expr> row : rows) {
                Objects.requireNonNull(row, "row");
                normalizedRows.add(List.copyOf(row));
            }
            rows = List.copyOf(normalizedRows);
        }
    }

    public boolean hasSelect() {
        return select != null;
    }
}
