package io.lighting.mongosql.sql.ast;

import java.util.Objects;

public record TableRef(String tableName, String alias) {
    public TableRef {
        Objects.requireNonNull(tableName, "tableName");
        if (tableName.isBlank()) {
            throw new IllegalArgumentException("tableName must not be blank");
        }
    }

    public TableRef(String tableName) {
        this(tableName, null);
    }

    /**
     * The name columns use to qualify this table: the alias when present, otherwise
     * the table name.
     */
    public String reference() {
        return alias != null ? alias : tableName;
    }
}
