package io.lighting.mongosql.sql.ast;

public enum SortDirection {
    ASC(1),
    DESC(-1);

    private final int mongoValue;

    SortDirection(int mongoValue) {
        this.mongoValue = mongoValue;
    }

    public int mongoValue() {
        return mongoValue;
    }
}
