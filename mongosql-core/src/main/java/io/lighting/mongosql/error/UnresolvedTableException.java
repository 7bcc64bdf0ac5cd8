package io.lighting.mongosql.error;

public class UnresolvedTableException extends MongoSqlException {
    private final String tableName;

    public UnresolvedTableException(String tableName) {
        this(tableName, "Unknown table: " + tableName);
    }

    public UnresolvedTableException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
