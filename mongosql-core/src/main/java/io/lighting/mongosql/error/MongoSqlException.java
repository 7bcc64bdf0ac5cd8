package io.lighting.mongosql.error;

/**
 * Base type of every failure raised while compiling a statement.
 * <p>
 * All compile failures are fatal for the current call: no partial command is
 * returned and nothing is retried.
 */
public class MongoSqlException extends RuntimeException {
    public MongoSqlException(String message) {
        super(message);
    }

    public MongoSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
