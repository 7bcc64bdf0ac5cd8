package io.lighting.mongosql.error;

/**
 * Raised as soon as the compiler reaches a construct it does not translate, for
 * example a non-equality join predicate or a HAVING reference to a column that
 * grouping did not materialize.
 */
public class UnsupportedFeatureException extends MongoSqlException {
    public UnsupportedFeatureException(String message) {
        super(message);
    }
}
