package io.lighting.mongosql.error;

import io.lighting.mongosql.sql.lexer.Token;

public class ParseException extends MongoSqlException {
    private final int position;

    public ParseException(String message) {
        super(message);
        this.position = -1;
    }

    public ParseException(Token token, String expected) {
        super(String.format(
            "Syntax error at position %d: expected %s, but found %s",
            token.position(),
            expected,
            token.describe()
        ));
        this.position = token.position();
    }

    /**
     * Source offset of the offending token, or {@code -1} when the error is not
     * tied to a single token.
     */
    public int position() {
        return position;
    }
}
