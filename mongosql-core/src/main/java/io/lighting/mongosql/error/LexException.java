package io.lighting.mongosql.error;

public class LexException extends MongoSqlException {
    private final char character;
    private final int position;

    public LexException(char character, int position) {
        this(character, position, "Unexpected character '" + character + "' at position " + position);
    }

    public LexException(char character, int position, String message) {
        super(message);
        this.character = character;
        this.position = position;
    }

    public char character() {
        return character;
    }

    public int position() {
        return position;
    }
}
