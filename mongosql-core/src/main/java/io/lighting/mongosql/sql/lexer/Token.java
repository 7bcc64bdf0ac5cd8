package io.lighting.mongosql.sql.lexer;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param type     token kind
 * @param text     identifier/operator text, literal value without quotes, number digits,
 *                 or the parameter name for {@link TokenType#NAMED_PARAM}
 * @param position offset of the token's first character in the statement
 */
public record Token(TokenType type, String text, int position) {
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }

    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case STRING -> "string '" + text + "'";
            case POSITIONAL_PARAM -> "'?'";
            case NAMED_PARAM -> "':" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
