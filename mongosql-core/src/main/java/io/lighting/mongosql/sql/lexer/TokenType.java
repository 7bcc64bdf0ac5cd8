package io.lighting.mongosql.sql.lexer;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    OPERATOR,
    POSITIONAL_PARAM,
    NAMED_PARAM,
    EOF
}
