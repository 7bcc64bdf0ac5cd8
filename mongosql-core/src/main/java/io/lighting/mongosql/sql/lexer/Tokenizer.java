package io.lighting.mongosql.sql.lexer;

import io.lighting.mongosql.error.LexException;
import java.util.Objects;

/**
 * Splits a statement into tokens on demand.
 * <p>
 * Keywords are not recognized here: every word is an {@link TokenType#IDENTIFIER}
 * and the parser decides, case-insensitively, which identifiers are keywords.
 */
public final class Tokenizer {
    private static final String SINGLE_OPERATORS = ",().=*+-/<>";

    private final String input;
    private int index;
    private Token peeked;

    public Tokenizer(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.index = 0;
    }

    public Token peek() {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    public Token next() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            peeked = null;
        }
        return token;
    }

    private Token scan() {
        skipInsignificant();
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", input.length());
        }
        int start = index;
        char ch = input.charAt(index);
        if (ch == '\'' || ch == '"') {
            return readString(ch);
        }
        if (isDigit(ch)) {
            return readNumber();
        }
        if (isIdentifierStart(ch)) {
            return new Token(TokenType.IDENTIFIER, readIdentifier(), start);
        }
        if (ch == ':') {
            index++;
            if (isAtEnd() || !isIdentifierStart(input.charAt(index))) {
                throw new LexException(ch, start, "Expected parameter name after ':' at position " + start);
            }
            return new Token(TokenType.NAMED_PARAM, readIdentifier(), start);
        }
        if (ch == '?') {
            index++;
            return new Token(TokenType.POSITIONAL_PARAM, "?", start);
        }
        if (index + 1 < input.length()) {
            String two = input.substring(index, index + 2);
            if (two.equals(">=") || two.equals("<=") || two.equals("<>") || two.equals("!=")) {
                index += 2;
                return new Token(TokenType.OPERATOR, two, start);
            }
        }
        if (SINGLE_OPERATORS.indexOf(ch) >= 0) {
            index++;
            return new Token(TokenType.OPERATOR, String.valueOf(ch), start);
        }
        throw new LexException(ch, start);
    }

    private void skipInsignificant() {
        while (!isAtEnd()) {
            char ch = input.charAt(index);
            if (Character.isWhitespace(ch)) {
                index++;
            } else if (ch == '-' && peekNext() == '-') {
                while (!isAtEnd() && input.charAt(index) != '\n') {
                    index++;
                }
            } else if (ch == '/' && peekNext() == '*') {
                int end = input.indexOf("*/", index + 2);
                // an unterminated block comment swallows the rest of the input
                index = end < 0 ? input.length() : end + 2;
            } else {
                return;
            }
        }
    }

    private Token readString(char quote) {
        int start = index;
        index++;
        StringBuilder value = new StringBuilder();
        while (!isAtEnd()) {
            char ch = input.charAt(index++);
            if (ch == '\\') {
                if (isAtEnd()) {
                    break;
                }
                value.append(input.charAt(index++));
            } else if (ch == quote) {
                return new Token(TokenType.STRING, value.toString(), start);
            } else {
                value.append(ch);
            }
        }
        throw new LexException(quote, start, "Unterminated string literal starting at position " + start);
    }

    private Token readNumber() {
        int start = index;
        boolean seenDot = false;
        while (!isAtEnd()) {
            char ch = input.charAt(index);
            if (isDigit(ch)) {
                index++;
            } else if (ch == '.' && !seenDot) {
                seenDot = true;
                index++;
            } else {
                break;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, index), start);
    }

    private String readIdentifier() {
        int start = index;
        while (!isAtEnd() && isIdentifierPart(input.charAt(index))) {
            index++;
        }
        return input.substring(start, index);
    }

    private char peekNext() {
        return index + 1 < input.length() ? input.charAt(index + 1) : '\0';
    }

    private boolean isAtEnd() {
        return index >= input.length();
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isIdentifierStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isIdentifierPart(char ch) {
        return isIdentifierStart(ch) || isDigit(ch) || ch == '$';
    }
}
