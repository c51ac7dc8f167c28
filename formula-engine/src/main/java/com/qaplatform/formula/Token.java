package com.qaplatform.formula;

import java.util.Objects;

/**
 * A lexical token. {@code value} holds the parsed number for NUMBER tokens and the
 * unescaped content for STRING tokens; it is null otherwise.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final Object value;
    private final SourcePosition position;

    public Token(TokenType type, String text, Object value, SourcePosition position) {
        this.type = type;
        this.text = text;
        this.value = value;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public Object getValue() {
        return value;
    }

    public SourcePosition getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }

    /**
     * Human readable form used in error messages.
     */
    public String describe() {
        return type == TokenType.EOF ? "end of expression" : "'" + text + "'";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return type == token.type && text.equals(token.text)
                && Objects.equals(value, token.value) && position.equals(token.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, value, position);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position.getLine() + ":" + position.getColumn();
    }
}
