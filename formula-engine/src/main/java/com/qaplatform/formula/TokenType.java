package com.qaplatform.formula;

public enum TokenType {
    NUMBER,
    IDENTIFIER,
    STRING,
    OPERATOR,
    LPAREN,
    RPAREN,
    COMMA,
    EOF
}
