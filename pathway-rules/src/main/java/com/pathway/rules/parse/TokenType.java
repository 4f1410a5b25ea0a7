package com.pathway.rules.parse;

public enum TokenType {
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    STRING,
    NUMBER,
    PATH,
    COMPARATOR,
    AND,
    OR,
    NOT,
    IN,
    NOT_IN,
    CONTAINS,
    TRUE,
    FALSE,
    NULL,
    EOF
}
