package com.grim.script.parser;

public enum TokenType {
    // punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, COMMA, SEMICOLON,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,
    AND_AND, OR_OR,

    // literals
    IDENTIFIER, INTEGER, FLOAT, STRING,

    // keywords
    LET, FN, IF, ELSE, WHILE, RETURN, PRINT, INPUT, TRUE, FALSE,

    EOF
}
