package com.valyxo.script.parser;

public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, COLON, SEMICOLON, PLUS, MINUS, PERCENT, EQUAL,

    // One or two character tokens
    STAR, DOUBLE_STAR, SLASH, DOUBLE_SLASH,
    BANG_EQUAL, EQUAL_EQUAL, GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,

    // Literals
    IDENTIFIER, STRING, INTEGER, FLOAT,

    // Statement keywords
    SET, PRINT, IF, THEN, ELSE, FOR, IN, TO, WHILE, FUNC, EXIT, VARS,

    // Expression keywords
    AND, OR, NOT, TRUE, FALSE, NONE,

    NEWLINE, EOF
}
