package com.sentrius.expr.model;

/**
 * Lexical categories produced by the tokenizer.
 */
public enum TokenType {
    NUMBER,
    OPERATOR,
    FUNCTION,
    VARIABLE,
    LEFT_PAREN,
    RIGHT_PAREN,
    WHITESPACE,
    UNKNOWN
}
