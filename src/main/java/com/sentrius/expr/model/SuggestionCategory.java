package com.sentrius.expr.model;

public enum SuggestionCategory {
    FUNCTION,
    VARIABLE,
    OPERATOR,
    CONSTANT
}
