package com.sentrius.expr.model;

import java.util.Objects;

/**
 * A numeric literal, kept as its source text until evaluation.
 */
public final class NumberNode implements Node {
    private final String value;

    public NumberNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberNode && Objects.equals(value, ((NumberNode) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
