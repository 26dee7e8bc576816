package com.sentrius.expr.model;

import java.util.Objects;

/**
 * Result of evaluating an expression.
 * A failed evaluation always has a null value and a non-null error.
 */
public class EvaluationResult {
    private final Object value;
    private final String error;

    private EvaluationResult(Object value, String error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult success(Object value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(String error) {
        return new EvaluationResult(null, error != null ? error : "Unknown evaluation error");
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return A Double, a Boolean, or null
     */
    public Object getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult other = (EvaluationResult) o;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "EvaluationResult{value=" + value + "}";
        }
        return "EvaluationResult{value=null, error='" + error + "'}";
    }
}
