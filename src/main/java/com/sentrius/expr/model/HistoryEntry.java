package com.sentrius.expr.model;

import java.time.Instant;

public class HistoryEntry {
    private final String expression;
    private final Object result;
    private final Instant timestamp;

    public HistoryEntry(String expression, Object result, Instant timestamp) {
        this.expression = expression;
        this.result = result;
        this.timestamp = timestamp;
    }

    public String getExpression() {
        return expression;
    }

    public Object getResult() {
        return result;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "HistoryEntry{expression='" + expression + "', result=" + result + ", timestamp=" + timestamp + "}";
    }
}
