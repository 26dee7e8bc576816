package com.sentrius.expr.model;

import java.util.Objects;

public class SyntaxError {
    private final String message;
    private final int position;

    public SyntaxError(String message, int position) {
        this.message = message;
        this.position = position;
    }

    public String getMessage() {
        return message;
    }

    public int getPosition() {
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxError)) {
            return false;
        }
        SyntaxError other = (SyntaxError) o;
        return position == other.position && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, position);
    }

    @Override
    public String toString() {
        return "SyntaxError{message='" + message + "', position=" + position + "}";
    }
}
