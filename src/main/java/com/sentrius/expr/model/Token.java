package com.sentrius.expr.model;

import java.util.Objects;

/**
 * A classified lexical unit together with its source range.
 * Offsets are inclusive, so a single-character token has {@code start == end}.
 */
public class Token {
    private final TokenType type;
    private final String value;
    private final int start;
    private final int end;

    public Token(TokenType type, String value, int start, int end) {
        this.type = type;
        this.value = value;
        this.start = start;
        this.end = end;
    }

    public TokenType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Check whether a character offset falls inside this token.
     * @param position The offset to test
     * @return true if {@code start <= position <= end}
     */
    public boolean covers(int position) {
        return position >= start && position <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        return start == other.start && end == other.end
            && type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, start, end);
    }

    @Override
    public String toString() {
        return "Token{type=" + type + ", value='" + value + "', start=" + start + ", end=" + end + "}";
    }
}
