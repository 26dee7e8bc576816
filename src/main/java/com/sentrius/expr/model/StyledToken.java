package com.sentrius.expr.model;

/**
 * A token annotated with the style tag chosen by the syntax highlighter.
 */
public class StyledToken extends Token {
    private final String style;

    public StyledToken(Token token, String style) {
        super(token.getType(), token.getValue(), token.getStart(), token.getEnd());
        this.style = style;
    }

    public String getStyle() {
        return style;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        if (!(o instanceof StyledToken)) {
            return false;
        }
        return style.equals(((StyledToken) o).style);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + style.hashCode();
    }

    @Override
    public String toString() {
        return "StyledToken{type=" + getType() + ", value='" + getValue() + "', start=" + getStart()
            + ", end=" + getEnd() + ", style='" + style + "'}";
    }
}
