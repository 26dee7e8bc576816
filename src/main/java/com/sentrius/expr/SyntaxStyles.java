package com.sentrius.expr;

import com.sentrius.expr.model.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Style tags (CSS class names) used by the syntax highlighter, one per token
 * type plus one for tokens that overlap a syntax error.
 */
public class SyntaxStyles {
    private static final SyntaxStyles DEFAULTS = new Builder().build();

    private final Map<TokenType, String> styles;
    private final String errorStyle;

    private SyntaxStyles(Builder builder) {
        this.styles = Collections.unmodifiableMap(new EnumMap<>(builder.styles));
        this.errorStyle = builder.errorStyle;
    }

    public static SyntaxStyles defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String styleFor(TokenType type) {
        return styles.get(type);
    }

    public String getErrorStyle() {
        return errorStyle;
    }

    public Map<TokenType, String> asMap() {
        return styles;
    }

    /**
     * Builder for SyntaxStyles, starting from the default table.
     */
    public static class Builder {
        private final Map<TokenType, String> styles = new EnumMap<>(TokenType.class);
        private String errorStyle = "expression-error";

        public Builder() {
            styles.put(TokenType.NUMBER, "expression-number");
            styles.put(TokenType.OPERATOR, "expression-operator");
            styles.put(TokenType.FUNCTION, "expression-function");
            styles.put(TokenType.LEFT_PAREN, "expression-paren");
            styles.put(TokenType.RIGHT_PAREN, "expression-paren");
            styles.put(TokenType.VARIABLE, "expression-variable");
            styles.put(TokenType.UNKNOWN, "expression-unknown");
            styles.put(TokenType.WHITESPACE, "expression-whitespace");
        }

        public Builder style(TokenType type, String style) {
            if (type == null || style == null) {
                throw new IllegalArgumentException("Token type and style cannot be null");
            }
            styles.put(type, style);
            return this;
        }

        public Builder errorStyle(String style) {
            if (style == null) {
                throw new IllegalArgumentException("Error style cannot be null");
            }
            this.errorStyle = style;
            return this;
        }

        public SyntaxStyles build() {
            return new SyntaxStyles(this);
        }
    }
}
