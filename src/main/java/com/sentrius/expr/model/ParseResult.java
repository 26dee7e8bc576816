package com.sentrius.expr.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of parsing one expression.
 * The AST is present only when no syntax error was recorded.
 */
public class ParseResult {
    private final List<Token> tokens;
    private final Node ast;
    private final List<SyntaxError> errors;

    public ParseResult(List<Token> tokens, Node ast, List<SyntaxError> errors) {
        this.tokens = Collections.unmodifiableList(tokens);
        this.ast = errors.isEmpty() ? ast : null;
        this.errors = Collections.unmodifiableList(errors);
    }

    /**
     * All tokens of the source text, whitespace included.
     */
    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * @return The root node, or null if the text was empty or had errors
     */
    public Node getAst() {
        return ast;
    }

    public boolean hasAst() {
        return ast != null;
    }

    public List<SyntaxError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ParseResult{tokens=" + tokens + ", ast=" + ast + ", errors=" + errors + "}";
    }
}
