package com.sentrius.expr;

import com.sentrius.expr.model.BinaryOperationNode;
import com.sentrius.expr.model.FunctionCallNode;
import com.sentrius.expr.model.Node;
import com.sentrius.expr.model.NumberNode;
import com.sentrius.expr.model.ParseResult;
import com.sentrius.expr.model.SyntaxError;
import com.sentrius.expr.model.Token;
import com.sentrius.expr.model.TokenType;
import com.sentrius.expr.model.UnaryOperationNode;
import com.sentrius.expr.model.VariableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for mathematical expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '%') factor)*
 * factor     := primary ('^' primary)*
 * primary    := ('+' | '-') primary | NUMBER | VARIABLE
 *             | FUNCTION '(' (expression (',' expression)*)? ')'
 *             | '(' expression ')'
 * </pre>
 *
 * Parsing never stops at the first problem. Errors are collected and the parser
 * recovers locally, so one call reports every syntax error it can find.
 */
public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Tokenizer tokenizer;

    public Parser() {
        this(new Tokenizer());
    }

    public Parser(Tokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    /**
     * Parse an expression string into an AST.
     * @param expression The expression to parse; null is treated as empty
     * @return The tokens, the AST (only when there are no errors) and the errors
     */
    public ParseResult parse(String expression) {
        List<Token> allTokens = tokenizer.tokenize(expression);

        List<Token> significant = new ArrayList<>();
        for (Token token : allTokens) {
            if (token.getType() != TokenType.WHITESPACE) {
                significant.add(token);
            }
        }

        if (significant.isEmpty()) {
            return new ParseResult(allTokens, null, new ArrayList<>());
        }

        State state = new State(significant);
        Node ast = null;
        try {
            ast = state.parseExpression();
            if (!state.atEnd()) {
                Token extra = state.current();
                state.addError("Unexpected token: " + extra.getValue(), extra.getStart());
            }
        } catch (RuntimeException e) {
            log.warn("Parser failed on '{}'", expression, e);
            state.addError(e.getMessage() != null ? e.getMessage() : "Unknown parsing error", state.errorPosition());
        } catch (StackOverflowError e) {
            log.warn("Expression of length {} is nested too deeply to parse", expression.length());
            state.addError("Expression is nested too deeply", state.errorPosition());
        }

        return new ParseResult(allTokens, ast, state.errors);
    }

    /**
     * Cursor over the non-whitespace tokens of a single parse.
     */
    private static class State {
        private final List<Token> tokens;
        private final List<SyntaxError> errors = new ArrayList<>();
        private int index;

        State(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node parseExpression() {
            Node left = parseTerm();
            while (atOperator("+", "-")) {
                String operator = current().getValue();
                advance();
                left = new BinaryOperationNode(operator, left, parseTerm());
            }
            return left;
        }

        Node parseTerm() {
            Node left = parseFactor();
            while (atOperator("*", "/", "%")) {
                String operator = current().getValue();
                advance();
                left = new BinaryOperationNode(operator, left, parseFactor());
            }
            return left;
        }

        Node parseFactor() {
            Node left = parsePrimary();
            while (atOperator("^")) {
                String operator = current().getValue();
                advance();
                left = new BinaryOperationNode(operator, left, parsePrimary());
            }
            return left;
        }

        Node parsePrimary() {
            if (atEnd()) {
                addError("Unexpected end of expression", endPosition());
                return new NumberNode("0");
            }

            Token token = current();

            if (atOperator("+", "-")) {
                advance();
                return new UnaryOperationNode(token.getValue(), parsePrimary());
            }

            switch (token.getType()) {
                case NUMBER:
                    advance();
                    return new NumberNode(token.getValue());
                case VARIABLE:
                    advance();
                    return new VariableNode(token.getValue());
                case FUNCTION:
                    advance();
                    return parseFunctionCall(token);
                case LEFT_PAREN:
                    advance();
                    return parseParenthesized(token);
                default:
                    addError("Unexpected token: " + token.getValue(), token.getStart());
                    advance();
                    // Placeholder so the surrounding rule can keep going.
                    return new NumberNode("0");
            }
        }

        private Node parseFunctionCall(Token nameToken) {
            String name = nameToken.getValue();

            if (atEnd() || current().getType() != TokenType.LEFT_PAREN) {
                addError("Expected '(' after function name '" + name + "'",
                    atEnd() ? nameToken.getEnd() + 1 : current().getStart());
                return new FunctionCallNode(name, new ArrayList<>());
            }
            advance();

            List<Node> args = new ArrayList<>();
            if (!atEnd() && current().getType() == TokenType.RIGHT_PAREN) {
                advance();
                return new FunctionCallNode(name, args);
            }

            while (true) {
                args.add(parseExpression());

                if (atEnd()) {
                    addError("Expected ')' or ',' in function arguments", nameToken.getEnd() + 1);
                    break;
                }
                if (current().getType() == TokenType.RIGHT_PAREN) {
                    advance();
                    break;
                }
                if (",".equals(current().getValue())) {
                    advance();
                } else {
                    // Carry on as if the comma had been written.
                    addError("Expected ',' between function arguments", current().getStart());
                }
            }

            return new FunctionCallNode(name, args);
        }

        private Node parseParenthesized(Token open) {
            Node inner = parseExpression();
            if (atEnd() || current().getType() != TokenType.RIGHT_PAREN) {
                addError("Expected ')'", atEnd() ? open.getEnd() + 1 : current().getStart());
            } else {
                advance();
            }
            return inner;
        }

        boolean atEnd() {
            return index >= tokens.size();
        }

        Token current() {
            return tokens.get(index);
        }

        private boolean atOperator(String... operators) {
            if (atEnd() || current().getType() != TokenType.OPERATOR) {
                return false;
            }
            String value = current().getValue();
            for (String operator : operators) {
                if (operator.equals(value)) {
                    return true;
                }
            }
            return false;
        }

        private void advance() {
            index++;
        }

        int errorPosition() {
            return atEnd() ? 0 : current().getStart();
        }

        private int endPosition() {
            return tokens.get(tokens.size() - 1).getEnd() + 1;
        }

        void addError(String message, int position) {
            errors.add(new SyntaxError(message, position));
        }
    }
}
