package com.sentrius.expr;

import com.sentrius.expr.model.Token;
import com.sentrius.expr.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits expression text into tokens.
 * Tokenizing never fails: characters that start no known token become
 * single-character UNKNOWN tokens, and the tokens always partition the input.
 */
public class Tokenizer {

    private static final String OPERATOR_CHARS = "+-*/^%=!<>&|";

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of("<=", ">=", "==", "!=", "&&", "||");

    /**
     * Tokenize an expression string.
     * @param expression The expression to tokenize; null is treated as empty
     * @return The tokens in source order, whitespace included
     */
    public List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        if (expression == null) {
            return tokens;
        }

        int length = expression.length();
        int pos = 0;
        while (pos < length) {
            char c = expression.charAt(pos);

            if (isWhitespace(c)) {
                int start = pos;
                while (pos < length && isWhitespace(expression.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(TokenType.WHITESPACE, expression.substring(start, pos), start, pos - 1));
                continue;
            }

            if (isDigit(c) || (c == '.' && pos + 1 < length && isDigit(expression.charAt(pos + 1)))) {
                int start = pos;
                pos = scanNumber(expression, pos);
                tokens.add(new Token(TokenType.NUMBER, expression.substring(start, pos), start, pos - 1));
                continue;
            }

            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int operatorLength = 1;
                if (pos + 1 < length && TWO_CHAR_OPERATORS.contains(expression.substring(pos, pos + 2))) {
                    operatorLength = 2;
                }
                tokens.add(new Token(TokenType.OPERATOR, expression.substring(pos, pos + operatorLength),
                    pos, pos + operatorLength - 1));
                pos += operatorLength;
                continue;
            }

            if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", pos, pos));
                pos++;
                continue;
            }

            if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", pos, pos));
                pos++;
                continue;
            }

            if (isIdentifierStart(c)) {
                int start = pos;
                while (pos < length && isIdentifierPart(expression.charAt(pos))) {
                    pos++;
                }

                // Any identifier followed by '(' is a call target; unknown names fail at evaluation.
                int lookahead = pos;
                while (lookahead < length && isWhitespace(expression.charAt(lookahead))) {
                    lookahead++;
                }
                boolean isFunction = lookahead < length && expression.charAt(lookahead) == '(';

                tokens.add(new Token(isFunction ? TokenType.FUNCTION : TokenType.VARIABLE,
                    expression.substring(start, pos), start, pos - 1));
                continue;
            }

            tokens.add(new Token(TokenType.UNKNOWN, String.valueOf(c), pos, pos));
            pos++;
        }

        return tokens;
    }

    /**
     * Scan a number starting at {@code pos}.
     * @return The offset just past the number
     */
    private static int scanNumber(String expression, int pos) {
        int length = expression.length();
        boolean hasDecimal = expression.charAt(pos) == '.';
        pos++;

        while (pos < length) {
            char c = expression.charAt(pos);
            if (isDigit(c)) {
                pos++;
            } else if (c == '.' && !hasDecimal) {
                hasDecimal = true;
                pos++;
            } else {
                break;
            }
        }

        if (pos < length && (expression.charAt(pos) == 'e' || expression.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < length && (expression.charAt(exponent) == '+' || expression.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && isDigit(expression.charAt(exponent))) {
                while (exponent < length && isDigit(expression.charAt(exponent))) {
                    exponent++;
                }
                pos = exponent;
            }
            // Otherwise the exponent marker is left for the identifier scanner.
        }

        return pos;
    }

    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
