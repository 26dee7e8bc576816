package com.sentrius.expr;

import com.sentrius.expr.model.Suggestion;
import com.sentrius.expr.model.SuggestionCategory;
import com.sentrius.expr.model.Token;
import com.sentrius.expr.model.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Context-aware auto-completion for expressions.
 * Suggestions are filtered by the identifier prefix at the cursor, narrowed by
 * the token in front of the cursor, then ranked exact match first and shortest first.
 */
public class AutoCompletionProvider {

    private static final Set<SuggestionCategory> OPERANDS =
        EnumSet.of(SuggestionCategory.FUNCTION, SuggestionCategory.VARIABLE, SuggestionCategory.CONSTANT);

    private static final Set<SuggestionCategory> OPERATORS = EnumSet.of(SuggestionCategory.OPERATOR);

    private static final List<Suggestion> DEFAULT_SUGGESTIONS = List.of(
        constant("pi", "π", "Pi (3.14159...)"),
        constant("e", "e", "Euler's number (2.71828...)"),

        operator("+", "+", "Addition"),
        operator("-", "-", "Subtraction"),
        operator("*", "×", "Multiplication"),
        operator("/", "÷", "Division"),
        operator("^", "^", "Exponentiation"),
        operator("%", "%", "Modulo"),

        function("sin", "sin", "Sine function"),
        function("cos", "cos", "Cosine function"),
        function("tan", "tan", "Tangent function"),
        function("asin", "asin", "Inverse sine function"),
        function("acos", "acos", "Inverse cosine function"),
        function("atan", "atan", "Inverse tangent function"),

        function("sinh", "sinh", "Hyperbolic sine function"),
        function("cosh", "cosh", "Hyperbolic cosine function"),
        function("tanh", "tanh", "Hyperbolic tangent function"),

        function("log", "log", "Base-10 logarithm"),
        function("ln", "ln", "Natural logarithm"),
        function("log2", "log2", "Base-2 logarithm"),

        function("sqrt", "√", "Square root"),
        function("abs", "abs", "Absolute value"),
        function("exp", "exp", "Exponential function (e^x)"),

        function("gcd", "gcd", "Greatest common divisor"),
        function("lcm", "lcm", "Least common multiple"),
        function("factorial", "factorial", "Factorial (n!)"),
        function("isPrime", "isPrime", "Check if a number is prime"),

        function("floor", "floor", "Round down to nearest integer"),
        function("ceil", "ceil", "Round up to nearest integer"),
        function("round", "round", "Round to nearest integer")
    );

    private final List<Suggestion> suggestions;
    private final Tokenizer tokenizer;

    public AutoCompletionProvider() {
        this(Collections.emptyList());
    }

    /**
     * @param additionalSuggestions Entries appended after the default catalog
     */
    public AutoCompletionProvider(List<Suggestion> additionalSuggestions) {
        List<Suggestion> all = new ArrayList<>(DEFAULT_SUGGESTIONS);
        if (additionalSuggestions != null) {
            all.addAll(additionalSuggestions);
        }
        this.suggestions = Collections.unmodifiableList(all);
        this.tokenizer = new Tokenizer();
    }

    public static List<Suggestion> defaultSuggestions() {
        return DEFAULT_SUGGESTIONS;
    }

    public List<Suggestion> getCatalog() {
        return suggestions;
    }

    public List<Suggestion> suggest(String expression, int cursorPosition) {
        return suggest(expression, cursorPosition, null);
    }

    /**
     * Get suggestions for the given cursor position.
     * @param expression The current expression text
     * @param cursorPosition The cursor offset; clamped to the text bounds
     * @param tokens Tokens of {@code expression}; null to tokenize here
     * @return Ranked suggestions, never null
     */
    public List<Suggestion> suggest(String expression, int cursorPosition, List<Token> tokens) {
        String text = expression != null ? expression : "";
        int cursor = Math.max(0, Math.min(cursorPosition, text.length()));
        List<Token> allTokens = tokens != null ? tokens : tokenizer.tokenize(text);

        Token atCursor = findIdentifierAt(allTokens, cursor);
        String prefix;
        if (atCursor != null) {
            prefix = text.substring(atCursor.getStart(), Math.min(cursor, text.length()));
            if (atCursor.getType() == TokenType.FUNCTION && prefix.indexOf('(') >= 0) {
                prefix = prefix.substring(0, prefix.indexOf('('));
            }
        } else {
            prefix = wordBefore(text, cursor);
        }
        prefix = prefix.toLowerCase(Locale.ROOT);

        List<Suggestion> matches = new ArrayList<>();
        for (Suggestion suggestion : suggestions) {
            if (suggestion.getText().toLowerCase(Locale.ROOT).startsWith(prefix)) {
                matches.add(suggestion);
            }
        }

        Set<SuggestionCategory> allowed = allowedCategories(atCursor, findTokenBefore(allTokens, cursor));
        if (allowed != null) {
            matches.removeIf(s -> !allowed.contains(s.getCategory()));
        }

        sortByRelevance(matches, prefix);
        return matches;
    }

    /**
     * @return The categories to keep, or null to keep everything
     */
    private static Set<SuggestionCategory> allowedCategories(Token atCursor, Token before) {
        if (atCursor != null) {
            // Mid-identifier: complete operands only.
            return OPERANDS;
        }
        if (before == null) {
            return null;
        }
        switch (before.getType()) {
            case OPERATOR:
            case LEFT_PAREN:
                return OPERANDS;
            case NUMBER:
            case RIGHT_PAREN:
                return OPERATORS;
            default:
                return null;
        }
    }

    private static void sortByRelevance(List<Suggestion> matches, String prefix) {
        Comparator<Suggestion> exactFirst = Comparator.comparing(
            s -> !s.getText().toLowerCase(Locale.ROOT).equals(prefix));
        matches.sort(exactFirst.thenComparingInt(s -> s.getText().length()));
    }

    /**
     * The first function or variable token that contains the cursor or ends right before it.
     */
    private static Token findIdentifierAt(List<Token> tokens, int cursor) {
        for (Token token : tokens) {
            if ((token.getType() == TokenType.FUNCTION || token.getType() == TokenType.VARIABLE)
                    && cursor >= token.getStart() && cursor <= token.getEnd() + 1) {
                return token;
            }
        }
        return null;
    }

    /**
     * The closest non-whitespace token ending before the cursor.
     */
    private static Token findTokenBefore(List<Token> tokens, int cursor) {
        Token closest = null;
        for (Token token : tokens) {
            if (token.getType() == TokenType.WHITESPACE || token.getEnd() >= cursor) {
                continue;
            }
            if (closest == null || token.getEnd() > closest.getEnd()) {
                closest = token;
            }
        }
        return closest;
    }

    private static String wordBefore(String text, int cursor) {
        int start = cursor;
        while (start > 0 && Tokenizer.isIdentifierPart(text.charAt(start - 1))) {
            start--;
        }
        // Identifiers never start with a digit.
        while (start < cursor && Tokenizer.isDigit(text.charAt(start))) {
            start++;
        }
        return text.substring(start, cursor);
    }

    private static Suggestion constant(String text, String display, String description) {
        return new Suggestion(text, display, SuggestionCategory.CONSTANT, description);
    }

    private static Suggestion operator(String text, String display, String description) {
        return new Suggestion(text, display, SuggestionCategory.OPERATOR, description);
    }

    private static Suggestion function(String name, String display, String description) {
        return new Suggestion(name + "(", display, SuggestionCategory.FUNCTION, description);
    }
}
