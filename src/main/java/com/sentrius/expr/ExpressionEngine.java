package com.sentrius.expr;

import com.sentrius.expr.model.EvaluationResult;
import com.sentrius.expr.model.HistoryEntry;
import com.sentrius.expr.model.Node;
import com.sentrius.expr.model.ParseResult;
import com.sentrius.expr.model.StyledToken;
import com.sentrius.expr.model.Suggestion;
import com.sentrius.expr.model.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Entry point for parsing, evaluating, highlighting and completing expressions.
 * Keeps a parse cache keyed by expression text and a bounded evaluation history.
 *
 * <p>Instances are not thread-safe. Hosts evaluating on several threads should
 * use one engine per thread or serialize access.
 */
public class ExpressionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExpressionEngine.class);

    public static final int MAX_HISTORY_SIZE = 100;

    private final Parser parser;
    private final SyntaxHighlighter syntaxHighlighter;
    private final AutoCompletionProvider autoCompletionProvider;
    private final Clock clock;
    private Evaluator evaluator;

    private final Map<String, ParseResult> parseCache = new HashMap<>();
    private final LinkedList<HistoryEntry> history = new LinkedList<>();

    public ExpressionEngine() {
        this(new Builder());
    }

    private ExpressionEngine(Builder builder) {
        this.parser = builder.parser != null ? builder.parser : new Parser();
        this.syntaxHighlighter = new SyntaxHighlighter(builder.syntaxStyles);
        this.evaluator = new Evaluator(builder.context);
        this.autoCompletionProvider = new AutoCompletionProvider(builder.additionalSuggestions);
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParseResult parse(String expression) {
        return parse(expression, true);
    }

    /**
     * Parse an expression.
     * @param expression The expression to parse; null is treated as empty
     * @param useCache Whether to read and populate the parse cache
     * @return The parse result; a cache hit returns the cached instance
     */
    public ParseResult parse(String expression, boolean useCache) {
        String text = expression != null ? expression : "";

        if (useCache) {
            ParseResult cached = parseCache.get(text);
            if (cached != null) {
                log.debug("Parse cache hit for '{}'", text);
                return cached;
            }
        }

        ParseResult result = parser.parse(text);

        if (useCache && !text.trim().isEmpty()) {
            log.debug("Caching parse of '{}'", text);
            parseCache.put(text, result);
        }
        return result;
    }

    public EvaluationResult evaluate(String expression) {
        return evaluate(expression, true);
    }

    /**
     * Parse and evaluate an expression.
     * @param expression The expression to evaluate
     * @param addToHistory Whether a successful result is recorded in the history
     * @return The evaluation result; syntax errors are reported as its error
     */
    public EvaluationResult evaluate(String expression, boolean addToHistory) {
        String text = expression != null ? expression : "";
        try {
            ParseResult parseResult = parse(text);

            if (parseResult.hasErrors()) {
                StringJoiner joined = new StringJoiner("; ");
                for (SyntaxError error : parseResult.getErrors()) {
                    joined.add(error.getMessage());
                }
                return EvaluationResult.failure(joined.toString());
            }
            if (!parseResult.hasAst()) {
                return EvaluationResult.failure("Invalid expression");
            }

            EvaluationResult result = evaluator.evaluate(parseResult.getAst());
            if (addToHistory && result.isSuccess()) {
                addToHistory(text, result.getValue());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Failed to evaluate '{}'", text, e);
            return EvaluationResult.failure(e.getMessage());
        }
    }

    /**
     * Evaluate a prebuilt tree against the current context. Not recorded in the history.
     */
    public EvaluationResult evaluate(Node ast) {
        return evaluator.evaluate(ast);
    }

    /**
     * Get syntax highlighting for an expression.
     * @param expression The expression to highlight
     * @return Tokens with style tags, error tokens marked
     */
    public List<StyledToken> highlightSyntax(String expression) {
        ParseResult parseResult = parse(expression);
        return syntaxHighlighter.highlight(parseResult.getTokens(), parseResult.getErrors());
    }

    public String renderHighlightedHtml(String expression) {
        return syntaxHighlighter.renderToHtml(expression, highlightSyntax(expression));
    }

    /**
     * Get auto-completion suggestions.
     * @param expression The current expression text
     * @param cursorPosition The cursor offset in the text
     * @return Ranked suggestions
     */
    public List<Suggestion> getSuggestions(String expression, int cursorPosition) {
        ParseResult parseResult = parse(expression);
        return autoCompletionProvider.suggest(expression, cursorPosition, parseResult.getTokens());
    }

    /**
     * Replace the evaluation context. The overrides are layered on the
     * built-in defaults, not on the previous context, and the parse cache is cleared.
     *
     * @param context The new overrides; null restores the defaults
     */
    public void updateContext(EvaluationContext context) {
        this.evaluator = new Evaluator(context);
        log.debug("Evaluation context replaced: {}", context);
        clearCache();
    }

    public EvaluationContext getContext() {
        return evaluator.getContext();
    }

    /**
     * @return The history, newest first; a snapshot that does not track later evaluations
     */
    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public void clearHistory() {
        history.clear();
    }

    public void clearCache() {
        parseCache.clear();
    }

    public int getCacheSize() {
        return parseCache.size();
    }

    private void addToHistory(String expression, Object value) {
        history.addFirst(new HistoryEntry(expression, value, clock.instant()));
        while (history.size() > MAX_HISTORY_SIZE) {
            HistoryEntry dropped = history.removeLast();
            log.debug("History full, dropped '{}'", dropped.getExpression());
        }
    }

    /**
     * Builder for ExpressionEngine.
     */
    public static class Builder {
        private EvaluationContext context = EvaluationContext.empty();
        private SyntaxStyles syntaxStyles = SyntaxStyles.defaults();
        private final List<Suggestion> additionalSuggestions = new ArrayList<>();
        private Parser parser;
        private Clock clock = Clock.systemUTC();

        /**
         * Variables and functions layered over the built-ins.
         */
        public Builder context(EvaluationContext context) {
            this.context = context != null ? context : EvaluationContext.empty();
            return this;
        }

        public Builder syntaxStyles(SyntaxStyles syntaxStyles) {
            this.syntaxStyles = syntaxStyles != null ? syntaxStyles : SyntaxStyles.defaults();
            return this;
        }

        public Builder addSuggestion(Suggestion suggestion) {
            if (suggestion == null) {
                throw new IllegalArgumentException("Suggestion cannot be null");
            }
            additionalSuggestions.add(suggestion);
            return this;
        }

        public Builder additionalSuggestions(List<Suggestion> suggestions) {
            for (Suggestion suggestion : suggestions) {
                addSuggestion(suggestion);
            }
            return this;
        }

        public Builder parser(Parser parser) {
            this.parser = parser;
            return this;
        }

        /**
         * Clock used to timestamp history entries.
         */
        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("Clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        public ExpressionEngine build() {
            return new ExpressionEngine(this);
        }
    }
}
