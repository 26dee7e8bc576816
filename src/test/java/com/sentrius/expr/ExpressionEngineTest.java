package com.sentrius.expr;

import com.sentrius.expr.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEngineTest {

    private CountingParser parser;
    private ExpressionEngine engine;

    /**
     * Parser that records how often it is invoked.
     */
    private static class CountingParser extends Parser {
        private int calls;

        @Override
        public ParseResult parse(String expression) {
            calls++;
            return super.parse(expression);
        }
    }

    @BeforeEach
    void setUp() {
        parser = new CountingParser();
        engine = ExpressionEngine.builder().parser(parser).build();
    }

    @Test
    void testEvaluateSimpleExpression() {
        EvaluationResult result = engine.evaluate("1 + 2 * 3");

        assertTrue(result.isSuccess());
        assertEquals(7.0, result.getValue());
    }

    @Test
    void testParseIsCached() {
        ParseResult first = engine.parse("2^10");
        ParseResult second = engine.parse("2^10");

        assertSame(first, second);
        assertEquals(1, parser.calls);
        assertEquals(1, engine.getCacheSize());
    }

    @Test
    void testParseWithoutCache() {
        ParseResult first = engine.parse("2^10", false);
        ParseResult second = engine.parse("2^10", false);

        assertNotSame(first, second);
        assertEquals(2, parser.calls);
        assertEquals(0, engine.getCacheSize());
    }

    @Test
    void testBlankExpressionsAreNotCached() {
        engine.parse("   ");
        engine.parse("");

        assertEquals(0, engine.getCacheSize());
    }

    @Test
    void testClearCache() {
        engine.parse("1 + 1");
        engine.clearCache();
        engine.parse("1 + 1");

        assertEquals(2, parser.calls);
    }

    @Test
    void testEvaluateUsesCache() {
        engine.evaluate("gcd(12,18)");
        EvaluationResult result = engine.evaluate("gcd(12,18)");

        assertEquals(6.0, result.getValue());
        assertEquals(1, parser.calls);
    }

    @Test
    void testSyntaxErrorsAreJoined() {
        EvaluationResult result = engine.evaluate("(# + 1");

        assertNull(result.getValue());
        assertEquals("Unexpected token: #; Expected ')'", result.getError());
    }

    @Test
    void testEmptyExpressionIsInvalid() {
        EvaluationResult result = engine.evaluate("");

        assertFalse(result.isSuccess());
        assertEquals("Invalid expression", result.getError());
        assertTrue(engine.getHistory().isEmpty());
    }

    @Test
    void testNullExpressionIsInvalid() {
        assertEquals("Invalid expression", engine.evaluate((String) null).getError());
        assertTrue(engine.parse(null).getTokens().isEmpty());
        assertEquals("", engine.renderHighlightedHtml(null));
    }

    @Test
    void testEvaluationErrorIsReported() {
        EvaluationResult result = engine.evaluate("5/0");

        assertNull(result.getValue());
        assertEquals("Division by zero", result.getError());
    }

    @Test
    void testEvaluatePrebuiltAst() {
        Node ast = new BinaryOperationNode("*", new VariableNode("pi"), new NumberNode("2"));

        assertEquals(2 * Math.PI, (Double) engine.evaluate(ast).getValue(), 1e-12);
        assertTrue(engine.getHistory().isEmpty());
    }

    @Test
    void testSuccessfulEvaluationsAreRecordedNewestFirst() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        ExpressionEngine timed = ExpressionEngine.builder().clock(Clock.fixed(now, ZoneOffset.UTC)).build();

        timed.evaluate("1 + 1");
        timed.evaluate("x");
        timed.evaluate("2 * 3");

        List<HistoryEntry> history = timed.getHistory();
        assertEquals(2, history.size());
        assertEquals("2 * 3", history.get(0).getExpression());
        assertEquals(6.0, history.get(0).getResult());
        assertEquals(now, history.get(0).getTimestamp());
        assertEquals("1 + 1", history.get(1).getExpression());
    }

    @Test
    void testEvaluateWithoutHistory() {
        engine.evaluate("1 + 1", false);
        assertTrue(engine.getHistory().isEmpty());
    }

    @Test
    void testHistoryIsBounded() {
        for (int i = 0; i < 150; i++) {
            engine.evaluate(i + " + 0");
        }

        List<HistoryEntry> history = engine.getHistory();
        assertEquals(ExpressionEngine.MAX_HISTORY_SIZE, history.size());
        assertEquals("149 + 0", history.get(0).getExpression());
        assertEquals("50 + 0", history.get(99).getExpression());
    }

    @Test
    void testHistorySnapshotIsUnmodifiable() {
        engine.evaluate("1");
        List<HistoryEntry> history = engine.getHistory();

        assertThrows(UnsupportedOperationException.class, history::clear);
        engine.evaluate("2");
        assertEquals(1, history.size());
    }

    @Test
    void testClearHistory() {
        engine.evaluate("1");
        engine.clearHistory();

        assertTrue(engine.getHistory().isEmpty());
    }

    @Test
    void testCustomContext() {
        ExpressionEngine custom = ExpressionEngine.builder()
            .context(EvaluationContext.builder().variable("rate", 0.5).build())
            .build();

        assertEquals(50.0, custom.evaluate("rate * 100").getValue());
        assertEquals(1.0, custom.evaluate("cos(0)").getValue());
    }

    @Test
    void testUpdateContextClearsCacheAndReplacesBindings() {
        engine.updateContext(EvaluationContext.builder().variable("x", 2).build());
        assertEquals(4.0, engine.evaluate("x * 2").getValue());
        assertEquals(1, engine.getCacheSize());

        engine.updateContext(EvaluationContext.builder().variable("y", 3).build());

        assertEquals(0, engine.getCacheSize());
        assertEquals("Unknown variable: x", engine.evaluate("x * 2").getError());
        assertEquals(3.0, engine.evaluate("y").getValue());
        assertTrue(engine.getContext().hasFunction("sqrt"));
    }

    @Test
    void testUpdateContextWithNullRestoresDefaults() {
        engine.updateContext(EvaluationContext.builder().variable("pi", 3).build());
        engine.updateContext(null);

        assertEquals(Math.PI, engine.evaluate("pi").getValue());
    }

    @Test
    void testHighlightSyntax() {
        List<StyledToken> styled = engine.highlightSyntax("2 * # + 1");

        assertEquals(9, styled.size());
        assertEquals("expression-error", styled.get(4).getStyle());
    }

    @Test
    void testRenderHighlightedHtml() {
        String html = engine.renderHighlightedHtml("sqrt(x)");

        assertEquals("<span class=\"expression-function\">sqrt</span>"
            + "<span class=\"expression-paren\">(</span>"
            + "<span class=\"expression-variable\">x</span>"
            + "<span class=\"expression-paren\">)</span>", html);
    }

    @Test
    void testCustomSyntaxStyles() {
        ExpressionEngine styled = ExpressionEngine.builder()
            .syntaxStyles(SyntaxStyles.builder().style(TokenType.NUMBER, "n").build())
            .build();

        assertEquals("<span class=\"n\">7</span>", styled.renderHighlightedHtml("7"));
    }

    @Test
    void testGetSuggestions() {
        List<Suggestion> suggestions = engine.getSuggestions("si", 2);

        assertEquals("sin(", suggestions.get(0).getText());
        assertEquals("sinh(", suggestions.get(1).getText());
        assertEquals(2, suggestions.size());
    }

    @Test
    void testAdditionalSuggestions() {
        ExpressionEngine custom = ExpressionEngine.builder()
            .addSuggestion(new Suggestion("rate", "rate", SuggestionCategory.VARIABLE, "Interest rate"))
            .build();

        List<Suggestion> suggestions = custom.getSuggestions("1 + ra", 6);

        assertEquals(1, suggestions.size());
        assertEquals("rate", suggestions.get(0).getText());
    }

    @Test
    void testPublicMethodsNeverThrow() {
        String[] inputs = {"", ")", "(((", "1 +* 2", "#$%", "sin(", "1e", "factorial(-1)", "a b c", ",,,"};
        for (String input : inputs) {
            assertDoesNotThrow(() -> {
                engine.evaluate(input);
                engine.highlightSyntax(input);
                engine.renderHighlightedHtml(input);
                engine.getSuggestions(input, input.length());
                engine.getSuggestions(input, 0);
            }, input);
        }
    }
}
