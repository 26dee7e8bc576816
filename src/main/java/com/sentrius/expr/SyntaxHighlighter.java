package com.sentrius.expr;

import com.sentrius.expr.model.StyledToken;
import com.sentrius.expr.model.SyntaxError;
import com.sentrius.expr.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Assigns style tags to tokens and renders them as HTML spans.
 */
public class SyntaxHighlighter {
    private final SyntaxStyles styles;

    public SyntaxHighlighter() {
        this(SyntaxStyles.defaults());
    }

    public SyntaxHighlighter(SyntaxStyles styles) {
        this.styles = styles != null ? styles : SyntaxStyles.defaults();
    }

    public SyntaxStyles getStyles() {
        return styles;
    }

    /**
     * Style each token by its type, or with the error style if any of its
     * characters sits at a recorded error position.
     *
     * @param tokens The tokens to highlight
     * @param errors Syntax errors to mark; may be null
     * @return One styled token per input token, in input order
     */
    public List<StyledToken> highlight(List<Token> tokens, List<SyntaxError> errors) {
        List<SyntaxError> markers = errors != null ? errors : Collections.emptyList();

        List<StyledToken> styled = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            boolean hasError = false;
            for (SyntaxError error : markers) {
                if (token.covers(error.getPosition())) {
                    hasError = true;
                    break;
                }
            }
            styled.add(new StyledToken(token, hasError ? styles.getErrorStyle() : styles.styleFor(token.getType())));
        }
        return styled;
    }

    public List<StyledToken> highlight(List<Token> tokens) {
        return highlight(tokens, null);
    }

    /**
     * Render highlighted tokens as HTML.
     * Text not covered by any token is copied through unchanged.
     *
     * @param expression The source text the tokens were produced from
     * @param styledTokens The highlighted tokens
     * @return The markup, e.g. {@code <span class="expression-number">2</span>}
     */
    public String renderToHtml(String expression, List<StyledToken> styledTokens) {
        String text = expression != null ? expression : "";
        List<StyledToken> sorted = new ArrayList<>(styledTokens);
        sorted.sort(Comparator.comparingInt(Token::getStart));

        StringBuilder html = new StringBuilder();
        int lastEnd = 0;
        for (StyledToken token : sorted) {
            if (token.getStart() < lastEnd || token.getEnd() >= text.length()) {
                // Overlapping or out of range for this text.
                continue;
            }
            if (token.getStart() > lastEnd) {
                html.append(text, lastEnd, token.getStart());
            }
            html.append("<span class=\"").append(token.getStyle()).append("\">")
                .append(text, token.getStart(), token.getEnd() + 1)
                .append("</span>");
            lastEnd = token.getEnd() + 1;
        }

        if (lastEnd < text.length()) {
            html.append(text.substring(lastEnd));
        }
        return html.toString();
    }
}
