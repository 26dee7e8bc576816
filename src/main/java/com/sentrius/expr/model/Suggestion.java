package com.sentrius.expr.model;

import java.util.Objects;

/**
 * An auto-completion candidate.
 * {@code text} is inserted literally, {@code displayText} is what a UI shows.
 */
public class Suggestion {
    private final String text;
    private final String displayText;
    private final SuggestionCategory category;
    private final String description;

    public Suggestion(String text, String displayText, SuggestionCategory category, String description) {
        if (text == null || category == null) {
            throw new IllegalArgumentException("Suggestion text and category cannot be null");
        }
        this.text = text;
        this.displayText = displayText != null ? displayText : text;
        this.category = category;
        this.description = description;
    }

    public String getText() {
        return text;
    }

    public String getDisplayText() {
        return displayText;
    }

    public SuggestionCategory getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Suggestion)) {
            return false;
        }
        Suggestion other = (Suggestion) o;
        return text.equals(other.text) && displayText.equals(other.displayText)
            && category == other.category && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, displayText, category, description);
    }

    @Override
    public String toString() {
        return "Suggestion{text='" + text + "', displayText='" + displayText + "', category=" + category + "}";
    }
}
