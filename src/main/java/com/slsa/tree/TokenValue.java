package com.slsa.tree;

import java.util.Objects;

/**
 * One observed value at a tree position: literal text (or a placeholder)
 * together with how often it was seen there.
 */
public final class TokenValue {
    private String text;
    private int occurrences;
    private boolean subword;
    private boolean special;

    public TokenValue(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.occurrences = 1;
    }

    /**
     * Creates a value with explicit flags, for synthetic tokens and placeholders.
     */
    public static TokenValue of(String text, boolean subword, boolean special) {
        TokenValue v = new TokenValue(text);
        v.subword = subword;
        v.special = special;
        return v;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public int getOccurrences() {
        return occurrences;
    }

    public void setOccurrences(int occurrences) {
        this.occurrences = occurrences;
    }

    public void incrementOccurrences() {
        occurrences++;
    }

    public boolean isSubword() {
        return subword;
    }

    public void setSubword(boolean subword) {
        this.subword = subword;
    }

    public boolean isSpecial() {
        return special;
    }

    public void setSpecial(boolean special) {
        this.special = special;
    }

    /**
     * Replace the text by a generalized placeholder.
     */
    public void becomePlaceholder(String placeholder) {
        this.text = placeholder;
        this.special = true;
    }

    /**
     * Whether the text is a placeholder produced by syntax detection or the
     * line preprocessor. Raw words that merely start with {@code %} are not.
     */
    public boolean isPlaceholder() {
        return special;
    }

    @Override
    public String toString() {
        return "TokenValue{" +
               "text='" + text + '\'' +
               ", occurrences=" + occurrences +
               ", subword=" + subword +
               ", special=" + special +
               '}';
    }
}
