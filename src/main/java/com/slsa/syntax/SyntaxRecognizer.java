package com.slsa.syntax;

/**
 * A stateless test for one token shape.
 * Implementations look at {@code text} starting at {@code offset} and never
 * read at or beyond {@code end}.
 */
@FunctionalInterface
public interface SyntaxRecognizer {
    /** Returned when the text at the offset does not have the recognized shape. */
    int NO_MATCH = -1;

    /**
     * @return number of characters consumed (always positive), or {@link #NO_MATCH}
     */
    int match(CharSequence text, int offset, int end);

    /**
     * Whether the whole of {@code text} has this shape.
     */
    default boolean matchesFully(CharSequence text) {
        return match(text, 0, text.length()) == text.length();
    }
}
