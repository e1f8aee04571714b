package com.slsa.tokenize;

import com.slsa.syntax.SyntaxRecognizer;
import com.slsa.syntax.Syntaxes;
import com.slsa.tree.TokenValue;

/**
 * Replaces a word by a typed placeholder when it has a known shape.
 *
 * Order matters: positive integer, 24-hour time, duration, IPv4. A duration
 * accepts every 24-hour time, so time is tried first; durations usually start
 * with a single digit and therefore slip past the time check. Durations of
 * ten hours or more are still reported as time.
 */
public final class SyntaxDetector {

    private SyntaxDetector() {} // Utility class

    /**
     * Detect the syntax of {@code value} and rewrite it in place.
     *
     * @param value         the word to examine
     * @param detectStacked whether composite shapes ({@code ipv4/prefixlen}) may be
     *                      split into several tokens
     * @param queue         receives the trailing tokens of a composite shape; may be
     *                      {@code null} when {@code detectStacked} is false
     * @return true if the value was turned into a placeholder
     */
    public static boolean detect(TokenValue value, boolean detectStacked, LookaheadQueue queue) {
        String word = value.getText();
        int len = word.length();

        if (fullMatch(Syntaxes.POSINT_RECOGNIZER, word)) {
            value.becomePlaceholder(Syntaxes.POSINT);
            return true;
        }
        if (fullMatch(Syntaxes.TIME_24HR_RECOGNIZER, word)) {
            value.becomePlaceholder(Syntaxes.TIME_24HR);
            return true;
        }
        if (fullMatch(Syntaxes.DURATION_RECOGNIZER, word)) {
            value.becomePlaceholder(Syntaxes.DURATION);
            return true;
        }

        int nproc = Syntaxes.ipv4(word, 0, len);
        if (nproc == SyntaxRecognizer.NO_MATCH) {
            return false;
        }
        if (nproc == len) {
            value.becomePlaceholder(Syntaxes.IPV4);
            return true;
        }
        if (detectStacked && word.charAt(nproc) == '/') {
            int start = nproc + 1;
            if (Syntaxes.posint(word, start, len) == len - start) {
                value.becomePlaceholder(Syntaxes.IPV4);
                value.setSubword(true);
                // popped in reverse: "/" comes out first, then the prefix length
                queue.push(TokenValue.of(Syntaxes.POSINT, true, true));
                queue.push(TokenValue.of("/", true, false));
                return true;
            }
        }
        return false;
    }

    private static boolean fullMatch(SyntaxRecognizer recognizer, String word) {
        return !word.isEmpty() && recognizer.matchesFully(word);
    }
}
