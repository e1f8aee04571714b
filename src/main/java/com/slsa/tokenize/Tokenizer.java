package com.slsa.tokenize;

import com.slsa.syntax.Syntaxes;
import com.slsa.tree.TokenValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one preprocessed line into whitespace-delimited tokens, running
 * syntax detection on each word.
 */
public final class Tokenizer {
    private final String line;
    private final LookaheadQueue pending = new LookaheadQueue();
    private int pos;

    public Tokenizer(String line) {
        this.line = line;
    }

    /**
     * @return the next token, or {@code null} at the end of the line
     * @throws LookaheadOverflowException if a word decomposes into too many tokens
     */
    public TokenValue next() {
        TokenValue queued = pending.pop();
        if (queued != null) {
            return queued;
        }
        int len = line.length();
        int i = pos;
        while (i < len && Syntaxes.isSpace(line.charAt(i))) {
            i++;
        }
        int begin = i;
        while (i < len && !Syntaxes.isSpace(line.charAt(i))) {
            i++;
        }
        pos = i;
        if (begin == i) {
            return null;
        }
        TokenValue value = new TokenValue(line.substring(begin, i));
        if (Syntaxes.isPlaceholder(value.getText())) {
            // marked words are never re-detected; only our own names count as placeholders
            value.setSpecial(Syntaxes.isKnownPlaceholder(value.getText()));
        } else {
            SyntaxDetector.detect(value, true, pending);
        }
        return value;
    }

    /**
     * Tokenize a whole line at once.
     */
    public static List<TokenValue> tokenize(String line) {
        Tokenizer t = new Tokenizer(line);
        List<TokenValue> out = new ArrayList<>();
        for (TokenValue v = t.next(); v != null; v = t.next()) {
            out.add(v);
        }
        return out;
    }
}
