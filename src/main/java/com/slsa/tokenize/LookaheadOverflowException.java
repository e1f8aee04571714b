package com.slsa.tokenize;

/**
 * Thrown when a single word decomposes into more deferred tokens than the
 * lookahead queue can hold. Fatal for the run.
 */
public class LookaheadOverflowException extends IllegalStateException {

    public LookaheadOverflowException(int capacity) {
        super("lookahead queue too small (capacity " + capacity + ")");
    }
}
