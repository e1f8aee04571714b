package com.slsa.tokenize;

import com.slsa.tree.TokenValue;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded holding area for tokens that must be consumed before reading
 * further input. Last pushed is first returned.
 */
public final class LookaheadQueue {
    public static final int CAPACITY = 8;

    private final Deque<TokenValue> stack = new ArrayDeque<>(CAPACITY);

    /**
     * @throws LookaheadOverflowException if {@link #CAPACITY} tokens are already pending
     */
    public void push(TokenValue value) {
        if (stack.size() >= CAPACITY) {
            throw new LookaheadOverflowException(CAPACITY);
        }
        stack.push(value);
    }

    /**
     * @return the most recently pushed token, or {@code null} when empty
     */
    public TokenValue pop() {
        return stack.poll();
    }

    public boolean isEmpty() {
        return stack.isEmpty();
    }

    public int size() {
        return stack.size();
    }

    public void clear() {
        stack.clear();
    }
}
