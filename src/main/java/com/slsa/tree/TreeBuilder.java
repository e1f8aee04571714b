package com.slsa.tree;

import com.slsa.tokenize.LinePreprocessor;
import com.slsa.tokenize.Tokenizer;

import java.util.Objects;

/**
 * Adds lines, one at a time, to a {@link StructureTree}.
 */
public final class TreeBuilder {
    private final StructureTree tree;
    private long linesAdded;

    public TreeBuilder(StructureTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    public StructureTree getTree() {
        return tree;
    }

    /**
     * Number of lines that contributed at least one token.
     */
    public long getLinesAdded() {
        return linesAdded;
    }

    /**
     * Preprocess, tokenize and insert one raw line.
     *
     * @return true if the line had tokens and was recorded
     */
    public boolean insert(String line) {
        return insertPreprocessed(LinePreprocessor.preprocess(line));
    }

    /**
     * Tokenize and insert a line that already went through the preprocessor.
     *
     * @return true if the line had tokens and was recorded
     */
    public boolean insertPreprocessed(String line) {
        Tokenizer tokenizer = new Tokenizer(line);
        TokenValue next = tokenizer.next();
        if (next == null) {
            return false;
        }
        int level = tree.root();
        while (next != null) {
            TokenValue current = next;
            next = tokenizer.next();
            level = addToLevel(level, current, next);
        }
        tree.node(level).incrementTerminalCount();
        linesAdded++;
        return true;
    }

    /**
     * Place {@code value} among the children of {@code level}.
     *
     * @param lookahead the token following {@code value}, or {@code null} at line end
     * @return the node {@code value} ended up in
     */
    int addToLevel(int level, TokenValue value, TokenValue lookahead) {
        TreeNode parent = tree.node(level);
        for (int c = parent.getChild(); c != StructureTree.NONE; c = tree.node(c).getSibling()) {
            TokenValue existing = tree.node(c).findValue(value.getText());
            if (existing != null) {
                existing.incrementOccurrences();
                return c;
            }
        }

        // branches that meet again right after this token share one node;
        // the end of the line counts as meeting again at a leaf
        for (int c = parent.getChild(); c != StructureTree.NONE; c = tree.node(c).getSibling()) {
            TreeNode candidate = tree.node(c);
            if (continuesWith(candidate, lookahead)) {
                value.setOccurrences(1);
                candidate.addValue(value);
                return c;
            }
        }

        return tree.appendChild(level, value);
    }

    // the candidate's sole descendant position holds exactly the lookahead value
    private boolean continuesWith(TreeNode candidate, TokenValue lookahead) {
        if (lookahead == null) {
            return !candidate.hasChild();
        }
        if (!candidate.hasChild()) {
            return false;
        }
        String text = lookahead.getText();
        TreeNode next = tree.node(candidate.getChild());
        return !next.hasSibling()
                && next.valueCount() == 1
                && next.firstValue().getText().equals(text);
    }
}
