package com.slsa.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One position in a token sequence, shared by all lines that reach it.
 * Links are arena indices into the owning {@link StructureTree};
 * {@link StructureTree#NONE} stands for "no node".
 */
public final class TreeNode {
    private final int id;
    final List<TokenValue> values = new ArrayList<>(1);
    int terminalCount;
    int parent = StructureTree.NONE;
    int sibling = StructureTree.NONE;
    int child = StructureTree.NONE;

    TreeNode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public List<TokenValue> getValues() {
        return Collections.unmodifiableList(values);
    }

    public int valueCount() {
        return values.size();
    }

    public TokenValue firstValue() {
        return values.get(0);
    }

    /**
     * @return the value with exactly this text, or {@code null}
     */
    public TokenValue findValue(String text) {
        for (TokenValue v : values) {
            if (v.getText().equals(text)) {
                return v;
            }
        }
        return null;
    }

    public void addValue(TokenValue value) {
        values.add(value);
    }

    public int getTerminalCount() {
        return terminalCount;
    }

    public void incrementTerminalCount() {
        terminalCount++;
    }

    public int getParent() {
        return parent;
    }

    public int getSibling() {
        return sibling;
    }

    public int getChild() {
        return child;
    }

    public boolean hasChild() {
        return child != StructureTree.NONE;
    }

    public boolean hasSibling() {
        return sibling != StructureTree.NONE;
    }

    @Override
    public String toString() {
        return "TreeNode{id=" + id + ", values=" + values + ", terminalCount=" + terminalCount + '}';
    }
}
