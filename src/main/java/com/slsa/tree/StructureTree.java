package com.slsa.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * The trie of observed token sequences.
 *
 * Nodes live in an arena and refer to each other by index. Removing a node
 * leaves a tombstone in its slot, so indices held elsewhere never point at a
 * different node.
 */
public final class StructureTree {
    public static final int NONE = -1;
    public static final String ROOT_TEXT = "[ROOT]";

    private final List<TreeNode> arena = new ArrayList<>();
    private final int root;
    private int liveNodes;

    public StructureTree() {
        this.root = allocate(new TokenValue(ROOT_TEXT));
    }

    public int root() {
        return root;
    }

    public TreeNode rootNode() {
        return node(root);
    }

    /**
     * @throws IllegalArgumentException if the node was removed or never existed
     */
    public TreeNode node(int id) {
        TreeNode n = id >= 0 && id < arena.size() ? arena.get(id) : null;
        if (n == null) {
            throw new IllegalArgumentException("no such node: " + id);
        }
        return n;
    }

    public boolean isLive(int id) {
        return id >= 0 && id < arena.size() && arena.get(id) != null;
    }

    /**
     * Number of nodes currently in the tree, root included.
     */
    public int size() {
        return liveNodes;
    }

    /**
     * Create a node holding {@code value} as last child of {@code parent}.
     *
     * @return the new node's id
     */
    public int appendChild(int parent, TokenValue value) {
        TreeNode p = node(parent);
        int id = allocate(value);
        TreeNode n = arena.get(id);
        n.parent = parent;
        if (p.child == NONE) {
            p.child = id;
        } else {
            int last = p.child;
            while (arena.get(last).sibling != NONE) {
                last = arena.get(last).sibling;
            }
            arena.get(last).sibling = id;
        }
        return id;
    }

    /**
     * Insert a new node holding {@code value} directly below {@code id}; the new
     * node takes over all of {@code id}'s children.
     *
     * @return the new node's id
     */
    public int insertBelow(int id, TokenValue value) {
        TreeNode n = node(id);
        int below = allocate(value);
        TreeNode b = arena.get(below);
        b.parent = id;
        b.child = n.child;
        reparentChain(b.child, below);
        n.child = below;
        return below;
    }

    /**
     * Split {@code id} into two positions: {@code id} keeps its place among its
     * siblings but is left holding only {@code head}, while its former values,
     * terminal count and children move into a new node right below it.
     *
     * @return the id of the new node holding the former values
     */
    public int splitAbove(int id, TokenValue head) {
        TreeNode n = node(id);
        int below = allocate(head);
        TreeNode b = arena.get(below);
        // swap value lists: the new node gets the old values
        b.values.clear();
        b.values.addAll(n.values);
        n.values.clear();
        n.values.add(head);
        b.terminalCount = n.terminalCount;
        n.terminalCount = 0;
        b.parent = id;
        b.child = n.child;
        reparentChain(b.child, below);
        n.child = below;
        return below;
    }

    /**
     * Remove the only child of {@code id}, letting {@code id} take over the
     * child's terminal count and children. Value texts are left to the caller.
     *
     * @throws IllegalStateException if {@code id} does not have exactly one child
     */
    public void absorbChild(int id) {
        TreeNode n = node(id);
        if (n.child == NONE || arena.get(n.child).sibling != NONE) {
            throw new IllegalStateException("node " + id + " does not have a single child");
        }
        int gone = n.child;
        TreeNode c = arena.get(gone);
        n.terminalCount = c.terminalCount;
        n.child = c.child;
        reparentChain(n.child, id);
        arena.set(gone, null);
        liveNodes--;
    }

    /**
     * Whether {@code id} is the sole node at its level.
     */
    public boolean isOnlyChild(int id) {
        TreeNode n = node(id);
        if (n.parent == NONE) {
            return n.sibling == NONE;
        }
        return arena.get(n.parent).child == id && n.sibling == NONE;
    }

    /**
     * Sum of terminal counts over all live nodes.
     */
    public long totalTerminalCount() {
        long total = 0;
        for (TreeNode n : arena) {
            if (n != null) total += n.terminalCount;
        }
        return total;
    }

    /**
     * Ids of the children of {@code id}, in sibling order.
     */
    public List<Integer> children(int id) {
        List<Integer> out = new ArrayList<>();
        for (int c = node(id).child; c != NONE; c = arena.get(c).sibling) {
            out.add(c);
        }
        return out;
    }

    private void reparentChain(int first, int parent) {
        for (int c = first; c != NONE; c = arena.get(c).sibling) {
            arena.get(c).parent = parent;
        }
    }

    private int allocate(TokenValue first) {
        int id = arena.size();
        TreeNode n = new TreeNode(id);
        n.values.add(first);
        arena.add(n);
        liveNodes++;
        return id;
    }
}
