package com.slsa.tree;

import com.slsa.core.ProgressReporter;
import com.slsa.core.SlsaLog;
import com.slsa.tokenize.SyntaxDetector;

import java.io.PrintWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Generalizes a fully built {@link StructureTree}.
 *
 * For every node, depth first with children before siblings:
 * <ol>
 *   <li>collapse a non-branching chain of plain words into one node,</li>
 *   <li>split the common prefix and suffix of the node's values into nodes of
 *       their own and re-run syntax detection on what remains,</li>
 *   <li>merge values that now have the same text.</li>
 * </ol>
 */
public final class TreeRefiner {
    private static final int TRACE_SAMPLES = 5;

    private final ProgressReporter progress;
    private final PrintWriter trace;

    private int collapses;
    private int disjoins;
    private int mergedValues;

    public TreeRefiner() {
        this(ProgressReporter.DISABLED, null);
    }

    /**
     * @param progress progress sink, never {@code null}
     * @param trace    receives a line per refinement decision; {@code null} for none
     */
    public TreeRefiner(ProgressReporter progress, PrintWriter trace) {
        this.progress = progress;
        this.trace = trace;
    }

    public void refine(StructureTree tree) {
        Deque<Integer> work = new ArrayDeque<>();
        work.push(tree.root());
        while (!work.isEmpty()) {
            int id = work.pop();
            progress.step("squashing");
            collapseChain(tree, id);
            int holder = disjoin(tree, id);
            squash(tree.node(holder));
            TreeNode n = tree.node(id);
            if (n.hasSibling()) work.push(n.getSibling());
            if (n.hasChild()) work.push(n.getChild());
        }
        SlsaLog.debug("refine: %d chains collapsed, %d nodes disjoined, %d duplicate values merged",
                collapses, disjoins, mergedValues);
    }

    public int getCollapses() {
        return collapses;
    }

    public int getDisjoins() {
        return disjoins;
    }

    public int getMergedValues() {
        return mergedValues;
    }

    void collapseChain(StructureTree tree, int id) {
        while (isCollapsible(tree, id)) {
            TreeNode n = tree.node(id);
            TokenValue v = n.firstValue();
            String joined = v.getText() + " " + tree.node(n.getChild()).firstValue().getText();
            if (trace != null) {
                trace.print("squashing: " + joined + "\n");
            }
            v.setText(joined);
            tree.absorbChild(id);
            collapses++;
        }
    }

    // lines ending at this node would lose their end position, so such nodes stay
    private boolean isCollapsible(StructureTree tree, int id) {
        TreeNode n = tree.node(id);
        if (id == tree.root() || !n.hasChild() || n.valueCount() != 1 || n.getTerminalCount() != 0) {
            return false;
        }
        if (!tree.isOnlyChild(id)) {
            return false;
        }
        TreeNode c = tree.node(n.getChild());
        if (c.hasSibling() || c.valueCount() != 1) {
            return false;
        }
        return isPlainWord(n.firstValue()) && isPlainWord(c.firstValue());
    }

    private static boolean isPlainWord(TokenValue v) {
        return !v.isPlaceholder() && !v.isSubword();
    }

    /**
     * @return the node that holds the (possibly shortened) values afterwards
     */
    int disjoin(StructureTree tree, int id) {
        TreeNode n = tree.node(id);
        if (n.valueCount() < 2 || n.firstValue().isSubword()) {
            return id;
        }
        List<String> texts = new ArrayList<>(n.valueCount());
        int shortest = Integer.MAX_VALUE;
        for (TokenValue v : n.values) {
            if (v.isPlaceholder()) {
                return id;
            }
            texts.add(v.getText());
            shortest = Math.min(shortest, v.getText().length());
        }

        AffixSplit split = AffixSplit.compute(texts);
        if (split.isEmpty()) {
            return id;
        }
        if (split.overlaps(shortest)) {
            SlsaLog.warn("overlapping common affixes (%s) for %s, suffix cut to %d",
                    split, texts, split.suffixWithin(shortest));
        }
        int prefixLen = split.getPrefixLength();
        int suffixLen = split.suffixWithin(shortest);
        traceSplit(texts, prefixLen, suffixLen);

        int holder = id;
        if (prefixLen > 0) {
            String prefix = texts.get(0).substring(0, prefixLen);
            holder = tree.splitAbove(id, TokenValue.of(prefix, true, false));
            for (TokenValue v : tree.node(holder).values) {
                v.setText(v.getText().substring(prefixLen));
            }
        }
        TreeNode h = tree.node(holder);
        if (suffixLen > 0) {
            String first = h.firstValue().getText();
            String suffix = first.substring(first.length() - suffixLen);
            int tail = tree.insertBelow(holder, TokenValue.of(suffix, true, false));
            // lines that ended at the holder now end after the suffix
            tree.node(tail).terminalCount = h.terminalCount;
            h.terminalCount = 0;
            for (TokenValue v : h.values) {
                String t = v.getText();
                v.setText(t.substring(0, t.length() - suffixLen));
            }
        }
        for (TokenValue v : h.values) {
            v.setSubword(true);
            SyntaxDetector.detect(v, false, null);
        }
        disjoins++;
        return holder;
    }

    /**
     * Sort values by text and merge equal ones, summing their occurrences.
     *
     * @return number of values merged away
     */
    int squash(TreeNode n) {
        if (n.values.size() < 2) {
            return 0;
        }
        n.values.sort(Comparator.comparing(TokenValue::getText));
        int merged = 0;
        TokenValue kept = null;
        for (Iterator<TokenValue> it = n.values.iterator(); it.hasNext(); ) {
            TokenValue v = it.next();
            if (kept != null && kept.getText().equals(v.getText())) {
                kept.setOccurrences(kept.getOccurrences() + v.getOccurrences());
                it.remove();
                merged++;
            } else {
                kept = v;
            }
        }
        mergedValues += merged;
        return merged;
    }

    private void traceSplit(List<String> texts, int prefixLen, int suffixLen) {
        if (trace == null) return;
        trace.print("prefix " + prefixLen + ", suffix " + suffixLen + "\n");
        int samples = Math.min(TRACE_SAMPLES, texts.size());
        for (int i = 0; i < samples; i++) {
            String w = texts.get(i);
            int suffixStart = w.length() - suffixLen;
            trace.print("\"" + w.substring(0, prefixLen) + "\" \""
                    + w.substring(prefixLen, suffixStart) + "\" \""
                    + w.substring(suffixStart) + "\"\n");
        }
    }
}
