package com.slsa.tree;

import com.slsa.core.ProgressReporter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Human-readable tree dump, one line per value:
 * <pre>
 *  0l:[ROOT]
 *  1l:   user= {subword}
 *  2l:      alice {subword} [nterm 1]
 *  2v:      bob {subword}
 * </pre>
 * The first value of a node is marked {@code l} and carries the terminal
 * count; further values are marked {@code v}.
 * The underlying writer is flushed but not closed on close().
 */
public final class TreePrinter implements TreeWriter {
    private static final String INDENT = "   ";

    private final BufferedWriter writer;
    private final ProgressReporter progress;

    public TreePrinter(Writer writer) {
        this(writer, ProgressReporter.DISABLED);
    }

    public TreePrinter(Writer writer, ProgressReporter progress) {
        this.writer = writer instanceof BufferedWriter ? (BufferedWriter) writer : new BufferedWriter(writer);
        this.progress = progress;
    }

    @Override
    public void write(StructureTree tree) throws IOException {
        Deque<int[]> work = new ArrayDeque<>();
        work.push(new int[] {tree.root(), 0});
        while (!work.isEmpty()) {
            int[] top = work.pop();
            int level = top[1];
            TreeNode n = tree.node(top[0]);
            progress.step("print");

            indent(level, 'l');
            writeValue(n.firstValue());
            if (n.getTerminalCount() != 0) {
                writer.write(" [nterm " + n.getTerminalCount() + "]");
            }
            writer.write('\n');
            for (int i = 1; i < n.valueCount(); i++) {
                indent(level, 'v');
                writeValue(n.values.get(i));
                writer.write('\n');
            }

            if (n.hasSibling()) work.push(new int[] {n.getSibling(), level});
            if (n.hasChild()) work.push(new int[] {n.getChild(), level + 1});
        }
        writer.flush();
    }

    /**
     * Render a whole tree to a string.
     */
    public static String render(StructureTree tree) {
        StringWriter sw = new StringWriter();
        try (TreePrinter p = new TreePrinter(sw)) {
            p.write(tree);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter failed", e);
        }
        return sw.toString();
    }

    private void indent(int level, char indicator) throws IOException {
        writer.write(String.format(Locale.ROOT, "%2d%c:", level, indicator));
        for (int i = 0; i < level; i++) {
            writer.write(INDENT);
        }
    }

    private void writeValue(TokenValue v) throws IOException {
        writer.write(v.getText());
        if (v.isSubword()) {
            writer.write(" {subword}");
        }
        if (v.getOccurrences() > 1) {
            writer.write(" {" + v.getOccurrences() + "}");
        }
    }

    @Override
    public void close() throws IOException {
        writer.flush();
    }
}
