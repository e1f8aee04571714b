package com.slsa.analyzer;

import com.slsa.core.ProgressReporter;
import com.slsa.core.SlsaLog;
import com.slsa.io.LineReader;
import com.slsa.tree.JsonTreeWriter;
import com.slsa.tree.StructureTree;
import com.slsa.tree.TreeBuilder;
import com.slsa.tree.TreePrinter;
import com.slsa.tree.TreeRefiner;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * One analyzer run. Owns the structure tree and takes it through the two
 * phases: every line is added first, then the tree is refined exactly once.
 */
public final class StructureAnalyzer {
    private final AnalyzerConfig config;
    private final StructureTree tree = new StructureTree();
    private final TreeBuilder builder = new TreeBuilder(tree);
    private final ProgressReporter progress;
    private boolean refined;

    public StructureAnalyzer(AnalyzerConfig config) {
        this(config, System.err);
    }

    /**
     * @param progressOut where progress goes when enabled in {@code config}
     */
    public StructureAnalyzer(AnalyzerConfig config, PrintStream progressOut) {
        this.config = Objects.requireNonNull(config, "config");
        this.progress = config.isReportProgress() ? new ProgressReporter(progressOut) : ProgressReporter.DISABLED;
    }

    public StructureTree getTree() {
        return tree;
    }

    /**
     * Number of lines that produced at least one token.
     */
    public long getLinesAdded() {
        return builder.getLinesAdded();
    }

    /**
     * Add a single raw line.
     *
     * @throws IllegalStateException once the tree has been refined
     */
    public void addLine(String line) {
        if (refined) {
            throw new IllegalStateException("tree already refined, no more lines accepted");
        }
        if (!line.isEmpty()) {
            builder.insert(line);
        }
    }

    /**
     * Add every line of {@code in}. The stream is not closed.
     */
    public void addLines(InputStream in) throws IOException {
        LineReader reader = new LineReader(in, config.getCharset(), config.getMaxLineLength());
        for (String line = reader.next(); line != null; line = reader.next()) {
            progress.step("reading");
            addLine(line);
        }
        SlsaLog.info("read %d lines (%d truncated), %d with tokens, tree has %d nodes",
                reader.getLinesRead(), reader.getLinesTruncated(), builder.getLinesAdded(), tree.size());
    }

    /**
     * Refine the tree. Refinement decisions go to {@code trace} when tracing is on.
     *
     * @throws IllegalStateException if called twice
     */
    public void refine(PrintWriter trace) {
        if (refined) {
            throw new IllegalStateException("tree already refined");
        }
        refined = true;
        new TreeRefiner(progress, config.isTraceRefinement() ? trace : null).refine(tree);
        SlsaLog.info("refined tree has %d nodes", tree.size());
    }

    /**
     * Full run: read, optionally print the raw tree, refine, print, and write
     * the JSON dump if configured.
     */
    public void run(InputStream in, PrintWriter out) throws IOException {
        addLines(in);
        TreePrinter printer = new TreePrinter(out, progress);
        if (config.isPrintInitialTree()) {
            printer.write(tree);
        }
        refine(out);
        out.flush();
        printer.write(tree);
        if (config.getJsonOutput() != null) {
            try (JsonTreeWriter json = new JsonTreeWriter(config.getJsonOutput(), config.isPrettyJson())) {
                json.write(tree);
            }
            SlsaLog.info("JSON tree written to %s", config.getJsonOutput());
        }
        progress.finish();
    }
}
