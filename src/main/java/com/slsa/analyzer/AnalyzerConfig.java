package com.slsa.analyzer;

import com.slsa.io.LineReader;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable settings for one analyzer run.
 * None of them changes how the tree is built or refined; they only control
 * what gets reported and where.
 */
public final class AnalyzerConfig {
    private final Path input;
    private final boolean reportProgress;
    private final boolean verbose;
    private final boolean printInitialTree;
    private final boolean traceRefinement;
    private final Path jsonOutput;
    private final boolean prettyJson;
    private final Charset charset;
    private final int maxLineLength;

    private AnalyzerConfig(Builder builder) {
        this.input = builder.input;
        this.reportProgress = builder.reportProgress;
        this.verbose = builder.verbose;
        this.printInitialTree = builder.printInitialTree;
        this.traceRefinement = builder.traceRefinement;
        this.jsonOutput = builder.jsonOutput;
        this.prettyJson = builder.prettyJson;
        this.charset = builder.charset;
        this.maxLineLength = builder.maxLineLength;
    }

    /** Input file; {@code null} means stdin. */
    public Path getInput() {
        return input;
    }

    public boolean isReportProgress() {
        return reportProgress;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isPrintInitialTree() {
        return printInitialTree;
    }

    public boolean isTraceRefinement() {
        return traceRefinement;
    }

    /** JSON dump destination; {@code null} means no JSON output. */
    public Path getJsonOutput() {
        return jsonOutput;
    }

    public boolean isPrettyJson() {
        return prettyJson;
    }

    public Charset getCharset() {
        return charset;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public static AnalyzerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(AnalyzerConfig config) {
        return new Builder()
            .input(config.input)
            .reportProgress(config.reportProgress)
            .verbose(config.verbose)
            .printInitialTree(config.printInitialTree)
            .traceRefinement(config.traceRefinement)
            .jsonOutput(config.jsonOutput)
            .prettyJson(config.prettyJson)
            .charset(config.charset)
            .maxLineLength(config.maxLineLength);
    }

    public static final class Builder {
        private Path input;
        private boolean reportProgress = false;
        private boolean verbose = false;
        private boolean printInitialTree = false;
        private boolean traceRefinement = false;
        private Path jsonOutput;
        private boolean prettyJson = false;
        private Charset charset = StandardCharsets.UTF_8;
        private int maxLineLength = LineReader.DEFAULT_MAX_LINE;

        private Builder() {}

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder reportProgress(boolean reportProgress) {
            this.reportProgress = reportProgress;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder printInitialTree(boolean printInitialTree) {
            this.printInitialTree = printInitialTree;
            return this;
        }

        public Builder traceRefinement(boolean traceRefinement) {
            this.traceRefinement = traceRefinement;
            return this;
        }

        public Builder jsonOutput(Path jsonOutput) {
            this.jsonOutput = jsonOutput;
            return this;
        }

        public Builder prettyJson(boolean prettyJson) {
            this.prettyJson = prettyJson;
            return this;
        }

        public Builder charset(Charset charset) {
            this.charset = charset;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public AnalyzerConfig build() {
            Objects.requireNonNull(charset, "charset cannot be null");
            if (maxLineLength < 2) {
                throw new IllegalArgumentException("maxLineLength must be at least 2");
            }
            return new AnalyzerConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyzerConfig)) return false;
        AnalyzerConfig that = (AnalyzerConfig) o;
        return reportProgress == that.reportProgress &&
               verbose == that.verbose &&
               printInitialTree == that.printInitialTree &&
               traceRefinement == that.traceRefinement &&
               prettyJson == that.prettyJson &&
               maxLineLength == that.maxLineLength &&
               Objects.equals(input, that.input) &&
               Objects.equals(jsonOutput, that.jsonOutput) &&
               Objects.equals(charset, that.charset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, reportProgress, verbose, printInitialTree, traceRefinement,
                jsonOutput, prettyJson, charset, maxLineLength);
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{" +
               "input=" + (input == null ? "<stdin>" : input) +
               ", reportProgress=" + reportProgress +
               ", verbose=" + verbose +
               ", printInitialTree=" + printInitialTree +
               ", traceRefinement=" + traceRefinement +
               ", jsonOutput=" + jsonOutput +
               ", prettyJson=" + prettyJson +
               ", charset=" + charset +
               ", maxLineLength=" + maxLineLength +
               '}';
    }
}
