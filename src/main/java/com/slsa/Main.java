package com.slsa;

import com.slsa.analyzer.AnalyzerConfig;
import com.slsa.analyzer.StructureAnalyzer;
import com.slsa.core.SlsaLog;
import com.slsa.tokenize.LookaheadOverflowException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class Main {

    static final String USAGE = "Usage: java -jar slsa-1.0.0.jar [options] [file]\n"
            + "Reads log lines from file (or stdin) and prints their structure tree.\n"
            + "  -p, --report-progress  report progress on stderr\n"
            + "  -v, --verbose          diagnostic messages on stderr\n"
            + "  --print-initial        also print the tree before refinement\n"
            + "  --trace                print refinement decisions\n"
            + "  --json <file>          also write the refined tree as JSON\n"
            + "  --pretty               pretty-print the JSON output\n"
            + "  --charset <name>       input charset (default UTF-8)";

    private Main() {}

    /**
     * Parse command line arguments.
     *
     * @return the run configuration, or {@code null} if only usage was requested
     */
    static AnalyzerConfig parseArgs(String[] args, PrintStream err) {
        AnalyzerConfig.Builder b = AnalyzerConfig.builder();
        for (int i = 0; i < args.length; i++) {
            String k = args[i];
            switch (k) {
                case "-p", "--report-progress" -> b.reportProgress(true);
                case "-v", "--verbose" -> b.verbose(true);
                case "--print-initial" -> b.printInitialTree(true);
                case "--trace" -> b.traceRefinement(true);
                case "--pretty" -> b.prettyJson(true);
                case "--json" -> b.jsonOutput(Path.of(requireValue(args, ++i, k)));
                case "--charset" -> b.charset(Charset.forName(requireValue(args, ++i, k)));
                case "-h", "--help" -> {
                    return null;
                }
                default -> {
                    if (k.startsWith("-") && !k.equals("-")) {
                        err.println("invalid option: " + k);
                    } else if (!k.equals("-")) {
                        b.input(Path.of(k));
                    }
                }
            }
        }
        return b.build();
    }

    private static String requireValue(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[i];
    }

    public static void main(String[] args) {
        AnalyzerConfig config;
        try {
            config = parseArgs(args, System.err);
        } catch (IllegalArgumentException e) {
            System.err.println("slsa: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }
        if (config == null) {
            System.out.println(USAGE);
            return;
        }
        SlsaLog.setVerbose(config.isVerbose());
        SlsaLog.debug("configuration: %s", config);

        PrintWriter out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        try (InputStream in = config.getInput() == null ? System.in : Files.newInputStream(config.getInput())) {
            new StructureAnalyzer(config).run(in, out);
        } catch (IOException e) {
            out.flush();
            SlsaLog.error("I/O failure", e);
            System.err.println("slsa: " + e.getMessage());
            System.exit(1);
        } catch (LookaheadOverflowException e) {
            out.flush();
            System.err.println("slsa: " + e.getMessage());
            System.exit(1);
        }
        out.flush();
    }
}
