package com.slsa;

import com.slsa.analyzer.AnalyzerConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    @Test
    void testNoArgumentsReadsStdin() {
        AnalyzerConfig c = Main.parseArgs(new String[0], err);
        assertEquals(AnalyzerConfig.defaults(), c);
    }

    @Test
    void testAllOptions() {
        AnalyzerConfig c = Main.parseArgs(new String[] {
                "-p", "--verbose", "--print-initial", "--trace",
                "--json", "out.json", "--pretty", "--charset", "ISO-8859-1", "app.log"}, err);

        assertTrue(c.isReportProgress());
        assertTrue(c.isVerbose());
        assertTrue(c.isPrintInitialTree());
        assertTrue(c.isTraceRefinement());
        assertTrue(c.isPrettyJson());
        assertEquals(Path.of("out.json"), c.getJsonOutput());
        assertEquals(StandardCharsets.ISO_8859_1, c.getCharset());
        assertEquals(Path.of("app.log"), c.getInput());
    }

    @Test
    void testDashMeansStdin() {
        assertNull(Main.parseArgs(new String[] {"-"}, err).getInput());
    }

    @Test
    void testHelp() {
        assertNull(Main.parseArgs(new String[] {"--help"}, err));
        assertNull(Main.parseArgs(new String[] {"-v", "-h"}, err));
    }

    @Test
    void testUnknownOptionIsReportedAndIgnored() {
        AnalyzerConfig c = Main.parseArgs(new String[] {"--bogus", "-v"}, err);

        assertTrue(c.isVerbose());
        assertTrue(errBuf.toString(StandardCharsets.UTF_8).contains("invalid option: --bogus"));
    }

    @Test
    void testMissingValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Main.parseArgs(new String[] {"--json"}, err));
        assertEquals("--json requires a value", e.getMessage());
    }

    @Test
    void testUnknownCharset() {
        assertThrows(IllegalArgumentException.class,
                () -> Main.parseArgs(new String[] {"--charset", "no-such-charset"}, err));
    }
}
