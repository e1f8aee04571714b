package com.slsa.syntax;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the token shape recognizers.
 */
class SyntaxesTest {

    private static int match(SyntaxRecognizer r, String s) {
        return r.match(s, 0, s.length());
    }

    @Test
    void testPosint() {
        assertEquals(3, match(Syntaxes.POSINT_RECOGNIZER, "200"));
        assertEquals(1, match(Syntaxes.POSINT_RECOGNIZER, "0"));
        assertEquals(2, match(Syntaxes.POSINT_RECOGNIZER, "42abc"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.POSINT_RECOGNIZER, "-1"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.POSINT_RECOGNIZER, ""));
    }

    @Test
    void testPosintHonorsOffsetAndEnd() {
        assertEquals(2, Syntaxes.posint("ab1234", 2, 4));
    }

    @Test
    void testTime24hr() {
        assertEquals(8, match(Syntaxes.TIME_24HR_RECOGNIZER, "23:59:59"));
        assertEquals(8, match(Syntaxes.TIME_24HR_RECOGNIZER, "00:00:00.123"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.TIME_24HR_RECOGNIZER, "24:00:00"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.TIME_24HR_RECOGNIZER, "12:60:00"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.TIME_24HR_RECOGNIZER, "1:00:00"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.TIME_24HR_RECOGNIZER, "12:00"));
    }

    @Test
    void testDuration() {
        assertEquals(7, match(Syntaxes.DURATION_RECOGNIZER, "1:02:03"));
        assertEquals(9, match(Syntaxes.DURATION_RECOGNIZER, "123:00:59"));
        assertEquals(8, match(Syntaxes.DURATION_RECOGNIZER, "12:30:45"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.DURATION_RECOGNIZER, "1:2:3"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.DURATION_RECOGNIZER, ":02:03"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.DURATION_RECOGNIZER, "1:75:00"));
    }

    @Test
    void testIpv4() {
        assertEquals(11, match(Syntaxes.IPV4_RECOGNIZER, "192.168.0.1"));
        assertEquals(15, match(Syntaxes.IPV4_RECOGNIZER, "255.255.255.255"));
        assertEquals(8, match(Syntaxes.IPV4_RECOGNIZER, "10.0.0.1/24"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.IPV4_RECOGNIZER, "256.1.1.1"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.IPV4_RECOGNIZER, "1.2.3"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.IPV4_RECOGNIZER, "1.2.3."));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.IPV4_RECOGNIZER, "a.b.c.d"));
    }

    @Test
    void testRfc3164Date() {
        assertEquals(15, match(Syntaxes.RFC3164_RECOGNIZER, "Oct 11 22:14:15 host su: x"));
        assertEquals(15, match(Syntaxes.RFC3164_RECOGNIZER, "Jan  1 00:00:01"));
        assertEquals(20, match(Syntaxes.RFC3164_RECOGNIZER, "Feb 02 2015 10:20:30"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC3164_RECOGNIZER, "Foo 11 22:14:15"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC3164_RECOGNIZER, "Oct 32 22:14:15"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC3164_RECOGNIZER, "Oct 11 25:14:15"));
    }

    @Test
    void testRfc5424Date() {
        assertEquals(20, match(Syntaxes.RFC5424_RECOGNIZER, "2003-10-11T22:14:15Z"));
        assertEquals(29, match(Syntaxes.RFC5424_RECOGNIZER, "2003-10-11T22:14:15.003-07:00 host"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC5424_RECOGNIZER, "2003-10-11T22:14:15"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC5424_RECOGNIZER, "2003-13-11T22:14:15Z"));
        assertEquals(SyntaxRecognizer.NO_MATCH, match(Syntaxes.RFC5424_RECOGNIZER, "2003-10-11T22:14:15Zx"));
    }

    @Test
    void testMatchesFully() {
        assertTrue(Syntaxes.POSINT_RECOGNIZER.matchesFully("404"));
        assertFalse(Syntaxes.POSINT_RECOGNIZER.matchesFully("404ms"));
    }

    @Test
    void testIsPlaceholder() {
        assertTrue(Syntaxes.isPlaceholder(Syntaxes.IPV4));
        assertTrue(Syntaxes.isPlaceholder("%anything"));
        assertFalse(Syntaxes.isPlaceholder("100%"));
        assertFalse(Syntaxes.isPlaceholder(""));
    }

    @Test
    void testIsKnownPlaceholder() {
        assertTrue(Syntaxes.isKnownPlaceholder(Syntaxes.POSINT));
        assertTrue(Syntaxes.isKnownPlaceholder(Syntaxes.DATE_RFC5424));
        assertFalse(Syntaxes.isKnownPlaceholder("%custom%"));
        assertFalse(Syntaxes.isKnownPlaceholder("%ASA-6-302013:"));
    }

    @Test
    void testIsSpace() {
        for (char c : new char[] {' ', '\t', '\n', '\u000B', '\f', '\r'}) {
            assertTrue(Syntaxes.isSpace(c), "char " + (int) c);
        }
        assertFalse(Syntaxes.isSpace('x'));
        assertFalse(Syntaxes.isSpace('\u00A0'));
    }
}
