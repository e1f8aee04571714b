package com.slsa.syntax;

import java.util.Set;

/**
 * Recognizers for the token shapes slsa generalizes into placeholders,
 * and the placeholder names they map to.
 *
 * Every recognizer reports how many characters it consumed; deciding whether a
 * partial match is acceptable is up to the caller.
 */
public final class Syntaxes {
    /** First character of every placeholder token. */
    public static final char PLACEHOLDER_MARK = '%';

    public static final String POSINT = "%posint%";
    public static final String TIME_24HR = "%time-24hr%";
    public static final String DURATION = "%duration%";
    public static final String IPV4 = "%ipv4%";
    public static final String DATE_RFC3164 = "%date-rfc3164%";
    public static final String DATE_RFC5424 = "%date-rfc5424%";

    public static final SyntaxRecognizer POSINT_RECOGNIZER = Syntaxes::posint;
    public static final SyntaxRecognizer TIME_24HR_RECOGNIZER = Syntaxes::time24hr;
    public static final SyntaxRecognizer DURATION_RECOGNIZER = Syntaxes::duration;
    public static final SyntaxRecognizer IPV4_RECOGNIZER = Syntaxes::ipv4;
    public static final SyntaxRecognizer RFC3164_RECOGNIZER = Syntaxes::rfc3164Date;
    public static final SyntaxRecognizer RFC5424_RECOGNIZER = Syntaxes::rfc5424Date;

    private static final Set<String> KNOWN_PLACEHOLDERS = Set.of(
            POSINT, TIME_24HR, DURATION, IPV4, DATE_RFC3164, DATE_RFC5424);

    private static final String[] MONTHS = {
        "Jan", "Feb", "Mar", "Apr", "May", "Jun",
        "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    private Syntaxes() {} // Utility class

    /**
     * Whether {@code text} already is a placeholder (starts with the reserved mark).
     */
    public static boolean isPlaceholder(CharSequence text) {
        return text.length() > 0 && text.charAt(0) == PLACEHOLDER_MARK;
    }

    /**
     * Whether {@code text} is one of the placeholder names produced by slsa itself.
     */
    public static boolean isKnownPlaceholder(String text) {
        return KNOWN_PLACEHOLDERS.contains(text);
    }

    /**
     * One or more decimal digits.
     */
    public static int posint(CharSequence s, int off, int end) {
        int n = digits(s, off, end, Integer.MAX_VALUE);
        return n == 0 ? SyntaxRecognizer.NO_MATCH : n;
    }

    /**
     * {@code hh:mm:ss} with a two-digit hour 00-23.
     */
    public static int time24hr(CharSequence s, int off, int end) {
        if (end - off < 8) return SyntaxRecognizer.NO_MATCH;
        int hh = twoDigits(s, off);
        if (hh < 0 || hh > 23 || s.charAt(off + 2) != ':') return SyntaxRecognizer.NO_MATCH;
        if (!minutesSeconds(s, off + 3)) return SyntaxRecognizer.NO_MATCH;
        return 8;
    }

    /**
     * {@code h+:mm:ss} with any number of hour digits.
     * Accepts everything {@link #time24hr} does, so callers test that first.
     */
    public static int duration(CharSequence s, int off, int end) {
        int h = digits(s, off, end, Integer.MAX_VALUE);
        if (h == 0) return SyntaxRecognizer.NO_MATCH;
        int i = off + h;
        if (end - i < 6 || s.charAt(i) != ':') return SyntaxRecognizer.NO_MATCH;
        if (!minutesSeconds(s, i + 1)) return SyntaxRecognizer.NO_MATCH;
        return h + 6;
    }

    /**
     * Dotted quad, each octet 0-255 written with one to three digits.
     * Consumes only the address; whatever follows is left to the caller.
     */
    public static int ipv4(CharSequence s, int off, int end) {
        int i = off;
        for (int octet = 0; octet < 4; octet++) {
            if (octet > 0) {
                if (i >= end || s.charAt(i) != '.') return SyntaxRecognizer.NO_MATCH;
                i++;
            }
            int n = digits(s, i, end, 3);
            if (n == 0) return SyntaxRecognizer.NO_MATCH;
            if (Integer.parseInt(s.subSequence(i, i + n).toString()) > 255) return SyntaxRecognizer.NO_MATCH;
            i += n;
        }
        return i - off;
    }

    /**
     * BSD syslog timestamp: {@code Mmm dd hh:mm:ss}, day padded with a space or
     * a zero, optionally with a year between day and time ({@code Mmm dd yyyy hh:mm:ss}).
     */
    public static int rfc3164Date(CharSequence s, int off, int end) {
        if (end - off < 14 || !isMonth(s, off)) return SyntaxRecognizer.NO_MATCH;
        int i = off + 3;
        if (s.charAt(i++) != ' ') return SyntaxRecognizer.NO_MATCH;
        if (i < end && s.charAt(i) == ' ') i++;
        int d = digits(s, i, end, 2);
        if (d == 0) return SyntaxRecognizer.NO_MATCH;
        int day = Integer.parseInt(s.subSequence(i, i + d).toString());
        if (day < 1 || day > 31) return SyntaxRecognizer.NO_MATCH;
        i += d;
        if (i >= end || s.charAt(i++) != ' ') return SyntaxRecognizer.NO_MATCH;
        if (digits(s, i, end, 4) == 4 && i + 4 < end && s.charAt(i + 4) == ' ') {
            i += 5;
        }
        int t = time24hr(s, i, end);
        if (t == SyntaxRecognizer.NO_MATCH) return SyntaxRecognizer.NO_MATCH;
        return i + t - off;
    }

    /**
     * RFC5424 / RFC3339 timestamp: {@code yyyy-mm-ddThh:mm:ss[.frac](Z|+hh:mm|-hh:mm)}.
     * Must be followed by whitespace or the end of the text.
     */
    public static int rfc5424Date(CharSequence s, int off, int end) {
        if (end - off < 20) return SyntaxRecognizer.NO_MATCH;
        int i = off;
        if (digits(s, i, end, 4) != 4 || s.charAt(i + 4) != '-') return SyntaxRecognizer.NO_MATCH;
        i += 5;
        int month = twoDigits(s, i);
        if (month < 1 || month > 12 || s.charAt(i + 2) != '-') return SyntaxRecognizer.NO_MATCH;
        i += 3;
        int day = twoDigits(s, i);
        if (day < 1 || day > 31 || s.charAt(i + 2) != 'T') return SyntaxRecognizer.NO_MATCH;
        i += 3;
        int t = time24hr(s, i, end);
        if (t == SyntaxRecognizer.NO_MATCH) return SyntaxRecognizer.NO_MATCH;
        i += t;
        if (i < end && s.charAt(i) == '.') {
            int frac = digits(s, i + 1, end, Integer.MAX_VALUE);
            if (frac == 0) return SyntaxRecognizer.NO_MATCH;
            i += 1 + frac;
        }
        if (i >= end) return SyntaxRecognizer.NO_MATCH;
        char tz = s.charAt(i);
        if (tz == 'Z') {
            i++;
        } else if (tz == '+' || tz == '-') {
            if (end - i < 6) return SyntaxRecognizer.NO_MATCH;
            int oh = twoDigits(s, i + 1);
            int om = twoDigits(s, i + 4);
            if (oh < 0 || oh > 23 || s.charAt(i + 3) != ':' || om < 0 || om > 59) return SyntaxRecognizer.NO_MATCH;
            i += 6;
        } else {
            return SyntaxRecognizer.NO_MATCH;
        }
        if (i < end && !isSpace(s.charAt(i))) return SyntaxRecognizer.NO_MATCH;
        return i - off;
    }

    /**
     * The whitespace set words are split on: space, tab, newline, vertical tab,
     * form feed and carriage return.
     */
    public static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\u000B' || c == '\f' || c == '\r';
    }

    private static boolean isMonth(CharSequence s, int off) {
        for (String m : MONTHS) {
            if (s.charAt(off) == m.charAt(0) && s.charAt(off + 1) == m.charAt(1) && s.charAt(off + 2) == m.charAt(2)) {
                return true;
            }
        }
        return false;
    }

    // "mm:ss" at off, both 00-59
    private static boolean minutesSeconds(CharSequence s, int off) {
        int mm = twoDigits(s, off);
        int ss = twoDigits(s, off + 3);
        return mm >= 0 && mm <= 59 && s.charAt(off + 2) == ':' && ss >= 0 && ss <= 59;
    }

    private static int twoDigits(CharSequence s, int off) {
        char a = s.charAt(off), b = s.charAt(off + 1);
        if (!isDigit(a) || !isDigit(b)) return -1;
        return (a - '0') * 10 + (b - '0');
    }

    private static int digits(CharSequence s, int off, int end, int max) {
        int n = 0;
        while (off + n < end && n < max && isDigit(s.charAt(off + n))) {
            n++;
        }
        return n;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
