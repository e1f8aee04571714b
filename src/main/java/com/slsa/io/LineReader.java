package com.slsa.io;

import com.slsa.core.SlsaLog;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Reads newline-terminated lines from a byte stream into a fixed-size buffer.
 *
 * A line keeps at most {@code maxLineLength - 1} bytes; anything past that up
 * to the next newline is dropped. The newline itself is never part of the line.
 * For UTF-8 input the cut is moved back so that it never splits a character.
 * Malformed input is decoded with the charset's replacement character.
 */
public final class LineReader implements Closeable {
    public static final int DEFAULT_MAX_LINE = 32 * 1024;

    private final InputStream in;
    private final Charset charset;
    private final byte[] buf;
    private long linesRead;
    private long linesTruncated;
    private boolean eof;

    public LineReader(InputStream in) {
        this(in, StandardCharsets.UTF_8, DEFAULT_MAX_LINE);
    }

    public LineReader(InputStream in, Charset charset, int maxLineLength) {
        if (maxLineLength < 2) {
            throw new IllegalArgumentException("maxLineLength must be at least 2: " + maxLineLength);
        }
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.charset = charset;
        this.buf = new byte[maxLineLength - 1];
    }

    /**
     * @return the next line, possibly empty, or {@code null} at end of input
     */
    public String next() throws IOException {
        if (eof) return null;
        int n = 0;
        int c;
        while ((c = in.read()) != -1 && c != '\n') {
            if (n == buf.length) {
                if (StandardCharsets.UTF_8.equals(charset)) {
                    n = utf8Boundary(n);
                }
                skipRestOfLine();
                linesTruncated++;
                SlsaLog.debug("line %d truncated to %d bytes", linesRead + 1, buf.length);
                c = '\n';
                break;
            }
            buf[n++] = (byte) c;
        }
        if (c == -1) {
            eof = true;
            if (n == 0) return null;
        }
        linesRead++;
        return new String(buf, 0, n, charset);
    }

    public long getLinesRead() {
        return linesRead;
    }

    public long getLinesTruncated() {
        return linesTruncated;
    }

    // drops a trailing multibyte sequence that the cut left incomplete
    private int utf8Boundary(int n) {
        int i = n;
        while (i > 0 && n - i < 3 && (buf[i - 1] & 0xC0) == 0x80) {
            i--;
        }
        if (i == 0) {
            return n;
        }
        int lead = buf[i - 1] & 0xFF;
        int need = lead >= 0xF0 ? 4 : lead >= 0xE0 ? 3 : lead >= 0xC0 ? 2 : 1;
        return n - (i - 1) < need ? i - 1 : n;
    }

    private void skipRestOfLine() throws IOException {
        int c;
        while ((c = in.read()) != -1 && c != '\n') {
            // drop
        }
        if (c == -1) {
            eof = true;
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
