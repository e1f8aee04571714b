package com.slsa.tokenize;

import com.slsa.syntax.SyntaxRecognizer;
import com.slsa.syntax.Syntaxes;

/**
 * Rewrites shapes that span several words before the line is tokenized.
 *
 * Only syntaxes that are recognized reliably AND cover multiple words belong
 * here; everything else is detected per word, where misdetection does less harm.
 */
public final class LinePreprocessor {

    private LinePreprocessor() {} // Utility class

    /**
     * Replace every RFC3164 or RFC5424 timestamp in {@code line} with its
     * placeholder. At each position RFC3164 is tried before RFC5424.
     */
    public static String preprocess(String line) {
        int len = line.length();
        StringBuilder out = null;
        int i = 0;
        while (i < len) {
            String placeholder = null;
            int nproc = Syntaxes.rfc3164Date(line, i, len);
            if (nproc != SyntaxRecognizer.NO_MATCH) {
                placeholder = Syntaxes.DATE_RFC3164;
            } else {
                nproc = Syntaxes.rfc5424Date(line, i, len);
                if (nproc != SyntaxRecognizer.NO_MATCH) {
                    placeholder = Syntaxes.DATE_RFC5424;
                }
            }
            if (placeholder == null) {
                if (out != null) out.append(line.charAt(i));
                i++;
            } else {
                if (out == null) {
                    out = new StringBuilder(len + 16).append(line, 0, i);
                }
                out.append(placeholder);
                i += nproc;
            }
        }
        return out == null ? line : out.toString();
    }
}
