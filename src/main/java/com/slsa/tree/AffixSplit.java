package com.slsa.tree;

import java.util.List;

/**
 * Common prefix and suffix lengths shared by a set of sibling values.
 *
 * The lengths are measured against the first value. They are then adjusted so
 * that a split does not cut through a delimited field: if the prefix contains
 * an opening quote or bracket whose closer shows up inside the suffix, the
 * split is moved to just inside that pair; a {@code =} or {@code :} in the
 * prefix ends the prefix right after it ({@code key=value}).
 *
 * Prefix and suffix are computed independently and may overlap when the
 * values share characters at the boundary, e.g. {@code "end"} and
 * {@code "eend"} give prefix 1 and suffix 3. {@link #suffixWithin(int)} is
 * the suffix length actually usable for a split.
 */
public final class AffixSplit {
    private final int prefixLength;
    private final int suffixLength;

    AffixSplit(int prefixLength, int suffixLength) {
        this.prefixLength = prefixLength;
        this.suffixLength = suffixLength;
    }

    /**
     * @param texts at least two values; the first one is the reference
     */
    public static AffixSplit compute(List<String> texts) {
        if (texts.size() < 2) {
            throw new IllegalArgumentException("need at least two values, got " + texts.size());
        }
        String base = texts.get(0);
        int baseLen = base.length();
        int prefix = baseLen;
        int suffix = baseLen;
        for (int i = 1; i < texts.size(); i++) {
            String w = texts.get(i);
            if (prefix > 0) {
                int j = 0;
                while (j < prefix && j < w.length() && w.charAt(j) == base.charAt(j)) {
                    j++;
                }
                prefix = j;
            }
            if (suffix > 0) {
                int wLen = w.length();
                int jmax = Math.min(wLen, suffix);
                int j = 0;
                while (j < jmax && w.charAt(wLen - j - 1) == base.charAt(baseLen - j - 1)) {
                    j++;
                }
                suffix = j;
            }
        }
        return adjustToBoundaries(base, prefix, suffix);
    }

    private static AffixSplit adjustToBoundaries(String base, int prefix, int suffix) {
        int baseLen = base.length();
        for (int j = prefix - 1; j >= 0; j--) {
            char c = base.charAt(j);
            char closer = closerFor(c);
            if (closer != 0) {
                for (int k = 0; k < suffix; k++) {
                    if (base.charAt(baseLen - k - 1) == closer) {
                        return new AffixSplit(j + 1, k + 1);
                    }
                }
            } else if (c == '=' || c == ':') {
                prefix = j + 1;
            }
        }
        return new AffixSplit(prefix, suffix);
    }

    private static char closerFor(char opener) {
        switch (opener) {
            case '"':  return '"';
            case '\'': return '\'';
            case '[':  return ']';
            case '(':  return ')';
            case '<':  return '>';
            default:   return 0;
        }
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public int getSuffixLength() {
        return suffixLength;
    }

    public boolean isEmpty() {
        return prefixLength == 0 && suffixLength == 0;
    }

    /**
     * Whether prefix and suffix together are longer than the shortest value.
     */
    public boolean overlaps(int shortestLength) {
        return prefixLength + suffixLength > shortestLength;
    }

    /**
     * Suffix length clamped so that it starts no earlier than the prefix ends
     * in a value of {@code shortestLength} characters.
     */
    public int suffixWithin(int shortestLength) {
        return Math.max(0, Math.min(suffixLength, shortestLength - prefixLength));
    }

    @Override
    public String toString() {
        return "prefix " + prefixLength + ", suffix " + suffixLength;
    }
}
