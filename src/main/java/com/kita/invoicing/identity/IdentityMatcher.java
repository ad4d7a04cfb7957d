package com.kita.invoicing.identity;

import com.kita.invoicing.config.InvoicingConfigConstants;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Fuzzy comparison of legal names
 *
 * <p>Names are normalized (accents folded, upper-cased, Mexican legal-form
 * suffixes and punctuation removed) and compared with the Ratcliff/Obershelp
 * ratio {@code 2M / (|a| + |b|)}, where M is the number of characters in the
 * recursively found longest common blocks.
 */
public class IdentityMatcher {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    // trailing legal forms, dots and spacing optional: S.A., S.A.B., S.A.P.I., S.A.S., S. DE R.L., DE C.V., S.C., A.C.
    private static final Pattern LEGAL_FORM_SUFFIX = Pattern.compile(
        "(?:[\\s,]+(?:"
            + "S\\.?\\s*A\\.?\\s*P\\.?\\s*I\\.?"
            + "|S\\.?\\s*A\\.?\\s*B\\.?"
            + "|S\\.?\\s*A\\.?\\s*S\\.?"
            + "|S\\.?\\s*A\\.?"
            + "|S\\.?\\s*DE\\s+R\\.?\\s*L\\.?"
            + "|DE\\s+R\\.?\\s*L\\.?"
            + "|DE\\s+C\\.?\\s*V\\.?"
            + "|S\\.?\\s*C\\.?"
            + "|A\\.?\\s*C\\.?"
            + "))+[\\s.,]*$");

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9 ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final double threshold;

    public IdentityMatcher() {
        this(InvoicingConfigConstants.DEFAULT_NAME_MATCH_THRESHOLD);
    }

    public IdentityMatcher(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1]");
        }
        this.threshold = threshold;
    }

    /**
     * Normalize a legal name for comparison
     *
     * @param name raw legal name
     * @return normalized name, empty for null input
     */
    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String folded = Normalizer.normalize(name, Normalizer.Form.NFKD);
        folded = COMBINING_MARKS.matcher(folded).replaceAll("");
        folded = folded.toUpperCase(Locale.ROOT);
        folded = LEGAL_FORM_SUFFIX.matcher(" " + folded).replaceAll("");
        folded = NON_ALPHANUMERIC.matcher(folded).replaceAll(" ");
        return WHITESPACE.matcher(folded).replaceAll(" ").trim();
    }

    /**
     * Similarity of two legal names in [0, 1]
     *
     * <p>Symmetric: {@code similarity(a, b) == similarity(b, a)}. Two blank
     * names score 1.0; a name with nothing left after normalization matches nothing.
     */
    public double similarity(String a, String b) {
        boolean leftBlank = a == null || a.isBlank();
        boolean rightBlank = b == null || b.isBlank();
        if (leftBlank && rightBlank) {
            return 1.0;
        }
        String left = normalize(a);
        String right = normalize(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int total = left.length() + right.length();
        int matched = Math.max(matchingCharacters(left, right), matchingCharacters(right, left));
        return 2.0 * matched / total;
    }

    /**
     * Whether two names are similar enough to be the same legal entity
     */
    public boolean matches(String a, String b) {
        return similarity(a, b) >= threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    private int matchingCharacters(String a, String b) {
        return matchingCharacters(a, 0, a.length(), b, 0, b.length());
    }

    private int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) {
            return 0;
        }
        int bestI = aLo;
        int bestJ = bLo;
        int bestSize = 0;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int size = previous[j - bLo] + 1;
                    current[j - bLo + 1] = size;
                    if (size > bestSize) {
                        bestSize = size;
                        bestI = i - size + 1;
                        bestJ = j - size + 1;
                    }
                }
            }
            previous = current;
        }
        if (bestSize == 0) {
            return 0;
        }
        return bestSize
            + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
            + matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
    }
}
