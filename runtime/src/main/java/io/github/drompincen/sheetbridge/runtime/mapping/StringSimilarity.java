package io.github.drompincen.sheetbridge.runtime.mapping;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.Locale;

/**
 * Label similarity used by the fuzzy pass of {@link ColumnMapper}. Labels are compared
 * after normalization: lower-cased with spaces, underscores, hyphens and dots removed.
 */
public final class StringSimilarity {

    /** Minimum score for a fuzzy match. */
    public static final double FUZZY_THRESHOLD = 0.8;

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private StringSimilarity() {}

    public static String normalize(String label) {
        if (label == null) return "";
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_\\-.]", "");
    }

    /** Edit distance between the normalized forms. */
    public static int distance(String a, String b) {
        return LEVENSHTEIN.apply(normalize(a), normalize(b));
    }

    /** {@code 1 - distance / max(length)} over normalized forms, in [0, 1]. */
    public static double score(String a, String b) {
        String na = normalize(a);
        String nb = normalize(b);
        int max = Math.max(na.length(), nb.length());
        if (max == 0) return 1.0;
        return 1.0 - (double) LEVENSHTEIN.apply(na, nb) / max;
    }
}
