package com.todayatsg.backend.ingestion;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Title comparison for deduplication: a normal form plus the Ratcliff/Obershelp
 * "gestalt pattern matching" ratio, 2 * matched characters / total characters.
 */
public final class TitleSimilarity {

    private TitleSimilarity() {
    }

    /**
     * Lower-case, accents and punctuation removed, whitespace collapsed
     */
    public static String normalize(String text) {
        if (text == null) return "";
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD).replaceAll("\\p{M}", "");
        return decomposed.toLowerCase(Locale.ROOT)
                .replace('&', ' ')
                .replaceAll("[^\\p{L}\\p{N}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Similarity of the normalized forms, in [0, 1]
     */
    public static double similarity(String a, String b) {
        return ratio(normalize(a), normalize(b));
    }

    /**
     * Ratcliff/Obershelp ratio of two strings as given
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
    }

    // Longest common block, then recurse on the unmatched pieces either side of it
    private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
        if (aLo >= aHi || bLo >= bHi) return 0;

        int bestLength = 0;
        int bestA = aLo;
        int bestB = bLo;
        int[] previous = new int[bHi - bLo + 1];
        for (int i = aLo; i < aHi; i++) {
            int[] current = new int[bHi - bLo + 1];
            for (int j = bLo; j < bHi; j++) {
                if (a.charAt(i) == b.charAt(j)) {
                    int length = previous[j - bLo] + 1;
                    current[j - bLo + 1] = length;
                    if (length > bestLength) {
                        bestLength = length;
                        bestA = i - length + 1;
                        bestB = j - length + 1;
                    }
                }
            }
            previous = current;
        }

        if (bestLength == 0) return 0;
        return bestLength
                + matchingCharacters(a, aLo, bestA, b, bLo, bestB)
                + matchingCharacters(a, bestA + bestLength, aHi, b, bestB + bestLength, bHi);
    }
}
