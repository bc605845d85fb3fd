package org.mediarenamer.controller.util;

import java.util.Locale;
import java.util.regex.Pattern;

public class StringUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Characters that are illegal in a directory name on at least one platform.
    private static final Pattern ILLEGAL_DIRECTORY_CHARS =
        Pattern.compile("[<>:\"/\\\\|?*]");

    private StringUtils() {
        // utility class
    }

    public static String toLower(final String orig) {
        if (orig == null) {
            return "";
        }
        return orig.toLowerCase(Locale.ROOT);
    }

    public static String zeroPadTwoDigits(final int number) {
        return String.format(Locale.ROOT, "%02d", number);
    }

    /**
     * Replace every run of whitespace with a single space, and trim.
     *
     * @param text the text to squeeze; may be null
     * @return the squeezed text, or the empty string for null input
     */
    public static String collapseWhitespace(final String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Make a title usable as a directory name: drop characters the common file
     * systems reject, and squeeze whitespace.
     *
     * @param title the title to sanitise
     * @return the sanitised title
     */
    public static String sanitiseDirectoryName(final String title) {
        if (title == null) {
            return "";
        }
        return collapseWhitespace(
            ILLEGAL_DIRECTORY_CHARS.matcher(title).replaceAll("")
        );
    }

    /**
     * Levenshtein (edit) distance: the minimum number of single-character
     * insertions, deletions and substitutions turning one string into the other.
     */
    static int levenshteinDistance(final String s1, final String s2) {
        int len1 = s1.length();
        int len2 = s2.length();

        if (len1 == 0) return len2;
        if (len2 == 0) return len1;

        // Two rows instead of the full matrix
        int[] prev = new int[len2 + 1];
        int[] curr = new int[len2 + 1];

        for (int j = 0; j <= len2; j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= len1; i++) {
            curr[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = (s1.charAt(i - 1) == s2.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(
                    Math.min(prev[j] + 1, curr[j - 1] + 1),
                    prev[j - 1] + cost
                );
            }
            int[] temp = prev;
            prev = curr;
            curr = temp;
        }
        return prev[len2];
    }

    /**
     * Similarity ratio between two strings, from 0.0 (nothing in common) to 1.0
     * (identical): one minus the edit distance divided by the longer length.
     * Symmetric in its arguments.
     *
     * @param s1 first string
     * @param s2 second string
     * @return the similarity ratio; 0.0 if either argument is null
     */
    public static double similarity(final String s1, final String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int maxLen = Math.max(s1.length(), s2.length());
        if (maxLen == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshteinDistance(s1, s2) / maxLen);
    }
}
