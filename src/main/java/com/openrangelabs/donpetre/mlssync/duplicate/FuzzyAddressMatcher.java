package com.openrangelabs.donpetre.mlssync.duplicate;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * String normalization and Levenshtein similarity for address fields.
 */
public final class FuzzyAddressMatcher {

    private static final Pattern PUNCTUATION = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ORDINAL = Pattern.compile("\\b(\\d+)(st|nd|rd|th)\\b");

    private static final Map<String, String> SUFFIXES = Map.ofEntries(
            Map.entry("street", "st"),
            Map.entry("avenue", "ave"),
            Map.entry("av", "ave"),
            Map.entry("road", "rd"),
            Map.entry("drive", "dr"),
            Map.entry("boulevard", "blvd"),
            Map.entry("lane", "ln"),
            Map.entry("court", "ct"),
            Map.entry("place", "pl"),
            Map.entry("parkway", "pkwy"),
            Map.entry("highway", "hwy"),
            Map.entry("circle", "cir"),
            Map.entry("terrace", "ter"),
            Map.entry("trail", "trl"),
            Map.entry("square", "sq"),
            Map.entry("north", "n"),
            Map.entry("south", "s"),
            Map.entry("east", "e"),
            Map.entry("west", "w"),
            Map.entry("apartment", "apt"),
            Map.entry("suite", "ste"));

    private FuzzyAddressMatcher() {
    }

    /**
     * Case-fold, strip punctuation and collapse whitespace.
     */
    public static String normalize(String value) {
        if (value == null) return "";
        String lowered = value.toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * {@link #normalize(String)} plus ordinal removal and suffix abbreviation,
     * so "123 Main Street" and "123 main st." compare equal.
     */
    public static String normalizeStreet(String value) {
        String normalized = ORDINAL.matcher(normalize(value)).replaceAll("$1");
        if (normalized.isEmpty()) return normalized;
        String[] tokens = normalized.split(" ");
        StringBuilder result = new StringBuilder();
        for (String token : tokens) {
            if (result.length() > 0) result.append(' ');
            result.append(SUFFIXES.getOrDefault(token, token));
        }
        return result.toString();
    }

    /**
     * 1 - distance / longer length; two empty strings are identical.
     */
    public static double similarity(String first, String second) {
        String a = first == null ? "" : first;
        String b = second == null ? "" : second;
        int longer = Math.max(a.length(), b.length());
        if (longer == 0) return 1.0;
        return 1.0 - (double) levenshtein(a, b) / longer;
    }

    public static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
