package com.valyxo.script.parser;

import java.util.Collection;

/** Fuzzy "did you mean" lookups for undefined names. */
final class NameSuggester {
    static final int MAX_DISTANCE = 2;

    private NameSuggester() {}

    /** Closest candidate within {@link #MAX_DISTANCE} edits, or null. Ties go to the earliest candidate. */
    static String closest(String name, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String c : candidates) {
            if (c.equals(name)) continue;
            int d = distance(name, c);
            if (d <= MAX_DISTANCE && d < name.length() && d < bestDistance) {
                best = c;
                bestDistance = d;
            }
        }
        return best;
    }

    // Levenshtein, two rows
    static int distance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = cur;
            cur = tmp;
        }
        return prev[b.length()];
    }
}
