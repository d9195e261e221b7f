package com.ocpbot.commands;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * "Did you mean" suggestions for an unknown command.
 * <p>
 * Keys containing the attempted text (ignoring case) come first, sorted by
 * name. They are followed by near-misses whose optimal-string-alignment distance
 * to the text is at most {@link #MAX_DISTANCE}, closest first. The result is
 * capped at the requested limit.
 */
public final class CommandSuggestions {

    public static final int DEFAULT_LIMIT = 5;
    static final int MAX_DISTANCE = 2;

    private CommandSuggestions() {
    }

    public static List<String> suggest(Collection<String> keys, String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        String needle = text.toLowerCase();
        List<String> contains = new ArrayList<>();
        List<String> near = new ArrayList<>();
        for (String key : keys) {
            String candidate = key.toLowerCase();
            if (candidate.contains(needle)) {
                contains.add(key);
            } else if (distance(candidate, needle) <= MAX_DISTANCE) {
                near.add(key);
            }
        }
        contains.sort(Comparator.naturalOrder());
        near.sort(Comparator.<String>comparingInt(k -> distance(k.toLowerCase(), needle))
                .thenComparing(Comparator.naturalOrder()));

        List<String> result = new ArrayList<>(contains);
        result.addAll(near);
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : List.copyOf(result);
    }

    /**
     * Edit distance counting insertions, deletions, substitutions and
     * adjacent transpositions as one edit each.
     */
    static int distance(String a, String b) {
        int[][] d = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1 && a.charAt(i - 1) == b.charAt(j - 2) && a.charAt(i - 2) == b.charAt(j - 1)) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
                }
            }
        }
        return d[a.length()][b.length()];
    }
}
