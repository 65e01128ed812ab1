package org.tessera.compiler.diagnostics;

import java.util.Collection;
import java.util.Optional;

/**
 * Suggests the closest known name for a misspelled one by Levenshtein distance.
 */
public final class DidYouMean {

    private DidYouMean() {}

    /**
     * Finds the best suggestion. A candidate qualifies if its distance is at most
     * {@code max(2, input.length() / 3)}; ties keep the first candidate in iteration order.
     * @param input The unknown name.
     * @param candidates The known names.
     * @return The closest known name, if any is close enough.
     */
    public static Optional<String> suggest(String input, Collection<String> candidates) {
        int threshold = Math.max(2, input.length() / 3);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = distance(input.toLowerCase(), candidate.toLowerCase());
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return bestDistance <= threshold ? Optional.ofNullable(best) : Optional.empty();
    }

    /**
     * Computes the Levenshtein edit distance (insertions, deletions, substitutions).
     * @param a The first string.
     * @param b The second string.
     * @return The number of edits.
     */
    public static int distance(String a, String b) {
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
