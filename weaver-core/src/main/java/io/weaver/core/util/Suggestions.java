package io.weaver.core.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/// "Did you mean" lookups by edit distance.
public final class Suggestions {

    private Suggestions() {}

    /// Returns the closest candidate within a distance of a third of the input length (at
    /// least 2). Ties keep the candidate that comes first.
    ///
    /// @param input misspelled name, not null
    /// @param candidates known names, not null
    /// @return the suggestion, or empty when nothing is close
    public static Optional<String> closest(String input, Collection<String> candidates) {
        int threshold = Math.max(2, input.length() / 3);
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = distance(input.toLowerCase(Locale.ROOT), candidate.toLowerCase(Locale.ROOT));
            if (distance <= threshold && distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /// Formats a suggestion as a message suffix: ` Did you mean "x"?`, or empty.
    public static String hint(String input, Collection<String> candidates) {
        return closest(input, candidates).map(s -> " Did you mean \"" + s + "\"?").orElse("");
    }

    static int distance(String a, String b) {
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
