package io.weaver.core.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;

/// Parses the short duration strings used by workflow directives.
///
/// Accepts `500ms`, `30s`, `5m`, `1h`, `2d` and ISO-8601 forms such as `PT30M`.
public final class Durations {

    private static final java.util.regex.Pattern SHORT_FORM =
            java.util.regex.Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)");

    private Durations() {}

    /// Parses a duration.
    ///
    /// @param text duration text, not null
    /// @return the duration, never null
    /// @throws IllegalArgumentException if the text is not a recognized duration
    public static Duration parse(String text) {
        String trimmed = text.trim();
        Matcher matcher = SHORT_FORM.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            try {
                long amount = Long.parseLong(matcher.group(1));
                return switch (matcher.group(2)) {
                    case "ms" -> Duration.ofMillis(amount);
                    case "s" -> Duration.ofSeconds(amount);
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    default -> Duration.ofDays(amount);
                };
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("Duration out of range: '" + text + "'", e);
            }
        }
        try {
            return Duration.parse(trimmed.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid duration: '" + text + "'", e);
        }
    }

    /// Formats a duration in the short form {@link #parse} accepts, using the largest unit
    /// that divides it.
    public static String format(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 86_400_000L == 0 && millis > 0) {
            return millis / 86_400_000L + "d";
        }
        if (millis % 3_600_000L == 0 && millis > 0) {
            return millis / 3_600_000L + "h";
        }
        if (millis % 60_000L == 0 && millis > 0) {
            return millis / 60_000L + "m";
        }
        if (millis % 1000L == 0) {
            return millis / 1000L + "s";
        }
        return millis + "ms";
    }
}
