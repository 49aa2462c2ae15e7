package com.rms.fanout.web;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tolerant parser for duration query parameters such as {@code lookback}.
 *
 * <h2>Accepted examples</h2>
 * <pre>
 * "60"     -> 60 seconds (bare numbers are seconds)
 * "250ms"  -> 250 milliseconds
 * "5s"     -> 5 seconds
 * "2m"     -> 2 minutes
 * "1h"     -> 1 hour
 * "PT30S"  -> 30 seconds (ISO-8601, case-insensitive)
 * null, "" -> the caller's default
 * </pre>
 *
 * Anything else, and negative values, are rejected with {@link IllegalArgumentException}; a silently
 * substituted window would hide client mistakes.
 */
public final class DurationParam {

    /**
     * group(1): magnitude, group(2): optional unit.
     */
    private static final Pattern SHORTHAND =
            Pattern.compile("^(\\d+)(ms|s|m|h)?$", Pattern.CASE_INSENSITIVE);

    private DurationParam() {
    }

    public static Duration parse(String raw, Duration fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String s = raw.trim();

        Matcher m = SHORTHAND.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            String unit = m.group(2) == null ? "s" : m.group(2).toLowerCase(Locale.ROOT);
            return switch (unit) {
                case "ms" -> Duration.ofMillis(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                default -> Duration.ofSeconds(n);
            };
        }

        if (s.startsWith("P") || s.startsWith("p")) {
            try {
                Duration d = Duration.parse(s.toUpperCase(Locale.ROOT));
                if (d.isNegative()) {
                    throw new IllegalArgumentException("Duration must not be negative: " + raw);
                }
                return d;
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + raw, e);
            }
        }
        throw new IllegalArgumentException("Invalid duration: " + raw);
    }
}
