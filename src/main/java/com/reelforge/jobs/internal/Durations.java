package com.reelforge.jobs.internal;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses duration settings given either in ISO-8601 ({@code PT30M}) or in
 * shorthand ({@code 500ms}, {@code 30s}, {@code 15m}, {@code 36h}, {@code 7d}).
 */
public final class Durations {

    private Durations() {
    }

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration value must not be blank");
        }
        String trimmed = value.trim();
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException ignored) {
            // Continue with shorthand parsing below.
        }

        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (shorthand.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(shorthand.substring(0, shorthand.length() - 2)));
            } else if (shorthand.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
            } else if (shorthand.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
            } else if (shorthand.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
            } else if (shorthand.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(shorthand.substring(0, shorthand.length() - 1)));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
        throw new IllegalArgumentException("Unsupported duration value: " + value);
    }
}
