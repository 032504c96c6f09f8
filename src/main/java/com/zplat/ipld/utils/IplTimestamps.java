package com.zplat.ipld.utils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Timestamp handling for the IPL CSV columns ({@code yyyy-MM-dd HH:mm:ss}).
 */
public final class IplTimestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter IPL_DATE = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private IplTimestamps() {
    }

    public static Optional<LocalDateTime> parse(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(value.trim(), FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static boolean isValid(String value) {
        return parse(value).isPresent();
    }

    public static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    /** Elapsed time between two valid timestamps as HH:MM:SS. */
    public static String between(String from, String to) {
        LocalDateTime start = parse(from).orElseThrow(() -> new IllegalArgumentException("Bad timestamp: " + from));
        LocalDateTime end = parse(to).orElseThrow(() -> new IllegalArgumentException("Bad timestamp: " + to));
        return formatDuration(Duration.between(start, end).getSeconds());
    }

    /**
     * Whole days are folded into the hour count, so 30 hours prints as {@code 30:00:00}.
     * Negative spans keep a leading minus sign.
     */
    public static String formatDuration(long seconds) {
        String sign = seconds < 0 ? "-" : "";
        long remaining = Math.abs(seconds);

        long hours = 0;
        if (remaining >= 86_400) {
            hours += (remaining / 86_400) * 24;
            remaining %= 86_400;
        }
        hours += remaining / 3_600;
        remaining %= 3_600;
        long minutes = remaining / 60;
        remaining %= 60;

        return String.format(Locale.ROOT, "%s%02d:%02d:%02d", sign, hours, minutes, remaining);
    }

    /** "Jan 01, 2024" style date used by the done report. */
    public static String toIplDate(String value) {
        return parse(value).map(IPL_DATE::format).orElse(null);
    }
}
