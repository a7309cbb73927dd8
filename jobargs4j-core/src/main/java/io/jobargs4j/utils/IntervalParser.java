package io.jobargs4j.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Converts delay and time values into {@link Duration}s and {@link Instant}s.
 * <p>
 * Supported interval formats:
 * <ul>
 *   <li>Numeric seconds, fractions allowed: "30", "1.5"</li>
 *   <li>Compact: "90s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable: "5 minutes", "2 hours", "1 day 3 hours"</li>
 * </ul>
 */
public final class IntervalParser {

    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private IntervalParser() {
    }

    /**
     * Seconds as a {@link Duration}, keeping fractional parts down to the nanosecond.
     */
    public static Duration ofSeconds(Number seconds) {
        Objects.requireNonNull(seconds, "seconds must not be null");
        if (seconds instanceof Integer || seconds instanceof Long || seconds instanceof Short || seconds instanceof Byte) {
            return Duration.ofSeconds(seconds.longValue());
        }
        double value = seconds.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("seconds must be finite: " + seconds);
        }
        BigDecimal nanos = new BigDecimal(seconds.toString()).multiply(NANOS_PER_SECOND);
        return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
    }

    /**
     * Unix timestamp in seconds, fractions allowed.
     */
    public static Instant instantOfEpochSeconds(Number epochSeconds) {
        return Instant.EPOCH.plus(ofSeconds(epochSeconds));
    }

    /**
     * Parse a delay; numeric strings are seconds, anything else goes through
     * {@link #parseHumanDuration(String)}.
     */
    public static Duration parseDuration(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        if (s.matches("^-?\\d+(\\.\\d+)?$")) {
            try {
                return ofSeconds(new BigDecimal(s));
            } catch (ArithmeticException ex) {
                throw new IllegalArgumentException("interval seconds out of range: " + text);
            }
        }
        return parseHumanDuration(s);
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            char unit = s.charAt(s.length() - 1);
            return switch (unit) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + unit);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        long totalSeconds = 0;
        boolean[] seen = new boolean[Unit.values().length];
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            Unit unit = Unit.parse(parts[i + 1]);
            if (seen[unit.ordinal()]) {
                throw new IllegalArgumentException("Duplicate unit: " + unit.label);
            }
            seen[unit.ordinal()] = true;
            totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(unit.seconds, n));
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private enum Unit {
        MONTH("month", ChronoUnit.DAYS.getDuration().toSeconds() * 30L),
        WEEK("week", ChronoUnit.WEEKS.getDuration().toSeconds()),
        DAY("day", ChronoUnit.DAYS.getDuration().toSeconds()),
        HOUR("hour", ChronoUnit.HOURS.getDuration().toSeconds()),
        MINUTE("minute", ChronoUnit.MINUTES.getDuration().toSeconds()),
        SECOND("second", 1L);

        private final String label;
        private final long seconds;

        Unit(String label, long seconds) {
            this.label = label;
            this.seconds = seconds;
        }

        static Unit parse(String text) {
            String singular = text.endsWith("s") ? text.substring(0, text.length() - 1) : text;
            for (Unit unit : values()) {
                if (unit.label.equals(singular)) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unsupported interval unit: " + text);
        }
    }
}
