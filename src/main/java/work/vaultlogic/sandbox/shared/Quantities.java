package work.vaultlogic.sandbox.shared;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Parses user-friendly durations ({@code 250ms}, {@code 2s}, {@code 1m}) and byte sizes ({@code 64kb}, {@code 128mb}).
 * Bare numbers are milliseconds and bytes respectively.
 */
public final class Quantities {
    // longest suffix first: "ms" must win over "s", "mb" over "b"
    private static final List<Unit> TIME_UNITS = List.of(
        new Unit("ms", 1L),
        new Unit("s", 1_000L),
        new Unit("m", 60_000L)
    );
    private static final List<Unit> SIZE_UNITS = List.of(
        new Unit("gb", 1024L * 1024 * 1024),
        new Unit("mb", 1024L * 1024),
        new Unit("kb", 1024L),
        new Unit("b", 1L)
    );

    private Quantities() {}

    public static Optional<Duration> parseDuration(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(scale(raw, TIME_UNITS)));
    }

    public static OptionalLong parseByteSize(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(scale(raw, SIZE_UNITS));
    }

    private static long scale(String raw, List<Unit> units) {
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Unit unit : units) {
            if (normalized.endsWith(unit.suffix())) {
                String digits = normalized.substring(0, normalized.length() - unit.suffix().length()).trim();
                return Math.multiplyExact(parseNonNegative(digits, raw), unit.multiplier());
            }
        }
        return parseNonNegative(normalized, raw);
    }

    private static long parseNonNegative(String digits, String original) {
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid quantity: " + original);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Quantity must not be negative: " + original);
        }
        return value;
    }

    private record Unit(String suffix, long multiplier) {}
}
