package work.vaultlogic.sandbox.helpers;

import static work.vaultlogic.sandbox.helpers.HelperArgs.arg;
import static work.vaultlogic.sandbox.helpers.HelperArgs.number;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@code helpers.date}: ISO-8601 arithmetic and formatting in UTC. Unparseable input yields {@code "Invalid Date"}.
 */
public final class DateHelpers {
    static final String INVALID_DATE = "Invalid Date";
    private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT)
        .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ISO_INPUT = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart()
        .appendLiteral('T')
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart()
        .appendOffsetId()
        .optionalEnd()
        .optionalEnd()
        .toFormatter(Locale.ROOT);

    private DateHelpers() {}

    public static HelperLibrary.Builder register(HelperLibrary.Builder builder, Clock clock) {
        builder.register(HelperNamespace.DATE, "now", args -> ISO_MILLIS.format(clock.instant()));
        builder.register(HelperNamespace.DATE, "add", args -> shift(args, 1, "date.add"));
        builder.register(HelperNamespace.DATE, "subtract", args -> shift(args, -1, "date.subtract"));
        builder.register(HelperNamespace.DATE, "format", DateHelpers::format);
        builder.register(HelperNamespace.DATE, "parse", DateHelpers::parse);
        builder.register(HelperNamespace.DATE, "diff", DateHelpers::diff);
        return builder;
    }

    private static Object shift(List<Object> args, int direction, String helper) {
        Optional<ZonedDateTime> date = parseIso(arg(args, 0));
        Optional<ChronoUnit> unit = unit(arg(args, 2));
        if (date.isEmpty() || unit.isEmpty() || !(arg(args, 1) instanceof Number)) {
            return INVALID_DATE;
        }
        long amount = (long) number(args, 1, helper) * direction;
        try {
            return ISO_MILLIS.format(date.get().plus(amount, unit.get()));
        } catch (DateTimeException | ArithmeticException ex) {
            return INVALID_DATE;
        }
    }

    private static Object format(List<Object> args) {
        Optional<ZonedDateTime> date = parseIso(arg(args, 0));
        if (date.isEmpty() || !(arg(args, 1) instanceof String pattern)) {
            return INVALID_DATE;
        }
        try {
            return DateTimeFormatter.ofPattern(pattern, Locale.US).format(date.get());
        } catch (IllegalArgumentException | DateTimeException ex) {
            return INVALID_DATE;
        }
    }

    private static Object parse(List<Object> args) {
        if (!(arg(args, 0) instanceof String text)) {
            return INVALID_DATE;
        }
        if (!(arg(args, 1) instanceof String pattern)) {
            return parseIso(text).map(ISO_MILLIS::format).orElse(INVALID_DATE);
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ofPattern(pattern, Locale.US).parse(text.strip());
            LocalDate day = parsed.query(TemporalQueries.localDate());
            if (day == null) {
                return INVALID_DATE;
            }
            return ISO_MILLIS.format(day.atStartOfDay(ZoneOffset.UTC));
        } catch (IllegalArgumentException | DateTimeException ex) {
            return INVALID_DATE;
        }
    }

    private static Object diff(List<Object> args) {
        Optional<ZonedDateTime> from = parseIso(arg(args, 0));
        Optional<ZonedDateTime> to = parseIso(arg(args, 1));
        Optional<ChronoUnit> unit = unit(arg(args, 2));
        if (from.isEmpty() || to.isEmpty() || unit.isEmpty()) {
            return 0;
        }
        return HelperArgs.numeric(unit.get().between(from.get(), to.get()));
    }

    private static Optional<ChronoUnit> unit(Object raw) {
        if (!(raw instanceof String name)) {
            return Optional.empty();
        }
        return switch (name) {
            case "days" -> Optional.of(ChronoUnit.DAYS);
            case "hours" -> Optional.of(ChronoUnit.HOURS);
            case "minutes" -> Optional.of(ChronoUnit.MINUTES);
            case "seconds" -> Optional.of(ChronoUnit.SECONDS);
            case "months" -> Optional.of(ChronoUnit.MONTHS);
            case "years" -> Optional.of(ChronoUnit.YEARS);
            default -> Optional.empty();
        };
    }

    /** Accepts instants, offset date-times, local date-times and plain dates; zone-less values are read as UTC. */
    static Optional<ZonedDateTime> parseIso(Object raw) {
        if (!(raw instanceof String value) || value.isBlank()) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = ISO_INPUT.parseBest(value.strip(), OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset.atZoneSameInstant(ZoneOffset.UTC));
            }
            if (parsed instanceof LocalDateTime local) {
                return Optional.of(local.atZone(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
