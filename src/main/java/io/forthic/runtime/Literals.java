package io.forthic.runtime;

import io.forthic.model.RuntimeValue;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Literals {
    private static final Pattern FLOAT = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern DATETIME_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T.*");
    private static final Pattern EXPLICIT_OFFSET = Pattern.compile(".*(Z|[+-]\\d{2}:\\d{2})$");
    private static final Pattern DATE = Pattern.compile("^(\\d{4}|YYYY)-(\\d{2}|MM)-(\\d{2}|DD)$");

    public static final LiteralHandler BOOLEAN = text -> {
        if ("TRUE".equals(text)) {
            return Optional.of(RuntimeValue.ofBool(true));
        }
        if ("FALSE".equals(text)) {
            return Optional.of(RuntimeValue.ofBool(false));
        }
        return Optional.empty();
    };

    /**
     * Canonical decimal integers that fit in 64 bits; {@code +5}, {@code 007} and
     * {@code -0} are not integers.
     */
    public static final LiteralHandler INTEGER = text -> {
        if (text.isEmpty() || text.indexOf('.') >= 0) {
            return Optional.empty();
        }
        try {
            long value = Long.parseLong(text);
            if (!Long.toString(value).equals(text)) {
                return Optional.empty();
            }
            return Optional.of(RuntimeValue.ofInt(value));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    };

    public static final LiteralHandler FLOAT_NUMBER = text -> {
        if (!FLOAT.matcher(text).matches()) {
            return Optional.empty();
        }
        return Optional.of(RuntimeValue.ofFloat(Double.parseDouble(text)));
    };

    private Literals() {
    }

    /**
     * {@code 2025-05-24T10:15:00Z} and explicit offsets are instants; without a zone the
     * value is a zoned datetime in the interpreter's zone.
     */
    public static LiteralHandler zonedDateTime(Supplier<ZoneId> zone) {
        return text -> {
            if (!DATETIME_PREFIX.matcher(text).matches()) {
                return Optional.empty();
            }
            try {
                if (EXPLICIT_OFFSET.matcher(text).matches()) {
                    return Optional.of(RuntimeValue.InstantValue.of(OffsetDateTime.parse(text).toInstant()));
                }
                LocalDateTime local = LocalDateTime.parse(text);
                return Optional.of(RuntimeValue.ZonedDateTimeValue.of(local.atZone(zone.get())));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        };
    }

    /**
     * {@code YYYY-MM-DD}; any of the parts may be the placeholder itself, meaning the
     * current year, month or day in the interpreter's zone.
     */
    public static LiteralHandler plainDate(Supplier<ZoneId> zone) {
        return text -> {
            Matcher matcher = DATE.matcher(text);
            if (!matcher.matches()) {
                return Optional.empty();
            }
            LocalDate today = LocalDate.now(zone.get());
            int year = "YYYY".equals(matcher.group(1)) ? today.getYear() : Integer.parseInt(matcher.group(1));
            int month = "MM".equals(matcher.group(2)) ? today.getMonthValue() : Integer.parseInt(matcher.group(2));
            int day = "DD".equals(matcher.group(3)) ? today.getDayOfMonth() : Integer.parseInt(matcher.group(3));
            try {
                return Optional.of(RuntimeValue.PlainDateValue.of(LocalDate.of(year, month, day)));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        };
    }
}
