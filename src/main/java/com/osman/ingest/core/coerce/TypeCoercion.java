package com.osman.ingest.core.coerce;

import com.osman.ingest.logging.AppLogger;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scalar converters used by the normalization pipelines.
 * <p>
 * None of these methods throw for bad input: unparseable values degrade to {@code null} or to the supplied default.
 */
public final class TypeCoercion {
    private static final Logger LOGGER = AppLogger.get();

    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern LOOSE_DATE_TIME = Pattern.compile(
        "(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})"
            + "(?:[ T]+(\\d{1,2}):(\\d{2})(?::(\\d{2})(?:[.,](\\d{1,9}))?)?(?:\\s*(AM|PM))?)?"
            + "\\s*(Z|UTC|GMT|[+-]\\d{2}:?\\d{2})?",
        Pattern.CASE_INSENSITIVE);

    /** Tried in order; the first one that parses the whole value wins. */
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_ZONED_DATE_TIME,
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        isoLikeWithOffset(),
        format("uuuu-MM-dd h:mm[:ss] a[ xx][ XXX]"),
        DateTimeFormatter.ISO_LOCAL_DATE,
        format("uuuu/MM/dd[ HH:mm[:ss]]"),
        format("M/d/uuuu h:mm[:ss] a[ xx][ XXX]"),
        format("M/d/uuuu[ H:mm[:ss]][ xx][ XXX]"),
        format("M/d/uu h:mm[:ss] a"),
        format("M/d/uu[ H:mm[:ss]]"),
        format("d MMM uuuu[ HH:mm[:ss]]"),
        format("d MMMM uuuu[ HH:mm[:ss]]"),
        format("MMM d, uuuu[ h:mm[:ss] a]"),
        format("MMMM d, uuuu[ h:mm[:ss] a]"),
        DateTimeFormatter.RFC_1123_DATE_TIME,
        DateTimeFormatter.BASIC_ISO_DATE
    );

    private TypeCoercion() {
    }

    /**
     * Convert a cell to a UTC instant. Values without zone information are taken to already be UTC.
     *
     * @return the instant, or {@code null} when the value is blank or cannot be parsed
     */
    public static Instant toUtcTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        try {
            Instant direct = fromTemporalValue(value);
            if (direct != null) {
                return direct;
            }
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
                Instant parsed = tryParse(formatter, text);
                if (parsed != null) {
                    return parsed;
                }
            }
            return parseLoosely(text);
        } catch (RuntimeException ex) {
            LOGGER.fine(() -> "Unable to coerce timestamp '" + value + "': " + ex.getMessage());
            return null;
        }
    }

    /**
     * Numeric coercion to a whole number. Fractions are truncated toward zero; values outside the {@code int}
     * range fall back to the default.
     */
    public static int toInteger(Object value, int defaultValue) {
        Double number = toDouble(value);
        if (number == null) {
            return defaultValue;
        }
        double whole = number.doubleValue();
        if (whole <= Integer.MIN_VALUE - 1.0 || whole >= Integer.MAX_VALUE + 1.0) {
            return defaultValue;
        }
        return (int) whole;
    }

    /**
     * Numeric coercion to a floating value; anything non-numeric is {@code null}.
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double result = number.doubleValue();
            return Double.isFinite(result) ? result : null;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        String text = value.toString().trim();
        if (!NUMERIC.matcher(text).matches()) {
            return null;
        }
        try {
            double result = Double.parseDouble(text);
            return Double.isFinite(result) ? result : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * String form of a cell; {@code null} becomes the empty string.
     */
    public static String toSafeString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                return "";
            }
            if (Double.isFinite(number) && number == Math.rint(number) && Math.abs(number) < 1e15) {
                return Long.toString((long) number);
            }
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public static String toTrimmedString(Object value) {
        return toSafeString(value).trim();
    }

    private static Instant fromTemporalValue(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (value instanceof LocalDateTime local) {
            return local.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return null;
    }

    private static Instant tryParse(DateTimeFormatter formatter, String text) {
        try {
            TemporalAccessor parsed = formatter.parseBest(text,
                ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            return fromTemporalValue(parsed);
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private static Instant parseLoosely(String text) {
        Matcher matcher = LOOSE_DATE_TIME.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        // digits outside the match mean a date or time part was not understood
        String rest = text.substring(0, matcher.start()) + text.substring(matcher.end());
        if (DIGIT.matcher(rest).find()) {
            return null;
        }
        try {
            int year = Integer.parseInt(matcher.group(1));
            int month = Integer.parseInt(matcher.group(2));
            int day = Integer.parseInt(matcher.group(3));
            int hour = matcher.group(4) == null ? 0 : Integer.parseInt(matcher.group(4));
            int minute = matcher.group(5) == null ? 0 : Integer.parseInt(matcher.group(5));
            int second = matcher.group(6) == null ? 0 : Integer.parseInt(matcher.group(6));
            if (matcher.group(8) != null) {
                hour = toTwentyFourHour(hour, matcher.group(8));
            }
            int nanos = 0;
            if (matcher.group(7) != null) {
                String fraction = (matcher.group(7) + "000000000").substring(0, 9);
                nanos = Integer.parseInt(fraction);
            }
            LocalDateTime local = LocalDateTime.of(year, month, day, hour, minute, second, nanos);
            return local.atOffset(parseOffset(matcher.group(9))).toInstant();
        } catch (DateTimeException | NumberFormatException ex) {
            return null;
        }
    }

    private static int toTwentyFourHour(int hour, String marker) {
        if (hour < 1 || hour > 12) {
            throw new DateTimeException("Hour " + hour + " is not valid with " + marker);
        }
        boolean pm = marker.equalsIgnoreCase("PM");
        if (hour == 12) {
            return pm ? 12 : 0;
        }
        return pm ? hour + 12 : hour;
    }

    private static ZoneOffset parseOffset(String token) {
        if (token == null) {
            return ZoneOffset.UTC;
        }
        String upper = token.toUpperCase(Locale.ROOT);
        if (upper.equals("Z") || upper.equals("UTC") || upper.equals("GMT")) {
            return ZoneOffset.UTC;
        }
        String digits = upper.replace(":", "");
        return ZoneOffset.of(digits.substring(0, 3) + ":" + digits.substring(3));
    }

    /**
     * Date and time separated by a space or {@code T}, optional fraction, optional offset or region id.
     * Covers the Shopify style {@code 2024-01-05 10:00:00 -0500}.
     */
    private static DateTimeFormatter isoLikeWithOffset() {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("uuuu-MM-dd[ ]['T']HH:mm[:ss]")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHmm", "Z").optionalEnd()
            .optionalStart().appendZoneRegionId().optionalEnd()
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter format(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
