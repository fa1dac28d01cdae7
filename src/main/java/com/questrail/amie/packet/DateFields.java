package com.questrail.amie.packet;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * DateFields
 * ============================================================================
 * Naming convention and value conversion for date-valued packet fields.
 *
 * <p>
 * AMIE field schemas carry names only, not value types. A declared field whose
 * name contains {@value #DATE_MARKER} (for example {@code StartDate} or
 * {@code EndDate}) is treated as a timestamp: it is stored as an
 * {@link OffsetDateTime} and written to the wire as an ISO-8601 string.
 * </p>
 *
 * <p>
 * Timestamps without an offset are interpreted as UTC. Date-only values are
 * taken as the start of that day in UTC.
 * </p>
 */
public final class DateFields
{
    /**
     * Substring that marks a field name as date-valued.
     */
    public static final String DATE_MARKER = "Date";

    private DateFields() {
    }

    /**
     * Returns {@code true} if the field name follows the date naming convention.
     */
    public static boolean isDateField(String name) {
        return name != null && name.contains(DATE_MARKER);
    }

    /**
     * Converts a raw field value into an {@link OffsetDateTime}.
     *
     * @param field field name, used for error reporting
     * @param value raw value; {@code null} passes through unchanged
     * @return the parsed timestamp, or {@code null}
     * @throws PacketInvalidDataException if the value is not a recognizable date-time
     */
    public static OffsetDateTime toTimestamp(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt;
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC);
        }
        if (value instanceof CharSequence text) {
            return parse(field, text.toString().trim());
        }
        throw new PacketInvalidDataException(field,
                "Field \"" + field + "\" expects a date-time, got " + value.getClass().getName());
    }

    /**
     * Formats a temporal value as ISO-8601 text.
     */
    public static String format(TemporalAccessor value) {
        if (value instanceof OffsetDateTime odt) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(odt);
        }
        if (value instanceof ZonedDateTime zdt) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(zdt.toOffsetDateTime());
        }
        // Instant, LocalDateTime and LocalDate already print ISO-8601.
        return value.toString();
    }

    private static OffsetDateTime parse(String field, String text) {
        // Accept the space separator some AMIE peers emit.
        String normalized = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt;
            }
            return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(normalized).atStartOfDay().atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException notADate) {
                throw new PacketInvalidDataException(field,
                        "Field \"" + field + "\" is not an ISO-8601 date-time: '" + text + "'", e);
            }
        }
    }
}
