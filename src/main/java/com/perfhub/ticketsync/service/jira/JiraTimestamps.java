package com.perfhub.ticketsync.service.jira;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

/**
 * Parses the timestamp shapes Jira emits. Changelog and created values look like
 * {@code 2024-03-01T09:15:00.000+0000}; ISO offsets ({@code +00:00}, {@code Z}) are accepted too.
 */
final class JiraTimestamps {

    private static final DateTimeFormatter JIRA_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart().appendPattern("XXX").optionalEnd()
            .optionalStart().appendPattern("XX").optionalEnd()
            .toFormatter();

    private JiraTimestamps() {
    }

    /**
     * @throws java.time.format.DateTimeParseException for blank or malformed values
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing timestamp");
        }
        return OffsetDateTime.parse(value.trim(), JIRA_DATE_TIME).toInstant();
    }

    static Instant parseOptionalInstant(String value) {
        if (value == null || value.isBlank()) return null;
        return parseInstant(value);
    }

    /** Due dates are plain calendar dates ({@code 2024-03-15}). */
    static LocalDate parseOptionalDate(String value) {
        if (value == null || value.isBlank()) return null;
        String trimmed = value.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == 'T') {
            return parseInstant(trimmed).atOffset(ZoneOffset.UTC).toLocalDate();
        }
        return LocalDate.parse(trimmed);
    }
}
