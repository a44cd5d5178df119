package com.exposure.sdk.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Date helpers for the formats used by the Exposure API.
 */
public final class ExposureDates {
    public static final DateTimeFormatter UTC_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ExposureDates() {
    }

    public static String formatUtc(Instant instant) {
        return UTC_FORMATTER.format(instant);
    }

    public static long toEpochMillis(Instant instant) {
        return instant.toEpochMilli();
    }

    public static Instant fromEpochMillis(long millis) {
        return Instant.ofEpochMilli(millis);
    }

    /**
     * Parses an ISO-8601 timestamp. Timestamps without an offset are read as UTC.
     *
     * @return empty when {@code value} is {@code null} or not a recognised timestamp
     */
    public static Optional<Instant> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
