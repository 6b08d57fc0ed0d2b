package com.sailfish.cloudrpc.storage;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses and formats the RFC 3339 timestamps used by the object storage service.
 */
public final class Rfc3339 {

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss", Locale.ROOT);

    private Rfc3339() {
    }

    /**
     * Parses a timestamp such as {@code 2018-08-02T01:02:03.123Z} or {@code 2018-08-02T01:02:03-07:00}.
     *
     * @throws IllegalArgumentException if the text is not a valid RFC 3339 timestamp.
     */
    public static Instant parse(String timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        // RFC 3339 allows lowercase 't' and 'z'
        String normalized = timestamp.trim().toUpperCase(Locale.ROOT);
        try {
            return OffsetDateTime.parse(normalized, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid RFC 3339 timestamp: " + timestamp, e);
        }
    }

    /**
     * Formats a timestamp in UTC. The fractional part is omitted when zero, and otherwise written with
     * 3, 6 or 9 digits, whichever is the shortest without losing precision.
     */
    public static String format(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        StringBuilder sb = new StringBuilder(SECONDS.format(timestamp.atOffset(ZoneOffset.UTC)));
        int nanos = timestamp.getNano();
        if (nanos != 0) {
            sb.append('.');
            if (nanos % 1_000_000 == 0) {
                sb.append(String.format(Locale.ROOT, "%03d", nanos / 1_000_000));
            } else if (nanos % 1_000 == 0) {
                sb.append(String.format(Locale.ROOT, "%06d", nanos / 1_000));
            } else {
                sb.append(String.format(Locale.ROOT, "%09d", nanos));
            }
        }
        return sb.append('Z').toString();
    }
}
