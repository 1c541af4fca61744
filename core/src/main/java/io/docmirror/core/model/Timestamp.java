package io.docmirror.core.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Store-native timestamp with nanosecond precision.
 *
 * <p>
 * {@code seconds} is floored towards negative infinity, so {@code nanos} is always
 * non-negative (the same split as {@link Instant}).
 *
 * @param seconds whole seconds since the Unix epoch
 * @param nanos   non-negative fraction of a second, in range [0, 999_999_999]
 */
public record Timestamp(long seconds, int nanos) {

    public Timestamp {
        if (nanos < 0 || nanos > 999_999_999) {
            throw new IllegalArgumentException("nanos must be in [0, 999999999], got " + nanos);
        }
    }

    public static Timestamp ofInstant(Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        return new Timestamp(instant.getEpochSecond(), instant.getNano());
    }

    public static Timestamp ofEpochSeconds(long seconds) {
        return new Timestamp(seconds, 0);
    }

    /**
     * Parses an RFC 3339 timestamp such as {@code 2019-08-21T10:15:30.123456Z}.
     *
     * @throws IllegalArgumentException if the text is not a valid UTC timestamp
     */
    public static Timestamp parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return ofInstant(Instant.parse(text));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid RFC 3339 timestamp: '" + text + "'", e);
        }
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(seconds, nanos);
    }

    @Override
    public String toString() {
        return toInstant().toString();
    }
}
