package com.alertrelay.core.driver;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lenient timestamp parsing shared by every source driver.
 *
 * <p>
 * Accepted inputs, tried in order:
 * </p>
 * <ol>
 * <li>JSON numbers and all-digit strings: epoch seconds, or epoch millis when
 * the value exceeds {@value #MILLIS_THRESHOLD}</li>
 * <li>ISO-8601 with offset or {@code Z}</li>
 * <li>ISO-8601 local date-time, taken as UTC</li>
 * <li>{@code yyyy.MM.dd HH:mm:ss}, {@code yyyy-MM-dd HH:mm:ss} and
 * {@code dd.MM.yyyy HH:mm:ss}, taken as UTC</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class Timestamps {

    /** Epoch values above this are milliseconds. */
    public static final long MILLIS_THRESHOLD = 10_000_000_000L;

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy.MM.dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm:ss"));

    private Timestamps() {
        // utility class
    }

    /**
     * @param raw JSON value (number, string) or {@code null}
     * @return parsed instant, empty when missing or unparseable
     */
    public static Optional<Instant> parse(Object raw) {
        if (raw instanceof Number n) {
            return fromEpoch(n.doubleValue());
        }
        if (raw instanceof String s) {
            return parseText(s.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseText(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        Optional<Instant> parsed = attempt(() -> OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                .toInstant())
                .or(() -> attempt(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                        .toInstant(ZoneOffset.UTC)));
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            if (parsed.isPresent()) {
                return parsed;
            }
            parsed = attempt(() -> LocalDateTime.parse(text, format).toInstant(ZoneOffset.UTC));
        }
        return parsed;
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> fromEpoch(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
            return Optional.empty();
        }
        long millis = value > MILLIS_THRESHOLD ? (long) value : (long) (value * 1000d);
        return Optional.of(Instant.ofEpochMilli(millis));
    }
}
