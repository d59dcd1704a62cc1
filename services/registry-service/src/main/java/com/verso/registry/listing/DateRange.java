package com.verso.registry.listing;

import com.verso.registry.common.BadRequestException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Creation-date window given by the {@code from} (inclusive) and {@code to} (exclusive) parameters,
 * both ISO dates in UTC.
 */
public record DateRange(LocalDate from, LocalDate to) {
    public static final String FROM = "from";
    public static final String TO = "to";

    /**
     * Validates whichever bounds are supplied. The range applies only when both are.
     */
    public static Optional<DateRange> parse(Map<String, String> query) {
        LocalDate from = parseDate(query.get(FROM), FROM);
        LocalDate to = parseDate(query.get(TO), TO);
        if (from == null || to == null) {
            return Optional.empty();
        }
        return Optional.of(new DateRange(from, to));
    }

    public boolean contains(Instant instant) {
        if (instant == null) {
            return false;
        }
        LocalDate date = instant.atZone(ZoneOffset.UTC).toLocalDate();
        return !date.isBefore(from) && date.isBefore(to);
    }

    private static LocalDate parseDate(String value, String parameter) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw BadRequestException.invalid(parameter, value);
        }
    }
}
