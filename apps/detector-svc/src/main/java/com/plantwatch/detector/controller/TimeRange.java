package com.plantwatch.detector.controller;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Optional {@code from}/{@code to} query parameters as ISO-8601 instants; {@code from} inclusive, {@code to} exclusive.
 */
record TimeRange(Instant from, Instant to) {

    static TimeRange parse(String from, String to) {
        Instant start = parseInstant("from", from);
        Instant end = parseInstant("to", to);
        if (start != null && end != null && !start.isBefore(end)) {
            throw new IllegalArgumentException("from must be before to");
        }
        return new TimeRange(start, end);
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant (e.g. 2024-01-01T00:00:00Z)");
        }
    }
}
