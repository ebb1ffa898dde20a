package com.salon.receptionist.scheduling;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * One opening block of a weekday, {@code [open, close)}.
 */
public record OpeningInterval(LocalTime open, LocalTime close) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public OpeningInterval {
        if (open == null || close == null || !open.isBefore(close)) {
            throw new IllegalArgumentException("Opening time must be before closing time: " + open + "-" + close);
        }
    }

    /**
     * Parses {@code HH:mm-HH:mm}.
     */
    public static OpeningInterval parse(String text) {
        String[] parts = text.trim().split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected HH:mm-HH:mm but got '" + text + "'");
        }
        try {
            return new OpeningInterval(LocalTime.parse(parts[0].trim(), HH_MM), LocalTime.parse(parts[1].trim(), HH_MM));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time range '" + text + "'", e);
        }
    }

    int openMinute() {
        return open.getHour() * 60 + open.getMinute();
    }

    int closeMinute() {
        return close.getHour() * 60 + close.getMinute();
    }

    @Override
    public String toString() {
        return open.format(HH_MM) + "-" + close.format(HH_MM);
    }
}
