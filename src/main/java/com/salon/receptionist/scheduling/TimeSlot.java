package com.salon.receptionist.scheduling;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A half-open interval {@code [start, end)} in business-local wall time.
 */
public record TimeSlot(LocalDateTime start, LocalDateTime end) {

    public TimeSlot {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Slot start " + start + " must be before end " + end);
        }
    }

    public static TimeSlot of(LocalDateTime start, int minutes) {
        return new TimeSlot(start, start.plusMinutes(minutes));
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }

    public boolean overlaps(TimeSlot other) {
        return overlaps(other.start, other.end);
    }
}
