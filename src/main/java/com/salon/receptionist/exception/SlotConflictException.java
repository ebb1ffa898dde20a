package com.salon.receptionist.exception;

import java.time.LocalDateTime;

public class SlotConflictException extends BookingException {

    public SlotConflictException(LocalDateTime start, LocalDateTime end) {
        super(BookingError.SLOT_CONFLICT, "Time slot " + start + " - " + end + " is no longer available");
    }
}
