package com.salon.receptionist.dto;

import com.salon.receptionist.exception.BookingError;

/**
 * Outcome of a booking or cancellation: either the appointment, or a typed error.
 */
public record BookingResult(boolean success, AppointmentDetails appointment, BookingError error, String message) {

    public static BookingResult success(AppointmentDetails appointment) {
        return new BookingResult(true, appointment, null, null);
    }

    public static BookingResult failure(BookingError error, String message) {
        return new BookingResult(false, null, error, message);
    }

    public boolean isRetryable() {
        return error != null && error.isRetryable();
    }
}
