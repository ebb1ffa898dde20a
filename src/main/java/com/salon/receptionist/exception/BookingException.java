package com.salon.receptionist.exception;

import lombok.Getter;

/**
 * Base exception of the scheduling core. Thrown out of a transactional method it rolls the
 * transaction back.
 */
@Getter
public class BookingException extends RuntimeException {

    private final BookingError error;

    public BookingException(BookingError error, String message) {
        super(message);
        this.error = error;
    }

    public BookingException(BookingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
