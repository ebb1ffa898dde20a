package com.salon.receptionist.exception;

/**
 * Requested start is misaligned, outside opening hours or in the past.
 */
public class InvalidSlotException extends BookingException {

    public InvalidSlotException(String message) {
        super(BookingError.INVALID_SLOT, message);
    }
}
