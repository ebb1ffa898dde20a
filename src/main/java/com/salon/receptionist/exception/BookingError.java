package com.salon.receptionist.exception;

/**
 * Every way a scheduling request can fail.
 */
public enum BookingError {
    UNKNOWN_CLIENT(false),
    UNKNOWN_SERVICE(false),
    INVALID_SLOT(false),
    SLOT_CONFLICT(false),
    NOT_FOUND(false),
    ALREADY_CANCELLED(false),
    STORAGE_TIMEOUT(true),
    STORAGE_UNAVAILABLE(false);

    private final boolean retryable;

    BookingError(boolean retryable) {
        this.retryable = retryable;
    }

    /** Whether the same request may succeed if simply repeated. */
    public boolean isRetryable() {
        return retryable;
    }
}
