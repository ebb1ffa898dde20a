package com.salon.receptionist.exception;

/**
 * The ledger could not be read or written. {@link BookingError#STORAGE_TIMEOUT} may be retried.
 */
public class StorageException extends BookingException {

    public StorageException(BookingError error, String message, Throwable cause) {
        super(error, message, cause);
    }

    public static StorageException timeout(Throwable cause) {
        return new StorageException(BookingError.STORAGE_TIMEOUT, "Storage timed out, please retry", cause);
    }

    public static StorageException unavailable(Throwable cause) {
        return new StorageException(BookingError.STORAGE_UNAVAILABLE, "Storage unavailable", cause);
    }
}
