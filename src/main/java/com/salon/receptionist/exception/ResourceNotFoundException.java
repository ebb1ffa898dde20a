package com.salon.receptionist.exception;

/**
 * A referenced client, service or appointment does not exist.
 */
public class ResourceNotFoundException extends BookingException {

    public ResourceNotFoundException(BookingError error, String resourceType, Object identifier) {
        super(error, String.format("%s with identifier %s not found", resourceType, identifier));
    }

    public static ResourceNotFoundException client(String phone) {
        return new ResourceNotFoundException(BookingError.UNKNOWN_CLIENT, "Client", phone);
    }

    public static ResourceNotFoundException service(Long serviceId) {
        return new ResourceNotFoundException(BookingError.UNKNOWN_SERVICE, "Service", serviceId);
    }

    public static ResourceNotFoundException appointment(Long appointmentId) {
        return new ResourceNotFoundException(BookingError.NOT_FOUND, "Appointment", appointmentId);
    }
}
