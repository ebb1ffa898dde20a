package com.salon.receptionist.dto;

import com.salon.receptionist.entity.Appointment;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Detached view of an appointment. Built inside the transaction that loaded it.
 */
public record AppointmentDetails(
        Long id,
        String clientPhone,
        Long serviceId,
        String serviceName,
        LocalDateTime startAt,
        LocalDateTime endAt,
        Appointment.Status status,
        String notes,
        Instant createdAt
) {
    public static AppointmentDetails from(Appointment appointment) {
        return new AppointmentDetails(
                appointment.getId(),
                appointment.getClient().getPhone(),
                appointment.getService().getId(),
                appointment.getService().getName(),
                appointment.getStartAt(),
                appointment.getEndAt(),
                appointment.getStatus(),
                appointment.getNotes(),
                appointment.getCreatedAt()
        );
    }
}
