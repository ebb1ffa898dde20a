package com.salon.receptionist.service;

import com.salon.receptionist.dto.AppointmentDetails;
import com.salon.receptionist.entity.Client;
import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.exception.InvalidSlotException;
import com.salon.receptionist.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Authoritative booking path. Validates the request, then commits through {@link BookingLedger},
 * which re-checks overlaps under the per-day lock regardless of any earlier availability lookup.
 */
@Service
@RequiredArgsConstructor
public class ConflictGuard {

    private static final Logger log = LoggerFactory.getLogger(ConflictGuard.class);

    private final ClientService clientService;
    private final CatalogService catalogService;
    private final AvailabilityService availabilityService;
    private final BookingLedger bookingLedger;
    private final Clock clock;

    public AppointmentDetails commit(String phone, Long serviceId, LocalDateTime requestedStart) {
        return commit(phone, serviceId, requestedStart, null);
    }

    /**
     * @throws ResourceNotFoundException UNKNOWN_CLIENT / UNKNOWN_SERVICE
     * @throws InvalidSlotException      start misaligned, outside opening hours or in the past
     * @throws com.salon.receptionist.exception.SlotConflictException interval already held
     */
    public AppointmentDetails commit(String phone, Long serviceId, LocalDateTime requestedStart, String notes) {
        Client client = clientService.findByPhone(phone)
                .orElseThrow(() -> ResourceNotFoundException.client(phone));
        SalonService service = catalogService.requireService(serviceId);
        validateStart(requestedStart, service.getDurationMinutes());

        bookingLedger.ensureDay(requestedStart.toLocalDate());
        return bookingLedger.insertIfFree(client.getId(), service.getId(), requestedStart, notes);
    }

    public AppointmentDetails cancel(Long appointmentId) {
        if (appointmentId == null) {
            throw ResourceNotFoundException.appointment(null);
        }
        return bookingLedger.cancel(appointmentId);
    }

    private void validateStart(LocalDateTime start, int durationMinutes) {
        if (start == null) {
            throw new InvalidSlotException("Requested start is required");
        }
        if (start.isBefore(LocalDateTime.now(clock))) {
            throw new InvalidSlotException("Requested start " + start + " is in the past");
        }
        if (!availabilityService.isBookableStart(start, durationMinutes)) {
            log.debug("Rejected start {} for a {}min service", start, durationMinutes);
            throw new InvalidSlotException("Requested start " + start
                    + " is not on a slot boundary within opening hours for a " + durationMinutes + " minute service");
        }
    }
}
