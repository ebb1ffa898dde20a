package com.salon.receptionist.service;

import com.salon.receptionist.dto.AppointmentDetails;
import com.salon.receptionist.entity.Appointment;
import com.salon.receptionist.entity.BookingDay;
import com.salon.receptionist.entity.Client;
import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.exception.BookingError;
import com.salon.receptionist.exception.BookingException;
import com.salon.receptionist.exception.ResourceNotFoundException;
import com.salon.receptionist.exception.SlotConflictException;
import com.salon.receptionist.repository.AppointmentRepository;
import com.salon.receptionist.repository.BookingDayRepository;
import com.salon.receptionist.repository.ClientRepository;
import com.salon.receptionist.repository.SalonServiceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Write side of the appointment ledger. Every commit for a business date holds the
 * {@link BookingDay} row lock while it re-checks overlaps and inserts.
 */
@Service
@RequiredArgsConstructor
public class BookingLedger {

    private static final Logger log = LoggerFactory.getLogger(BookingLedger.class);
    static final int TX_TIMEOUT_SECONDS = 10;

    private final BookingDayRepository bookingDayRepository;
    private final AppointmentRepository appointmentRepository;
    private final ClientRepository clientRepository;
    private final SalonServiceRepository serviceRepository;
    private final Clock clock;

    /**
     * Makes sure the lock row for the date exists. Must run outside the commit transaction.
     */
    public void ensureDay(LocalDate date) {
        if (bookingDayRepository.existsById(date)) {
            return;
        }
        try {
            bookingDayRepository.saveAndFlush(new BookingDay(date));
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            if (!bookingDayRepository.existsById(date)) {
                throw e;
            }
            log.debug("Booking day {} was created concurrently", date);
        }
    }

    /**
     * Inserts a CONFIRMED appointment unless a PENDING/CONFIRMED one overlaps it.
     *
     * @throws SlotConflictException when the interval is taken; nothing is written
     */
    @Transactional(timeout = TX_TIMEOUT_SECONDS)
    public AppointmentDetails insertIfFree(Long clientId, Long serviceId, LocalDateTime start, String notes) {
        LocalDate date = start.toLocalDate();
        bookingDayRepository.findByIdForUpdate(date)
                .orElseThrow(() -> new IllegalStateException("Booking day " + date + " has not been prepared"));

        SalonService service = serviceRepository.findById(serviceId)
                .orElseThrow(() -> ResourceNotFoundException.service(serviceId));
        Client client = clientRepository.findById(clientId)
                .orElseThrow(() -> ResourceNotFoundException.client(String.valueOf(clientId)));
        LocalDateTime end = start.plusMinutes(service.getDurationMinutes());

        List<Appointment> overlapping = appointmentRepository.findOverlapping(start, end, Appointment.Status.ACTIVE);
        if (!overlapping.isEmpty()) {
            log.warn("Slot conflict: {} - {} overlaps appointment {}", start, end, overlapping.get(0).getId());
            throw new SlotConflictException(start, end);
        }

        Appointment appointment = appointmentRepository.save(Appointment.builder()
                .client(client)
                .service(service)
                .startAt(start)
                .endAt(end)
                .durationMinutes(service.getDurationMinutes())
                .status(Appointment.Status.CONFIRMED)
                .notes(notes)
                .createdAt(clock.instant())
                .build());

        log.info("Booked appointment {}: client={} service={} {} - {}",
                appointment.getId(), client.getPhone(), service.getName(), start, end);
        return AppointmentDetails.from(appointment);
    }

    /**
     * CONFIRMED/PENDING to CANCELLED. The row is kept; its interval becomes free.
     */
    @Transactional(timeout = TX_TIMEOUT_SECONDS)
    public AppointmentDetails cancel(Long appointmentId) {
        Appointment appointment = appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> ResourceNotFoundException.appointment(appointmentId));
        if (appointment.getStatus() == Appointment.Status.CANCELLED) {
            throw new BookingException(BookingError.ALREADY_CANCELLED,
                    "Appointment " + appointmentId + " is already cancelled");
        }
        appointment.setStatus(Appointment.Status.CANCELLED);
        appointment.setCancelledAt(clock.instant());
        log.info("Cancelled appointment {} ({} - {})", appointmentId, appointment.getStartAt(), appointment.getEndAt());
        return AppointmentDetails.from(appointment);
    }

    @Transactional(readOnly = true)
    public List<AppointmentDetails> upcomingFor(String phone, LocalDateTime from) {
        return appointmentRepository.findUpcomingForClient(phone, from, Appointment.Status.ACTIVE).stream()
                .map(AppointmentDetails::from)
                .toList();
    }
}
