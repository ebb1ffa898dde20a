package com.salon.receptionist.service;

import com.salon.receptionist.dto.AppointmentDetails;
import com.salon.receptionist.dto.BookingResult;
import com.salon.receptionist.dto.ClientProfile;
import com.salon.receptionist.dto.ServiceDetails;
import com.salon.receptionist.dto.SessionContext;
import com.salon.receptionist.dto.SessionHistoryEntry;
import com.salon.receptionist.exception.BookingError;
import com.salon.receptionist.exception.BookingException;
import com.salon.receptionist.exception.StorageException;
import com.salon.receptionist.scheduling.TimeSlot;
import com.salon.receptionist.utils.PhoneNumberNormalizer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point for the conversational layer. Client identifiers are raw phone numbers and are
 * normalized here; storage failures are translated into {@link StorageException}.
 */
@Service
@RequiredArgsConstructor
public class ReceptionistDesk {

    private static final Logger log = LoggerFactory.getLogger(ReceptionistDesk.class);

    private final SessionContextService sessionContextService;
    private final AvailabilityService availabilityService;
    private final ConflictGuard conflictGuard;
    private final CatalogService catalogService;
    private final ClientService clientService;
    private final BookingLedger bookingLedger;
    private final PhoneNumberNormalizer phoneNumbers;
    private final Clock clock;

    // =========================================================
    // SESSIONS
    // =========================================================
    public SessionContext resolveSession(String clientId, Instant now) {
        String phone = phoneNumbers.normalize(clientId);
        return withStorage(() -> sessionContextService.resolve(phone, now));
    }

    public SessionContext resolveSession(String clientId) {
        return resolveSession(clientId, clock.instant());
    }

    public String appendSummary(SessionContext context, String note) {
        return withStorage(() -> sessionContextService.appendSummary(context, note));
    }

    public List<SessionHistoryEntry> sessionHistory(String clientId) {
        String phone = phoneNumbers.normalize(clientId);
        return withStorage(() -> sessionContextService.history(phone));
    }

    // =========================================================
    // CATALOG & CLIENTS
    // =========================================================
    public List<ServiceDetails> listServices() {
        return withStorage(catalogService::listServices);
    }

    public ClientProfile updateClientName(String clientId, String name) {
        String phone = phoneNumbers.normalize(clientId);
        return withStorage(() -> clientService.updateName(phone, name));
    }

    public ClientProfile updatePreferences(String clientId, Map<String, Object> preferences) {
        String phone = phoneNumbers.normalize(clientId);
        return withStorage(() -> clientService.updatePreferences(phone, preferences));
    }

    // =========================================================
    // AVAILABILITY (advisory, lock-free)
    // =========================================================
    public List<TimeSlot> checkAvailability(LocalDate date, Long serviceId, int maxResults) {
        return withStorage(() -> availabilityService.checkAvailability(date, serviceId, maxResults));
    }

    public List<TimeSlot> checkAvailability(LocalDate date, Long serviceId) {
        return checkAvailability(date, serviceId, availabilityService.getDefaultMaxResults());
    }

    // =========================================================
    // BOOK / CANCEL (authoritative)
    // =========================================================
    public BookingResult bookAppointment(String clientId, Long serviceId, LocalDateTime start) {
        return bookAppointment(clientId, serviceId, start, null);
    }

    public BookingResult bookAppointment(String clientId, Long serviceId, LocalDateTime start, String notes) {
        String phone;
        try {
            phone = phoneNumbers.normalize(clientId);
        } catch (IllegalArgumentException e) {
            log.warn("Booking rejected, bad client id '{}': {}", clientId, e.getMessage());
            return BookingResult.failure(BookingError.UNKNOWN_CLIENT, e.getMessage());
        }
        try {
            return BookingResult.success(withStorage(() -> conflictGuard.commit(phone, serviceId, start, notes)));
        } catch (BookingException e) {
            log.warn("Booking rejected: client={} service={} start={} -> {} ({})",
                    phone, serviceId, start, e.getError(), e.getMessage());
            return BookingResult.failure(e.getError(), e.getMessage());
        }
    }

    public BookingResult cancelAppointment(Long appointmentId) {
        try {
            return BookingResult.success(withStorage(() -> conflictGuard.cancel(appointmentId)));
        } catch (BookingException e) {
            log.warn("Cancellation of appointment {} rejected -> {} ({})", appointmentId, e.getError(), e.getMessage());
            return BookingResult.failure(e.getError(), e.getMessage());
        }
    }

    public List<AppointmentDetails> upcomingAppointments(String clientId) {
        String phone = phoneNumbers.normalize(clientId);
        return withStorage(() -> bookingLedger.upcomingFor(phone, LocalDateTime.now(clock)));
    }

    // =========================================================
    // STORAGE FAILURES
    // =========================================================
    private static <T> T withStorage(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            StorageException translated = translate(e);
            log.error("Storage failure ({}): {}", translated.getError(), e.getMessage(), e);
            throw translated;
        }
    }

    static StorageException translate(RuntimeException e) {
        if (e instanceof TransientDataAccessException || e instanceof TransactionTimedOutException) {
            return StorageException.timeout(e);
        }
        return StorageException.unavailable(e);
    }
}
