package com.salon.receptionist.service;

import com.salon.receptionist.entity.Appointment;
import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.repository.AppointmentRepository;
import com.salon.receptionist.scheduling.OperatingHours;
import com.salon.receptionist.scheduling.SlotGridGenerator;
import com.salon.receptionist.scheduling.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Advisory availability lookups. Reads take no lock; a stale answer is caught by
 * {@link ConflictGuard} when the slot is actually committed.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final SlotGridGenerator slotGridGenerator;
    private final OperatingHours operatingHours;
    private final CatalogService catalogService;
    private final AppointmentRepository appointmentRepository;
    private final Clock clock;
    private final int defaultMaxResults;

    public AvailabilityService(SlotGridGenerator slotGridGenerator,
                               OperatingHours operatingHours,
                               CatalogService catalogService,
                               AppointmentRepository appointmentRepository,
                               Clock clock,
                               @Value("${salon.availability.max-results:10}") int defaultMaxResults) {
        this.slotGridGenerator = slotGridGenerator;
        this.operatingHours = operatingHours;
        this.catalogService = catalogService;
        this.appointmentRepository = appointmentRepository;
        this.clock = clock;
        this.defaultMaxResults = defaultMaxResults;
    }

    public int getDefaultMaxResults() {
        return defaultMaxResults;
    }

    /**
     * Open start times for the service on the given day, earliest first, at most {@code maxResults}.
     * An empty list means nothing fits.
     */
    @Transactional(readOnly = true)
    public List<TimeSlot> checkAvailability(LocalDate date, Long serviceId, int maxResults) {
        SalonService service = catalogService.requireService(serviceId);
        LocalDateTime dayStart = date.atStartOfDay();
        List<Appointment> existing = appointmentRepository.findOverlapping(
                dayStart, dayStart.plusDays(1), Appointment.Status.ACTIVE);
        List<TimeSlot> open = findAvailable(date, service.getDurationMinutes(), existing, maxResults);
        log.debug("Availability {} service={} -> {} slot(s)", date, serviceId, open.size());
        return open;
    }

    public List<TimeSlot> findAvailable(LocalDate date, Long serviceId, List<Appointment> existingAppointments, int maxResults) {
        return findAvailable(date, catalogService.requireService(serviceId).getDurationMinutes(), existingAppointments, maxResults);
    }

    List<TimeSlot> findAvailable(LocalDate date, int durationMinutes, List<Appointment> existingAppointments, int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        List<TimeSlot> busy = existingAppointments.stream()
                .filter(a -> a.getStatus().holdsSlot())
                .map(a -> new TimeSlot(a.getStartAt(), a.getEndAt()))
                .toList();
        return bookableWindows(date, durationMinutes).stream()
                .filter(window -> !window.start().isBefore(now))
                .filter(window -> busy.stream().noneMatch(window::overlaps))
                .limit(maxResults)
                .toList();
    }

    /**
     * Every {@code [start, start + duration)} that begins on a slot boundary and lies inside one
     * contiguous run of base slots, ignoring existing bookings.
     */
    public List<TimeSlot> bookableWindows(LocalDate date, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Service duration must be positive: " + durationMinutes);
        }
        List<TimeSlot> grid = slotGridGenerator.generate(date, operatingHours);
        int n = grid.size();
        LocalDateTime[] runEnd = new LocalDateTime[n];
        for (int i = n - 1; i >= 0; i--) {
            boolean continues = i + 1 < n && grid.get(i + 1).start().equals(grid.get(i).end());
            runEnd[i] = continues ? runEnd[i + 1] : grid.get(i).end();
        }
        List<TimeSlot> windows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            TimeSlot window = TimeSlot.of(grid.get(i).start(), durationMinutes);
            if (!window.end().isAfter(runEnd[i])) {
                windows.add(window);
            }
        }
        return windows;
    }

    public boolean isBookableStart(LocalDateTime start, int durationMinutes) {
        return bookableWindows(start.toLocalDate(), durationMinutes).stream()
                .anyMatch(window -> window.start().equals(start));
    }
}
