package com.salon.receptionist.service;

import com.salon.receptionist.entity.Appointment;
import com.salon.receptionist.entity.SalonService;
import com.salon.receptionist.exception.BookingError;
import com.salon.receptionist.exception.ResourceNotFoundException;
import com.salon.receptionist.repository.AppointmentRepository;
import com.salon.receptionist.scheduling.OperatingHours;
import com.salon.receptionist.scheduling.SlotGridGenerator;
import com.salon.receptionist.scheduling.TimeSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AvailabilityService}: contiguity, overlap filtering, result cap,
 * past filtering and unknown services.
 */
@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    private static final ZoneId LISBON = ZoneId.of("Europe/Lisbon");
    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 12);
    private static final Long MANICURE_ID = 1L;

    @Mock
    private CatalogService catalogService;
    @Mock
    private AppointmentRepository appointmentRepository;

    private AvailabilityService service;

    @BeforeEach
    void setUp() {
        service = serviceWith("MON-SAT 09:00-19:00", Clock.fixed(
                LocalDateTime.of(2026, 10, 11, 12, 0).atZone(LISBON).toInstant(), LISBON));
    }

    private AvailabilityService serviceWith(String hours, Clock clock) {
        return new AvailabilityService(new SlotGridGenerator(), OperatingHours.parse(hours, 15),
                catalogService, appointmentRepository, clock, 10);
    }

    private static SalonService manicure(int minutes) {
        return SalonService.builder().id(MANICURE_ID).name("Basic Manicure").durationMinutes(minutes)
                .price(new BigDecimal("23.00")).active(true).build();
    }

    private static Appointment appointment(LocalDateTime start, int minutes, Appointment.Status status) {
        return Appointment.builder().startAt(start).endAt(start.plusMinutes(minutes))
                .durationMinutes(minutes).status(status).build();
    }

    @Test
    @DisplayName("empty ledger: first 10 quarter-hour starts from opening")
    void checkAvailability_emptyLedger() {
        when(catalogService.requireService(MANICURE_ID)).thenReturn(manicure(30));
        when(appointmentRepository.findOverlapping(eq(MONDAY.atStartOfDay()), eq(MONDAY.plusDays(1).atStartOfDay()), any()))
                .thenReturn(List.of());

        List<TimeSlot> slots = service.checkAvailability(MONDAY, MANICURE_ID, 10);

        assertThat(slots).hasSize(10);
        assertThat(slots.get(0)).isEqualTo(new TimeSlot(MONDAY.atTime(9, 0), MONDAY.atTime(9, 30)));
        assertThat(slots).extracting(TimeSlot::start).containsExactly(
                MONDAY.atTime(9, 0), MONDAY.atTime(9, 15), MONDAY.atTime(9, 30), MONDAY.atTime(9, 45),
                MONDAY.atTime(10, 0), MONDAY.atTime(10, 15), MONDAY.atTime(10, 30), MONDAY.atTime(10, 45),
                MONDAY.atTime(11, 0), MONDAY.atTime(11, 15));
    }

    @Test
    @DisplayName("a booked 09:00-09:30 removes 09:00 and 09:15 but keeps 09:30 onward")
    void findAvailable_skipsOverlapping() {
        List<Appointment> existing = List.of(appointment(MONDAY.atTime(9, 0), 30, Appointment.Status.CONFIRMED));

        List<TimeSlot> slots = service.findAvailable(MONDAY, 30, existing, 10);

        assertThat(slots).extracting(TimeSlot::start)
                .doesNotContain(MONDAY.atTime(9, 0), MONDAY.atTime(9, 15), MONDAY.atTime(8, 45))
                .startsWith(MONDAY.atTime(9, 30), MONDAY.atTime(9, 45));
    }

    @Test
    @DisplayName("cancelled appointments do not block; pending ones do")
    void findAvailable_statusAware() {
        List<Appointment> existing = List.of(
                appointment(MONDAY.atTime(9, 0), 30, Appointment.Status.CANCELLED),
                appointment(MONDAY.atTime(10, 0), 15, Appointment.Status.PENDING));

        List<TimeSlot> slots = service.findAvailable(MONDAY, 15, existing, 10);

        assertThat(slots).extracting(TimeSlot::start)
                .contains(MONDAY.atTime(9, 0))
                .doesNotContain(MONDAY.atTime(10, 0));
    }

    @Test
    @DisplayName("multi-slot services must fit inside one contiguous run, never across a break or past closing")
    void findAvailable_requiresContiguousSpan() {
        AvailabilityService lunchBreak = serviceWith("MON 09:00-10:00,10:30-12:00",
                Clock.fixed(MONDAY.minusDays(1).atStartOfDay(LISBON).toInstant(), LISBON));

        List<TimeSlot> slots = lunchBreak.findAvailable(MONDAY, 45, List.of(), 20);

        assertThat(slots).extracting(TimeSlot::start).containsExactly(
                MONDAY.atTime(9, 0), MONDAY.atTime(9, 15),
                MONDAY.atTime(10, 30), MONDAY.atTime(10, 45), MONDAY.atTime(11, 0), MONDAY.atTime(11, 15));
    }

    @Test
    @DisplayName("a gap shorter than the service is not offered")
    void findAvailable_gapTooSmall() {
        List<Appointment> existing = List.of(
                appointment(MONDAY.atTime(9, 0), 60, Appointment.Status.CONFIRMED),
                appointment(MONDAY.atTime(10, 30), 510, Appointment.Status.CONFIRMED));

        List<TimeSlot> slots = service.findAvailable(MONDAY, 45, existing, 10);

        assertThat(slots).isEmpty();
    }

    @Test
    @DisplayName("maxResults caps the result in chronological order")
    void findAvailable_respectsMaxResults() {
        List<TimeSlot> slots = service.findAvailable(MONDAY, 60, List.of(), 3);

        assertThat(slots).extracting(TimeSlot::start)
                .containsExactly(MONDAY.atTime(9, 0), MONDAY.atTime(9, 15), MONDAY.atTime(9, 30));
        assertThatThrownBy(() -> service.findAvailable(MONDAY, 60, List.of(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("closed day and service longer than the day give an empty result, not an error")
    void findAvailable_noAvailability() {
        assertThat(service.findAvailable(MONDAY.plusDays(6), 30, List.of(), 10)).isEmpty();
        assertThat(service.findAvailable(MONDAY, 11 * 60, List.of(), 10)).isEmpty();
    }

    @Test
    @DisplayName("slots that already started are not offered")
    void findAvailable_skipsPast() {
        AvailabilityService midMorning = serviceWith("MON-SAT 09:00-19:00",
                Clock.fixed(MONDAY.atTime(10, 5).atZone(LISBON).toInstant(), LISBON));

        List<TimeSlot> slots = midMorning.findAvailable(MONDAY, 30, List.of(), 2);

        assertThat(slots).extracting(TimeSlot::start).containsExactly(MONDAY.atTime(10, 15), MONDAY.atTime(10, 30));
    }

    @Test
    @DisplayName("findAvailable by service id takes the duration from the catalog")
    void findAvailable_byServiceId() {
        when(catalogService.requireService(MANICURE_ID)).thenReturn(manicure(60));
        List<Appointment> existing = List.of(appointment(MONDAY.atTime(10, 0), 60, Appointment.Status.CONFIRMED));

        List<TimeSlot> slots = service.findAvailable(MONDAY, MANICURE_ID, existing, 10);

        assertThat(slots.get(0)).isEqualTo(new TimeSlot(MONDAY.atTime(9, 0), MONDAY.atTime(10, 0)));
        assertThat(slots).extracting(TimeSlot::start)
                .doesNotContain(MONDAY.atTime(9, 15), MONDAY.atTime(10, 45))
                .contains(MONDAY.atTime(11, 0));
    }

    @Test
    @DisplayName("unknown service surfaces UNKNOWN_SERVICE")
    void checkAvailability_unknownService() {
        when(catalogService.requireService(99L)).thenThrow(ResourceNotFoundException.service(99L));

        assertThatThrownBy(() -> service.checkAvailability(MONDAY, 99L, 10))
                .isInstanceOf(ResourceNotFoundException.class)
                .extracting("error").isEqualTo(BookingError.UNKNOWN_SERVICE);
    }

    @Test
    @DisplayName("isBookableStart accepts aligned in-hours starts only")
    void isBookableStart() {
        assertThat(service.isBookableStart(MONDAY.atTime(9, 0), 30)).isTrue();
        assertThat(service.isBookableStart(MONDAY.atTime(18, 30), 30)).isTrue();
        assertThat(service.isBookableStart(MONDAY.atTime(18, 45), 30)).isFalse();
        assertThat(service.isBookableStart(MONDAY.atTime(9, 10), 30)).isFalse();
        assertThat(service.isBookableStart(MONDAY.atTime(8, 45), 30)).isFalse();
    }
}
