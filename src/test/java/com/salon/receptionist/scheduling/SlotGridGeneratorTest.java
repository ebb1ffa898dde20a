package com.salon.receptionist.scheduling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotGridGeneratorTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 12);
    private static final LocalDate SUNDAY = LocalDate.of(2026, 10, 18);

    private final SlotGridGenerator generator = new SlotGridGenerator();

    @Test
    @DisplayName("09:00-19:00 at 15 minutes yields 40 ordered, back-to-back slots")
    void generate_fullDay() {
        OperatingHours hours = OperatingHours.parse("MON-SAT 09:00-19:00", 15);

        List<TimeSlot> slots = generator.generate(MONDAY, hours);

        assertThat(slots).hasSize(40);
        assertThat(slots.get(0)).isEqualTo(new TimeSlot(MONDAY.atTime(9, 0), MONDAY.atTime(9, 15)));
        assertThat(slots.get(39)).isEqualTo(new TimeSlot(MONDAY.atTime(18, 45), MONDAY.atTime(19, 0)));
        for (int i = 1; i < slots.size(); i++) {
            assertThat(slots.get(i).start()).isEqualTo(slots.get(i - 1).end());
        }
    }

    @Test
    @DisplayName("closed weekday yields no slots")
    void generate_closedDay() {
        OperatingHours hours = OperatingHours.parse("MON-SAT 09:00-19:00", 15);

        assertThat(generator.generate(SUNDAY, hours)).isEmpty();
    }

    @Test
    @DisplayName("trailing remainder shorter than the granularity is dropped")
    void generate_dropsRemainder() {
        OperatingHours hours = OperatingHours.parse("MON 09:00-09:50", 15);

        List<TimeSlot> slots = generator.generate(MONDAY, hours);

        assertThat(slots).extracting(TimeSlot::start).containsExactly(
                MONDAY.atTime(9, 0), MONDAY.atTime(9, 15), MONDAY.atTime(9, 30));
        assertThat(slots.get(2).end()).isEqualTo(MONDAY.atTime(9, 45));
    }

    @Test
    @DisplayName("a lunch break leaves a gap in the grid")
    void generate_lunchBreak() {
        OperatingHours hours = OperatingHours.parse("MON 09:00-10:00,11:00-12:00", 30);

        List<TimeSlot> slots = generator.generate(MONDAY, hours);

        assertThat(slots).extracting(TimeSlot::start).containsExactly(
                MONDAY.atTime(9, 0), MONDAY.atTime(9, 30), MONDAY.atTime(11, 0), MONDAY.atTime(11, 30));
    }

    @Test
    @DisplayName("an interval ending at 23:59 never wraps past midnight")
    void generate_lateClose() {
        OperatingHours hours = OperatingHours.parse("MON 23:00-23:59", 15);

        List<TimeSlot> slots = generator.generate(MONDAY, hours);

        assertThat(slots).hasSize(3);
        assertThat(slots.get(2).end()).isEqualTo(LocalDateTime.of(2026, 10, 12, 23, 45));
    }
}
