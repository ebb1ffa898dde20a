package com.salon.receptionist.scheduling;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a day's opening intervals into base slots of the configured granularity.
 * A trailing remainder shorter than one slot is dropped.
 */
@Component
public class SlotGridGenerator {

    public List<TimeSlot> generate(LocalDate date, OperatingHours hours) {
        int step = hours.granularityMinutes();
        LocalDateTime midnight = date.atStartOfDay();
        List<TimeSlot> slots = new ArrayList<>();
        for (OpeningInterval interval : hours.intervalsOn(date.getDayOfWeek())) {
            for (int m = interval.openMinute(); m + step <= interval.closeMinute(); m += step) {
                slots.add(TimeSlot.of(midnight.plusMinutes(m), step));
            }
        }
        return slots;
    }
}
