package com.salon.receptionist.scheduling;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Weekly opening hours of the salon plus the slot granularity the day is cut into.
 * Immutable; a weekday without intervals is closed.
 */
public final class OperatingHours {

    private final Map<DayOfWeek, List<OpeningInterval>> intervals;
    private final int granularityMinutes;

    public OperatingHours(Map<DayOfWeek, List<OpeningInterval>> intervals, int granularityMinutes) {
        if (granularityMinutes <= 0) {
            throw new IllegalArgumentException("Slot granularity must be positive: " + granularityMinutes);
        }
        EnumMap<DayOfWeek, List<OpeningInterval>> copy = new EnumMap<>(DayOfWeek.class);
        intervals.forEach((day, list) -> {
            List<OpeningInterval> sorted = new ArrayList<>(list);
            sorted.sort(Comparator.comparing(OpeningInterval::open));
            for (int i = 1; i < sorted.size(); i++) {
                if (sorted.get(i).open().isBefore(sorted.get(i - 1).close())) {
                    throw new IllegalArgumentException("Overlapping opening intervals on " + day + ": "
                            + sorted.get(i - 1) + " and " + sorted.get(i));
                }
            }
            if (!sorted.isEmpty()) {
                copy.put(day, Collections.unmodifiableList(sorted));
            }
        });
        this.intervals = Collections.unmodifiableMap(copy);
        this.granularityMinutes = granularityMinutes;
    }

    /**
     * Parses an hours spec such as {@code "MON-SAT 09:00-19:00; SUN 11:00-17:00"}.
     * Several ranges for one day are comma separated: {@code "MON-FRI 09:00-13:00,14:00-18:00"}.
     */
    public static OperatingHours parse(String spec, int granularityMinutes) {
        Map<DayOfWeek, List<OpeningInterval>> parsed = new EnumMap<>(DayOfWeek.class);
        if (spec == null || spec.isBlank()) {
            return new OperatingHours(parsed, granularityMinutes);
        }
        for (String entry : spec.split(";")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("\\s+", 2);
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected '<days> <ranges>' but got '" + trimmed + "'");
            }
            List<OpeningInterval> ranges = new ArrayList<>();
            for (String range : parts[1].split(",")) {
                ranges.add(OpeningInterval.parse(range));
            }
            for (DayOfWeek day : parseDays(parts[0])) {
                parsed.computeIfAbsent(day, d -> new ArrayList<>()).addAll(ranges);
            }
        }
        return new OperatingHours(parsed, granularityMinutes);
    }

    private static List<DayOfWeek> parseDays(String text) {
        String[] bounds = text.split("-");
        if (bounds.length == 1) {
            return List.of(parseDay(bounds[0]));
        }
        if (bounds.length != 2) {
            throw new IllegalArgumentException("Invalid day range '" + text + "'");
        }
        DayOfWeek from = parseDay(bounds[0]);
        DayOfWeek to = parseDay(bounds[1]);
        if (to.compareTo(from) < 0) {
            throw new IllegalArgumentException("Day range must not wrap the week: '" + text + "'");
        }
        List<DayOfWeek> days = new ArrayList<>();
        for (int d = from.getValue(); d <= to.getValue(); d++) {
            days.add(DayOfWeek.of(d));
        }
        return days;
    }

    private static DayOfWeek parseDay(String text) {
        String key = text.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day.name().startsWith(key) && key.length() == 3) {
                return day;
            }
        }
        throw new IllegalArgumentException("Unknown weekday '" + text + "'");
    }

    public List<OpeningInterval> intervalsOn(DayOfWeek day) {
        return intervals.getOrDefault(day, List.of());
    }

    public boolean isClosedOn(DayOfWeek day) {
        return intervalsOn(day).isEmpty();
    }

    public int granularityMinutes() {
        return granularityMinutes;
    }

    /** True when a service of this length starts and ends on slot boundaries. */
    public boolean fitsGrid(int durationMinutes) {
        return durationMinutes > 0 && durationMinutes % granularityMinutes == 0;
    }

    /** Human readable summary, e.g. {@code "Mon 09:00-19:00, Sun 11:00-17:00"}. */
    public String describe() {
        return intervals.entrySet().stream()
                .map(e -> e.getKey().getDisplayName(TextStyle.SHORT, Locale.ENGLISH) + " "
                        + e.getValue().stream().map(OpeningInterval::toString).collect(Collectors.joining(",")))
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "OperatingHours{" + describe() + ", granularity=" + granularityMinutes + "min}";
    }
}
