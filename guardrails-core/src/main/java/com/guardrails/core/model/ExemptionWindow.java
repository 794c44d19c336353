package com.guardrails.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * A recurring local-time window during which a policy is suppressed.
 * Times are "HH:mm" in the window's own zone; a window whose start is after its end spans midnight.
 */
public record ExemptionWindow(
    @JsonProperty("start") String start,
    @JsonProperty("end") String end,
    @JsonProperty("timezone") String timezone,
    @JsonProperty("days") List<String> days
) {
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public ExemptionWindow {
        days = days == null ? List.of() : List.copyOf(days);
    }

    public LocalTime startTime() {
        return LocalTime.parse(start, TIME_FORMAT);
    }

    public LocalTime endTime() {
        return LocalTime.parse(end, TIME_FORMAT);
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    public boolean spansMidnight() {
        return startTime().isAfter(endTime());
    }

    public Set<DayOfWeek> daysOfWeek() {
        Set<DayOfWeek> result = EnumSet.noneOf(DayOfWeek.class);
        for (String day : days) {
            result.add(parseDay(day));
        }
        return result;
    }

    /**
     * Parse "mon".."sun" or a full day name, case-insensitive.
     */
    public static DayOfWeek parseDay(String day) {
        if (day == null) {
            throw new IllegalArgumentException("Day must not be null");
        }
        String normalized = day.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek candidate : DayOfWeek.values()) {
            if (candidate.name().equals(normalized) || candidate.name().substring(0, 3).equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Invalid day: " + day);
    }
}
