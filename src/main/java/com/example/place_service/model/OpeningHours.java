package com.example.place_service.model;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly open/close schedule of a place.
 * A period whose close time is not after its open time runs past midnight into the next day.
 */
public final class OpeningHours {

    public record OpenPeriod(LocalTime opens, LocalTime closes) {

        boolean crossesMidnight() {
            return !closes.isAfter(opens);
        }
    }

    private final Map<DayOfWeek, List<OpenPeriod>> periodsByDay;

    private OpeningHours(Map<DayOfWeek, List<OpenPeriod>> periodsByDay) {
        this.periodsByDay = periodsByDay;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<DayOfWeek, List<OpenPeriod>> getPeriodsByDay() {
        return Map.copyOf(periodsByDay);
    }

    public List<OpenPeriod> periods(DayOfWeek day) {
        return periodsByDay.getOrDefault(day, List.of());
    }

    public boolean isOpen(ZonedDateTime time) {
        LocalTime now = time.toLocalTime();
        for (OpenPeriod period : periods(time.getDayOfWeek())) {
            if (period.crossesMidnight()) {
                if (!now.isBefore(period.opens())) {
                    return true;
                }
            } else if (!now.isBefore(period.opens()) && now.isBefore(period.closes())) {
                return true;
            }
        }
        // the tail of yesterday's overnight period
        for (OpenPeriod period : periods(time.getDayOfWeek().minus(1))) {
            if (period.crossesMidnight() && now.isBefore(period.closes())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Next opening strictly after {@code time} on the same calendar day.
     */
    public Optional<ZonedDateTime> nextOpeningTime(ZonedDateTime time) {
        LocalTime now = time.toLocalTime();
        return periods(time.getDayOfWeek()).stream()
                .map(OpenPeriod::opens)
                .filter(opens -> opens.isAfter(now))
                .min(Comparator.naturalOrder())
                .map(opens -> time.with(opens));
    }

    public static final class Builder {

        private final Map<DayOfWeek, List<OpenPeriod>> periodsByDay = new EnumMap<>(DayOfWeek.class);

        public Builder open(DayOfWeek day, LocalTime opens, LocalTime closes) {
            periodsByDay.computeIfAbsent(day, d -> new ArrayList<>()).add(new OpenPeriod(opens, closes));
            return this;
        }

        public Builder everyDay(LocalTime opens, LocalTime closes) {
            for (DayOfWeek day : DayOfWeek.values()) {
                open(day, opens, closes);
            }
            return this;
        }

        public OpeningHours build() {
            Map<DayOfWeek, List<OpenPeriod>> copy = new EnumMap<>(DayOfWeek.class);
            periodsByDay.forEach((day, periods) -> copy.put(day, List.copyOf(periods)));
            return new OpeningHours(copy);
        }
    }
}
