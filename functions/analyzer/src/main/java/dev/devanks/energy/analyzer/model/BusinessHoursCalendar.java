package dev.devanks.energy.analyzer.model;

import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Opening hours per day of week. Days without an entry are closed all day.
 */
@Value
public class BusinessHoursCalendar {

    Map<DayOfWeek, HourRange> hours;

    public BusinessHoursCalendar(Map<DayOfWeek, HourRange> hours) {
        var copy = new EnumMap<DayOfWeek, HourRange>(DayOfWeek.class);
        copy.putAll(hours);
        this.hours = Collections.unmodifiableMap(copy);
    }

    /**
     * Monday to Friday, 07:00 to 18:00.
     */
    public static BusinessHoursCalendar defaultCalendar() {
        var range = new HourRange(LocalTime.of(7, 0), LocalTime.of(18, 0));
        var hours = new EnumMap<DayOfWeek, HourRange>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                hours.put(day, range);
            }
        }
        return new BusinessHoursCalendar(hours);
    }

    public boolean isBusinessHours(ZonedDateTime time) {
        var range = hours.get(time.getDayOfWeek());
        return range != null && range.contains(time.toLocalTime());
    }

    /**
     * [open, close) within a single day.
     */
    @Value
    public static class HourRange {
        LocalTime open;
        LocalTime close;

        public boolean contains(LocalTime time) {
            return !time.isBefore(open) && time.isBefore(close);
        }

        /**
         * Parses {@code HH:mm-HH:mm}.
         */
        public static HourRange parse(String text) {
            var parts = text.trim().split("\\s*-\\s*");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Business hours must look like 07:00-18:00, got '" + text + "'");
            }
            var range = new HourRange(LocalTime.parse(parts[0]), LocalTime.parse(parts[1]));
            if (!range.getOpen().isBefore(range.getClose())) {
                throw new IllegalArgumentException("Opening time must precede closing time in '" + text + "'");
            }
            return range;
        }
    }
}
