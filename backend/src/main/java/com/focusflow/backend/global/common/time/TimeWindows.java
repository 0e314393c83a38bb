package com.focusflow.backend.global.common.time;

import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * Small time helpers shared by the lifecycle and the background jobs.
 */
public final class TimeWindows {

    private TimeWindows() {
    }

    /**
     * Whole minutes between two instants, rounded half-up, never below {@code minimum}.
     */
    public static long minutesBetween(OffsetDateTime start, OffsetDateTime end, long minimum) {
        if (start == null || end == null) {
            return minimum;
        }
        long millis = Duration.between(start, end).toMillis();
        long rounded = Math.round(millis / 60_000d);
        return Math.max(minimum, rounded);
    }

    public static OffsetDateTime plusMinutes(OffsetDateTime start, Integer minutes) {
        if (start == null || minutes == null) {
            return null;
        }
        return start.plusMinutes(minutes);
    }

    /**
     * The calendar day, in the given zone, that a window ending at {@code end} and spanning one day reports on.
     */
    public static LocalDate reportingDay(OffsetDateTime end, ZoneId zone) {
        return end.minusDays(1).atZoneSameInstant(zone).toLocalDate();
    }
}
