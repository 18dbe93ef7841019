package com.autobudget.engine;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive wall-clock window at minute resolution, e.g. 03:00-05:00.
 * A start after the end wraps past midnight (22:00-02:00 covers 23:30 and 01:00).
 */
public final class DailyTimeWindow {

    private DailyTimeWindow() {}

    /** False when either bound is null, i.e. the window is disabled. */
    public static boolean contains(LocalTime start, LocalTime end, LocalTime now) {
        if (start == null || end == null) {
            return false;
        }
        LocalTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (!start.isAfter(end)) {
            return !minute.isBefore(start) && !minute.isAfter(end);
        }
        return !minute.isBefore(start) || !minute.isAfter(end);
    }
}
