package com.partshortage.calendar;

import com.partshortage.domain.CalendarEntry;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Plant working-day calendar used for back-scheduling.
 *
 * Dates outside the known range clamp to the first/last workday. An empty calendar is
 * a no-op: every lookup returns its input date unchanged.
 */
public final class WorkdayCalendar {

    private static final WorkdayCalendar EMPTY = new WorkdayCalendar(List.of());

    /** ascending, distinct */
    private final List<LocalDate> workdays;

    private WorkdayCalendar(List<LocalDate> workdays) {
        this.workdays = workdays;
    }

    public static WorkdayCalendar ofWorkdays(Collection<LocalDate> days) {
        if (days == null || days.isEmpty()) {
            return EMPTY;
        }
        TreeSet<LocalDate> sorted = new TreeSet<>();
        days.stream().filter(Objects::nonNull).forEach(sorted::add);
        return sorted.isEmpty() ? EMPTY : new WorkdayCalendar(List.copyOf(sorted));
    }

    /** Keeps only the working entries; shutdown days never become workdays. */
    public static WorkdayCalendar fromEntries(Collection<CalendarEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        return ofWorkdays(entries.stream()
            .filter(Objects::nonNull)
            .filter(CalendarEntry::isWorkday)
            .map(CalendarEntry::date)
            .toList());
    }

    public static WorkdayCalendar empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return workdays.isEmpty();
    }

    public List<LocalDate> workdays() {
        return Collections.unmodifiableList(workdays);
    }

    public boolean isWorkday(LocalDate date) {
        return Collections.binarySearch(workdays, date) >= 0;
    }

    /**
     * Closest workday to {@code date}; on equal distance the earlier one wins.
     */
    public LocalDate nearestWorkday(LocalDate date) {
        if (workdays.isEmpty()) {
            return date;
        }
        LocalDate first = workdays.get(0);
        LocalDate last = workdays.get(workdays.size() - 1);
        if (!date.isAfter(first)) {
            return first;
        }
        if (!date.isBefore(last)) {
            return last;
        }
        int i = insertionPoint(date);
        if (i < workdays.size() && workdays.get(i).equals(date)) {
            return date;
        }
        LocalDate before = workdays.get(i - 1);
        LocalDate after = workdays.get(i);
        long toBefore = ChronoUnit.DAYS.between(before, date);
        long toAfter = ChronoUnit.DAYS.between(date, after);
        return toBefore <= toAfter ? before : after;
    }

    /**
     * Snaps {@code date} to its nearest workday and steps {@code n} workdays back,
     * never past the first known workday.
     */
    public LocalDate backOffset(LocalDate date, int n) {
        if (workdays.isEmpty()) {
            return date;
        }
        LocalDate snapped = nearestWorkday(date);
        int index = insertionPoint(snapped);
        int target = Math.min(workdays.size() - 1, Math.max(0, index - n));
        return workdays.get(target);
    }

    private int insertionPoint(LocalDate date) {
        int idx = Collections.binarySearch(workdays, date);
        return idx >= 0 ? idx : -(idx + 1);
    }
}
