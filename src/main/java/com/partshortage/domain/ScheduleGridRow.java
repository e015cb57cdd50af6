package com.partshortage.domain;

import java.util.Map;

/**
 * Parent schedule in its stored shape: one row per (year-month, parent part) with one
 * quantity per day-of-month. Quantities may be null.
 */
public record ScheduleGridRow(String yearMonth, String parentPart, Map<Integer, Double> quantitiesByDay) {

    public ScheduleGridRow {
        quantitiesByDay = quantitiesByDay == null ? Map.of() : quantitiesByDay;
    }
}
