package com.partshortage.domain;

import java.util.List;

/**
 * Dense daily demand of one child part: exactly one value per horizon day,
 * ascending by date.
 */
public record ChildDemandSeries(PartKey childPart, List<DailyQuantity> days) {

    public ChildDemandSeries {
        days = List.copyOf(days);
    }

    public double total() {
        return days.stream().mapToDouble(DailyQuantity::quantity).sum();
    }
}
