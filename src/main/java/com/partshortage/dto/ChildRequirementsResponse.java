package com.partshortage.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class ChildRequirementsResponse {
    LocalDate planningDate;
    int horizonDays;
    int childCount;
    List<LocalDate> horizonDates;
    List<ChildRow> children;

    @Value
    @Builder
    public static class ChildRow {
        String childPart;
        double horizonTotal;
        List<Double> dailyDemand;
    }
}
