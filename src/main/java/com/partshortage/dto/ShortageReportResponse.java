package com.partshortage.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
public class ShortageReportResponse {
    UUID runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    LocalDate planningDate;
    int horizonDays;
    int leadWorkdays;
    int orderStatusOpenThreshold;
    int partCount;
    int rowCount;
    List<LocalDate> horizonDates;
    List<ReportRow> rows;

    @Value
    @Builder
    public static class ReportRow {
        String partNumber;
        String partName;
        String routing;
        String category;
        double onHandStock;
        double shelfTheoretical;
        double externalStock;
        LocalDate shortageDate;
        LocalDate dueDate;
        double shortageQty;
        double manufacturingBacklog;
        double startableQty;
        double horizonDemandTotal;
        List<Double> dailyDemand;
    }
}
