package com.partshortage.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class ReportRunResponse {
    UUID runId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    LocalDate planningDate;
    int horizonDays;
    int leadWorkdays;
    int orderStatusOpenThreshold;
    int partCount;
    int shortageRowCount;
    String requestId;
}
