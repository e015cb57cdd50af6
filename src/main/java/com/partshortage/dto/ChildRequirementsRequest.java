package com.partshortage.dto;

import com.partshortage.dto.ShortageReportRequest.BomRow;
import com.partshortage.dto.ShortageReportRequest.PlanRow;
import com.partshortage.dto.ShortageReportRequest.ScheduleRow;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class ChildRequirementsRequest {

    LocalDate asOfDate;

    @Min(value = 0, message = "horizonDays must be >= 0")
    @Max(value = 366, message = "horizonDays must be <= 366")
    Integer horizonDays;

    @Valid
    List<@Valid PlanRow> productionPlan;

    @Valid
    List<@Valid ScheduleRow> scheduleGrid;

    @NotNull(message = "bom is required")
    @Valid
    List<@Valid BomRow> bom;
}
