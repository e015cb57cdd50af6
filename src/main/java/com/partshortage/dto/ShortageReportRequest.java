package com.partshortage.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Full input snapshot of one shortage run. Each list is one source table as extracted
 * upstream; the production plan may arrive as dated entries, as schedule-grid rows, or both.
 */
@Value
@Builder
@Jacksonized
public class ShortageReportRequest {

    /** Planning date; defaults to the current date. */
    LocalDate asOfDate;

    @Min(value = 0, message = "horizonDays must be >= 0")
    @Max(value = 366, message = "horizonDays must be <= 366")
    Integer horizonDays;

    @Min(value = 0, message = "leadWorkdays must be >= 0")
    @Max(value = 250, message = "leadWorkdays must be <= 250")
    Integer leadWorkdays;

    @Min(value = 1, message = "orderStatusOpenThreshold must be >= 1")
    Integer orderStatusOpenThreshold;

    @Valid
    List<@Valid PartRow> parts;

    @Valid
    List<@Valid PlanRow> productionPlan;

    @Valid
    List<@Valid ScheduleRow> scheduleGrid;

    @NotNull(message = "bom is required")
    @Valid
    List<@Valid BomRow> bom;

    @NotNull(message = "calendar is required")
    @Valid
    List<@Valid CalendarRow> calendar;

    @NotNull(message = "onHandStock is required")
    @Valid
    List<@Valid StockRow> onHandStock;

    @NotNull(message = "shelfTheoretical is required")
    @Valid
    List<@Valid StockRow> shelfTheoretical;

    @NotNull(message = "externalStock is required")
    @Valid
    List<@Valid StockRow> externalStock;

    @NotNull(message = "manufacturingOrders is required")
    @Valid
    List<@Valid OrderRow> manufacturingOrders;

    @NotNull(message = "purchaseLines is required")
    @Valid
    List<@Valid PurchaseRow> purchaseLines;

    @NotNull(message = "receiptLines is required")
    @Valid
    List<@Valid ReceiptRow> receiptLines;

    @Value
    @Builder
    @Jacksonized
    public static class PartRow {
        @NotBlank(message = "partNumber is required")
        String partNumber;
        String name;
        String warehouse;
        String routingStep;
    }

    @Value
    @Builder
    @Jacksonized
    public static class PlanRow {
        @NotBlank(message = "parentPart is required")
        String parentPart;
        @NotNull(message = "date is required")
        LocalDate date;
        @DecimalMin(value = "0.0", message = "quantity must be >= 0")
        double quantity;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ScheduleRow {
        String yearMonth;
        String parentPart;
        Map<Integer, Double> days;
    }

    @Value
    @Builder
    @Jacksonized
    public static class BomRow {
        @NotBlank(message = "parentPart is required")
        String parentPart;
        @NotBlank(message = "childPart is required")
        String childPart;
        @DecimalMin(value = "0.0", message = "perUnitQty must be >= 0")
        double perUnitQty;
    }

    @Value
    @Builder
    @Jacksonized
    public static class CalendarRow {
        @NotNull(message = "date is required")
        LocalDate date;
        boolean shutdown;
    }

    @Value
    @Builder
    @Jacksonized
    public static class StockRow {
        String partNumber;
        @DecimalMin(value = "0.0", message = "quantity must be >= 0")
        double quantity;
    }

    @Value
    @Builder
    @Jacksonized
    public static class OrderRow {
        String orderId;
        Object lineId;
        String partNumber;
        @DecimalMin(value = "0.0", message = "orderedQty must be >= 0")
        double orderedQty;
        @DecimalMin(value = "0.0", message = "deliveredQty must be >= 0")
        double deliveredQty;
        int status;
    }

    @Value
    @Builder
    @Jacksonized
    public static class PurchaseRow {
        String orderId;
        Object lineId;
        String poNumber;
        String releaseNumber;
        @DecimalMin(value = "0.0", message = "orderedQty must be >= 0")
        double orderedQty;
    }

    @Value
    @Builder
    @Jacksonized
    public static class ReceiptRow {
        String orderId;
        String poNumber;
        String releaseNumber;
        @DecimalMin(value = "0.0", message = "deliveredQty must be >= 0")
        double deliveredQty;
        LocalDate receiptDate;
    }
}
