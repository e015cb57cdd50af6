package com.partshortage.domain;

import java.util.List;

/**
 * Fully materialized inputs of one run. Lists are never null; an absent source is empty.
 */
public record PlanningSnapshot(
    List<PartMaster> parts,
    List<ProductionPlanEntry> plan,
    List<ScheduleGridRow> scheduleGrid,
    List<BomLine> bom,
    List<CalendarEntry> calendar,
    List<StockQuantity> onHandStock,
    List<StockQuantity> shelfTheoretical,
    List<StockQuantity> externalStock,
    List<OpenManufacturingOrder> manufacturingOrders,
    List<MaterialPurchaseLine> purchaseLines,
    List<MaterialReceiptLine> receiptLines
) {

    public PlanningSnapshot {
        parts = nonNull(parts);
        plan = nonNull(plan);
        scheduleGrid = nonNull(scheduleGrid);
        bom = nonNull(bom);
        calendar = nonNull(calendar);
        onHandStock = nonNull(onHandStock);
        shelfTheoretical = nonNull(shelfTheoretical);
        externalStock = nonNull(externalStock);
        manufacturingOrders = nonNull(manufacturingOrders);
        purchaseLines = nonNull(purchaseLines);
        receiptLines = nonNull(receiptLines);
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
