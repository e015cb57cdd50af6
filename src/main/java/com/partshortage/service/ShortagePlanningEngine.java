package com.partshortage.service;

import com.partshortage.calendar.WorkdayCalendar;
import com.partshortage.domain.BomLine;
import com.partshortage.domain.ChildDemandSeries;
import com.partshortage.domain.OpenManufacturingOrder;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.PartMaster;
import com.partshortage.domain.PlanningParameters;
import com.partshortage.domain.PlanningSnapshot;
import com.partshortage.domain.ProductionPlanEntry;
import com.partshortage.domain.ScheduleGridRow;
import com.partshortage.dto.ChildRequirementsResponse;
import com.partshortage.dto.ShortageReportResponse;
import com.partshortage.exception.PlanningInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single-pass batch computation from a full input snapshot to the shortage table.
 * Holds no state between runs; the same snapshot, parameters and planning date always
 * give the same rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShortagePlanningEngine {

    private final ScheduleGridConverter scheduleGridConverter;
    private final BomExplosionService bomExplosionService;
    private final InventoryAggregator inventoryAggregator;
    private final OpenOrderReconciler openOrderReconciler;
    private final ShortageReportAssembler reportAssembler;

    public ShortageReportResponse run(PlanningSnapshot snapshot, PlanningParameters params, LocalDate today) {
        validate(params, today);
        List<LocalDate> horizon = BomExplosionService.horizonDays(today, params.horizonDays());

        List<ProductionPlanEntry> plan = planWithinHorizon(snapshot.plan(), snapshot.scheduleGrid(), today, params.horizonDays());
        Map<PartKey, ChildDemandSeries> demand =
            bomExplosionService.explodeDense(plan, snapshot.bom(), today, params.horizonDays());

        List<PartMaster> parts = snapshot.parts().isEmpty()
            ? demand.keySet().stream().map(PartMaster::bare).toList()
            : snapshot.parts();
        Set<PartKey> partKeys = parts.stream().map(PartMaster::part).collect(Collectors.toSet());

        InventoryAggregator.Sources inventory = inventoryAggregator.aggregate(
            snapshot.onHandStock(), snapshot.shelfTheoretical(), snapshot.externalStock());
        WorkdayCalendar calendar = WorkdayCalendar.fromEntries(snapshot.calendar());
        if (calendar.isEmpty()) {
            log.warn("Workday calendar is empty; due dates fall back to shortage dates");
        }

        List<OpenManufacturingOrder> orders = snapshot.manufacturingOrders().stream()
            .filter(o -> partKeys.contains(o.part()))
            .toList();
        Map<PartKey, OpenOrderReconciler.ReconciledBacklog> backlog = openOrderReconciler.reconcile(
            orders, snapshot.purchaseLines(), snapshot.receiptLines(), params.orderStatusOpenThreshold());

        List<ShortageReportResponse.ReportRow> rows = reportAssembler.assemble(new ShortageReportAssembler.AssemblyInput(
            parts, demand, inventory, backlog, calendar, params, today, horizon));

        log.info("Shortage run complete | planningDate={} | parts={} | planEntries={} | children={} | openOrderParts={} | shortageRows={}",
                 today, parts.size(), plan.size(), demand.size(), backlog.size(), rows.size());

        return ShortageReportResponse.builder()
            .generatedAt(Instant.now())
            .planningDate(today)
            .horizonDays(params.horizonDays())
            .leadWorkdays(params.leadWorkdays())
            .orderStatusOpenThreshold(params.orderStatusOpenThreshold())
            .partCount(parts.size())
            .rowCount(rows.size())
            .horizonDates(horizon)
            .rows(rows)
            .build();
    }

    /** Explosion only: the dense child-demand table, one row per child part. */
    public ChildRequirementsResponse childRequirements(List<ProductionPlanEntry> planEntries, List<ScheduleGridRow> grid,
                                                       List<BomLine> bom,
                                                       LocalDate today, int horizonDays) {
        if (horizonDays < 0) {
            throw new PlanningInputException("horizonDays must be >= 0");
        }
        List<ProductionPlanEntry> plan = planWithinHorizon(planEntries, grid, today, horizonDays);
        Map<PartKey, ChildDemandSeries> demand = bomExplosionService.explodeDense(plan, bom, today, horizonDays);

        List<ChildRequirementsResponse.ChildRow> children = demand.values().stream()
            .map(series -> ChildRequirementsResponse.ChildRow.builder()
                .childPart(series.childPart().value())
                .horizonTotal(ShortageReportAssembler.round(series.total()))
                .dailyDemand(series.days().stream().map(d -> ShortageReportAssembler.round(d.quantity())).toList())
                .build())
            .toList();

        log.info("Child requirements exploded | planningDate={} | planEntries={} | children={}",
                 today, plan.size(), children.size());

        return ChildRequirementsResponse.builder()
            .planningDate(today)
            .horizonDays(horizonDays)
            .childCount(children.size())
            .horizonDates(BomExplosionService.horizonDays(today, horizonDays))
            .children(children)
            .build();
    }

    private List<ProductionPlanEntry> planWithinHorizon(List<ProductionPlanEntry> entries, List<ScheduleGridRow> grid,
                                                        LocalDate today, int horizonDays) {
        LocalDate end = today.plusDays(horizonDays);
        List<ProductionPlanEntry> plan = new ArrayList<>();
        if (entries != null) {
            for (ProductionPlanEntry e : entries) {
                if (e.date() == null || e.quantity() <= 0.0 || e.date().isBefore(today) || e.date().isAfter(end)) {
                    continue;
                }
                plan.add(e);
            }
        }
        plan.addAll(scheduleGridConverter.toPlanEntries(grid, today, end));
        return plan;
    }

    private void validate(PlanningParameters params, LocalDate today) {
        if (today == null) {
            throw new PlanningInputException("planning date is required");
        }
        if (params.horizonDays() < 0) {
            throw new PlanningInputException("horizonDays must be >= 0");
        }
        if (params.leadWorkdays() < 0) {
            throw new PlanningInputException("leadWorkdays must be >= 0");
        }
        if (params.orderStatusOpenThreshold() < 1) {
            throw new PlanningInputException("orderStatusOpenThreshold must be >= 1");
        }
    }
}
