package com.partshortage.service;

import com.partshortage.calendar.WorkdayCalendar;
import com.partshortage.domain.ChildDemandSeries;
import com.partshortage.domain.DailyQuantity;
import com.partshortage.domain.InventorySnapshot;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.PartMaster;
import com.partshortage.domain.PlanningParameters;
import com.partshortage.domain.ShortageResult;
import com.partshortage.dto.ShortageReportResponse.ReportRow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Joins per-part results into report rows. Parts without an actionable shortage
 * (shortage quantity {@code >= 0}) are dropped; the rest are ordered by shortage date
 * (nulls last) and part key.
 */
@Service
@RequiredArgsConstructor
public class ShortageReportAssembler {

    private final ShortageDetector shortageDetector;

    public List<ReportRow> assemble(AssemblyInput in) {
        List<RankedRow> ranked = new ArrayList<>();
        for (PartMaster part : in.parts()) {
            PartKey key = part.part();
            InventorySnapshot stock = in.inventory().snapshot(key);
            List<DailyQuantity> demand = demandFor(in, key);

            ShortageResult shortage = shortageDetector.detect(key, stock.totalAvailable(), demand);
            if (!shortage.isShort()) {
                continue;
            }

            OpenOrderReconciler.ReconciledBacklog backlog = in.backlog().get(key);
            LocalDate due = dueDate(shortage.shortageDate(), in.calendar(), in.parameters().leadWorkdays(), in.today());

            ReportRow row = ReportRow.builder()
                .partNumber(part.partNumber())
                .partName(part.name())
                .routing(part.routingLabel())
                .category(part.passesThrough(in.parameters().terminalStepCode())
                    ? in.parameters().terminalStepTag() : "")
                .onHandStock(round(stock.onHand()))
                .shelfTheoretical(round(stock.theoretical()))
                .externalStock(round(stock.external()))
                .shortageDate(shortage.shortageDate())
                .dueDate(due)
                .shortageQty(round(shortage.shortageQty()))
                .manufacturingBacklog(backlog != null ? round(backlog.backlogQty()) : 0.0)
                .startableQty(backlog != null ? round(backlog.startableQty()) : 0.0)
                .horizonDemandTotal(round(demand.stream().mapToDouble(DailyQuantity::quantity).sum()))
                .dailyDemand(demand.stream().map(d -> round(d.quantity())).toList())
                .build();
            ranked.add(new RankedRow(key, shortage.shortageDate(), row));
        }

        ranked.sort(Comparator
            .comparing(RankedRow::shortageDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RankedRow::part));
        return ranked.stream().map(RankedRow::row).toList();
    }

    /**
     * Back-schedules {@code leadWorkdays} workdays from the shortage date; a due date
     * already in the past is moved up to {@code today}.
     */
    LocalDate dueDate(LocalDate shortageDate, WorkdayCalendar calendar, int leadWorkdays, LocalDate today) {
        if (shortageDate == null) {
            return null;
        }
        LocalDate due = calendar.backOffset(shortageDate, leadWorkdays);
        return due.isBefore(today) ? today : due;
    }

    private List<DailyQuantity> demandFor(AssemblyInput in, PartKey key) {
        ChildDemandSeries series = in.demand().get(key);
        if (series != null) {
            return series.days();
        }
        List<DailyQuantity> zeros = new ArrayList<>(in.horizonDates().size());
        for (LocalDate day : in.horizonDates()) {
            zeros.add(new DailyQuantity(day, 0.0));
        }
        return Collections.unmodifiableList(zeros);
    }

    static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }

    public record AssemblyInput(
        List<PartMaster> parts,
        Map<PartKey, ChildDemandSeries> demand,
        InventoryAggregator.Sources inventory,
        Map<PartKey, OpenOrderReconciler.ReconciledBacklog> backlog,
        WorkdayCalendar calendar,
        PlanningParameters parameters,
        LocalDate today,
        List<LocalDate> horizonDates
    ) {}

    private record RankedRow(PartKey part, LocalDate shortageDate, ReportRow row) {}
}
