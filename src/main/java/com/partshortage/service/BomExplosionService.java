package com.partshortage.service;

import com.partshortage.domain.BomLine;
import com.partshortage.domain.ChildDemandEntry;
import com.partshortage.domain.ChildDemandSeries;
import com.partshortage.domain.DailyQuantity;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.ProductionPlanEntry;
import com.partshortage.support.ZeroDefaultLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single-level BOM explosion of the parent plan into per-child daily demand.
 */
@Slf4j
@Service
public class BomExplosionService {

    /**
     * One aggregated entry per (child, date); parents without BOM lines produce nothing.
     * Output is ordered by child part, then date.
     */
    public List<ChildDemandEntry> explode(List<ProductionPlanEntry> plan, List<BomLine> bom) {
        if (plan == null || plan.isEmpty() || bom == null || bom.isEmpty()) {
            return List.of();
        }
        Map<PartKey, List<BomLine>> byParent = new HashMap<>();
        for (BomLine line : bom) {
            byParent.computeIfAbsent(line.parentPart(), k -> new ArrayList<>()).add(line);
        }

        Map<PartKey, TreeMap<LocalDate, Double>> demand = new TreeMap<>();
        int unmatched = 0;
        for (ProductionPlanEntry entry : plan) {
            List<BomLine> lines = byParent.get(entry.parentPart());
            if (lines == null) {
                unmatched++;
                continue;
            }
            for (BomLine line : lines) {
                demand.computeIfAbsent(line.childPart(), k -> new TreeMap<>())
                      .merge(entry.date(), line.perUnitQty() * entry.quantity(), Double::sum);
            }
        }
        if (unmatched > 0) {
            log.debug("Plan entries without BOM skipped | count={}", unmatched);
        }

        List<ChildDemandEntry> out = new ArrayList<>();
        demand.forEach((child, byDate) ->
            byDate.forEach((date, qty) -> out.add(new ChildDemandEntry(child, date, qty))));
        return out;
    }

    /**
     * Dense per-child series over {@code [from, from + horizonDays]}: every child with at
     * least one demand entry gets a value for every day, zero where nothing was planned.
     * Entries outside the window are ignored.
     */
    public Map<PartKey, ChildDemandSeries> densify(List<ChildDemandEntry> demand, LocalDate from, int horizonDays) {
        List<LocalDate> days = horizonDays(from, horizonDays);
        Map<PartKey, ChildDemandSeries> out = new LinkedHashMap<>();
        if (demand == null || demand.isEmpty()) {
            return out;
        }
        ZeroDefaultLookup<DemandCell> cells = ZeroDefaultLookup.summing(demand,
            e -> new DemandCell(e.childPart(), e.date()), ChildDemandEntry::quantity);

        demand.stream()
            .map(ChildDemandEntry::childPart)
            .distinct()
            .sorted(Comparator.naturalOrder())
            .forEach(child -> {
                List<DailyQuantity> series = new ArrayList<>(days.size());
                for (LocalDate day : days) {
                    series.add(new DailyQuantity(day, cells.get(new DemandCell(child, day))));
                }
                out.put(child, new ChildDemandSeries(child, series));
            });
        return out;
    }

    public Map<PartKey, ChildDemandSeries> explodeDense(List<ProductionPlanEntry> plan, List<BomLine> bom,
                                                        LocalDate from, int horizonDays) {
        return densify(explode(plan, bom), from, horizonDays);
    }

    /** Every calendar day from {@code from} to {@code from + horizonDays}, inclusive. */
    public static List<LocalDate> horizonDays(LocalDate from, int horizonDays) {
        List<LocalDate> days = new ArrayList<>(horizonDays + 1);
        for (int i = 0; i <= horizonDays; i++) {
            days.add(from.plusDays(i));
        }
        return days;
    }

    private record DemandCell(PartKey part, LocalDate date) {}
}
