package com.partshortage.service;

import com.partshortage.domain.BomLine;
import com.partshortage.domain.CalendarEntry;
import com.partshortage.domain.MaterialPurchaseLine;
import com.partshortage.domain.MaterialReceiptLine;
import com.partshortage.domain.OpenManufacturingOrder;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.PartMaster;
import com.partshortage.domain.PlanningSnapshot;
import com.partshortage.domain.ProductionPlanEntry;
import com.partshortage.domain.ScheduleGridRow;
import com.partshortage.domain.StockQuantity;
import com.partshortage.dto.ShortageReportRequest;
import com.partshortage.dto.ShortageReportRequest.BomRow;
import com.partshortage.dto.ShortageReportRequest.PartRow;
import com.partshortage.dto.ShortageReportRequest.PlanRow;
import com.partshortage.dto.ShortageReportRequest.ScheduleRow;
import com.partshortage.dto.ShortageReportRequest.StockRow;
import com.partshortage.exception.PlanningInputException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Turns request tables into domain snapshots. Part identifiers are normalized to
 * {@link PartKey} here and nowhere else.
 */
@Component
public class PlanningInputMapper {

    public PlanningSnapshot toSnapshot(ShortageReportRequest req) {
        requirePlan(req.getProductionPlan(), req.getScheduleGrid());
        return new PlanningSnapshot(
            mergeParts(req.getParts()),
            toPlan(req.getProductionPlan()),
            toGrid(req.getScheduleGrid()),
            toBom(req.getBom()),
            map(req.getCalendar(), c -> new CalendarEntry(c.getDate(), c.isShutdown())),
            toStock(req.getOnHandStock()),
            toStock(req.getShelfTheoretical()),
            toStock(req.getExternalStock()),
            map(req.getManufacturingOrders(), o -> new OpenManufacturingOrder(
                o.getOrderId(), o.getLineId(), PartKey.of(o.getPartNumber()),
                o.getOrderedQty(), o.getDeliveredQty(), o.getStatus())),
            map(req.getPurchaseLines(), p -> new MaterialPurchaseLine(
                p.getOrderId(), p.getLineId(), p.getPoNumber(), p.getReleaseNumber(), p.getOrderedQty())),
            map(req.getReceiptLines(), r -> new MaterialReceiptLine(
                r.getOrderId(), r.getPoNumber(), r.getReleaseNumber(), r.getDeliveredQty(), r.getReceiptDate())));
    }

    /** At least one plan stream must be present, even if empty. */
    public void requirePlan(List<PlanRow> plan, List<ScheduleRow> grid) {
        if (plan == null && grid == null) {
            throw new PlanningInputException("Either productionPlan or scheduleGrid must be supplied");
        }
    }

    public List<ProductionPlanEntry> toPlan(List<PlanRow> rows) {
        return map(rows, r -> new ProductionPlanEntry(PartKey.of(r.getParentPart()), r.getDate(), r.getQuantity()));
    }

    public List<ScheduleGridRow> toGrid(List<ScheduleRow> rows) {
        return map(rows, r -> new ScheduleGridRow(r.getYearMonth(), r.getParentPart(), r.getDays()));
    }

    public List<BomLine> toBom(List<BomRow> rows) {
        return map(rows, b -> new BomLine(PartKey.of(b.getParentPart()), PartKey.of(b.getChildPart()), b.getPerUnitQty()));
    }

    /**
     * One master per part key: first non-blank number, name and warehouse win; routing
     * steps are collected from every row.
     */
    public List<PartMaster> mergeParts(List<PartRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        Map<PartKey, PartMasterBuilder> merged = new LinkedHashMap<>();
        for (PartRow row : rows) {
            PartKey key = PartKey.of(row.getPartNumber());
            if (key.isBlank()) {
                continue;
            }
            merged.computeIfAbsent(key, PartMasterBuilder::new).add(row);
        }
        return merged.values().stream().map(PartMasterBuilder::build).toList();
    }

    private List<StockQuantity> toStock(List<StockRow> rows) {
        return map(rows, s -> new StockQuantity(PartKey.of(s.getPartNumber()), s.getQuantity()));
    }

    private static <S, T> List<T> map(List<S> rows, Function<S, T> fn) {
        if (rows == null) {
            return List.of();
        }
        List<T> out = new ArrayList<>(rows.size());
        for (S row : rows) {
            if (row != null) {
                out.add(fn.apply(row));
            }
        }
        return out;
    }

    private static final class PartMasterBuilder {
        private final PartKey key;
        private String partNumber;
        private String name;
        private String warehouse;
        private final TreeSet<String> steps = new TreeSet<>();

        private PartMasterBuilder(PartKey key) {
            this.key = key;
        }

        private void add(PartRow row) {
            partNumber = firstNonBlank(partNumber, row.getPartNumber());
            name = firstNonBlank(name, row.getName());
            warehouse = firstNonBlank(warehouse, row.getWarehouse());
            if (row.getRoutingStep() != null && !row.getRoutingStep().isBlank()) {
                steps.add(row.getRoutingStep().trim());
            }
        }

        private PartMaster build() {
            return new PartMaster(key, Objects.requireNonNullElse(partNumber, key.value()),
                Objects.requireNonNullElse(name, ""), Objects.requireNonNullElse(warehouse, ""), steps);
        }

        private static String firstNonBlank(String current, String candidate) {
            if (current != null && !current.isBlank()) {
                return current;
            }
            return candidate != null && !candidate.isBlank() ? candidate : current;
        }
    }
}
