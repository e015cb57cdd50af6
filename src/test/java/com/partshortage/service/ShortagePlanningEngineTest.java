package com.partshortage.service;

import com.partshortage.domain.BomLine;
import com.partshortage.domain.CalendarEntry;
import com.partshortage.domain.MaterialPurchaseLine;
import com.partshortage.domain.MaterialReceiptLine;
import com.partshortage.domain.OpenManufacturingOrder;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.PartMaster;
import com.partshortage.domain.PlanningParameters;
import com.partshortage.domain.PlanningSnapshot;
import com.partshortage.domain.ProductionPlanEntry;
import com.partshortage.domain.ScheduleGridRow;
import com.partshortage.domain.StockQuantity;
import com.partshortage.dto.ShortageReportResponse.ReportRow;
import com.partshortage.exception.PlanningInputException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShortagePlanningEngineTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 1, 6);
    private static final PlanningParameters PARAMS = new PlanningParameters(4, 2, 6, "050", "PAINT");

    private final ShortagePlanningEngine engine = new ShortagePlanningEngine(
        new ScheduleGridConverter(), new BomExplosionService(), new InventoryAggregator(),
        new OpenOrderReconciler(), new ShortageReportAssembler(new ShortageDetector()));

    private static PartKey key(String s) {
        return PartKey.of(s);
    }

    private static PartMaster part(String number, String name, String... steps) {
        return new PartMaster(key(number), number, name, "WH1", new TreeSet<>(List.of(steps)));
    }

    private static List<CalendarEntry> calendar() {
        return List.of(
            new CalendarEntry(LocalDate.of(2024, 12, 30), false),
            new CalendarEntry(LocalDate.of(2024, 12, 31), false),
            new CalendarEntry(LocalDate.of(2025, 1, 1), true),
            new CalendarEntry(LocalDate.of(2025, 1, 2), false),
            new CalendarEntry(LocalDate.of(2025, 1, 3), false),
            new CalendarEntry(LocalDate.of(2025, 1, 6), false),
            new CalendarEntry(LocalDate.of(2025, 1, 7), false),
            new CalendarEntry(LocalDate.of(2025, 1, 8), false),
            new CalendarEntry(LocalDate.of(2025, 1, 9), false),
            new CalendarEntry(LocalDate.of(2025, 1, 10), false));
    }

    private static PlanningSnapshot snapshot(List<PartMaster> parts) {
        return new PlanningSnapshot(
            parts,
            List.of(new ProductionPlanEntry(key("A1"), LocalDate.of(2025, 1, 7), 5),
                    new ProductionPlanEntry(key("A1"), LocalDate.of(2025, 1, 9), 5),
                    new ProductionPlanEntry(key("A1"), LocalDate.of(2025, 1, 3), 500),
                    new ProductionPlanEntry(key("A1"), LocalDate.of(2025, 1, 20), 500)),
            List.of(),
            List.of(new BomLine(key("A1"), key("C1"), 2),
                    new BomLine(key("A1"), key("C2"), 1),
                    new BomLine(key("A1"), key("C4"), 1)),
            calendar(),
            List.of(new StockQuantity(key("C1"), 8), new StockQuantity(key("C2"), 20)),
            List.of(new StockQuantity(key("C1"), 4)),
            List.of(),
            List.of(new OpenManufacturingOrder("1001", 10, key("C1"), 30, 10, 3),
                    new OpenManufacturingOrder("1002", 10, key("C1"), 99, 0, 7)),
            List.of(new MaterialPurchaseLine("1001", "10.0", "PO9", "1", 15)),
            List.of(new MaterialReceiptLine("1001", "PO9", "1", 5, LocalDate.of(2025, 1, 3))));
    }

    @Test
    void run_producesSortedShortageRows() {
        var parts = List.of(part("C1", "Bracket", "041", "050"), part("C2", "Shaft", "042"),
                            part("C3", "Unused"), part("C4", "Pin"));

        var report = engine.run(snapshot(parts), PARAMS, TODAY);

        assertThat(report.getHorizonDates()).hasSize(5).startsWith(TODAY);
        assertThat(report.getPartCount()).isEqualTo(4);
        assertThat(report.getRows()).extracting(ReportRow::getPartNumber).containsExactly("C4", "C1");

        ReportRow pin = report.getRows().get(0);
        assertThat(pin.getShortageDate()).isEqualTo(TODAY);
        assertThat(pin.getShortageQty()).isEqualTo(-10.0);
        assertThat(pin.getDueDate()).isEqualTo(TODAY);

        ReportRow bracket = report.getRows().get(1);
        assertThat(bracket.getShortageDate()).isEqualTo(LocalDate.of(2025, 1, 9));
        assertThat(bracket.getShortageQty()).isEqualTo(-8.0);
        assertThat(bracket.getDueDate()).isEqualTo(LocalDate.of(2025, 1, 7));
        assertThat(bracket.getCategory()).isEqualTo("PAINT");
        assertThat(bracket.getRouting()).isEqualTo("041,050");
        assertThat(bracket.getOnHandStock()).isEqualTo(8.0);
        assertThat(bracket.getShelfTheoretical()).isEqualTo(4.0);
        assertThat(bracket.getDailyDemand()).containsExactly(0.0, 10.0, 0.0, 10.0, 0.0);
        assertThat(bracket.getHorizonDemandTotal()).isEqualTo(20.0);
        assertThat(bracket.getManufacturingBacklog()).isEqualTo(20.0);
        assertThat(bracket.getStartableQty()).isEqualTo(10.0);
    }

    @Test
    void run_withoutPartMasterUsesDemandChildren() {
        var report = engine.run(snapshot(List.of()), PARAMS, TODAY);

        assertThat(report.getPartCount()).isEqualTo(3);
        assertThat(report.getRows()).extracting(ReportRow::getPartNumber).containsExactly("C4", "C1");
        assertThat(report.getRows().get(1).getCategory()).isEmpty();
    }

    @Test
    void run_mergesScheduleGridWithDatedPlan() {
        PlanningSnapshot base = snapshot(List.of());
        PlanningSnapshot withGrid = new PlanningSnapshot(base.parts(), base.plan(),
            List.of(new ScheduleGridRow("2025/01", "A1", Map.of(8, 1.0))),
            base.bom(), base.calendar(), base.onHandStock(), base.shelfTheoretical(), base.externalStock(),
            base.manufacturingOrders(), base.purchaseLines(), base.receiptLines());

        var report = engine.run(withGrid, PARAMS, TODAY);

        ReportRow bracket = report.getRows().stream()
            .filter(r -> r.getPartNumber().equals("C1")).findFirst().orElseThrow();
        assertThat(bracket.getDailyDemand()).containsExactly(0.0, 10.0, 2.0, 10.0, 0.0);
        assertThat(bracket.getShortageDate()).isEqualTo(LocalDate.of(2025, 1, 8));
    }

    @Test
    void run_rejectsNegativeLead() {
        assertThatThrownBy(() -> engine.run(snapshot(List.of()), new PlanningParameters(4, -1, 6, "050", "PAINT"), TODAY))
            .isInstanceOf(PlanningInputException.class)
            .hasMessageContaining("leadWorkdays");
    }

    @Test
    void childRequirements_returnsDenseTable() {
        var table = engine.childRequirements(
            List.of(new ProductionPlanEntry(key("A1"), LocalDate.of(2025, 1, 7), 5)),
            List.of(),
            List.of(new BomLine(key("A1"), key("C2"), 1.5), new BomLine(key("A1"), key("C1"), 2)),
            TODAY, 2);

        assertThat(table.getChildCount()).isEqualTo(2);
        assertThat(table.getHorizonDates()).hasSize(3);
        assertThat(table.getChildren().get(0).getChildPart()).isEqualTo("C1");
        assertThat(table.getChildren().get(0).getDailyDemand()).containsExactly(0.0, 10.0, 0.0);
        assertThat(table.getChildren().get(1).getHorizonTotal()).isEqualTo(7.5);
    }
}
