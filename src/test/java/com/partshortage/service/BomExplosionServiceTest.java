package com.partshortage.service;

import com.partshortage.domain.BomLine;
import com.partshortage.domain.ChildDemandEntry;
import com.partshortage.domain.ChildDemandSeries;
import com.partshortage.domain.DailyQuantity;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.ProductionPlanEntry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BomExplosionServiceTest {

    private static final LocalDate D10 = LocalDate.of(2025, 1, 10);
    private static final LocalDate D11 = LocalDate.of(2025, 1, 11);

    private final BomExplosionService service = new BomExplosionService();

    private static ProductionPlanEntry plan(String parent, LocalDate date, double qty) {
        return new ProductionPlanEntry(PartKey.of(parent), date, qty);
    }

    private static BomLine bom(String parent, String child, double perUnit) {
        return new BomLine(PartKey.of(parent), PartKey.of(child), perUnit);
    }

    @Test
    void explode_multipliesParentQuantityByPerUnitUsage() {
        List<ChildDemandEntry> out = service.explode(
            List.of(plan("P1", D10, 5)), List.of(bom("P1", "C1", 2)));

        assertThat(out).containsExactly(new ChildDemandEntry(PartKey.of("C1"), D10, 10.0));
    }

    @Test
    void explode_aggregatesSameChildAndDateAcrossParents() {
        List<ChildDemandEntry> out = service.explode(
            List.of(plan("P1", D10, 5), plan("P2", D10, 3), plan("P1", D11, 1)),
            List.of(bom("P1", "C1", 2), bom("P2", "C1", 1), bom("P2", "C2", 4)));

        assertThat(out).containsExactly(
            new ChildDemandEntry(PartKey.of("C1"), D10, 13.0),
            new ChildDemandEntry(PartKey.of("C1"), D11, 2.0),
            new ChildDemandEntry(PartKey.of("C2"), D10, 12.0));
    }

    @Test
    void explode_dropsParentsWithoutBom() {
        List<ChildDemandEntry> out = service.explode(
            List.of(plan("P1", D10, 5), plan("ORPHAN", D10, 100)), List.of(bom("P1", "C1", 1)));

        assertThat(out).hasSize(1);
        assertThat(out.get(0).quantity()).isEqualTo(5.0);
    }

    @Test
    void explode_conservesQuantityPerBomLine() {
        // one parent per child so each cell traces back to a single BOM line
        List<ProductionPlanEntry> plan = List.of(plan("P1", D10, 4), plan("P1", D11, 6), plan("P2", D11, 3));
        List<BomLine> bom = List.of(bom("P1", "C1", 2), bom("P1", "C2", 0.5), bom("P2", "C3", 3));

        List<ChildDemandEntry> out = service.explode(plan, bom);

        for (BomLine line : bom) {
            for (ProductionPlanEntry entry : plan) {
                if (!entry.parentPart().equals(line.parentPart())) {
                    continue;
                }
                double childQty = out.stream()
                    .filter(e -> e.childPart().equals(line.childPart()) && e.date().equals(entry.date()))
                    .mapToDouble(ChildDemandEntry::quantity)
                    .sum();
                assertThat(childQty / line.perUnitQty())
                    .as("%s -> %s on %s", line.parentPart(), line.childPart(), entry.date())
                    .isCloseTo(entry.quantity(), within(1e-9));
            }
        }
        assertThat(out).hasSize(5);
    }

    @Test
    void densify_fillsEveryHorizonDayIncludingBothEnds() {
        LocalDate from = LocalDate.of(2025, 1, 6);
        Map<PartKey, ChildDemandSeries> dense = service.densify(List.of(
            new ChildDemandEntry(PartKey.of("C2"), from.plusDays(2), 7.0),
            new ChildDemandEntry(PartKey.of("C1"), from.plusDays(4), 3.0),
            new ChildDemandEntry(PartKey.of("C1"), from.plusDays(9), 99.0)), from, 4);

        assertThat(dense.keySet()).containsExactly(PartKey.of("C1"), PartKey.of("C2"));
        ChildDemandSeries c1 = dense.get(PartKey.of("C1"));
        assertThat(c1.days()).hasSize(5);
        assertThat(c1.days()).extracting(DailyQuantity::date).first().isEqualTo(from);
        assertThat(c1.days()).extracting(DailyQuantity::quantity).containsExactly(0.0, 0.0, 0.0, 0.0, 3.0);
        assertThat(dense.get(PartKey.of("C2")).total()).isEqualTo(7.0);
    }

    @Test
    void explodeDense_emptyPlanGivesNoChildren() {
        assertThat(service.explodeDense(List.of(), List.of(bom("P1", "C1", 1)), D10, 10)).isEmpty();
    }

    @Test
    void horizonDays_isInclusive() {
        assertThat(BomExplosionService.horizonDays(D10, 0)).containsExactly(D10);
        assertThat(BomExplosionService.horizonDays(D10, 60)).hasSize(61);
    }
}
