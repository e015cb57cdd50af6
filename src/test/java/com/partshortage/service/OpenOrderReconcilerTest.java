package com.partshortage.service;

import com.partshortage.domain.MaterialPurchaseLine;
import com.partshortage.domain.MaterialReceiptLine;
import com.partshortage.domain.OpenManufacturingOrder;
import com.partshortage.domain.PartKey;
import com.partshortage.service.OpenOrderReconciler.ReconciledBacklog;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OpenOrderReconcilerTest {

    private static final PartKey C1 = PartKey.of("C1");
    private static final int OPEN_BELOW = 6;

    private final OpenOrderReconciler reconciler = new OpenOrderReconciler();

    private static OpenManufacturingOrder order(String id, Object line, double ordered, double delivered, int status) {
        return new OpenManufacturingOrder(id, line, C1, ordered, delivered, status);
    }

    private static MaterialPurchaseLine purchase(String order, Object line, String po, String release, double qty) {
        return new MaterialPurchaseLine(order, line, po, release, qty);
    }

    private static MaterialReceiptLine receipt(String order, String po, String release, double qty) {
        return new MaterialReceiptLine(order, po, release, qty, LocalDate.of(2025, 1, 2));
    }

    @Test
    void reconcile_netsBacklogAgainstUnfulfilledMaterial() {
        Map<PartKey, ReconciledBacklog> out = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3)),
            List.of(purchase("7001", "10", "PO1", "1", 30)),
            List.of(receipt("7001", "PO1", "1", 4), receipt("7001", "PO1", "1", 6)),
            OPEN_BELOW);

        ReconciledBacklog r = out.get(C1);
        assertThat(r.backlogQty()).isEqualTo(50.0);
        assertThat(r.materialOrderedQty()).isEqualTo(30.0);
        assertThat(r.materialReceivedQty()).isEqualTo(10.0);
        assertThat(r.unfulfilledMaterialQty()).isEqualTo(20.0);
        assertThat(r.materialTracked()).isTrue();
        assertThat(r.startableQty()).isEqualTo(30.0);
    }

    @Test
    void reconcile_multipleReceiptsDoNotInflateOrderedQuantity() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3)),
            List.of(purchase("7001", 10, "PO1", "1", 30)),
            List.of(receipt("7001", "PO1", "1", 1), receipt("7001", "PO1", "1", 1), receipt("7001", "PO1", "1", 1)),
            OPEN_BELOW).get(C1);

        assertThat(r.materialOrderedQty()).isEqualTo(30.0);
        assertThat(r.materialReceivedQty()).isEqualTo(3.0);
    }

    @Test
    void reconcile_duplicatePurchaseRowsCountOnce() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3)),
            List.of(purchase("7001", 10, "PO1", "1", 30), purchase("7001", "10.0", "PO1 ", "1", 30)),
            List.of(),
            OPEN_BELOW).get(C1);

        assertThat(r.materialOrderedQty()).isEqualTo(30.0);
        assertThat(r.startableQty()).isEqualTo(20.0);
    }

    @Test
    void reconcile_lineNumberRepresentationsJoin() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10.0, 60, 10, 3)),
            List.of(purchase("7001", "10 ", "PO1", "1", 30)),
            List.of(),
            OPEN_BELOW).get(C1);

        assertThat(r.materialTracked()).isTrue();
    }

    @Test
    void reconcile_withoutMatchingPurchaseUsesBacklogAlone() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3)),
            List.of(purchase("7002", 10, "PO1", "1", 30), purchase("7001", 20, "PO2", "1", 30)),
            List.of(),
            OPEN_BELOW).get(C1);

        assertThat(r.materialTracked()).isFalse();
        assertThat(r.startableQty()).isEqualTo(50.0);
    }

    @Test
    void reconcile_overDeliveredOrderClampsStartableAtZero() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 10, 15, 3)), List.of(), List.of(), OPEN_BELOW).get(C1);

        assertThat(r.backlogQty()).isEqualTo(-5.0);
        assertThat(r.startableQty()).isZero();
    }

    @Test
    void reconcile_unfulfilledMaterialBeyondBacklogClampsAtZero() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 20, 0, 3)),
            List.of(purchase("7001", 10, "PO1", "1", 50)),
            List.of(),
            OPEN_BELOW).get(C1);

        assertThat(r.startableQty()).isZero();
    }

    @Test
    void reconcile_unparsableLineNumbersMatchEachOther() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", "N/A", 60, 10, 3)),
            List.of(purchase("7001", "??", "PO1", "1", 30)),
            List.of(),
            OPEN_BELOW).get(C1);

        assertThat(r.materialTracked()).isTrue();
        assertThat(r.materialOrderedQty()).isEqualTo(30.0);
    }

    @Test
    void reconcile_receiptsFromAnotherOrderOnSamePoAreIgnored() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3)),
            List.of(purchase("7001", 10, "PO1", "1", 30)),
            List.of(receipt("9999", "PO1", "1", 30)),
            OPEN_BELOW).get(C1);

        assertThat(r.materialReceivedQty()).isZero();
    }

    @Test
    void reconcile_closedOrdersAreIgnored() {
        Map<PartKey, ReconciledBacklog> out = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 6), order("7002", 10, 60, 10, 9)), List.of(), List.of(), OPEN_BELOW);

        assertThat(out).isEmpty();
    }

    @Test
    void reconcile_sumsBacklogOverOpenLines() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("7001", 10, 60, 10, 3), order("7001", 20, 5, 0, 5), order("7003", 10, 100, 0, 8)),
            List.of(), List.of(), OPEN_BELOW).get(C1);

        assertThat(r.backlogQty()).isEqualTo(55.0);
    }

    @Test
    void reconcile_hugeExponentKeysDegradeInsteadOfFailing() {
        ReconciledBacklog r = reconciler.reconcile(
            List.of(order("9E99999999", "1e999999999", 60, 10, 3)),
            List.of(purchase("9E99999999", "N/A", "PO1", "1", 30)),
            List.of(receipt("9E99999999", "PO1", "1", 5)),
            OPEN_BELOW).get(C1);

        assertThat(r.backlogQty()).isEqualTo(50.0);
        assertThat(r.materialTracked()).isTrue();
        assertThat(r.materialReceivedQty()).isEqualTo(5.0);
    }
}
