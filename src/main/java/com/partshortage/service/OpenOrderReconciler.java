package com.partshortage.service;

import com.partshortage.domain.MaterialPurchaseLine;
import com.partshortage.domain.MaterialReceiptLine;
import com.partshortage.domain.OpenManufacturingOrder;
import com.partshortage.domain.PartKey;
import com.partshortage.support.NumericKeys;
import com.partshortage.support.ZeroDefaultLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nets open manufacturing backlog against the raw-material purchase backlog raised for
 * the same order lines.
 *
 * <pre>
 *   A = sum of backlog over the part's open order lines
 *   B = sum of ordered quantity over matched purchase lines, one per (order, PO, release)
 *   C = sum of received quantity for those purchase lines, receipts pre-summed per key
 *   startable = max(0, A - (B - C)), or max(0, A) when no purchase line matched
 * </pre>
 *
 * Order lines join purchase lines on (order, canonical line number); a line number that
 * does not parse becomes {@link NumericKeys#SENTINEL} and only meets other sentinels.
 */
@Slf4j
@Service
public class OpenOrderReconciler {

    public Map<PartKey, ReconciledBacklog> reconcile(List<OpenManufacturingOrder> orders,
                                                     List<MaterialPurchaseLine> purchaseLines,
                                                     List<MaterialReceiptLine> receiptLines,
                                                     int openStatusThreshold) {
        Map<PartKey, ReconciledBacklog> result = new TreeMap<>();
        if (orders == null || orders.isEmpty()) {
            return result;
        }

        Map<LineRef, List<MaterialPurchaseLine>> purchasesByLine = new HashMap<>();
        int sentinelLines = 0;
        if (purchaseLines != null) {
            for (MaterialPurchaseLine pl : purchaseLines) {
                LineRef ref = new LineRef(NumericKeys.orderKey(pl.orderId()), NumericKeys.canonicalize(pl.lineId()));
                if (NumericKeys.isSentinel(ref.line())) {
                    sentinelLines++;
                }
                purchasesByLine.computeIfAbsent(ref, k -> new ArrayList<>()).add(pl);
            }
        }
        ZeroDefaultLookup<PurchaseKey> received = ZeroDefaultLookup.summing(receiptLines,
            r -> PurchaseKey.of(r.orderId(), r.poNumber(), r.releaseNumber()),
            MaterialReceiptLine::deliveredQty);

        Map<PartKey, PartAccumulator> byPart = new LinkedHashMap<>();
        for (OpenManufacturingOrder order : orders) {
            if (!order.isOpen(openStatusThreshold)) {
                continue;
            }
            PartAccumulator acc = byPart.computeIfAbsent(order.part(), k -> new PartAccumulator());
            acc.backlog += order.backlogQty();

            LineRef ref = new LineRef(NumericKeys.orderKey(order.orderId()), NumericKeys.canonicalize(order.lineId()));
            if (NumericKeys.isSentinel(ref.line())) {
                sentinelLines++;
            }
            for (MaterialPurchaseLine pl : purchasesByLine.getOrDefault(ref, List.of())) {
                acc.purchases.putIfAbsent(PurchaseKey.of(pl.orderId(), pl.poNumber(), pl.releaseNumber()), pl.orderedQty());
            }
        }
        if (sentinelLines > 0) {
            log.debug("Unparsable order line numbers mapped to sentinel | count={}", sentinelLines);
        }

        byPart.forEach((part, acc) -> result.put(part, acc.toResult(received)));
        return result;
    }

    /**
     * Per-part figures. {@code materialTracked} is false when no purchase line matched any
     * of the part's open order lines.
     */
    public record ReconciledBacklog(
        double backlogQty,
        double materialOrderedQty,
        double materialReceivedQty,
        boolean materialTracked,
        double startableQty
    ) {

        public double unfulfilledMaterialQty() {
            return materialOrderedQty - materialReceivedQty;
        }
    }

    private record LineRef(String order, String line) {}

    private record PurchaseKey(String order, String po, String release) {

        static PurchaseKey of(String orderId, String po, String release) {
            return new PurchaseKey(NumericKeys.orderKey(orderId), strip(po), strip(release));
        }

        private static String strip(String s) {
            return s == null ? "" : s.strip();
        }
    }

    private static final class PartAccumulator {
        private double backlog;
        private final Map<PurchaseKey, Double> purchases = new LinkedHashMap<>();

        private ReconciledBacklog toResult(ZeroDefaultLookup<PurchaseKey> received) {
            if (purchases.isEmpty()) {
                return new ReconciledBacklog(backlog, 0.0, 0.0, false, Math.max(0.0, backlog));
            }
            double ordered = 0.0;
            double delivered = 0.0;
            for (Map.Entry<PurchaseKey, Double> e : purchases.entrySet()) {
                ordered += e.getValue();
                delivered += received.get(e.getKey());
            }
            double unfulfilled = ordered - delivered;
            return new ReconciledBacklog(backlog, ordered, delivered, true, Math.max(0.0, backlog - unfulfilled));
        }
    }
}
