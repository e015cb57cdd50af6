package com.partshortage.domain;

/** Raw-material purchase line raised for a manufacturing order line. */
public record MaterialPurchaseLine(
    String orderId,
    Object lineId,
    String poNumber,
    String releaseNumber,
    double orderedQty
) {
}
