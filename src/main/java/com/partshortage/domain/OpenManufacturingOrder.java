package com.partshortage.domain;

/**
 * Manufacturing order line as extracted from the ERP. The line id is kept raw because
 * source systems disagree on its representation ({@code 10}, {@code 10.0}, {@code "10 "}).
 */
public record OpenManufacturingOrder(
    String orderId,
    Object lineId,
    PartKey part,
    double orderedQty,
    double deliveredQty,
    int status
) {

    /** Not clamped: an over-delivered line yields a negative backlog. */
    public double backlogQty() {
        return orderedQty - deliveredQty;
    }

    public boolean isOpen(int openStatusThreshold) {
        return status < openStatusThreshold;
    }
}
