package com.partshortage.domain;

import java.time.LocalDate;

/** One (possibly partial) delivery against a purchase line. */
public record MaterialReceiptLine(
    String orderId,
    String poNumber,
    String releaseNumber,
    double deliveredQty,
    LocalDate receiptDate
) {
}
