package com.partshortage.domain;

/** One row of an inventory source; several rows of the same part are summed. */
public record StockQuantity(PartKey part, double quantity) {
}
