package com.partshortage.domain;

/**
 * Supply-side figures of one part. Each source is zero when the part is absent from it.
 */
public record InventorySnapshot(PartKey part, double onHand, double theoretical, double external) {

    public double totalAvailable() {
        return onHand + theoretical + external;
    }
}
