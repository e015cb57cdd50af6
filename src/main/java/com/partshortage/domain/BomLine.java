package com.partshortage.domain;

/** Single-level BOM arc: one unit of the parent consumes {@code perUnitQty} of the child. */
public record BomLine(PartKey parentPart, PartKey childPart, double perUnitQty) {
}
