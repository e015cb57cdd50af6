package com.partshortage.domain;

import java.time.LocalDate;

/** Plan to build {@code quantity} units of {@code parentPart} on {@code date}. */
public record ProductionPlanEntry(PartKey parentPart, LocalDate date, double quantity) {
}
