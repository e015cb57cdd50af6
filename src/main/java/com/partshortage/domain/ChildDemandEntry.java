package com.partshortage.domain;

import java.time.LocalDate;

public record ChildDemandEntry(PartKey childPart, LocalDate date, double quantity) {
}
