package com.partshortage.domain;

import java.time.LocalDate;

public record DailyQuantity(LocalDate date, double quantity) {
}
