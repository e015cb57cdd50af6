package com.partshortage.domain;

import java.time.LocalDate;

/**
 * Outcome of netting one part. {@code shortageDate} is the first day cumulative demand
 * reaches the available quantity, or null; {@code shortageQty} is the end-of-horizon
 * remainder.
 */
public record ShortageResult(LocalDate shortageDate, double shortageQty) {

    public boolean isShort() {
        return shortageQty < 0;
    }
}
