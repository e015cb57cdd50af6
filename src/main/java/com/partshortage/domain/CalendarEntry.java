package com.partshortage.domain;

import java.time.LocalDate;

public record CalendarEntry(LocalDate date, boolean shutdown) {

    public boolean isWorkday() {
        return !shutdown;
    }
}
