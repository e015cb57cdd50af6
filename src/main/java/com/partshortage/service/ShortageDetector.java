package com.partshortage.service;

import com.partshortage.domain.DailyQuantity;
import com.partshortage.domain.PartKey;
import com.partshortage.domain.ShortageResult;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

@Service
public class ShortageDetector {

    /**
     * Walks the daily demand in order, accumulating it against {@code availableQty}.
     * The shortage date is the first day the remainder drops to zero or below and is
     * never moved afterwards. The walk always runs to the end of the horizon so the
     * reported quantity is the end-of-horizon remainder, not the one on the shortage day.
     */
    public ShortageResult detect(PartKey part, double availableQty, List<DailyQuantity> dailyDemand) {
        double cum = 0.0;
        LocalDate shortageDate = null;
        if (dailyDemand != null) {
            for (DailyQuantity day : dailyDemand) {
                cum += day.quantity();
                if (shortageDate == null && availableQty - cum <= 0) {
                    shortageDate = day.date();
                }
            }
        }
        return new ShortageResult(shortageDate, availableQty - cum);
    }
}
