package com.partshortage.service;

import com.partshortage.domain.PartKey;
import com.partshortage.domain.ProductionPlanEntry;
import com.partshortage.domain.ScheduleGridRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the day-as-column schedule layout into dated plan entries. Cells that
 * cannot become a real, positive, in-horizon entry are dropped without error.
 */
@Slf4j
@Component
public class ScheduleGridConverter {

    private static final Pattern YEAR_MONTH = Pattern.compile("^\\s*(\\d{4})\\s*[/\\-.]\\s*(\\d{1,2})\\s*$");

    public List<ProductionPlanEntry> toPlanEntries(List<ScheduleGridRow> rows, LocalDate from, LocalDate to) {
        List<ProductionPlanEntry> entries = new ArrayList<>();
        if (rows == null || rows.isEmpty()) {
            return entries;
        }
        int dropped = 0;
        for (ScheduleGridRow row : rows) {
            YearMonth ym = parseYearMonth(row.yearMonth());
            if (ym == null || !overlaps(ym, from, to)) {
                dropped += row.quantitiesByDay().size();
                continue;
            }
            PartKey parent = PartKey.of(row.parentPart());
            for (Map.Entry<Integer, Double> cell : row.quantitiesByDay().entrySet()) {
                Integer day = cell.getKey();
                Double qty = cell.getValue();
                if (day == null || qty == null || qty.isNaN() || qty <= 0.0 || !ym.isValidDay(day)) {
                    dropped++;
                    continue;
                }
                LocalDate date = ym.atDay(day);
                if (date.isBefore(from) || date.isAfter(to)) {
                    dropped++;
                    continue;
                }
                entries.add(new ProductionPlanEntry(parent, date, qty));
            }
        }
        log.debug("Schedule grid converted | rows={} | entries={} | droppedCells={}",
                  rows.size(), entries.size(), dropped);
        return entries;
    }

    static YearMonth parseYearMonth(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = YEAR_MONTH.matcher(text);
        if (!m.matches()) {
            return null;
        }
        int month = Integer.parseInt(m.group(2));
        if (month < 1 || month > 12) {
            return null;
        }
        return YearMonth.of(Integer.parseInt(m.group(1)), month);
    }

    private boolean overlaps(YearMonth ym, LocalDate from, LocalDate to) {
        return !(ym.atEndOfMonth().isBefore(from) || ym.atDay(1).isAfter(to));
    }
}
