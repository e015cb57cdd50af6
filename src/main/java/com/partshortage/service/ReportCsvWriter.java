package com.partshortage.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.partshortage.dto.ChildRequirementsResponse;
import com.partshortage.dto.ShortageReportResponse;
import com.partshortage.exception.ReportRenderingException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat CSV rendering of the report tables: fixed columns followed by one column per
 * horizon day ({@code yyyy-MM-dd}). Output starts with a UTF-8 BOM so spreadsheet tools
 * pick the right encoding.
 */
@Component
public class ReportCsvWriter {

    public static final String BOM = "\uFEFF";

    static final List<String> SHORTAGE_COLUMNS = List.of(
        "PartNumber", "PartName", "Routing", "Category",
        "Stock", "ShelfTheoretical", "External",
        "ShortageDate", "DueDate", "ShortageQty",
        "MfgBacklog", "StartableQty", "HorizonDemand");

    static final List<String> CHILD_COLUMNS = List.of("ChildPart", "HorizonDemand");

    private final CsvMapper mapper = new CsvMapper();

    public String writeShortageReport(ShortageReportResponse report) {
        List<List<String>> rows = new ArrayList<>(report.getRows().size());
        for (ShortageReportResponse.ReportRow r : report.getRows()) {
            List<String> cells = new ArrayList<>(SHORTAGE_COLUMNS.size() + r.getDailyDemand().size());
            cells.add(text(r.getPartNumber()));
            cells.add(text(r.getPartName()));
            cells.add(text(r.getRouting()));
            cells.add(text(r.getCategory()));
            cells.add(number(r.getOnHandStock()));
            cells.add(number(r.getShelfTheoretical()));
            cells.add(number(r.getExternalStock()));
            cells.add(date(r.getShortageDate()));
            cells.add(date(r.getDueDate()));
            cells.add(number(r.getShortageQty()));
            cells.add(number(r.getManufacturingBacklog()));
            cells.add(number(r.getStartableQty()));
            cells.add(number(r.getHorizonDemandTotal()));
            r.getDailyDemand().forEach(q -> cells.add(number(q)));
            rows.add(cells);
        }
        return write(SHORTAGE_COLUMNS, report.getHorizonDates(), rows);
    }

    public String writeChildRequirements(ChildRequirementsResponse table) {
        List<List<String>> rows = new ArrayList<>(table.getChildren().size());
        for (ChildRequirementsResponse.ChildRow c : table.getChildren()) {
            List<String> cells = new ArrayList<>(CHILD_COLUMNS.size() + c.getDailyDemand().size());
            cells.add(c.getChildPart());
            cells.add(number(c.getHorizonTotal()));
            c.getDailyDemand().forEach(q -> cells.add(number(q)));
            rows.add(cells);
        }
        return write(CHILD_COLUMNS, table.getHorizonDates(), rows);
    }

    private String write(List<String> fixed, List<LocalDate> days, List<List<String>> rows) {
        List<String> columns = new ArrayList<>(fixed);
        days.forEach(d -> columns.add(d.toString()));
        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);

        StringWriter out = new StringWriter();
        out.write(BOM);
        // header written as the first row so an empty table still carries it
        try (SequenceWriter writer = mapper.writer(schema.build().withoutHeader()).writeValues(out)) {
            writer.write(toRow(columns, columns));
            for (List<String> row : rows) {
                writer.write(toRow(columns, row));
            }
        } catch (IOException ex) {
            throw new ReportRenderingException("Failed to render CSV: " + ex.getMessage(), ex);
        }
        return out.toString();
    }

    private static Map<String, String> toRow(List<String> columns, List<String> cells) {
        Map<String, String> byColumn = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            byColumn.put(columns.get(i), i < cells.size() ? cells.get(i) : "");
        }
        return byColumn;
    }

    private static String text(String s) {
        return s == null ? "" : s;
    }

    private static String date(LocalDate d) {
        return d == null ? "" : d.toString();
    }

    static String number(double value) {
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
