package com.partshortage.service;

import com.partshortage.config.PlanningProperties;
import com.partshortage.domain.PlanningParameters;
import com.partshortage.domain.PlanningSnapshot;
import com.partshortage.dto.ChildRequirementsRequest;
import com.partshortage.dto.ChildRequirementsResponse;
import com.partshortage.dto.ShortageReportRequest;
import com.partshortage.dto.ShortageReportResponse;
import com.partshortage.entity.ReportRunRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShortageReportService {

    private final PlanningProperties properties;
    private final PlanningInputMapper inputMapper;
    private final ShortagePlanningEngine engine;
    private final ReportCsvWriter csvWriter;
    private final ReportArchiveService archiveService;

    /** Runs the engine on the request snapshot and archives the result. */
    public GeneratedReport generate(ShortageReportRequest request, String requestId) {
        PlanningSnapshot snapshot = inputMapper.toSnapshot(request);
        PlanningParameters params = properties.toParameters().withOverrides(
            request.getHorizonDays(), request.getLeadWorkdays(), request.getOrderStatusOpenThreshold());
        LocalDate today = request.getAsOfDate() != null ? request.getAsOfDate() : LocalDate.now();

        log.info("Shortage run requested | planningDate={} | parts={} | bomLines={} | orders={} | requestId={}",
                 today, snapshot.parts().size(), snapshot.bom().size(),
                 snapshot.manufacturingOrders().size(), requestId);

        ShortageReportResponse report = engine.run(snapshot, params, today);
        String csv = csvWriter.writeShortageReport(report);
        ReportRunRecord run = archiveService.archive(report, csv, requestId);
        return new GeneratedReport(report.toBuilder().runId(run.getId()).build(), csv);
    }

    public ChildRequirementsResponse childRequirements(ChildRequirementsRequest request) {
        inputMapper.requirePlan(request.getProductionPlan(), request.getScheduleGrid());
        int horizon = request.getHorizonDays() != null ? request.getHorizonDays() : properties.getHorizonDays();
        LocalDate today = request.getAsOfDate() != null ? request.getAsOfDate() : LocalDate.now();
        return engine.childRequirements(
            inputMapper.toPlan(request.getProductionPlan()),
            inputMapper.toGrid(request.getScheduleGrid()),
            inputMapper.toBom(request.getBom()),
            today, horizon);
    }

    public String childRequirementsCsv(ChildRequirementsRequest request) {
        return csvWriter.writeChildRequirements(childRequirements(request));
    }

    public record GeneratedReport(ShortageReportResponse report, String csv) {}
}
