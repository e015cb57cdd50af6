package com.partshortage.controller;

import com.partshortage.config.RequestGuardFilter;
import com.partshortage.dto.ReportRunResponse;
import com.partshortage.dto.ShortageReportRequest;
import com.partshortage.dto.ShortageReportResponse;
import com.partshortage.service.ReportArchiveService;
import com.partshortage.service.ShortageReportService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/shortage-reports")
@RequiredArgsConstructor
public class ShortageReportController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final ShortageReportService reportService;
    private final ReportArchiveService archiveService;

    @PostMapping
    public ResponseEntity<ShortageReportResponse> generate(
            @Valid @RequestBody ShortageReportRequest request,
            HttpServletRequest httpRequest) {

        String requestId = RequestGuardFilter.requestId(httpRequest);
        log.info("POST /shortage-reports | asOfDate={} | requestId={}", request.getAsOfDate(), requestId);

        ShortageReportService.GeneratedReport generated = reportService.generate(request, requestId);
        return ResponseEntity.status(HttpStatus.CREATED).body(generated.report());
    }

    @PostMapping("/csv")
    public ResponseEntity<String> generateCsv(
            @Valid @RequestBody ShortageReportRequest request,
            HttpServletRequest httpRequest) {

        String requestId = RequestGuardFilter.requestId(httpRequest);
        log.info("POST /shortage-reports/csv | asOfDate={} | requestId={}", request.getAsOfDate(), requestId);

        ShortageReportService.GeneratedReport generated = reportService.generate(request, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .contentType(TEXT_CSV)
            .header("X-Report-Run-ID", String.valueOf(generated.report().getRunId()))
            .body(generated.csv());
    }

    @GetMapping("/runs")
    public ResponseEntity<Page<ReportRunResponse>> runs(
            @RequestParam(defaultValue = "0")  @Min(0)           int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(archiveService.listRuns(PageRequest.of(page, size)));
    }

    @GetMapping("/runs/{runId}/csv")
    public ResponseEntity<String> archivedCsv(@PathVariable UUID runId) {
        return ResponseEntity.ok()
            .contentType(TEXT_CSV)
            .body(archiveService.archivedCsv(runId));
    }
}
