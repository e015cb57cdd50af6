package com.partshortage.service;

import com.partshortage.dto.ReportRunResponse;
import com.partshortage.dto.ShortageReportResponse;
import com.partshortage.entity.ReportRunRecord;
import com.partshortage.exception.ReportRunNotFoundException;
import com.partshortage.repository.ReportRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Keeps a copy of every generated report, CSV included.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportArchiveService {

    private final ReportRunRepository repository;

    @Transactional
    public ReportRunRecord archive(ShortageReportResponse report, String csv, String requestId) {
        ReportRunRecord saved = repository.save(ReportRunRecord.builder()
            .planningDate(report.getPlanningDate())
            .horizonDays(report.getHorizonDays())
            .leadWorkdays(report.getLeadWorkdays())
            .orderStatusOpenThreshold(report.getOrderStatusOpenThreshold())
            .partCount(report.getPartCount())
            .shortageRowCount(report.getRowCount())
            .requestId(requestId)
            .reportCsv(csv)
            .build());
        log.info("Report archived | runId={} | rows={} | requestId={}", saved.getId(), report.getRowCount(), requestId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Page<ReportRunResponse> listRuns(Pageable pageable) {
        return repository.findAllByOrderByGeneratedAtDesc(pageable).map(this::toResponse);
    }

    @Transactional(readOnly = true)
    public String archivedCsv(UUID runId) {
        return repository.findById(runId)
            .map(ReportRunRecord::getReportCsv)
            .orElseThrow(() -> new ReportRunNotFoundException(runId));
    }

    private ReportRunResponse toResponse(ReportRunRecord r) {
        return ReportRunResponse.builder()
            .runId(r.getId())
            .generatedAt(r.getGeneratedAt())
            .planningDate(r.getPlanningDate())
            .horizonDays(r.getHorizonDays())
            .leadWorkdays(r.getLeadWorkdays())
            .orderStatusOpenThreshold(r.getOrderStatusOpenThreshold())
            .partCount(r.getPartCount())
            .shortageRowCount(r.getShortageRowCount())
            .requestId(r.getRequestId())
            .build();
    }
}
