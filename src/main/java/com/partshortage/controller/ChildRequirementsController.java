package com.partshortage.controller;

import com.partshortage.dto.ChildRequirementsRequest;
import com.partshortage.dto.ChildRequirementsResponse;
import com.partshortage.service.ShortageReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/v1/child-requirements")
@RequiredArgsConstructor
public class ChildRequirementsController {

    private final ShortageReportService reportService;

    @PostMapping
    public ResponseEntity<ChildRequirementsResponse> explode(@Valid @RequestBody ChildRequirementsRequest request) {
        return ResponseEntity.ok(reportService.childRequirements(request));
    }

    @PostMapping("/csv")
    public ResponseEntity<String> explodeCsv(@Valid @RequestBody ChildRequirementsRequest request) {
        return ResponseEntity.ok()
            .contentType(ShortageReportController.TEXT_CSV)
            .body(reportService.childRequirementsCsv(request));
    }
}
