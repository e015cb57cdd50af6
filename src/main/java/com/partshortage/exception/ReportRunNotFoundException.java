package com.partshortage.exception;

import java.util.UUID;

public class ReportRunNotFoundException extends PartShortageException {
    public ReportRunNotFoundException(UUID runId) {
        super("REPORT_RUN_NOT_FOUND", "Report run with id '" + runId + "' not found.");
    }
}
