package com.partshortage.exception;

public class ReportRenderingException extends PartShortageException {
    public ReportRenderingException(String message, Throwable cause) {
        super("REPORT_RENDERING_ERROR", message, cause);
    }
}
