package com.ssau.analyzer.exception;

import java.io.IOException;

/**
 * Failure while writing run output (workbook, JSON report, preview images).
 */
public class ExportException extends IOException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
