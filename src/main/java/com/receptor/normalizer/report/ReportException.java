package com.receptor.normalizer.report;

/**
 * Raised when a batch report cannot be rendered or written.
 */
public class ReportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }
}
