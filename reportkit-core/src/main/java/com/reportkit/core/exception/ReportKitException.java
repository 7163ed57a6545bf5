package com.reportkit.core.exception;

/**
 * Base class for errors reported to callers of the reporting API.
 */
public class ReportKitException extends RuntimeException {

    public ReportKitException(String message) {
        super(message);
    }

    public ReportKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
