package com.reportkit.core.exception;

/**
 * A renderer could not produce its final encoding.
 */
public class ReportRenderingException extends ReportKitException {

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
