package com.reportkit.core.exception;

/**
 * Report data could not be read from its source.
 */
public class DataSourceException extends ReportKitException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
