package com.reportkit.core.exception;

/**
 * No renderer is registered for the requested format.
 */
public class UnknownFormatException extends ReportKitException {

    private final String format;

    public UnknownFormatException(String format) {
        super("No renderer registered for format '" + format + "'");
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
