package com.reportkit.core.exception;

/**
 * A section failed validation, so the report it belongs to is not rendered.
 */
public class ReportValidationException extends ReportKitException {

    private final String sectionTitle;

    public ReportValidationException(String sectionTitle, String reason) {
        super("Invalid section '" + sectionTitle + "': " + reason);
        this.sectionTitle = sectionTitle;
    }

    public String getSectionTitle() {
        return sectionTitle;
    }
}
