package com.reportkit.report.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Document serialized by the JSON renderer.
 */
@JsonPropertyOrder({"generatedAt", "sections"})
public class JsonReport {

    private Instant generatedAt;
    private List<JsonSection> sections = new ArrayList<>();

    public JsonReport() {
    }

    public JsonReport(Instant generatedAt, List<JsonSection> sections) {
        this.generatedAt = generatedAt;
        this.sections = sections;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public List<JsonSection> getSections() {
        return sections;
    }

    public void setSections(List<JsonSection> sections) {
        this.sections = sections;
    }
}
