package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analysis stages in pipeline order.
 */
public enum StageName {
    REQUIREMENTS("requirements"),
    CODE("code"),
    TESTS("tests"),
    DOCUMENTATION("documentation"),
    SECURITY("security"),
    BUG_SYNTHESIS("bug-synthesis"),
    REPORT_SYNTHESIS("report-synthesis");

    private final String label;

    StageName(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
