package com.example.compliance.controller;

import com.example.compliance.model.AnalysisBundle;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Body of {@code POST /api/analyze}.
 *
 * @param analyzeSecurity optional; the configured default applies when absent
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisRequest(
        String requirements,
        String code,
        String testCases,
        String documentation,
        Boolean analyzeSecurity
) {

    /**
     * @throws IllegalArgumentException if there is nothing to analyze
     */
    AnalysisBundle toBundle(boolean securityByDefault) {
        return new AnalysisBundle(requirements, code, testCases, documentation,
                analyzeSecurity != null ? analyzeSecurity : securityByDefault);
    }
}
