package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A security vulnerability found in the code.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SecurityFinding(
        String type,
        Severity severity,
        String description,
        String filePath,
        Integer lineNumber,
        String codeSnippet,
        String mitigation,
        String cweId
) {}
