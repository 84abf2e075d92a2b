package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A defect reported by one of the stages.
 *
 * @param description what is wrong
 * @param cause       technical cause
 * @param severity    normalized severity
 * @param location    where in the code
 * @param impact      effect on the system
 * @param remediation how to fix it
 * @param sourceStage stage that reported the defect
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BugDetail(
        String description,
        String cause,
        Severity severity,
        String location,
        String impact,
        String remediation,
        StageName sourceStage
) {}
