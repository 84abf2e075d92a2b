package com.example.compliance.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One entry of the report's diagnostic trail.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageDiagnostic(
        StageName stage,
        StageStatus status,
        ExtractedResult.Kind outcome,
        long elapsedMillis,
        int attempts,
        String detail
) {

    public static StageDiagnostic from(StageResult result) {
        return new StageDiagnostic(
                result.stage(),
                result.status(),
                result.result().kind(),
                result.elapsed().toMillis(),
                result.attempts(),
                result.diagnostic()
        );
    }
}
