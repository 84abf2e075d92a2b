package com.example.compliance.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one pipeline stage.
 *
 * @param stage      the stage
 * @param status     how the stage ended
 * @param result     extracted result; an {@link ExtractionFailure} for failed, cancelled and skipped stages
 * @param elapsed    wall-clock time spent in the stage
 * @param attempts   transport attempts made (0 when no call was made)
 * @param diagnostic human-readable note for the diagnostic trail
 * @param usage      tokens consumed by the stage
 */
public record StageResult(
        StageName stage,
        StageStatus status,
        ExtractedResult result,
        Duration elapsed,
        int attempts,
        String diagnostic,
        TokenUsage usage
) {

    public StageResult {
        if (usage == null) usage = TokenUsage.NONE;
        if (elapsed == null) elapsed = Duration.ZERO;
    }

    public static StageResult skipped(StageName stage, String reason) {
        return new StageResult(stage, StageStatus.SKIPPED, ExtractionFailure.of(reason),
                Duration.ZERO, 0, reason, TokenUsage.NONE);
    }

    public static StageResult cancelled(StageName stage, Duration elapsed, int attempts) {
        return new StageResult(stage, StageStatus.CANCELLED, ExtractionFailure.of("run cancelled"),
                elapsed, attempts, "run cancelled", TokenUsage.NONE);
    }

    /** Validated payload, when the stage succeeded. */
    public Optional<JsonNode> payload() {
        return result instanceof StructuredPayload structured
                ? Optional.of(structured.data())
                : Optional.empty();
    }

    /** Fallback text, when the stage degraded. */
    public Optional<String> fallbackText() {
        return result instanceof TextFallback fallback
                ? Optional.of(fallback.text())
                : Optional.empty();
    }
}
