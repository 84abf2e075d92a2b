package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Final result of an analysis run.
 * {@code securityVulnerabilities} and {@code securityScore} are {@code null} when security
 * analysis was disabled or produced nothing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregateReport(
        String runId,
        RunStatus status,
        String finalReport,
        int bugsCount,
        String bugsExplanations,
        List<BugDetail> detailedBugs,
        Map<Severity, Long> severityDistribution,
        List<Recommendation> recommendations,
        List<SecurityFinding> securityVulnerabilities,
        Double securityScore,
        List<StageDiagnostic> stages,
        TokenUsage tokenUsage,
        Instant completedAt
) {

    /**
     * Factory that derives the bug count and severity distribution from the bug list,
     * so the count can never disagree with the evidence.
     */
    public static AggregateReport from(String runId, RunStatus status, String finalReport,
                                       String bugsExplanations, List<BugDetail> bugs,
                                       List<Recommendation> recommendations,
                                       List<SecurityFinding> securityFindings, Double securityScore,
                                       List<StageDiagnostic> stages, TokenUsage tokenUsage) {
        Map<Severity, Long> distribution = bugs.stream()
                .collect(Collectors.groupingBy(BugDetail::severity, Collectors.counting()));
        return new AggregateReport(
                runId,
                status,
                finalReport,
                bugs.size(),
                bugsExplanations,
                List.copyOf(bugs),
                distribution,
                List.copyOf(recommendations),
                securityFindings != null ? List.copyOf(securityFindings) : null,
                securityScore,
                List.copyOf(stages),
                tokenUsage,
                Instant.now()
        );
    }
}
