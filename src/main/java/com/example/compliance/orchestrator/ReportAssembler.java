package com.example.compliance.orchestrator;

import com.example.compliance.model.AggregateReport;
import com.example.compliance.model.AnalysisBundle;
import com.example.compliance.model.BugDetail;
import com.example.compliance.model.Recommendation;
import com.example.compliance.model.RunStatus;
import com.example.compliance.model.SecurityFinding;
import com.example.compliance.model.Severity;
import com.example.compliance.model.StageDiagnostic;
import com.example.compliance.model.StageName;
import com.example.compliance.model.StageResult;
import com.example.compliance.model.StageStatus;
import com.example.compliance.model.TokenUsage;
import com.example.compliance.service.ReportNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Merges the stage results of a run into the {@link AggregateReport}.
 * <p>
 * Only validated payloads contribute bugs, so a failed or degraded stage adds none, and the bug count
 * is always the size of the de-duplicated list rather than a number claimed by the model.
 */
@Component
public class ReportAssembler {

    static final String NOT_COMPLETED =
            "The analysis could not be completed: no analysis stage produced a usable result.";
    static final String NO_BUGS = "No bugs were identified.";

    private final ReportNormalizer normalizer;

    public ReportAssembler(ReportNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public AggregateReport assemble(String runId, AnalysisBundle bundle, List<StageResult> results) {
        Map<StageName, StageResult> byStage = new EnumMap<>(StageName.class);
        results.forEach(result -> byStage.put(result.stage(), result));

        boolean anyUsable = results.stream().anyMatch(r -> r.status().usable());

        List<BugDetail> bugs = normalizer.normalizeBugs(collectBugs(byStage));
        List<Recommendation> recommendations = normalizer.normalizeRecommendations(collectRecommendations(results));

        List<SecurityFinding> findings = null;
        Double securityScore = null;
        if (bundle.securityEnabled()) {
            findings = normalizer.normalizeFindings(collectFindings(byStage));
            securityScore = payload(byStage, StageName.SECURITY)
                    .map(p -> p.get("overall_security_score"))
                    .filter(JsonNode::isNumber)
                    .map(JsonNode::asDouble)
                    .orElse(null);
        }

        String narrative = anyUsable ? narrative(byStage, results) : NOT_COMPLETED;
        String bugsExplanation = bugsExplanation(byStage, bugs, anyUsable);

        TokenUsage usage = results.stream()
                .map(StageResult::usage)
                .reduce(TokenUsage.NONE, TokenUsage::plus);

        return AggregateReport.from(runId, runStatus(results, anyUsable), narrative, bugsExplanation,
                bugs, recommendations, findings, securityScore,
                results.stream().map(StageDiagnostic::from).toList(), usage);
    }

    // ═══════════════════════════════════════════════════
    // Bugs
    // ═══════════════════════════════════════════════════

    /**
     * The synthesized {@code detailed_bugs} list is authoritative when report synthesis produced one.
     * Otherwise the code and bug-synthesis lists are merged.
     */
    private static List<BugDetail> collectBugs(Map<StageName, StageResult> byStage) {
        List<BugDetail> bugs = new ArrayList<>();
        Optional<JsonNode> synthesized = payload(byStage, StageName.REPORT_SYNTHESIS)
                .map(p -> p.get("detailed_bugs"))
                .filter(JsonNode::isArray);
        if (synthesized.isPresent()) {
            synthesized.get().forEach(node -> bugs.add(bug(node, StageName.REPORT_SYNTHESIS)));
            return bugs;
        }
        payload(byStage, StageName.CODE).ifPresent(p ->
                elements(p, "potential_bugs").forEach(node -> bugs.add(bug(node, StageName.CODE))));
        payload(byStage, StageName.BUG_SYNTHESIS).ifPresent(p ->
                elements(p, "bugs").forEach(node -> bugs.add(bug(node, StageName.BUG_SYNTHESIS))));
        return bugs;
    }

    private static BugDetail bug(JsonNode node, StageName source) {
        return new BugDetail(
                text(node, "description"),
                text(node, "cause"),
                Severity.fromLabel(text(node, "severity")),
                text(node, "location"),
                text(node, "impact"),
                text(node, "recommendations"),
                source
        );
    }

    private static String bugsExplanation(Map<StageName, StageResult> byStage, List<BugDetail> bugs,
                                          boolean anyUsable) {
        if (!anyUsable) {
            return NOT_COMPLETED;
        }
        Optional<String> synthesized = payload(byStage, StageName.REPORT_SYNTHESIS)
                .map(p -> text(p, "bugs_explanations"))
                .filter(text -> !text.isBlank());
        if (synthesized.isPresent()) {
            return synthesized.get();
        }
        if (bugs.isEmpty()) {
            return NO_BUGS;
        }
        return bugs.stream()
                .map(bug -> "[" + bug.severity() + "] " + bug.description())
                .collect(Collectors.joining("\n"));
    }

    // ═══════════════════════════════════════════════════
    // Recommendations and security
    // ═══════════════════════════════════════════════════

    private static List<Recommendation> collectRecommendations(List<StageResult> results) {
        List<Recommendation> recommendations = new ArrayList<>();
        for (StageResult result : results) {
            result.payload().ifPresent(p -> elements(p, "recommendations").forEach(node -> {
                if (node.isTextual()) {
                    recommendations.add(Recommendation.plain(node.asText(), result.stage()));
                } else if (node.isObject()) {
                    recommendations.add(new Recommendation(
                            text(node, "text"),
                            emptyToNull(text(node, "priority")),
                            integerOrNull(node.get("priority_level")),
                            emptyToNull(text(node, "type")),
                            strings(node, "affected_requirements"),
                            strings(node, "affected_code"),
                            result.stage()));
                }
            }));
        }
        return recommendations;
    }

    private static List<SecurityFinding> collectFindings(Map<StageName, StageResult> byStage) {
        List<SecurityFinding> findings = new ArrayList<>();
        payload(byStage, StageName.SECURITY).ifPresent(p ->
                elements(p, "vulnerabilities").forEach(node -> findings.add(finding(node))));
        payload(byStage, StageName.REPORT_SYNTHESIS).ifPresent(p ->
                elements(p, "security_vulnerabilities").forEach(node -> findings.add(finding(node))));
        return findings;
    }

    private static SecurityFinding finding(JsonNode node) {
        return new SecurityFinding(
                text(node, "type"),
                Severity.fromLabel(text(node, "severity")),
                text(node, "description"),
                emptyToNull(text(node, "file_path")),
                integerOrNull(node.get("line_number")),
                emptyToNull(text(node, "code_snippet")),
                text(node, "mitigation"),
                emptyToNull(text(node, "cwe_id"))
        );
    }

    // ═══════════════════════════════════════════════════
    // Narrative and status
    // ═══════════════════════════════════════════════════

    private static String narrative(Map<StageName, StageResult> byStage, List<StageResult> results) {
        StageResult synthesis = byStage.get(StageName.REPORT_SYNTHESIS);
        if (synthesis != null) {
            Optional<String> report = synthesis.payload()
                    .map(p -> text(p, "final_report"))
                    .filter(text -> !text.isBlank())
                    .or(synthesis::fallbackText);
            if (report.isPresent()) {
                return report.get();
            }
        }

        StringBuilder composed = new StringBuilder(
                "The final report could not be synthesized; summary of the individual analyses:");
        for (StageResult result : results) {
            stageSummary(result).ifPresent(summary ->
                    composed.append("\n\n").append(result.stage()).append(": ").append(summary.strip()));
        }
        return composed.toString();
    }

    private static Optional<String> stageSummary(StageResult result) {
        if (!result.status().usable()) {
            return Optional.empty();
        }
        if (result.status() == StageStatus.DEGRADED) {
            return result.fallbackText();
        }
        JsonNode payload = result.payload().orElseThrow();
        for (String field : List.of("summary", "overall_assessment", "final_report")) {
            String value = text(payload, field);
            if (!value.isBlank()) {
                return Optional.of(value);
            }
        }
        if (result.stage() == StageName.SECURITY) {
            return Optional.of(elements(payload, "vulnerabilities").size()
                    + " vulnerabilities reported, security score "
                    + payload.path("overall_security_score").asText("n/a") + "/10");
        }
        return Optional.of("completed");
    }

    private static RunStatus runStatus(List<StageResult> results, boolean anyUsable) {
        if (results.stream().anyMatch(r -> r.status() == StageStatus.CANCELLED)) {
            return RunStatus.CANCELLED;
        }
        if (!anyUsable) {
            return RunStatus.FAILED;
        }
        boolean allSucceeded = results.stream()
                .filter(r -> r.status() != StageStatus.SKIPPED)
                .allMatch(r -> r.status() == StageStatus.SUCCEEDED);
        return allSucceeded ? RunStatus.COMPLETED : RunStatus.DEGRADED;
    }

    // ═══════════════════════════════════════════════════
    // JsonNode helpers
    // ═══════════════════════════════════════════════════

    private static Optional<JsonNode> payload(Map<StageName, StageResult> byStage, StageName stage) {
        StageResult result = byStage.get(stage);
        return result != null ? result.payload() : Optional.empty();
    }

    private static List<JsonNode> elements(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<JsonNode> items = new ArrayList<>();
        value.forEach(items::add);
        return items;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : "";
    }

    private static List<String> strings(JsonNode node, String field) {
        return elements(node, field).stream()
                .filter(item -> !item.isNull())
                .map(JsonNode::asText)
                .toList();
    }

    private static Integer integerOrNull(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        try {
            return Integer.valueOf(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
