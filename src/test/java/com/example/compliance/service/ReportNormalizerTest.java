package com.example.compliance.service;

import com.example.compliance.model.BugDetail;
import com.example.compliance.model.Recommendation;
import com.example.compliance.model.Severity;
import com.example.compliance.model.StageName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportNormalizerTest {

    private final ReportNormalizer normalizer = new ReportNormalizer();

    private static BugDetail bug(String description, Severity severity, String location, StageName source) {
        return new BugDetail(description, "", severity, location, "", "", source);
    }

    @Test
    @DisplayName("duplicate bugs collapse, blank ones are dropped, the rest sort by severity")
    void normalizeBugs() {
        List<BugDetail> bugs = normalizer.normalizeBugs(List.of(
                bug("Missing null check", Severity.LOW, "parse()", StageName.CODE),
                bug("  missing NULL check. ", Severity.HIGH, "parse()", StageName.BUG_SYNTHESIS),
                bug("SQL injection", Severity.CRITICAL, "query()", StageName.BUG_SYNTHESIS),
                bug("Missing null check", Severity.LOW, "format()", StageName.CODE),
                bug(" ", Severity.HIGH, "", StageName.CODE)));

        assertEquals(3, bugs.size());
        assertEquals("SQL injection", bugs.get(0).description());
        assertEquals(StageName.CODE, bugs.get(1).sourceStage());
        assertEquals("format()", bugs.get(2).location());
    }

    @Test
    @DisplayName("a known severity replaces UNKNOWN on a duplicate")
    void knownSeverityWins() {
        List<BugDetail> bugs = normalizer.normalizeBugs(List.of(
                bug("Off by one", Severity.UNKNOWN, "loop", StageName.CODE),
                bug("Off by one", Severity.MEDIUM, "loop", StageName.REPORT_SYNTHESIS)));

        assertEquals(1, bugs.size());
        assertEquals(Severity.MEDIUM, bugs.get(0).severity());
    }

    @Test
    @DisplayName("recommendations are de-duplicated by text and ordered by priority level")
    void normalizeRecommendations() {
        List<Recommendation> result = normalizer.normalizeRecommendations(List.of(
                Recommendation.plain("Add tests for negative input", StageName.TESTS),
                new Recommendation("Fix the injection", "High", 1, "Security", null, null, StageName.REPORT_SYNTHESIS),
                Recommendation.plain("add tests for negative input.", StageName.REPORT_SYNTHESIS),
                Recommendation.plain("", StageName.CODE)));

        assertEquals(2, result.size());
        assertEquals("Fix the injection", result.get(0).text());
        assertEquals(StageName.TESTS, result.get(1).sourceStage());
    }
}
