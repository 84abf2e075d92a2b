package com.example.compliance.service;

import com.example.compliance.model.BugDetail;
import com.example.compliance.model.Recommendation;
import com.example.compliance.model.SecurityFinding;
import com.example.compliance.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Post-processing of the merged report lists.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Drop entries without a description</li>
 *   <li>De-duplicate bugs, recommendations and security findings reported by more than one stage</li>
 *   <li>Sort bugs and findings by severity (CRITICAL first), recommendations by priority level</li>
 * </ul>
 * The first occurrence of a duplicate is kept, except that a known severity replaces UNKNOWN.
 */
@Service
public class ReportNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ReportNormalizer.class);

    private static final Comparator<Recommendation> RECOMMENDATION_ORDER = Comparator
            .comparing((Recommendation r) -> r.priorityLevel() != null ? r.priorityLevel() : Integer.MAX_VALUE);

    public List<BugDetail> normalizeBugs(List<BugDetail> bugs) {
        Map<String, BugDetail> unique = new LinkedHashMap<>();
        for (BugDetail bug : bugs) {
            if (isBlank(bug.description())) continue;
            String key = normalize(bug.description()) + "|" + normalize(bug.location());
            unique.merge(key, bug, (kept, duplicate) ->
                    kept.severity() == Severity.UNKNOWN && duplicate.severity() != Severity.UNKNOWN
                            ? duplicate : kept);
        }
        List<BugDetail> result = unique.values().stream()
                .sorted(Comparator.comparing(BugDetail::severity))
                .toList();
        logReduction("bugs", bugs.size(), result.size());
        return result;
    }

    public List<Recommendation> normalizeRecommendations(List<Recommendation> recommendations) {
        List<Recommendation> result = dedupe(recommendations, Recommendation::text).stream()
                .sorted(RECOMMENDATION_ORDER)
                .toList();
        logReduction("recommendations", recommendations.size(), result.size());
        return result;
    }

    public List<SecurityFinding> normalizeFindings(List<SecurityFinding> findings) {
        Map<String, SecurityFinding> unique = new LinkedHashMap<>();
        for (SecurityFinding finding : findings) {
            if (isBlank(finding.description())) continue;
            String key = normalize(finding.type()) + "|" + normalize(finding.description())
                    + "|" + normalize(finding.filePath()) + "|" + finding.lineNumber();
            unique.merge(key, finding, (kept, duplicate) ->
                    kept.severity() == Severity.UNKNOWN && duplicate.severity() != Severity.UNKNOWN
                            ? duplicate : kept);
        }
        List<SecurityFinding> result = unique.values().stream()
                .sorted(Comparator.comparing(SecurityFinding::severity))
                .toList();
        logReduction("security findings", findings.size(), result.size());
        return result;
    }

    /**
     * Lower-cased, whitespace collapsed, trailing punctuation removed.
     */
    static String normalize(String text) {
        if (text == null) return "";
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ")
                .replaceAll("[\\s.;:!]+$", "")
                .trim();
    }

    private static <T> List<T> dedupe(List<T> items, Function<T, String> text) {
        Map<String, T> unique = new LinkedHashMap<>();
        for (T item : items) {
            String value = text.apply(item);
            if (isBlank(value)) continue;
            unique.putIfAbsent(normalize(value), item);
        }
        return List.copyOf(unique.values());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void logReduction(String what, int before, int after) {
        if (after < before) {
            log.info("ReportNormalizer: {} {} reduced to {} after de-duplication", before, what, after);
        }
    }
}
