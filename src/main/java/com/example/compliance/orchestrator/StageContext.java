package com.example.compliance.orchestrator;

import com.example.compliance.model.AnalysisBundle;
import com.example.compliance.model.StageName;
import com.example.compliance.model.StageResult;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view a stage gets of its run: the input bundle and the results of the stages before it.
 */
public class StageContext {

    private final AnalysisBundle bundle;
    private final Map<StageName, StageResult> completed;

    public StageContext(AnalysisBundle bundle, Map<StageName, StageResult> completed) {
        this.bundle = bundle;
        this.completed = Map.copyOf(completed);
    }

    public AnalysisBundle bundle() {
        return bundle;
    }

    public Optional<StageResult> result(StageName stage) {
        return Optional.ofNullable(completed.get(stage));
    }

    /**
     * Renders an earlier stage for inclusion in a prompt: the validated payload as JSON, the fallback
     * text as prose, or a note that the result is unavailable.
     */
    public String render(StageName stage) {
        StageResult result = completed.get(stage);
        if (result == null) {
            return "(" + stage + " analysis was not run)";
        }
        return result.payload()
                .map(payload -> payload.toPrettyString())
                .or(result::fallbackText)
                .orElse("(" + stage + " analysis unavailable: " + result.status().name().toLowerCase() + ")");
    }
}
