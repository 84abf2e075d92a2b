package com.example.compliance.orchestrator;

import com.example.compliance.model.AggregateReport;
import com.example.compliance.model.AnalysisBundle;
import com.example.compliance.model.StageName;
import com.example.compliance.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the analysis pipeline over an {@link AnalysisBundle}.
 * Pipeline:
 * 1. Requirements analysis
 * 2. Code analysis
 * 3. Test analysis
 * 4. Documentation analysis
 * 5. Security analysis (skipped when disabled for the run)
 * 6. Bug synthesis
 * 7. Report synthesis
 * <p>
 * Stages run sequentially; a failed stage never stops the pipeline. This class is the only
 * writer of a run's results.
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final StageRunner stageRunner;
    private final ReportAssembler reportAssembler;
    private final ExecutorService analysisExecutor;

    public AnalysisOrchestrator(StageRunner stageRunner,
                                ReportAssembler reportAssembler,
                                ExecutorService analysisExecutor) {
        this.stageRunner = stageRunner;
        this.reportAssembler = reportAssembler;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Runs the whole pipeline on the calling thread.
     */
    public AggregateReport analyze(AnalysisBundle bundle) {
        requireBundle(bundle);
        return execute(bundle, new AnalysisRun(newRunId()));
    }

    /**
     * Submits a run to the analysis executor and returns its cancellable handle.
     * The handle's report completes exceptionally only if the orchestrator itself breaks.
     */
    public AnalysisRun submit(AnalysisBundle bundle) {
        requireBundle(bundle);
        AnalysisRun run = new AnalysisRun(newRunId());
        try {
            analysisExecutor.execute(() -> {
                run.attach(Thread.currentThread());
                try {
                    run.report().complete(execute(bundle, run));
                } catch (RuntimeException e) {
                    log.error("Run {} aborted", run.runId(), e);
                    run.report().completeExceptionally(e);
                } finally {
                    run.detach();
                    // the pooled thread must not carry a cancellation into the next run
                    Thread.interrupted();
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Run {} rejected by the analysis executor", run.runId(), e);
            run.report().completeExceptionally(e);
        }
        return run;
    }

    AggregateReport execute(AnalysisBundle bundle, AnalysisRun run) {
        List<StageDescriptor> stages = AnalysisPipeline.stages();
        int total = stages.size();

        log.info("═══════════════════════════════════════════════");
        log.info("Starting analysis run {} (security {})", run.runId(),
                bundle.securityEnabled() ? "enabled" : "disabled");
        log.info("═══════════════════════════════════════════════");

        Map<StageName, StageResult> results = new LinkedHashMap<>();
        for (int i = 0; i < total; i++) {
            StageDescriptor descriptor = stages.get(i);
            StageName stage = descriptor.stage();
            String step = "[" + (i + 1) + "/" + total + "]";

            StageResult result;
            if (run.isCancelled()) {
                result = StageResult.cancelled(stage, Duration.ZERO, 0);
            } else if (stage == StageName.SECURITY && !bundle.securityEnabled()) {
                result = StageResult.skipped(stage, "security analysis disabled");
            } else {
                log.info("{} Running {} analysis...", step, stage);
                result = stageRunner.run(descriptor, new StageContext(bundle, results), run::isCancelled);
            }
            results.put(stage, result);
            logOutcome(step, result);
        }

        AggregateReport report = reportAssembler.assemble(run.runId(), bundle, List.copyOf(results.values()));

        log.info("═══════════════════════════════════════════════");
        log.info("Run {} finished {}: {} bugs, {} recommendations, {} tokens",
                run.runId(), report.status(), report.bugsCount(), report.recommendations().size(),
                report.tokenUsage().totalTokens());
        log.info("═══════════════════════════════════════════════");
        return report;
    }

    private static void logOutcome(String step, StageResult result) {
        switch (result.status()) {
            case SUCCEEDED -> log.info("{} {} completed in {} ms ({} attempt(s))",
                    step, result.stage(), result.elapsed().toMillis(), result.attempts());
            case DEGRADED -> log.warn("{} {} degraded: {}", step, result.stage(), result.diagnostic());
            case FAILED -> log.warn("{} {} failed: {}", step, result.stage(), result.diagnostic());
            case CANCELLED -> log.info("{} {} cancelled", step, result.stage());
            case SKIPPED -> log.info("{} {} skipped: {}", step, result.stage(), result.diagnostic());
        }
    }

    private static void requireBundle(AnalysisBundle bundle) {
        if (bundle == null) {
            throw new IllegalArgumentException("Analysis bundle is required");
        }
    }

    private static String newRunId() {
        return UUID.randomUUID().toString();
    }
}
